package io.lightclient.core.protocol;

import java.util.Objects;

/** What a header provider serves for one height: the signed header and its validator set. */
public record LightBlock(SignedHeader signedHeader, ValidatorSet validatorSet) {
    public LightBlock {
        Objects.requireNonNull(signedHeader, "signedHeader");
        Objects.requireNonNull(validatorSet, "validatorSet");
    }

    public long height() { return signedHeader.height(); }
}
