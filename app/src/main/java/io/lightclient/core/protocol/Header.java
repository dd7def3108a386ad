package io.lightclient.core.protocol;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Client update payload: a signed header with the validator set that signed it and the
 * set it commits to for the next height.
 */
public final class Header {
    private final SignedHeader signedHeader;
    private final ValidatorSet validatorSet;
    private final ValidatorSet nextValidatorSet;

    public Header(SignedHeader signedHeader, ValidatorSet validatorSet, ValidatorSet nextValidatorSet) {
        this.signedHeader = Objects.requireNonNull(signedHeader, "signedHeader");
        this.validatorSet = Objects.requireNonNull(validatorSet, "validatorSet");
        this.nextValidatorSet = Objects.requireNonNull(nextValidatorSet, "nextValidatorSet");
    }

    public SignedHeader signedHeader() { return signedHeader; }
    public ValidatorSet validatorSet() { return validatorSet; }
    public ValidatorSet nextValidatorSet() { return nextValidatorSet; }

    public long height() { return signedHeader.height(); }
    public Instant time() { return signedHeader.time(); }
    public String chainId() { return signedHeader.chainId(); }

    public LightBlock lightBlock() { return new LightBlock(signedHeader, validatorSet); }

    /** True iff the validator set hashes to the header's validators hash. */
    public boolean validatorSetMatches(Hasher hasher) {
        return Arrays.equals(validatorSet.hash(hasher), signedHeader.header().validatorsHash());
    }

    /** True iff the next validator set hashes to the header's next-validators hash. */
    public boolean nextValidatorSetMatches(Hasher hasher) {
        return Arrays.equals(nextValidatorSet.hash(hasher), signedHeader.header().nextValidatorsHash());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Header)) return false;
        Header other = (Header) o;
        return signedHeader.equals(other.signedHeader)
                && validatorSet.equals(other.validatorSet)
                && nextValidatorSet.equals(other.nextValidatorSet);
    }

    @Override public int hashCode() { return Objects.hash(signedHeader, validatorSet, nextValidatorSet); }

    @Override public String toString() { return "Header{h=" + height() + ", time=" + time() + "}"; }
}
