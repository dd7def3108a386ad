package io.lightclient.core.protocol;

import java.security.PublicKey;
import java.util.Arrays;
import java.util.Objects;

/**
 * One member of a validator set: address (derived from the key), public key and
 * voting power. The address is recomputed from the key and checked, never trusted.
 */
public final class Validator {
    private final String address;
    private final PublicKey publicKey;
    private final long votingPower;

    public Validator(PublicKey publicKey, long votingPower) {
        this(publicKey == null ? null : SignatureUtil.deriveAddress(publicKey), publicKey, votingPower);
    }

    public Validator(String address, PublicKey publicKey, long votingPower) {
        this.address = address;
        this.publicKey = publicKey;
        this.votingPower = votingPower;
        basicValidate();
    }

    public String address() { return address; }
    public PublicKey publicKey() { return publicKey; }
    public long votingPower() { return votingPower; }

    /** Leaf bytes for the validator-set hash: key encoding and power. */
    public byte[] hashBytes() {
        return new ProtocolCodec()
                .writeBytes(publicKey.getEncoded())
                .writeLong(votingPower)
                .toBytes();
    }

    public void basicValidate() {
        if (publicKey == null) throw new IllegalArgumentException("validator public key required");
        if (address == null || address.length() != SignatureUtil.ADDRESS_LENGTH * 2) {
            throw new IllegalArgumentException("validator address must be " + SignatureUtil.ADDRESS_LENGTH + " bytes");
        }
        if (!address.equals(SignatureUtil.deriveAddress(publicKey))) {
            throw new IllegalArgumentException("validator address does not match public key: " + address);
        }
        if (votingPower <= 0) throw new IllegalArgumentException("voting power must be > 0");
        if (votingPower > ProtocolLimits.MAX_TOTAL_VOTING_POWER) {
            throw new IllegalArgumentException("voting power exceeds maximum: " + votingPower);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Validator)) return false;
        Validator other = (Validator) o;
        return votingPower == other.votingPower
                && address.equals(other.address)
                && Arrays.equals(publicKey.getEncoded(), other.publicKey.getEncoded());
    }

    @Override public int hashCode() { return Objects.hash(address, votingPower); }

    @Override public String toString() {
        return "Validator{" + address.substring(0, 8) + ", power=" + votingPower + "}";
    }
}
