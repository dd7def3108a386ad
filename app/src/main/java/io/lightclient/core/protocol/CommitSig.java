package io.lightclient.core.protocol;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One positional slot of a commit. Absent slots carry nothing; present slots carry the
 * signer's address, the vote timestamp and the signature bytes.
 */
public final class CommitSig {
    private final BlockIdFlag flag;
    private final String validatorAddress;
    private final Instant timestamp;
    private final byte[] signature;

    public CommitSig(BlockIdFlag flag, String validatorAddress, Instant timestamp, byte[] signature) {
        this.flag = Objects.requireNonNull(flag, "flag");
        this.validatorAddress = validatorAddress != null ? validatorAddress : "";
        this.timestamp = timestamp;
        this.signature = signature != null ? signature.clone() : new byte[0];
        basicValidate();
    }

    public static CommitSig absent() {
        return new CommitSig(BlockIdFlag.ABSENT, "", null, new byte[0]);
    }

    public static CommitSig forBlock(String validatorAddress, Instant timestamp, byte[] signature) {
        return new CommitSig(BlockIdFlag.COMMIT, validatorAddress, timestamp, signature);
    }

    public static CommitSig forNil(String validatorAddress, Instant timestamp, byte[] signature) {
        return new CommitSig(BlockIdFlag.NIL, validatorAddress, timestamp, signature);
    }

    public BlockIdFlag flag() { return flag; }
    public String validatorAddress() { return validatorAddress; }
    public Instant timestamp() { return timestamp; }
    public byte[] signature() { return signature.clone(); }

    public boolean isAbsent() { return flag == BlockIdFlag.ABSENT; }
    public boolean isForBlock() { return flag == BlockIdFlag.COMMIT; }

    /**
     * Structural checks only. Signature length is checked by the commit verifier so a
     * malformed encoding is reported as such instead of failing construction.
     */
    public void basicValidate() {
        if (flag == BlockIdFlag.ABSENT) {
            if (!validatorAddress.isEmpty()) throw new IllegalArgumentException("absent commit sig must not carry an address");
            if (timestamp != null) throw new IllegalArgumentException("absent commit sig must not carry a timestamp");
            if (signature.length != 0) throw new IllegalArgumentException("absent commit sig must not carry a signature");
            return;
        }
        if (validatorAddress.length() != SignatureUtil.ADDRESS_LENGTH * 2) {
            throw new IllegalArgumentException("commit sig address must be " + SignatureUtil.ADDRESS_LENGTH + " bytes");
        }
        if (timestamp == null) throw new IllegalArgumentException("commit sig timestamp required");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommitSig)) return false;
        CommitSig other = (CommitSig) o;
        return flag == other.flag
                && validatorAddress.equals(other.validatorAddress)
                && Objects.equals(timestamp, other.timestamp)
                && Arrays.equals(signature, other.signature);
    }

    @Override public int hashCode() { return Objects.hash(flag, validatorAddress, timestamp, Arrays.hashCode(signature)); }

    @Override public String toString() {
        return isAbsent() ? "CommitSig{absent}" : "CommitSig{" + flag + ", " + validatorAddress.substring(0, 8) + "}";
    }
}
