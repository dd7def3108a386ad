package io.lightclient.core.protocol;

import java.util.List;
import java.util.Objects;

/**
 * Precommits for one block, aligned positionally with the validator set that produced them.
 */
public final class Commit {
    private final long height;
    private final int round;
    private final BlockId blockId;
    private final List<CommitSig> signatures;

    public Commit(long height, int round, BlockId blockId, List<CommitSig> signatures) {
        this.height = height;
        this.round = round;
        this.blockId = Objects.requireNonNull(blockId, "blockId");
        this.signatures = signatures != null ? List.copyOf(signatures) : List.of();
        basicValidate();
    }

    public long height() { return height; }
    public int round() { return round; }
    public BlockId blockId() { return blockId; }
    public List<CommitSig> signatures() { return signatures; }
    public int size() { return signatures.size(); }

    /**
     * Canonical precommit sign bytes for slot {@code index}: what the validator at that
     * slot signed. Nil votes sign an empty block id.
     */
    public byte[] voteSignBytes(String chainId, int index) {
        CommitSig sig = signatures.get(index);
        if (sig.isAbsent()) {
            throw new IllegalArgumentException("no vote at absent slot " + index);
        }
        BlockId voted = sig.isForBlock() ? blockId : BlockId.empty();
        return new ProtocolCodec()
                .writeByte(ProtocolLimits.PRECOMMIT_TYPE)
                .writeLong(height)
                .writeLong(round)
                .writeBytes(voted.encode())
                .writeInstant(sig.timestamp())
                .writeString(chainId)
                .toBytes();
    }

    public void basicValidate() {
        if (height < 1) throw new IllegalArgumentException("commit height must be >= 1");
        if (round < 0) throw new IllegalArgumentException("commit round must be >= 0");
        if (blockId.isEmpty()) throw new IllegalArgumentException("commit must reference a block");
        if (signatures.isEmpty()) throw new IllegalArgumentException("commit has no signatures");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Commit)) return false;
        Commit other = (Commit) o;
        return height == other.height && round == other.round
                && blockId.equals(other.blockId) && signatures.equals(other.signatures);
    }

    @Override public int hashCode() { return Objects.hash(height, round, blockId, signatures); }

    @Override public String toString() {
        return "Commit{h=" + height + ", r=" + round + ", sigs=" + signatures.size() + "}";
    }
}
