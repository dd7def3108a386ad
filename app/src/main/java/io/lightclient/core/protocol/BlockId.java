package io.lightclient.core.protocol;

import java.util.Arrays;
import java.util.Objects;

/** Identifies a block: header hash plus the part-set header of its serialized body. */
public final class BlockId {
    private final byte[] hash;
    private final int partsTotal;
    private final byte[] partsHash;

    public BlockId(byte[] hash, int partsTotal, byte[] partsHash) {
        this.hash = hash != null ? hash.clone() : new byte[0];
        this.partsTotal = partsTotal;
        this.partsHash = partsHash != null ? partsHash.clone() : new byte[0];
        basicValidate();
    }

    public static BlockId empty() { return new BlockId(new byte[0], 0, new byte[0]); }

    public byte[] hash() { return hash.clone(); }
    public int partsTotal() { return partsTotal; }
    public byte[] partsHash() { return partsHash.clone(); }

    public boolean isEmpty() { return hash.length == 0 && partsTotal == 0 && partsHash.length == 0; }

    public byte[] encode() {
        return new ProtocolCodec()
                .writeBytes(hash)
                .writeInt(partsTotal)
                .writeBytes(partsHash)
                .toBytes();
    }

    public void basicValidate() {
        if (hash.length > ProtocolLimits.MAX_HASH_BYTES) throw new IllegalArgumentException("block id hash too long");
        if (partsHash.length > ProtocolLimits.MAX_HASH_BYTES) throw new IllegalArgumentException("part set hash too long");
        if (partsTotal < 0) throw new IllegalArgumentException("part set total must be >= 0");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockId)) return false;
        BlockId other = (BlockId) o;
        return partsTotal == other.partsTotal
                && Arrays.equals(hash, other.hash)
                && Arrays.equals(partsHash, other.partsHash);
    }

    @Override public int hashCode() { return Objects.hash(Arrays.hashCode(hash), partsTotal, Arrays.hashCode(partsHash)); }

    @Override public String toString() { return "BlockId(" + Hex.shortHex(hash) + ":" + partsTotal + ")"; }
}
