package io.lightclient.core.protocol;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Header fields of a BFT block: everything a light client needs to identify the block
 * and the validator sets responsible for it, without the block body.
 * - validatorsHash: the set that signs this block's commit
 * - nextValidatorsHash: the set that signs the next block
 * - appHash: application state after the previous block (the commitment root)
 */
public final class BlockHeader {
    private final long versionBlock;
    private final long versionApp;
    private final String chainId;
    private final long height;
    private final Instant time;
    private final BlockId lastBlockId;
    private final byte[] lastCommitHash;
    private final byte[] dataHash;
    private final byte[] validatorsHash;
    private final byte[] nextValidatorsHash;
    private final byte[] consensusHash;
    private final byte[] appHash;
    private final byte[] lastResultsHash;
    private final byte[] evidenceHash;
    private final String proposerAddress;

    private BlockHeader(Builder b) {
        this.versionBlock = b.versionBlock;
        this.versionApp = b.versionApp;
        this.chainId = b.chainId;
        this.height = b.height;
        this.time = b.time;
        this.lastBlockId = b.lastBlockId != null ? b.lastBlockId : BlockId.empty();
        this.lastCommitHash = copy(b.lastCommitHash);
        this.dataHash = copy(b.dataHash);
        this.validatorsHash = copy(b.validatorsHash);
        this.nextValidatorsHash = copy(b.nextValidatorsHash);
        this.consensusHash = copy(b.consensusHash);
        this.appHash = copy(b.appHash);
        this.lastResultsHash = copy(b.lastResultsHash);
        this.evidenceHash = copy(b.evidenceHash);
        this.proposerAddress = b.proposerAddress;
        basicValidate();
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .version(versionBlock, versionApp)
                .chainId(chainId)
                .height(height)
                .time(time)
                .lastBlockId(lastBlockId)
                .lastCommitHash(lastCommitHash)
                .dataHash(dataHash)
                .validatorsHash(validatorsHash)
                .nextValidatorsHash(nextValidatorsHash)
                .consensusHash(consensusHash)
                .appHash(appHash)
                .lastResultsHash(lastResultsHash)
                .evidenceHash(evidenceHash)
                .proposerAddress(proposerAddress);
    }

    public static final class Builder {
        private long versionBlock = 11;
        private long versionApp;
        private String chainId;
        private long height;
        private Instant time;
        private BlockId lastBlockId;
        private byte[] lastCommitHash;
        private byte[] dataHash;
        private byte[] validatorsHash;
        private byte[] nextValidatorsHash;
        private byte[] consensusHash;
        private byte[] appHash;
        private byte[] lastResultsHash;
        private byte[] evidenceHash;
        private String proposerAddress;

        public Builder version(long block, long app) { this.versionBlock = block; this.versionApp = app; return this; }
        public Builder chainId(String id) { this.chainId = id; return this; }
        public Builder height(long h) { this.height = h; return this; }
        public Builder time(Instant t) { this.time = t; return this; }
        public Builder lastBlockId(BlockId id) { this.lastBlockId = id; return this; }
        public Builder lastCommitHash(byte[] h) { this.lastCommitHash = h; return this; }
        public Builder dataHash(byte[] h) { this.dataHash = h; return this; }
        public Builder validatorsHash(byte[] h) { this.validatorsHash = h; return this; }
        public Builder nextValidatorsHash(byte[] h) { this.nextValidatorsHash = h; return this; }
        public Builder consensusHash(byte[] h) { this.consensusHash = h; return this; }
        public Builder appHash(byte[] h) { this.appHash = h; return this; }
        public Builder lastResultsHash(byte[] h) { this.lastResultsHash = h; return this; }
        public Builder evidenceHash(byte[] h) { this.evidenceHash = h; return this; }
        public Builder proposerAddress(String a) { this.proposerAddress = a; return this; }

        public BlockHeader build() { return new BlockHeader(this); }
    }

    public long versionBlock() { return versionBlock; }
    public long versionApp() { return versionApp; }
    public String chainId() { return chainId; }
    public long height() { return height; }
    public Instant time() { return time; }
    public BlockId lastBlockId() { return lastBlockId; }
    public byte[] lastCommitHash() { return lastCommitHash.clone(); }
    public byte[] dataHash() { return dataHash.clone(); }
    public byte[] validatorsHash() { return validatorsHash.clone(); }
    public byte[] nextValidatorsHash() { return nextValidatorsHash.clone(); }
    public byte[] consensusHash() { return consensusHash.clone(); }
    public byte[] appHash() { return appHash.clone(); }
    public byte[] lastResultsHash() { return lastResultsHash.clone(); }
    public byte[] evidenceHash() { return evidenceHash.clone(); }
    public String proposerAddress() { return proposerAddress; }

    /** Merkle root over the encoded fields, in declaration order. */
    public byte[] hash(Hasher hasher) {
        List<byte[]> fields = List.of(
                new ProtocolCodec().writeLong(versionBlock).writeLong(versionApp).toBytes(),
                ProtocolCodec.encodeString(chainId),
                ProtocolCodec.encodeLong(height),
                ProtocolCodec.encodeInstant(time),
                lastBlockId.encode(),
                lastCommitHash,
                dataHash,
                validatorsHash,
                nextValidatorsHash,
                consensusHash,
                appHash,
                lastResultsHash,
                evidenceHash,
                Hex.decode(proposerAddress)
        );
        return Merkle.rootOf(fields, hasher);
    }

    public void basicValidate() {
        if (chainId == null || chainId.isBlank()) throw new IllegalArgumentException("chainId required");
        if (chainId.length() > ProtocolLimits.MAX_CHAIN_ID_LEN) {
            throw new IllegalArgumentException("chainId longer than " + ProtocolLimits.MAX_CHAIN_ID_LEN + " chars");
        }
        if (height < 1) throw new IllegalArgumentException("height must be >= 1");
        if (time == null) throw new IllegalArgumentException("time required");
        requireHash("validatorsHash", validatorsHash, true);
        requireHash("nextValidatorsHash", nextValidatorsHash, true);
        requireHash("lastCommitHash", lastCommitHash, false);
        requireHash("dataHash", dataHash, false);
        requireHash("consensusHash", consensusHash, false);
        requireHash("appHash", appHash, false);
        requireHash("lastResultsHash", lastResultsHash, false);
        requireHash("evidenceHash", evidenceHash, false);
        if (proposerAddress == null || proposerAddress.length() != SignatureUtil.ADDRESS_LENGTH * 2) {
            throw new IllegalArgumentException("proposerAddress must be " + SignatureUtil.ADDRESS_LENGTH + " bytes");
        }
    }

    private static void requireHash(String name, byte[] h, boolean nonEmpty) {
        if (nonEmpty && h.length == 0) throw new IllegalArgumentException(name + " required");
        if (h.length > ProtocolLimits.MAX_HASH_BYTES) throw new IllegalArgumentException(name + " too long");
    }

    private static byte[] copy(byte[] b) { return b != null ? b.clone() : new byte[0]; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockHeader)) return false;
        BlockHeader other = (BlockHeader) o;
        return versionBlock == other.versionBlock && versionApp == other.versionApp
                && height == other.height
                && chainId.equals(other.chainId)
                && time.equals(other.time)
                && lastBlockId.equals(other.lastBlockId)
                && Arrays.equals(lastCommitHash, other.lastCommitHash)
                && Arrays.equals(dataHash, other.dataHash)
                && Arrays.equals(validatorsHash, other.validatorsHash)
                && Arrays.equals(nextValidatorsHash, other.nextValidatorsHash)
                && Arrays.equals(consensusHash, other.consensusHash)
                && Arrays.equals(appHash, other.appHash)
                && Arrays.equals(lastResultsHash, other.lastResultsHash)
                && Arrays.equals(evidenceHash, other.evidenceHash)
                && proposerAddress.equals(other.proposerAddress);
    }

    @Override public int hashCode() { return Objects.hash(chainId, height, time, Arrays.hashCode(validatorsHash)); }

    @Override public String toString() {
        return "BlockHeader{chain=" + chainId + ", h=" + height + ", time=" + time + "}";
    }
}
