package io.lightclient.core.protocol;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/** A header together with the commit that finalized it. */
public final class SignedHeader {
    private final BlockHeader header;
    private final Commit commit;

    public SignedHeader(BlockHeader header, Commit commit) {
        this.header = Objects.requireNonNull(header, "header");
        this.commit = Objects.requireNonNull(commit, "commit");
    }

    public BlockHeader header() { return header; }
    public Commit commit() { return commit; }

    public long height() { return header.height(); }
    public Instant time() { return header.time(); }
    public String chainId() { return header.chainId(); }

    /**
     * The commit must be for this header: same height and a block id whose hash is the
     * header's own hash.
     */
    public void validateBasic(String expectedChainId, Hasher hasher) {
        if (expectedChainId != null && !expectedChainId.equals(header.chainId())) {
            throw new IllegalArgumentException("header belongs to chain " + header.chainId()
                    + ", expected " + expectedChainId);
        }
        if (commit.height() != header.height()) {
            throw new IllegalArgumentException("commit height " + commit.height()
                    + " does not match header height " + header.height());
        }
        byte[] headerHash = header.hash(hasher);
        if (!Arrays.equals(commit.blockId().hash(), headerHash)) {
            throw new IllegalArgumentException("commit signs block " + Hex.shortHex(commit.blockId().hash())
                    + " but header hashes to " + Hex.shortHex(headerHash));
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignedHeader)) return false;
        SignedHeader other = (SignedHeader) o;
        return header.equals(other.header) && commit.equals(other.commit);
    }

    @Override public int hashCode() { return Objects.hash(header, commit); }

    @Override public String toString() { return "SignedHeader{h=" + header.height() + ", " + commit + "}"; }
}
