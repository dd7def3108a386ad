package io.lightclient.core.client;

import io.lightclient.core.protocol.Hex;
import io.lightclient.core.protocol.MerkleRoot;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/** Snapshot of a verified height. Never mutated, only superseded. */
public final class ConsensusState {
    private final long height;
    private final Instant timestamp;
    private final MerkleRoot root;
    private final byte[] nextValidatorsHash;

    public ConsensusState(long height, Instant timestamp, MerkleRoot root, byte[] nextValidatorsHash) {
        this.height = height;
        this.timestamp = timestamp;
        this.root = root;
        this.nextValidatorsHash = nextValidatorsHash != null ? nextValidatorsHash.clone() : new byte[0];
        basicValidate();
    }

    public long height() { return height; }
    public Instant timestamp() { return timestamp; }
    public MerkleRoot root() { return root; }
    public byte[] nextValidatorsHash() { return nextValidatorsHash.clone(); }

    public void basicValidate() {
        if (height < 1) throw new IllegalArgumentException("height must be >= 1");
        if (timestamp == null) throw new IllegalArgumentException("timestamp required");
        if (root == null) throw new IllegalArgumentException("commitment root required");
        if (nextValidatorsHash.length == 0) throw new IllegalArgumentException("next validators hash required");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConsensusState)) return false;
        ConsensusState other = (ConsensusState) o;
        return height == other.height
                && timestamp.equals(other.timestamp)
                && root.equals(other.root)
                && Arrays.equals(nextValidatorsHash, other.nextValidatorsHash);
    }

    @Override public int hashCode() { return Objects.hash(height, timestamp, root); }

    @Override public String toString() {
        return "ConsensusState{h=" + height + ", time=" + timestamp + ", root=" + root
                + ", nextVals=" + Hex.shortHex(nextValidatorsHash) + "}";
    }
}
