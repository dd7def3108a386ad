package io.lightclient.core.protocol;

import java.util.Arrays;

/**
 * Commitment root carried by a consensus state: the app hash of a verified header,
 * against which higher layers check membership proofs.
 */
public final class MerkleRoot {
    private final byte[] bytes;

    public MerkleRoot(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Merkle root required");
        }
        this.bytes = bytes.clone();
    }

    public static MerkleRoot of(byte[] appHash) { return new MerkleRoot(appHash); }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hex.encode(bytes); }

    @Override public boolean equals(Object o){ return o instanceof MerkleRoot && Arrays.equals(bytes, ((MerkleRoot)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "MerkleRoot(" + Hex.shortHex(bytes) + ")"; }
}
