package io.lightclient.core.protocol;

import java.util.List;

/**
 * Merkle root over byte[] leaves, RFC 6962 style:
 * - leaf = H(0x00 || leaf), inner = H(0x01 || left || right)
 * - no leaves: root = H(empty)
 * - split point is the largest power of two strictly below the leaf count,
 *   so odd leaves are promoted rather than duplicated.
 */
public final class Merkle {
    private static final byte LEAF_PREFIX = 0x00;
    private static final byte INNER_PREFIX = 0x01;

    private Merkle(){}

    public static byte[] rootOf(List<byte[]> leaves, Hasher hasher) {
        if (leaves == null || leaves.isEmpty()) return hasher.hash(new byte[0]);
        return subtreeRoot(leaves, 0, leaves.size(), hasher);
    }

    private static byte[] subtreeRoot(List<byte[]> leaves, int from, int to, Hasher hasher) {
        int n = to - from;
        if (n == 1) {
            return hasher.hash(prefixed(LEAF_PREFIX, leaves.get(from), new byte[0]));
        }
        int k = splitPoint(n);
        byte[] left = subtreeRoot(leaves, from, from + k, hasher);
        byte[] right = subtreeRoot(leaves, from + k, to, hasher);
        return hasher.hash(prefixed(INNER_PREFIX, left, right));
    }

    static int splitPoint(int n) {
        if (n < 2) throw new IllegalArgumentException("split point needs at least 2 leaves");
        int k = Integer.highestOneBit(n);
        return k == n ? k >>> 1 : k;
    }

    private static byte[] prefixed(byte prefix, byte[] a, byte[] b) {
        byte[] out = new byte[1 + a.length + b.length];
        out[0] = prefix;
        System.arraycopy(a, 0, out, 1, a.length);
        System.arraycopy(b, 0, out, 1 + a.length, b.length);
        return out;
    }
}
