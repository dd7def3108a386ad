package io.lightclient.core.protocol;

/** Lowercase hex helpers for addresses, hashes and the JSON codecs. */
public final class Hex {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hex() {}

    public static String encode(byte[] b) {
        if (b == null) return "";
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    public static byte[] decode(String s) {
        if (s == null || s.isEmpty()) return new byte[0];
        if ((s.length() & 1) != 0) {
            throw new IllegalArgumentException("Odd-length hex string");
        }
        byte[] out = new byte[s.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(s.charAt(2 * i), 16);
            int lo = Character.digit(s.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Invalid hex character in: " + s);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    /** First 8 hex chars, for log lines. */
    public static String shortHex(byte[] b) {
        String hex = encode(b);
        return hex.length() <= 8 ? hex : hex.substring(0, 8) + "...";
    }
}
