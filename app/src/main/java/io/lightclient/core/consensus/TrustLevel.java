package io.lightclient.core.consensus;

import java.math.BigInteger;

/**
 * Fraction of a trusted validator set's voting power that must sign a non-adjacent
 * header before it is trusted, with {@code 0 < numerator <= denominator}.
 */
public final class TrustLevel {
    public static final TrustLevel ONE_THIRD = new TrustLevel(1, 3);
    public static final TrustLevel TWO_THIRDS = new TrustLevel(2, 3);
    public static final TrustLevel DEFAULT = ONE_THIRD;

    private final long numerator;
    private final long denominator;

    public TrustLevel(long numerator, long denominator) {
        if (denominator <= 0) throw new IllegalArgumentException("trust level denominator must be > 0");
        if (numerator <= 0) throw new IllegalArgumentException("trust level numerator must be > 0");
        if (numerator > denominator) {
            throw new IllegalArgumentException("trust level must not exceed 1: " + numerator + "/" + denominator);
        }
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /** Parses {@code "n/d"}. */
    public static TrustLevel parse(String fraction) {
        if (fraction == null) throw new IllegalArgumentException("trust level required");
        String[] parts = fraction.trim().split("/", 2);
        if (parts.length != 2) throw new IllegalArgumentException("trust level must look like n/d: " + fraction);
        try {
            return new TrustLevel(Long.parseLong(parts[0].trim()), Long.parseLong(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("trust level must look like n/d: " + fraction, e);
        }
    }

    public long numerator() { return numerator; }
    public long denominator() { return denominator; }

    /** True iff {@code signed / total >= numerator / denominator}. */
    public boolean isMetBy(long signed, long total) {
        if (total <= 0) return false;
        BigInteger lhs = BigInteger.valueOf(signed).multiply(BigInteger.valueOf(denominator));
        BigInteger rhs = BigInteger.valueOf(total).multiply(BigInteger.valueOf(numerator));
        return lhs.compareTo(rhs) >= 0;
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof TrustLevel)) return false;
        TrustLevel other = (TrustLevel) o;
        return numerator == other.numerator && denominator == other.denominator;
    }

    @Override public int hashCode() { return Long.hashCode(numerator) * 31 + Long.hashCode(denominator); }

    @Override public String toString() { return numerator + "/" + denominator; }
}
