package io.lightclient.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_SIGNATURE_BYTES = 64;      // Ed25519
    public static final int MAX_CHAIN_ID_LEN = 50;
    public static final int MAX_VALIDATORS = 10_000;
    public static final int MAX_HASH_BYTES = 64;
    /** Keeps every voting-power sum and trust-level product far from overflow. */
    public static final long MAX_TOTAL_VOTING_POWER = Long.MAX_VALUE / 8;
    /** Vote type tag for precommits in canonical sign bytes. */
    public static final byte PRECOMMIT_TYPE = 2;
}
