package io.lightclient.core.consensus;

/** How a caller should react to a rejected update. */
public enum ErrorCategory {
    /** Stale or out-of-order update. Never retried; the caller must supply a newer header. */
    TEMPORAL_VIOLATION,
    /** Quorum, trust level, signature or hash check failed. Fatal for the update; may be an attack. */
    CRYPTO_VERIFICATION_FAILURE,
    /** No intermediate header could be obtained. Transient; the whole update may be retried later. */
    PROVIDER_FAILURE,
    /** Terminal until the client is replaced. */
    CLIENT_FROZEN,
    /** Malformed or mismatched input. */
    INVALID_HEADER
}
