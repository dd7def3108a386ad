package io.lightclient.core.consensus;

public enum ErrorCode {
    TRUSTING_PERIOD_EXPIRED(ErrorCategory.TEMPORAL_VIOLATION),
    HEADER_OUTSIDE_TRUSTING_PERIOD(ErrorCategory.TEMPORAL_VIOLATION),
    NON_MONOTONIC_TIMESTAMP(ErrorCategory.TEMPORAL_VIOLATION),
    NON_MONOTONIC_HEIGHT(ErrorCategory.TEMPORAL_VIOLATION),
    HEADER_FROM_FUTURE(ErrorCategory.TEMPORAL_VIOLATION),

    INSUFFICIENT_VOTING_POWER(ErrorCategory.CRYPTO_VERIFICATION_FAILURE),
    VALIDATOR_SET_MISMATCH(ErrorCategory.CRYPTO_VERIFICATION_FAILURE),
    INVALID_SIGNATURE(ErrorCategory.CRYPTO_VERIFICATION_FAILURE),
    INVALID_COMMIT(ErrorCategory.CRYPTO_VERIFICATION_FAILURE),

    NO_TRUST_PATH(ErrorCategory.PROVIDER_FAILURE),

    CLIENT_FROZEN(ErrorCategory.CLIENT_FROZEN),

    INVALID_HEADER(ErrorCategory.INVALID_HEADER),
    CHAIN_ID_MISMATCH(ErrorCategory.INVALID_HEADER);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
