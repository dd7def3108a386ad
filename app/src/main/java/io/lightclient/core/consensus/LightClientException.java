package io.lightclient.core.consensus;

/**
 * Rejection of a client update or header verification. Carries which check failed and
 * the height it failed at, so the caller can decide between retry, alerting and
 * abandoning the counterparty.
 */
public class LightClientException extends RuntimeException {
    private final ErrorCode code;
    private final long height;

    public LightClientException(ErrorCode code, long height, String message) {
        super(format(code, height, message));
        this.code = code;
        this.height = height;
    }

    public LightClientException(ErrorCode code, long height, String message, Throwable cause) {
        super(format(code, height, message), cause);
        this.code = code;
        this.height = height;
    }

    public ErrorCode code() {
        return code;
    }

    public ErrorCategory category() {
        return code.category();
    }

    /** Height of the header the failed check was applied to. */
    public long height() {
        return height;
    }

    private static String format(ErrorCode code, long height, String message) {
        return code + " at height " + height + ": " + message;
    }
}
