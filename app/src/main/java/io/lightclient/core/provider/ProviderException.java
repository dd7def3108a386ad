package io.lightclient.core.provider;

/** A header provider could not be reached, timed out, or answered with an unusable payload. */
public class ProviderException extends RuntimeException {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
