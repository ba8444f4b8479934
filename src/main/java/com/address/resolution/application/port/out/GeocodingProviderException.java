package com.address.resolution.application.port.out;

/**
 * Exception signalled by a {@link GeocodingProvider} when a lookup fails.
 */
public class GeocodingProviderException extends RuntimeException {

    public enum Reason {
        NETWORK,
        QUOTA,
        NOT_FOUND,
        MALFORMED_RESPONSE
    }

    private final Reason reason;

    public GeocodingProviderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GeocodingProviderException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
