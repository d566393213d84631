package ch.so.arp.docqa.exception;

import java.time.Instant;

/**
 * Error body returned by the REST endpoints.
 */
public record ApiError(String errorId, String code, String message, String path, Instant timestamp) {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String UNSUPPORTED_FORMAT = "UNSUPPORTED_FORMAT";
    public static final String SESSION_NOT_FOUND = "SESSION_NOT_FOUND";
    public static final String PROVIDER_UNAVAILABLE = "PROVIDER_UNAVAILABLE";
    public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
    public static final String CONFIGURATION_ERROR = "CONFIGURATION_ERROR";
}
