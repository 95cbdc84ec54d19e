package com.example.tenantstore.store;

import com.example.tenantstore.exception.ErrorKind;
import com.example.tenantstore.exception.TenantStoreException;

import java.time.Duration;
import java.util.Optional;

/**
 * Error reported by a {@link DocumentStore}, classified by an HTTP-like status code.
 */
public class StoreException extends TenantStoreException {

    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int TIMEOUT = 408;
    public static final int CONFLICT = 409;
    public static final int PRECONDITION_FAILED = 412;
    public static final int TOO_MANY_REQUESTS = 429;
    public static final int INTERNAL_ERROR = 500;
    public static final int SERVICE_UNAVAILABLE = 503;

    private final int statusCode;
    private final Duration retryAfter;

    public StoreException(int statusCode, String message) {
        this(statusCode, message, null, null);
    }

    public StoreException(int statusCode, String message, Throwable cause) {
        this(statusCode, message, null, cause);
    }

    public StoreException(int statusCode, String message, Duration retryAfter, Throwable cause) {
        super(ErrorKind.STORE, String.format("[%d] %s", statusCode, message), cause);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public static StoreException throttled(String message, Duration retryAfter, Throwable cause) {
        return new StoreException(TOO_MANY_REQUESTS, message, retryAfter, cause);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isNotFound() {
        return statusCode == NOT_FOUND;
    }

    public boolean isConflict() {
        return statusCode == CONFLICT;
    }

    public boolean isPreconditionFailed() {
        return statusCode == PRECONDITION_FAILED;
    }
}
