package com.example.tenantstore.exception;

/**
 * Base class for every error raised by the tenant data-access layer.
 */
public class TenantStoreException extends RuntimeException {

    private final ErrorKind kind;
    private int attempts;

    public TenantStoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TenantStoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Number of attempts the retry executor made before giving up, or 0 when the
     * error was raised before any database call.
     */
    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }
}
