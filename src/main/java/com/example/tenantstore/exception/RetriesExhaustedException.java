package com.example.tenantstore.exception;

public class RetriesExhaustedException extends TenantStoreException {

    public RetriesExhaustedException(String operation, int attempts, Throwable lastError) {
        super(ErrorKind.RETRIES_EXHAUSTED,
                String.format("Operation '%s' failed after %d attempts: %s", operation, attempts, lastError.getMessage()),
                lastError);
        setAttempts(attempts);
    }
}
