package com.example.tenantstore.exception;

public class VersionConflictException extends TenantStoreException {

    private final long expectedVersion;

    public VersionConflictException(String message, long expectedVersion, Throwable cause) {
        super(ErrorKind.VERSION_CONFLICT, message, cause);
        this.expectedVersion = expectedVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
