package com.example.tenantstore.exception;

/**
 * Raised by write paths (update, soft delete, hard delete) when the target is missing.
 * Reads report absence as an empty result instead.
 */
public class EntityNotFoundException extends TenantStoreException {

    public EntityNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public EntityNotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
