package com.example.tenantstore.exception;

/**
 * Entity or query failed validation before reaching the database.
 */
public class ValidationException extends TenantStoreException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public static ValidationException required(String entityType, String field) {
        return new ValidationException(String.format("%s.%s is required", entityType, field));
    }
}
