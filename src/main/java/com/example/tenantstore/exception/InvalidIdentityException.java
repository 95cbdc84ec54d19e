package com.example.tenantstore.exception;

public class InvalidIdentityException extends TenantStoreException {

    private final String field;

    public InvalidIdentityException(String field, String message) {
        super(ErrorKind.INVALID_IDENTITY, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
