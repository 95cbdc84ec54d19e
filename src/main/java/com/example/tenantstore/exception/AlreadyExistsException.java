package com.example.tenantstore.exception;

public class AlreadyExistsException extends TenantStoreException {

    public AlreadyExistsException(String message, Throwable cause) {
        super(ErrorKind.ALREADY_EXISTS, message, cause);
    }
}
