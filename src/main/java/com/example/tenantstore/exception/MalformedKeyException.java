package com.example.tenantstore.exception;

public class MalformedKeyException extends TenantStoreException {

    public MalformedKeyException(String message) {
        super(ErrorKind.MALFORMED_KEY, message);
    }
}
