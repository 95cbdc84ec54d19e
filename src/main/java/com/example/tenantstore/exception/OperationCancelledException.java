package com.example.tenantstore.exception;

public class OperationCancelledException extends TenantStoreException {

    public OperationCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
