package com.example.tenantstore.exception;

public class PartitionMismatchException extends TenantStoreException {

    public PartitionMismatchException(String message) {
        super(ErrorKind.PARTITION_MISMATCH, message);
    }
}
