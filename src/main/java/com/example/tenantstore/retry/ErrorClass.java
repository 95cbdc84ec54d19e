package com.example.tenantstore.retry;

public enum ErrorClass {
    TRANSIENT,
    PERMANENT
}
