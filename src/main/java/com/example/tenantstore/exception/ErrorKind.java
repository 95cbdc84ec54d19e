package com.example.tenantstore.exception;

/**
 * Kinds of failure surfaced by the data-access layer. Callers branch on the kind,
 * not on the concrete exception class.
 */
public enum ErrorKind {
    INVALID_IDENTITY,
    MALFORMED_KEY,
    PARTITION_MISMATCH,
    VALIDATION,
    ALREADY_EXISTS,
    NOT_FOUND,
    VERSION_CONFLICT,
    RETRIES_EXHAUSTED,
    CANCELLED,
    STORE
}
