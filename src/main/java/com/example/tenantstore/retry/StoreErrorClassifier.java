package com.example.tenantstore.retry;

import com.example.tenantstore.exception.TenantStoreException;
import com.example.tenantstore.store.StoreException;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Treats throttling, timeouts, 5xx responses and network failures as transient.
 */
public class StoreErrorClassifier implements ErrorClassifier {

    static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(408, 429, 449, 500, 502, 503, 504);

    @Override
    public ErrorClass classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof StoreException) {
                return TRANSIENT_STATUS_CODES.contains(((StoreException) t).getStatusCode())
                        ? ErrorClass.TRANSIENT : ErrorClass.PERMANENT;
            }
            if (t instanceof TenantStoreException) {
                return ErrorClass.PERMANENT;
            }
            if (t instanceof IOException || t instanceof TimeoutException) {
                return ErrorClass.TRANSIENT;
            }
        }
        return ErrorClass.PERMANENT;
    }

    @Override
    public Optional<Duration> retryAfter(Throwable error) {
        if (error instanceof StoreException) {
            return ((StoreException) error).getRetryAfter();
        }
        return Optional.empty();
    }
}
