package com.example.tenantstore.retry;

/**
 * Observes retries. Called before each backoff; exceptions thrown here are logged and ignored.
 */
@FunctionalInterface
public interface RetryListener {

    void onRetry(RetryEvent event);
}
