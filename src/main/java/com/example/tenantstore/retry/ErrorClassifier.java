package com.example.tenantstore.retry;

import java.time.Duration;
import java.util.Optional;

@FunctionalInterface
public interface ErrorClassifier {

    ErrorClass classify(Throwable error);

    /** Server-suggested wait before the next attempt, when the error carries one. */
    default Optional<Duration> retryAfter(Throwable error) {
        return Optional.empty();
    }
}
