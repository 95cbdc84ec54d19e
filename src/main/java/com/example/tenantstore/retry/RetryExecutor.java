package com.example.tenantstore.retry;

import com.example.tenantstore.exception.OperationCancelledException;
import com.example.tenantstore.exception.RetriesExhaustedException;
import com.example.tenantstore.exception.TenantStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Runs store operations with bounded retry on transient failures. This is the only place
 * retries happen; permanent errors and cancellation propagate immediately.
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final ErrorClassifier classifier;
    private final Sleeper sleeper;
    private final Clock clock;
    private final List<RetryListener> listeners = new CopyOnWriteArrayList<>();

    public RetryExecutor(RetryPolicy policy, ErrorClassifier classifier, Sleeper sleeper, Clock clock) {
        this.policy = policy;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public void addListener(RetryListener listener) {
        listeners.add(listener);
    }

    public <T> T execute(String operation, Supplier<T> call) {
        return execute(operation, call, policy, OperationContext.none());
    }

    public <T> T execute(String operation, Supplier<T> call, OperationContext context) {
        return execute(operation, call, policy, context);
    }

    public <T> T execute(String operation, Supplier<T> call, RetryPolicy policy, OperationContext context) {
        int attempt = 0;
        while (true) {
            checkContext(operation, context);
            attempt++;
            try {
                return call.get();
            } catch (OperationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                ErrorClass errorClass = classifier.classify(e);
                if (errorClass == ErrorClass.PERMANENT) {
                    if (e instanceof TenantStoreException) {
                        ((TenantStoreException) e).setAttempts(attempt);
                    }
                    logger.debug("{} failed permanently on attempt {}: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                if (attempt >= policy.getMaxAttempts()) {
                    logger.error("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw new RetriesExhaustedException(operation, attempt, e);
                }
                Duration delay = classifier.retryAfter(e).orElse(policy.backoff(attempt));
                logger.warn("{} attempt {}/{} failed ({}), retrying in {} ms: {}",
                        operation, attempt, policy.getMaxAttempts(), errorClass, delay.toMillis(), e.getMessage());
                notifyListeners(new RetryEvent(operation, attempt, delay, errorClass, e));
                pause(operation, delay, context, e);
            }
        }
    }

    private void checkContext(String operation, OperationContext context) {
        if (context.isCancelled()) {
            throw new OperationCancelledException(operation + " was cancelled");
        }
        if (context.isExpired(clock.instant())) {
            throw new OperationCancelledException(operation + " passed its deadline " + context.getDeadline());
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException(operation + " was interrupted");
        }
    }

    private void pause(String operation, Duration delay, OperationContext context, RuntimeException lastError) {
        if (context.wouldExpire(clock.instant(), delay)) {
            throw new OperationCancelledException(
                    String.format("%s: backoff of %d ms would pass the deadline", operation, delay.toMillis()), lastError);
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(operation + " was interrupted during backoff", e);
        }
    }

    private void notifyListeners(RetryEvent event) {
        for (RetryListener listener : listeners) {
            try {
                listener.onRetry(event);
            } catch (RuntimeException e) {
                logger.warn("Retry listener {} failed: {}", listener, e.getMessage());
            }
        }
    }
}
