package com.example.tenantstore.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-call deadline and cancellation signal. Create one per caller operation; it is never shared
 * between unrelated calls.
 */
public final class OperationContext {

    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private OperationContext(Instant deadline) {
        this.deadline = deadline;
    }

    public static OperationContext none() {
        return new OperationContext(null);
    }

    public static OperationContext withDeadline(Instant deadline) {
        return new OperationContext(deadline);
    }

    public static OperationContext withTimeout(Duration timeout, Clock clock) {
        return new OperationContext(clock.instant().plus(timeout));
    }

    public Instant getDeadline() {
        return deadline;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }

    public boolean wouldExpire(Instant now, Duration wait) {
        return deadline != null && now.plus(wait).isAfter(deadline);
    }
}
