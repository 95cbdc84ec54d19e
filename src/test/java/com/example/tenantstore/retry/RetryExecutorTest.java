package com.example.tenantstore.retry;

import com.example.tenantstore.exception.ErrorKind;
import com.example.tenantstore.exception.OperationCancelledException;
import com.example.tenantstore.exception.RetriesExhaustedException;
import com.example.tenantstore.exception.VersionConflictException;
import com.example.tenantstore.store.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
    private final List<Duration> sleeps = new ArrayList<>();
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new RetryExecutor(RetryPolicy.defaults(), new StoreErrorClassifier(), sleeps::add, clock);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void testExecute_SucceedsWithoutRetry() {
        assertEquals("ok", executor.execute("op", () -> "ok"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testExecute_AlwaysTransientStopsAtMaxAttempts() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        RetriesExhaustedException e = assertThrows(RetriesExhaustedException.class, () -> executor.execute("op", () -> {
            calls.incrementAndGet();
            throw new StoreException(503, "unavailable");
        }));

        // Then
        assertEquals(3, calls.get());
        assertEquals(3, e.getAttempts());
        assertEquals(ErrorKind.RETRIES_EXHAUSTED, e.getKind());
        assertInstanceOf(StoreException.class, e.getCause());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void testExecute_RecoversAfterTransientFailure() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("op", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new UncheckedIOException(new IOException("connection reset"));
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(2, calls.get());
    }

    @Test
    void testExecute_PermanentErrorIsNotRetried() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        StoreException e = assertThrows(StoreException.class, () -> executor.execute("op", () -> {
            calls.incrementAndGet();
            throw new StoreException(StoreException.CONFLICT, "exists");
        }));

        // Then
        assertEquals(1, calls.get());
        assertEquals(1, e.getAttempts());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testExecute_VersionConflictIsNeverRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(VersionConflictException.class, () -> executor.execute("op", () -> {
            calls.incrementAndGet();
            throw new VersionConflictException("stale", 1, null);
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void testExecute_HonorsServerRetryAfter() {
        AtomicInteger calls = new AtomicInteger();

        executor.execute("op", () -> {
            if (calls.incrementAndGet() == 1) {
                throw StoreException.throttled("busy", Duration.ofMillis(250), null);
            }
            return null;
        });

        assertEquals(List.of(Duration.ofMillis(250)), sleeps);
    }

    @Test
    void testBackoff_IsCappedAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(30));

        assertEquals(Duration.ofSeconds(1), policy.backoff(1));
        assertEquals(Duration.ofSeconds(16), policy.backoff(5));
        assertEquals(Duration.ofSeconds(30), policy.backoff(6));
        assertEquals(Duration.ofSeconds(30), policy.backoff(200));
    }

    @Test
    void testExecute_CancelledContextNeverCallsOperation() {
        // Given
        OperationContext context = OperationContext.none();
        context.cancel();
        AtomicInteger calls = new AtomicInteger();

        // When
        OperationCancelledException e = assertThrows(OperationCancelledException.class,
                () -> executor.execute("op", calls::incrementAndGet, context));

        // Then
        assertEquals(0, calls.get());
        assertEquals(ErrorKind.CANCELLED, e.getKind());
    }

    @Test
    void testExecute_CancelDuringBackoffStopsRetrying() {
        OperationContext context = OperationContext.none();
        AtomicInteger calls = new AtomicInteger();
        RetryExecutor cancelling = new RetryExecutor(RetryPolicy.defaults(), new StoreErrorClassifier(),
                delay -> context.cancel(), clock);

        assertThrows(OperationCancelledException.class, () -> cancelling.execute("op", () -> {
            calls.incrementAndGet();
            throw new StoreException(503, "unavailable");
        }, context));

        assertEquals(1, calls.get());
    }

    @Test
    void testExecute_BackoffPastDeadlineIsCancelled() {
        // Given
        OperationContext context = OperationContext.withDeadline(clock.instant().plusMillis(500));
        AtomicInteger calls = new AtomicInteger();

        // When
        assertThrows(OperationCancelledException.class, () -> executor.execute("op", () -> {
            calls.incrementAndGet();
            throw new StoreException(503, "unavailable");
        }, context));

        // Then
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testExecute_InterruptedSleepRestoresInterruptFlag() {
        RetryExecutor interrupted = new RetryExecutor(RetryPolicy.defaults(), new StoreErrorClassifier(),
                delay -> { throw new InterruptedException(); }, clock);

        assertThrows(OperationCancelledException.class, () -> interrupted.execute("op", () -> {
            throw new StoreException(503, "unavailable");
        }));

        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void testExecute_ListenerFailureDoesNotAffectRetry() {
        // Given
        List<RetryEvent> events = new ArrayList<>();
        executor.addListener(event -> { throw new IllegalStateException("listener broke"); });
        executor.addListener(events::add);
        AtomicInteger calls = new AtomicInteger();

        // When
        String result = executor.execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new StoreException(429, "throttled");
            }
            return "ok";
        });

        // Then
        assertEquals("ok", result);
        assertEquals(2, events.size());
        assertEquals(1, events.get(0).getAttempt());
        assertEquals(ErrorClass.TRANSIENT, events.get(0).getErrorClass());
    }

    @Test
    void testClassifier_TransientStatusCodes() {
        StoreErrorClassifier classifier = new StoreErrorClassifier();

        for (int code : new int[] {408, 429, 449, 500, 502, 503, 504}) {
            assertEquals(ErrorClass.TRANSIENT, classifier.classify(new StoreException(code, "x")), "status " + code);
        }
        for (int code : new int[] {400, 404, 409, 412}) {
            assertEquals(ErrorClass.PERMANENT, classifier.classify(new StoreException(code, "x")), "status " + code);
        }
        assertEquals(ErrorClass.PERMANENT, classifier.classify(new IllegalArgumentException("bug")));
    }
}
