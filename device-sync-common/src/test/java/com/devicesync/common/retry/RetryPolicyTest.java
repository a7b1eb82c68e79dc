package com.devicesync.common.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final CancellationSignal signal = new CancellationSignal();

    @Test
    void run_succeedsOnFifthAttempt() {
        var calls = new AtomicInteger();
        var policy = RetryPolicy.fixed(Duration.ZERO, 5);

        var outcome = policy.run(() -> {
            int n = calls.incrementAndGet();
            if (n < 5) {
                throw new IllegalStateException("attempt " + n);
            }
            return "ok";
        }, signal);

        assertTrue(outcome.isSucceeded());
        assertEquals("ok", outcome.value().orElseThrow());
        assertEquals(5, outcome.attempts());
        assertEquals(5, calls.get());
    }

    @Test
    void run_surfacesLastFailureWhenExhausted() {
        var calls = new AtomicInteger();
        var policy = RetryPolicy.fixed(Duration.ZERO, 5);

        var ex = assertThrows(RetryExhaustedException.class, () -> policy.run(() -> {
            throw new IllegalStateException("attempt " + calls.incrementAndGet());
        }, signal));

        assertEquals(5, calls.get());
        assertEquals(5, ex.getAttempts());
        assertEquals("attempt 5", ex.getCause().getMessage());
        assertEquals(4, ex.getSuppressed().length);
        assertEquals("attempt 1", ex.getSuppressed()[0].getMessage());
    }

    @Test
    void run_cancelledBeforeFirstAttemptDoesNothing() {
        var calls = new AtomicInteger();
        signal.cancel();

        var outcome = RetryPolicy.fixed(Duration.ZERO, 5).run(calls::incrementAndGet, signal);

        assertTrue(outcome.isCancelled());
        assertEquals(0, outcome.attempts());
        assertEquals(0, calls.get());
    }

    @Test
    void run_failureAfterCancellationIsNotReportedAsFailure() {
        var calls = new AtomicInteger();

        var outcome = RetryPolicy.fixed(Duration.ZERO, 5).run(() -> {
            calls.incrementAndGet();
            signal.cancel();
            throw new IllegalStateException("shutting down");
        }, signal);

        assertTrue(outcome.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void run_cancellationInterruptsBackoffWait() {
        var calls = new AtomicInteger();
        var policy = RetryPolicy.fixed(Duration.ofSeconds(30), 5);
        var canceller = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel();
        });
        canceller.start();

        var outcome = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> policy.run(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("broker unreachable");
        }, signal));

        assertTrue(outcome.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void runAsync_startsNewAttemptEachRetry() {
        var starts = new AtomicInteger();
        AsyncOperation<String> operation = () -> {
            int n = starts.incrementAndGet();
            return n < 3
                ? CompletableFuture.failedFuture(new IllegalStateException("attempt " + n))
                : CompletableFuture.completedFuture("done");
        };

        var outcome = RetryPolicy.fixed(Duration.ZERO, 5).runAsync(operation, signal);

        assertTrue(outcome.isSucceeded());
        assertEquals("done", outcome.value().orElseThrow());
        assertEquals(3, starts.get());
    }

    @Test
    void runAsync_surfacesLastFailureWhenExhausted() {
        var starts = new AtomicInteger();
        AsyncOperation<Void> operation = () ->
            CompletableFuture.failedFuture(new IllegalStateException("attempt " + starts.incrementAndGet()));

        var ex = assertThrows(RetryExhaustedException.class,
            () -> RetryPolicy.fixed(Duration.ZERO, 5).runAsync(operation, signal));

        assertEquals(5, starts.get());
        assertEquals("attempt 5", ex.getCause().getMessage());
    }

    @Test
    void runAsync_singleShotOperationIsNotReawaited() {
        var failure = new IllegalStateException("boom");
        var operation = AsyncOperation.once(CompletableFuture.<String>failedFuture(failure));

        var ex = assertThrows(RetryExhaustedException.class,
            () -> RetryPolicy.fixed(Duration.ZERO, 5).runAsync(operation, signal));

        assertEquals(1, ex.getAttempts());
        assertSame(failure, ex.getCause());
    }

    @Test
    void runAsync_cancellationCancelsInFlightAttempt() {
        var inFlight = new CompletableFuture<String>();
        var canceller = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel();
        });
        canceller.start();

        var outcome = assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> RetryPolicy.fixed(Duration.ZERO, 5).runAsync(() -> inFlight, signal));

        assertTrue(outcome.isCancelled());
        assertTrue(inFlight.isCancelled());
    }

    @Test
    void fixed_rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(Duration.ofSeconds(-1), 3));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(Duration.ZERO, 0));
    }
}
