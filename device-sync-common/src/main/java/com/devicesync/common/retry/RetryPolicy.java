package com.devicesync.common.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Bounded retry with a fixed delay between attempts.
 *
 * <ul>
 *   <li>At most {@code maxAttempts} attempts; no wait after the last one.</li>
 *   <li>On exhaustion a {@link RetryExhaustedException} carrying the last failure is thrown.</li>
 *   <li>A raised {@link CancellationSignal} (or thread interrupt) ends the run with
 *       {@link RetryOutcome#isCancelled()}; cancellation is never reported as a failure.</li>
 * </ul>
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final Duration delay;
    private final int maxAttempts;

    private RetryPolicy(Duration delay, int maxAttempts) {
        this.delay = delay;
        this.maxAttempts = maxAttempts;
    }

    public static RetryPolicy fixed(Duration delay, int maxAttempts) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0, got: " + delay);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
        }
        return new RetryPolicy(delay, maxAttempts);
    }

    public Duration delay() {
        return delay;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Invokes {@code action} until it returns normally, attempts run out or the
     * signal is raised.
     */
    public <T> RetryOutcome<T> run(RetryableAction<T> action, CancellationSignal signal) {
        List<Throwable> failures = new ArrayList<>();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (signal.isCancelled()) {
                return RetryOutcome.cancelled(attempt - 1);
            }
            try {
                return RetryOutcome.succeeded(action.run(), attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RetryOutcome.cancelled(attempt);
            } catch (Exception e) {
                if (signal.isCancelled()) {
                    return RetryOutcome.cancelled(attempt);
                }
                failures.add(e);
                if (attempt < maxAttempts) {
                    log.warn("Attempt {}/{} failed, retrying in {} ms: {}",
                        attempt, maxAttempts, delay.toMillis(), e.toString());
                    if (waitOrCancelled(signal)) {
                        return RetryOutcome.cancelled(attempt);
                    }
                }
            }
        }
        throw exhausted(failures);
    }

    /**
     * Starts a new attempt of {@code operation} until one completes normally,
     * attempts run out or the signal is raised. Raising the signal cancels the
     * in-flight future. A non-repeatable operation gets exactly one attempt.
     */
    public <T> RetryOutcome<T> runAsync(AsyncOperation<T> operation, CancellationSignal signal) {
        List<Throwable> failures = new ArrayList<>();
        int allowed = operation.isRepeatable() ? maxAttempts : 1;
        for (int attempt = 1; attempt <= allowed; attempt++) {
            if (signal.isCancelled()) {
                return RetryOutcome.cancelled(attempt - 1);
            }
            Throwable failure;
            try {
                CompletableFuture<T> future = operation.start();
                try (var ignored = signal.onCancel(() -> future.cancel(true))) {
                    return RetryOutcome.succeeded(future.get(), attempt);
                }
            } catch (CancellationException e) {
                return RetryOutcome.cancelled(attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RetryOutcome.cancelled(attempt);
            } catch (ExecutionException e) {
                failure = e.getCause() != null ? e.getCause() : e;
            } catch (RuntimeException e) {
                failure = e;
            }
            if (signal.isCancelled() || failure instanceof CancellationException) {
                return RetryOutcome.cancelled(attempt);
            }
            failures.add(failure);
            if (attempt < allowed) {
                log.warn("Async attempt {}/{} failed, retrying in {} ms: {}",
                    attempt, allowed, delay.toMillis(), failure.toString());
                if (waitOrCancelled(signal)) {
                    return RetryOutcome.cancelled(attempt);
                }
            }
        }
        throw exhausted(failures);
    }

    private boolean waitOrCancelled(CancellationSignal signal) {
        try {
            return signal.await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private RetryExhaustedException exhausted(List<Throwable> failures) {
        String message = String.format("Operation failed after %d attempt(s) with %d ms intervals",
            failures.size(), delay.toMillis());
        return new RetryExhaustedException(message, failures.size(), failures);
    }
}
