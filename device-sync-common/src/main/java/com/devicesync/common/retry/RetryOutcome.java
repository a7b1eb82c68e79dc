package com.devicesync.common.retry;

import java.util.Optional;

/**
 * Result of a {@link RetryPolicy} run that did not fail: either the action
 * succeeded or the run was cancelled. Failures are thrown as
 * {@link RetryExhaustedException} instead.
 */
public final class RetryOutcome<T> {

    private final boolean cancelled;
    private final T value;
    private final int attempts;

    private RetryOutcome(boolean cancelled, T value, int attempts) {
        this.cancelled = cancelled;
        this.value = value;
        this.attempts = attempts;
    }

    static <T> RetryOutcome<T> succeeded(T value, int attempts) {
        return new RetryOutcome<>(false, value, attempts);
    }

    static <T> RetryOutcome<T> cancelled(int attempts) {
        return new RetryOutcome<>(true, null, attempts);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isSucceeded() {
        return !cancelled;
    }

    /** Number of attempts that were started, including the successful one. */
    public int attempts() {
        return attempts;
    }

    /** Value of the successful attempt; empty for cancelled runs or {@code null} results. */
    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return cancelled
            ? "RetryOutcome[cancelled, attempts=" + attempts + "]"
            : "RetryOutcome[succeeded, attempts=" + attempts + ", value=" + value + "]";
    }
}
