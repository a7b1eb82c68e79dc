package com.devicesync.common.retry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous unit of work for {@link RetryPolicy#runAsync}.
 *
 * Every call to {@link #start()} must begin a new attempt and return a new
 * future. An operation wrapping a future that is already running cannot be
 * restarted; build it with {@link #once(CompletableFuture)} so the policy
 * surfaces its failure instead of awaiting the same completed handle again.
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    CompletableFuture<T> start();

    default boolean isRepeatable() {
        return true;
    }

    static <T> AsyncOperation<T> once(CompletableFuture<T> inFlight) {
        Objects.requireNonNull(inFlight, "inFlight");
        return new AsyncOperation<>() {
            @Override
            public CompletableFuture<T> start() {
                return inFlight;
            }

            @Override
            public boolean isRepeatable() {
                return false;
            }
        };
    }
}
