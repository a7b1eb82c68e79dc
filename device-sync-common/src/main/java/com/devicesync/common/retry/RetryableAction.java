package com.devicesync.common.retry;

/**
 * Synchronous unit of work that is invoked afresh on every attempt.
 */
@FunctionalInterface
public interface RetryableAction<T> {
    T run() throws Exception;
}
