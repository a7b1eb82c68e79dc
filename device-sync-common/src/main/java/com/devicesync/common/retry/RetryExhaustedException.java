package com.devicesync.common.retry;

import java.util.List;

/**
 * Thrown when every permitted attempt failed. The cause is the failure of the
 * last attempt; failures of earlier attempts are attached as suppressed
 * exceptions in attempt order.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    RetryExhaustedException(String message, int attempts, List<Throwable> failures) {
        super(message, failures.get(failures.size() - 1));
        this.attempts = attempts;
        for (int i = 0; i < failures.size() - 1; i++) {
            addSuppressed(failures.get(i));
        }
    }

    public int getAttempts() {
        return attempts;
    }
}
