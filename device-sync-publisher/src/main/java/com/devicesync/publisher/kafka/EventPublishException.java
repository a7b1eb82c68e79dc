package com.devicesync.publisher.kafka;

/**
 * A device event could not be published. Whether to retry is up to the caller.
 */
public class EventPublishException extends RuntimeException {

    public enum Reason {
        SERIALIZATION,
        TIMEOUT,
        BROKER,
        INTERRUPTED
    }

    private final Reason reason;

    public EventPublishException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
