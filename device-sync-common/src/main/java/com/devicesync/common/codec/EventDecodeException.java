package com.devicesync.common.codec;

/**
 * Raised when a record value cannot be turned into a
 * {@link com.devicesync.common.model.DeviceEventEnvelope}.
 *
 * This is a contract violation by the producer, not a transport problem, so
 * retrying the same bytes never helps on its own.
 */
public class EventDecodeException extends RuntimeException {

    public EventDecodeException(String message) {
        super(message);
    }

    public EventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
