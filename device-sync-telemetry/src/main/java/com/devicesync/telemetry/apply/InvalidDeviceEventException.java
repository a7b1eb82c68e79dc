package com.devicesync.telemetry.apply;

/**
 * A decoded event whose content cannot be applied, such as a registration
 * without device details.
 */
public class InvalidDeviceEventException extends RuntimeException {

    public InvalidDeviceEventException(String message) {
        super(message);
    }
}
