package com.devicesync.common.jdbc;

/**
 * Unchecked wrapper for {@link java.sql.SQLException} raised by device table access.
 */
public class DeviceStoreException extends RuntimeException {

    public DeviceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
