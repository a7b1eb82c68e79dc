package com.devicesync.publisher.device;

import com.devicesync.common.model.DeviceDetails;

import java.util.UUID;

/**
 * A device registration request, validated on construction.
 */
public record NewDevice(
    String deviceType,
    String name,
    String model,
    String deviceAddress,
    String serialNumber,
    String status,
    UUID userId,
    UUID homeId
) {

    static final int MAX_LENGTH = 255;
    static final int MAX_STATUS_LENGTH = 50;

    public NewDevice {
        requireText("deviceType", deviceType, MAX_LENGTH);
        requireText("name", name, MAX_LENGTH);
        requireText("model", model, MAX_LENGTH);
        requireText("deviceAddress", deviceAddress, MAX_LENGTH);
        requireText("serialNumber", serialNumber, MAX_LENGTH);
        requireText("status", status, MAX_STATUS_LENGTH);
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        if (homeId == null) {
            throw new IllegalArgumentException("homeId is required");
        }
    }

    public DeviceDetails toDetails() {
        return new DeviceDetails(deviceType, name, model, deviceAddress, serialNumber, status, userId, homeId);
    }

    private static void requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(field + " must be at most " + maxLength + " characters");
        }
    }
}
