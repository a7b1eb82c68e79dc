package com.devicesync.common.model;

import java.util.UUID;

/**
 * One row of the {@code device_item} table. Rows are created from a registration
 * and removed on deletion; fields never change in between.
 */
public record DeviceRecord(
    UUID id,
    String deviceType,
    String name,
    String model,
    String deviceAddress,
    String serialNumber,
    String status,
    UUID userId,
    UUID homeId
) {

    public static DeviceRecord of(UUID id, DeviceDetails details) {
        return new DeviceRecord(
            id,
            details.deviceType(),
            details.name(),
            details.model(),
            details.deviceAddress(),
            details.serialNumber(),
            details.status(),
            details.userId(),
            details.homeId());
    }

    public DeviceDetails details() {
        return new DeviceDetails(deviceType, name, model, deviceAddress, serialNumber, status, userId, homeId);
    }
}
