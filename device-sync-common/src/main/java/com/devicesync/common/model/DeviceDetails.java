package com.devicesync.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Payload of a {@link DeviceEvent#REGISTERED} event.
 *
 * @param deviceType    kind of device, e.g. "sensor"
 * @param name          display name
 * @param model         hardware model
 * @param deviceAddress network or physical address
 * @param serialNumber  manufacturer serial number
 * @param status        device status as reported at registration
 * @param userId        owning user
 * @param homeId        home the device is installed in
 */
public record DeviceDetails(
    @JsonProperty("deviceType") String deviceType,
    @JsonProperty("name") String name,
    @JsonProperty("model") String model,
    @JsonProperty("deviceAddress") String deviceAddress,
    @JsonProperty("serialNumber") String serialNumber,
    @JsonProperty("status") String status,
    @JsonProperty("userId") UUID userId,
    @JsonProperty("homeId") UUID homeId
) {}
