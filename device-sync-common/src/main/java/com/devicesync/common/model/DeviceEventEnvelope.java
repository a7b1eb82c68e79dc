package com.devicesync.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * Wire-level message published for every device lifecycle change.
 *
 * {@code details} is expected only for registrations. The codec does not enforce
 * that; the telemetry side validates it when applying the event.
 *
 * @param deviceId    entity the event belongs to, also used as the record key
 * @param deviceEvent lifecycle event kind
 * @param details     registration payload, {@code null} for deletions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceEventEnvelope(
    @JsonProperty("deviceId") UUID deviceId,
    @JsonProperty("deviceEvent") DeviceEvent deviceEvent,
    @JsonProperty("details") DeviceDetails details
) {

    public static DeviceEventEnvelope registered(UUID deviceId, DeviceDetails details) {
        return new DeviceEventEnvelope(
            Objects.requireNonNull(deviceId, "deviceId"),
            DeviceEvent.REGISTERED,
            Objects.requireNonNull(details, "details"));
    }

    public static DeviceEventEnvelope deleted(UUID deviceId) {
        return new DeviceEventEnvelope(Objects.requireNonNull(deviceId, "deviceId"), DeviceEvent.DELETED, null);
    }
}
