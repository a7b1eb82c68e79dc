package com.devicesync.common.codec;

import com.devicesync.common.model.DeviceEventEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * JSON codec for {@link DeviceEventEnvelope}.
 *
 * Field names come from explicit {@code @JsonProperty} annotations on the model,
 * so renaming a Java accessor never changes the wire format. Unknown event kinds
 * decode to {@code UNKNOWN} and unknown fields are ignored, which keeps older
 * consumers running against newer producers. Event kinds travel by name only;
 * a numeric ordinal is rejected.
 */
public final class DeviceEventCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
        .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public byte[] encode(DeviceEventEnvelope envelope) {
        try {
            return MAPPER.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize: " + envelope, e);
        }
    }

    /**
     * @throws EventDecodeException if the bytes are not valid JSON or a required field is missing
     */
    public DeviceEventEnvelope decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new EventDecodeException("Empty device event payload");
        }
        DeviceEventEnvelope envelope;
        try {
            envelope = MAPPER.readValue(data, DeviceEventEnvelope.class);
        } catch (IOException e) {
            throw new EventDecodeException("Failed to deserialize device event", e);
        }
        if (envelope == null) {
            throw new EventDecodeException("Device event payload is JSON null");
        }
        if (envelope.deviceId() == null) {
            throw new EventDecodeException("Device event is missing deviceId");
        }
        if (envelope.deviceEvent() == null) {
            throw new EventDecodeException("Device event is missing deviceEvent");
        }
        return envelope;
    }
}
