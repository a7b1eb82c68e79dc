package com.devicesync.common.codec;

import com.devicesync.common.model.DeviceDetails;
import com.devicesync.common.model.DeviceEvent;
import com.devicesync.common.model.DeviceEventEnvelope;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DeviceEventCodecTest {

    private static final UUID DEVICE_ID = UUID.fromString("3f2b8c1e-6a0d-4e55-9a51-0c7f3d1b2e44");
    private static final UUID USER_ID = UUID.fromString("11111111-2222-3333-4444-555555555555");
    private static final UUID HOME_ID = UUID.fromString("66666666-7777-8888-9999-000000000000");

    private final DeviceEventCodec codec = new DeviceEventCodec();

    @Test
    void encode_usesStableFieldNamesAndSymbolicEnum() {
        var envelope = DeviceEventEnvelope.registered(DEVICE_ID, details());

        String json = new String(codec.encode(envelope), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"deviceId\":\"" + DEVICE_ID + "\""), json);
        assertTrue(json.contains("\"deviceEvent\":\"Registered\""), json);
        assertTrue(json.contains("\"deviceAddress\":\"10.0.0.7\""), json);
        assertTrue(json.contains("\"serialNumber\":\"SN-0042\""), json);
        assertTrue(json.contains("\"userId\":\"" + USER_ID + "\""), json);
        assertTrue(json.contains("\"homeId\":\"" + HOME_ID + "\""), json);
    }

    @Test
    void encode_omitsDetailsForDeletion() {
        String json = new String(codec.encode(DeviceEventEnvelope.deleted(DEVICE_ID)), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"deviceEvent\":\"Deleted\""), json);
        assertFalse(json.contains("details"), json);
    }

    @Test
    void decode_readsWhatEncodeWrote() {
        var envelope = DeviceEventEnvelope.registered(DEVICE_ID, details());

        assertEquals(envelope, codec.decode(codec.encode(envelope)));
    }

    @Test
    void decode_acceptsPayloadFromAnotherProducer() {
        String json = """
            {"deviceId":"%s","deviceEvent":"Registered","details":{
              "deviceType":"sensor","name":"Kitchen","model":"T-1000","deviceAddress":"10.0.0.7",
              "serialNumber":"SN-0042","status":"Active","userId":"%s","homeId":"%s",
              "firmware":"1.2.3"}}
            """.formatted(DEVICE_ID, USER_ID, HOME_ID);

        var envelope = codec.decode(json.getBytes(StandardCharsets.UTF_8));

        assertEquals(DEVICE_ID, envelope.deviceId());
        assertEquals(DeviceEvent.REGISTERED, envelope.deviceEvent());
        assertEquals(details(), envelope.details());
    }

    @Test
    void decode_mapsUnrecognizedKindToUnknown() {
        String json = "{\"deviceId\":\"" + DEVICE_ID + "\",\"deviceEvent\":\"Rebooted\"}";

        var envelope = codec.decode(json.getBytes(StandardCharsets.UTF_8));

        assertEquals(DeviceEvent.UNKNOWN, envelope.deviceEvent());
        assertEquals(DEVICE_ID, envelope.deviceId());
    }

    @Test
    void decode_leavesCrossFieldValidationToConsumer() {
        String registeredWithoutDetails = "{\"deviceId\":\"" + DEVICE_ID + "\",\"deviceEvent\":\"Registered\"}";

        var envelope = codec.decode(registeredWithoutDetails.getBytes(StandardCharsets.UTF_8));

        assertEquals(DeviceEvent.REGISTERED, envelope.deviceEvent());
        assertNull(envelope.details());
    }

    @Test
    void decode_rejectsMalformedBytes() {
        byte[] garbage = "{not json".getBytes(StandardCharsets.UTF_8);

        assertThrows(EventDecodeException.class, () -> codec.decode(garbage));
        assertThrows(EventDecodeException.class, () -> codec.decode(new byte[0]));
        assertThrows(EventDecodeException.class, () -> codec.decode(null));
    }

    @Test
    void decode_rejectsMissingRequiredFields() {
        byte[] noKind = ("{\"deviceId\":\"" + DEVICE_ID + "\"}").getBytes(StandardCharsets.UTF_8);
        byte[] noId = "{\"deviceEvent\":\"Deleted\"}".getBytes(StandardCharsets.UTF_8);
        byte[] badId = "{\"deviceId\":\"not-a-uuid\",\"deviceEvent\":\"Deleted\"}".getBytes(StandardCharsets.UTF_8);

        assertThrows(EventDecodeException.class, () -> codec.decode(noKind));
        assertThrows(EventDecodeException.class, () -> codec.decode(noId));
        assertThrows(EventDecodeException.class, () -> codec.decode(badId));
    }

    @Test
    void decode_rejectsNumericEventKind() {
        byte[] ordinal = ("{\"deviceId\":\"" + DEVICE_ID + "\",\"deviceEvent\":1}").getBytes(StandardCharsets.UTF_8);
        byte[] negative = ("{\"deviceId\":\"" + DEVICE_ID + "\",\"deviceEvent\":-1}").getBytes(StandardCharsets.UTF_8);

        assertThrows(EventDecodeException.class, () -> codec.decode(ordinal));
        assertThrows(EventDecodeException.class, () -> codec.decode(negative));
    }

    private static DeviceDetails details() {
        return new DeviceDetails("sensor", "Kitchen", "T-1000", "10.0.0.7", "SN-0042", "Active", USER_ID, HOME_ID);
    }
}
