package com.devicesync.publisher.device;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class NewDeviceTest {

    @Test
    void acceptsCompleteRequest() {
        var device = sample("active");

        var details = device.toDetails();
        assertEquals("thermostat", details.deviceType());
        assertEquals(device.userId(), details.userId());
        assertEquals(device.homeId(), details.homeId());
    }

    @Test
    void rejectsBlankFields() {
        var ex = assertThrows(IllegalArgumentException.class, () -> new NewDevice(
            "thermostat", " ", "T-1000", "10.0.0.12", "SN-42", "active", UUID.randomUUID(), UUID.randomUUID()));
        assertEquals("name is required", ex.getMessage());
    }

    @Test
    void rejectsOverlongFields() {
        assertThrows(IllegalArgumentException.class, () -> sample("x".repeat(NewDevice.MAX_STATUS_LENGTH + 1)));
        assertDoesNotThrow(() -> sample("x".repeat(NewDevice.MAX_STATUS_LENGTH)));
        assertThrows(IllegalArgumentException.class, () -> new NewDevice(
            "x".repeat(NewDevice.MAX_LENGTH + 1), "Hallway", "T-1000", "10.0.0.12", "SN-42", "active",
            UUID.randomUUID(), UUID.randomUUID()));
    }

    @Test
    void rejectsMissingOwners() {
        assertThrows(IllegalArgumentException.class, () -> new NewDevice(
            "thermostat", "Hallway", "T-1000", "10.0.0.12", "SN-42", "active", null, UUID.randomUUID()));
        assertThrows(IllegalArgumentException.class, () -> new NewDevice(
            "thermostat", "Hallway", "T-1000", "10.0.0.12", "SN-42", "active", UUID.randomUUID(), null));
    }

    static NewDevice sample(String status) {
        return new NewDevice("thermostat", "Hallway", "T-1000", "10.0.0.12", "SN-42", status,
            UUID.randomUUID(), UUID.randomUUID());
    }
}
