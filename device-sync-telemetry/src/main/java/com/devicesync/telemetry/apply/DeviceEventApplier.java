package com.devicesync.telemetry.apply;

import com.devicesync.common.model.DeviceEventEnvelope;
import com.devicesync.common.model.DeviceRecord;
import com.devicesync.telemetry.store.DeviceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

/**
 * Applies a device lifecycle event to the local store.
 *
 * Registered inserts the device unless it exists, Deleted removes it if it
 * exists. Re-applying an event is a no-op, which is what makes at-least-once
 * delivery safe here. Unknown event kinds are skipped.
 */
public class DeviceEventApplier {

    private static final Logger log = LoggerFactory.getLogger(DeviceEventApplier.class);

    private final DeviceRepository repository;

    public DeviceEventApplier(DeviceRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    /**
     * @param deviceId id taken from the record key
     * @throws InvalidDeviceEventException if a registration carries no details
     */
    public ApplyResult apply(UUID deviceId, DeviceEventEnvelope envelope) {
        return switch (envelope.deviceEvent()) {
            case REGISTERED -> register(deviceId, envelope);
            case DELETED -> delete(deviceId);
            case UNKNOWN -> {
                log.warn("Unknown event kind for device {}, skipping", deviceId);
                yield ApplyResult.SKIPPED;
            }
        };
    }

    private ApplyResult register(UUID deviceId, DeviceEventEnvelope envelope) {
        if (envelope.details() == null) {
            throw new InvalidDeviceEventException("Registered event for device " + deviceId + " has no details");
        }
        if (repository.insertIfAbsent(DeviceRecord.of(deviceId, envelope.details()))) {
            log.info("Device {} added", deviceId);
            return ApplyResult.INSERTED;
        }
        log.debug("Device {} already present", deviceId);
        return ApplyResult.ALREADY_PRESENT;
    }

    private ApplyResult delete(UUID deviceId) {
        if (repository.deleteIfPresent(deviceId)) {
            log.info("Device {} removed", deviceId);
            return ApplyResult.DELETED;
        }
        log.debug("Device {} already absent", deviceId);
        return ApplyResult.ALREADY_ABSENT;
    }
}
