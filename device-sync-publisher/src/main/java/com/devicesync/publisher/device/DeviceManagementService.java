package com.devicesync.publisher.device;

import com.devicesync.common.config.SyncConfig;
import com.devicesync.common.jdbc.DataSources;
import com.devicesync.common.kafka.DeviceTopicAdmin;
import com.devicesync.common.model.DeviceRecord;
import com.devicesync.common.partition.DevicePartitioner;
import com.devicesync.publisher.kafka.DeviceEventPublisher;
import com.devicesync.publisher.kafka.ProducerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Registers and deletes devices, announcing each change on the device topic.
 *
 * The database write commits before the event is published. If publishing then
 * fails, the {@link com.devicesync.publisher.kafka.EventPublishException} reaches
 * the caller, who may retry the same call.
 */
public class DeviceManagementService {

    private static final Logger log = LoggerFactory.getLogger(DeviceManagementService.class);

    public static final String CONFIG_RESOURCE = "device-management.properties";

    private final DeviceItemRepository repository;
    private final DeviceEventPublisher publisher;

    public DeviceManagementService(DeviceItemRepository repository, DeviceEventPublisher publisher) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /** Wires the service from {@value #CONFIG_RESOURCE} on the classpath. */
    public static DeviceManagementService create() {
        return create(SyncConfig.load(CONFIG_RESOURCE));
    }

    public static DeviceManagementService create(SyncConfig config) {
        Duration sendTimeout = config.getDuration("publisher.send-timeout", Duration.ofSeconds(3));
        return create(config, ProducerFactory.kafka(config.require("kafka.bootstrap-servers"), sendTimeout));
    }

    static DeviceManagementService create(SyncConfig config, ProducerFactory producerFactory) {
        String topic = config.get("kafka.topic", DeviceTopicAdmin.DEVICE_TOPIC);
        int partitions = config.getInt("kafka.partitions", DevicePartitioner.DEFAULT_PARTITION_COUNT);
        Duration sendTimeout = config.getDuration("publisher.send-timeout", Duration.ofSeconds(3));

        var repository = new DeviceItemRepository(DataSources.create(config, "device-management"));
        repository.initSchema();
        var publisher = new DeviceEventPublisher(producerFactory, topic, partitions, sendTimeout);
        log.info("Device management ready: topic={}, partitions={}", topic, partitions);
        return new DeviceManagementService(repository, publisher);
    }

    public UUID register(NewDevice device) {
        Objects.requireNonNull(device, "device");
        UUID id = UUID.randomUUID();
        repository.insert(DeviceRecord.of(id, device.toDetails()));
        log.info("Device {} registered ({} {})", id, device.deviceType(), device.serialNumber());
        publisher.publishRegistered(id, device.toDetails());
        return id;
    }

    /**
     * Deletes the device and publishes Deleted. The event goes out even when the
     * row is already gone, so retrying after a failed publish still reaches the
     * telemetry side.
     *
     * @return false if no row was removed
     */
    public boolean delete(UUID id) {
        Objects.requireNonNull(id, "id");
        boolean removed = repository.delete(id);
        if (removed) {
            log.info("Device {} deleted", id);
        } else {
            log.info("Device {} not found, publishing Deleted again", id);
        }
        publisher.publishDeleted(id);
        return removed;
    }

    public Optional<DeviceRecord> find(UUID id) {
        return repository.find(id);
    }
}
