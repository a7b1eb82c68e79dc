package com.devicesync.telemetry;

import com.devicesync.common.kafka.DeviceTopicAdmin;
import com.devicesync.common.partition.DevicePartitioner;
import com.devicesync.common.retry.CancellationSignal;
import com.devicesync.publisher.device.DeviceItemRepository;
import com.devicesync.publisher.device.DeviceManagementService;
import com.devicesync.publisher.device.NewDevice;
import com.devicesync.publisher.kafka.DeviceEventPublisher;
import com.devicesync.publisher.kafka.ProducerFactory;
import com.devicesync.telemetry.apply.DeviceEventApplier;
import com.devicesync.telemetry.consumer.ConsumerFactory;
import com.devicesync.telemetry.consumer.DeviceConsumerLoop;
import com.devicesync.telemetry.store.DeviceRepository;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.UUID;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full publish/consume round trip against a real broker. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class DeviceSyncKafkaIntegrationTest {

    @Container
    private static final KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.6.0"));

    @Test
    void registrationAndDeletionReachTelemetryStore() throws Exception {
        String bootstrap = kafka.getBootstrapServers();
        DeviceTopicAdmin.ensureTopic(bootstrap, DeviceTopicAdmin.DEVICE_TOPIC, 3, (short) 1);

        var source = new DeviceItemRepository(InMemoryDatabase.create());
        source.initSchema();
        Duration sendTimeout = Duration.ofSeconds(10);
        var publisher = new DeviceEventPublisher(ProducerFactory.kafka(bootstrap, sendTimeout),
            DeviceTopicAdmin.DEVICE_TOPIC, 3, sendTimeout);
        var management = new DeviceManagementService(source, publisher);

        var store = new DeviceRepository(InMemoryDatabase.create());
        store.initSchema();
        var loop = new DeviceConsumerLoop(ConsumerFactory.kafka(bootstrap, "telemetry_service-" + UUID.randomUUID()),
            DeviceTopicAdmin.DEVICE_TOPIC, new DeviceEventApplier(store), Duration.ofMillis(500));
        var signal = new CancellationSignal();
        var thread = new Thread(() -> loop.run(signal), "device-consumer-it");
        thread.start();

        try {
            UUID id = management.register(new NewDevice("hub", "Living room", "H-1", "10.0.2.1", "SN-H1", "online",
                UUID.randomUUID(), UUID.randomUUID()));
            waitUntil(() -> store.find(id).isPresent(), Duration.ofSeconds(30));
            assertEquals("Living room", store.find(id).orElseThrow().name());

            var receipt = publisher.publishDeleted(id);
            assertEquals(DevicePartitioner.partition(id, 3), receipt.partition());
            waitUntil(() -> store.find(id).isEmpty(), Duration.ofSeconds(30));
        } finally {
            signal.cancel();
            thread.join(15_000);
        }
        assertFalse(thread.isAlive());
        assertEquals(DeviceConsumerLoop.State.STOPPED, loop.state());
    }

    private static void waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + timeout.toSeconds() + " s");
            }
            Thread.sleep(100);
        }
    }
}
