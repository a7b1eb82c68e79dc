package com.devicesync.telemetry.consumer;

import com.devicesync.common.codec.DeviceEventCodec;
import com.devicesync.common.codec.EventDecodeException;
import com.devicesync.common.model.DeviceEventEnvelope;
import com.devicesync.common.retry.CancellationSignal;
import com.devicesync.telemetry.apply.ApplyResult;
import com.devicesync.telemetry.apply.DeviceEventApplier;
import com.devicesync.telemetry.supervisor.Worker;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Keeps the local device table in step with the device topic.
 *
 * Each connect creates a fresh consumer and subscribes. Records are decoded
 * and applied in partition order and offsets are committed after each batch,
 * so a batch interrupted by a failure is re-read after reconnecting. Any
 * failure other than cancellation closes the consumer, waits the recovery
 * backoff and reconnects. Raising the signal wakes a blocked poll and stops
 * the loop.
 */
public class DeviceConsumerLoop implements Worker {

    private static final Logger log = LoggerFactory.getLogger(DeviceConsumerLoop.class);

    public enum State {
        CONNECTING,
        RUNNING,
        RECOVERING,
        STOPPED
    }

    private final ConsumerFactory consumerFactory;
    private final String topic;
    private final DeviceEventApplier applier;
    private final Duration recoveryBackoff;
    private final Duration pollTimeout;
    private final DeviceEventCodec codec = new DeviceEventCodec();
    private volatile State state = State.CONNECTING;

    public DeviceConsumerLoop(ConsumerFactory consumerFactory, String topic, DeviceEventApplier applier,
                              Duration recoveryBackoff) {
        this(consumerFactory, topic, applier, recoveryBackoff, Duration.ofSeconds(1));
    }

    public DeviceConsumerLoop(ConsumerFactory consumerFactory, String topic, DeviceEventApplier applier,
                              Duration recoveryBackoff, Duration pollTimeout) {
        this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.applier = Objects.requireNonNull(applier, "applier");
        this.recoveryBackoff = Objects.requireNonNull(recoveryBackoff, "recoveryBackoff");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
    }

    public State state() {
        return state;
    }

    @Override
    public void run(CancellationSignal signal) {
        while (!signal.isCancelled()) {
            state = State.CONNECTING;
            try (Consumer<String, byte[]> consumer = consumerFactory.create();
                 var ignored = signal.onCancel(consumer::wakeup)) {
                consumer.subscribe(List.of(topic));
                state = State.RUNNING;
                log.info("Subscribed to '{}', listening...", topic);
                pollUntilCancelled(consumer, signal);
            } catch (RuntimeException e) {
                if (signal.isCancelled()) {
                    break;
                }
                state = State.RECOVERING;
                log.error("Device event processing failed, reconnecting in {} ms", recoveryBackoff.toMillis(), e);
                if (backoffCancelled(signal)) {
                    break;
                }
            }
        }
        state = State.STOPPED;
        log.info("Device event processing stopped");
    }

    private void pollUntilCancelled(Consumer<String, byte[]> consumer, CancellationSignal signal) {
        while (!signal.isCancelled()) {
            ConsumerRecords<String, byte[]> records = consumer.poll(pollTimeout);
            for (ConsumerRecord<String, byte[]> record : records) {
                process(record);
            }
            if (!records.isEmpty()) {
                consumer.commitSync();
                log.debug("Applied and committed {} device events", records.count());
            }
        }
    }

    private void process(ConsumerRecord<String, byte[]> record) {
        UUID deviceId = deviceId(record);
        DeviceEventEnvelope envelope;
        try {
            envelope = codec.decode(record.value());
        } catch (EventDecodeException e) {
            throw new EventDecodeException("Undecodable event at " + position(record), e);
        }
        if (!deviceId.equals(envelope.deviceId())) {
            log.warn("Record key {} does not match envelope deviceId {} at {}, using the key",
                deviceId, envelope.deviceId(), position(record));
        }
        ApplyResult result = applier.apply(deviceId, envelope);
        log.debug("{} {} for device {} at {}", envelope.deviceEvent(), result, deviceId, position(record));
    }

    private static UUID deviceId(ConsumerRecord<String, byte[]> record) {
        if (record.key() == null) {
            throw new EventDecodeException("Missing record key at " + position(record));
        }
        try {
            return UUID.fromString(record.key());
        } catch (IllegalArgumentException e) {
            throw new EventDecodeException("Record key is not a device id at " + position(record), e);
        }
    }

    private boolean backoffCancelled(CancellationSignal signal) {
        try {
            return signal.await(recoveryBackoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private static String position(ConsumerRecord<?, ?> record) {
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }
}
