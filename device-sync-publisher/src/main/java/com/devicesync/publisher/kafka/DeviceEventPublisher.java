package com.devicesync.publisher.kafka;

import com.devicesync.common.codec.DeviceEventCodec;
import com.devicesync.common.model.DeviceDetails;
import com.devicesync.common.model.DeviceEvent;
import com.devicesync.common.model.DeviceEventEnvelope;
import com.devicesync.common.partition.DevicePartitioner;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes device lifecycle events and blocks until the broker acknowledges them.
 *
 * Each call:
 * 1. Picks the partition from the device id, so one device's events stay in one ordered log
 * 2. Sends the encoded envelope keyed by the device id
 * 3. Waits for the acks=all acknowledgment, bounded by the send timeout
 * 4. Flushes and closes its own producer before returning
 */
public class DeviceEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(DeviceEventPublisher.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final ProducerFactory producerFactory;
    private final DeviceEventCodec codec;
    private final String topic;
    private final int partitionCount;
    private final Duration sendTimeout;

    public DeviceEventPublisher(ProducerFactory producerFactory, String topic, int partitionCount, Duration sendTimeout) {
        this.producerFactory = Objects.requireNonNull(producerFactory, "producerFactory");
        this.codec = new DeviceEventCodec();
        this.topic = Objects.requireNonNull(topic, "topic");
        if (partitionCount <= 0) {
            throw new IllegalArgumentException("partitionCount must be > 0, got: " + partitionCount);
        }
        this.partitionCount = partitionCount;
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
    }

    public PublishReceipt publishRegistered(UUID deviceId, DeviceDetails details) {
        return publish(deviceId, DeviceEvent.REGISTERED, Objects.requireNonNull(details, "details"));
    }

    public PublishReceipt publishDeleted(UUID deviceId) {
        return publish(deviceId, DeviceEvent.DELETED, null);
    }

    /**
     * @throws IllegalArgumentException if {@code deviceEvent} is {@link DeviceEvent#UNKNOWN}
     * @throws EventPublishException    if the event could not be encoded, was rejected
     *                                  by the broker or was not acknowledged in time
     */
    public PublishReceipt publish(UUID deviceId, DeviceEvent deviceEvent, DeviceDetails details) {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(deviceEvent, "deviceEvent");
        if (deviceEvent == DeviceEvent.UNKNOWN) {
            throw new IllegalArgumentException("UNKNOWN is a decode-side placeholder and cannot be published");
        }

        byte[] value;
        try {
            value = codec.encode(new DeviceEventEnvelope(deviceId, deviceEvent, details));
        } catch (IllegalArgumentException e) {
            throw new EventPublishException(EventPublishException.Reason.SERIALIZATION,
                "Failed to encode " + deviceEvent + " event for device " + deviceId, e);
        }
        int partition = DevicePartitioner.partition(deviceId, partitionCount);
        var record = new ProducerRecord<>(topic, partition, deviceId.toString(), value);

        Producer<String, byte[]> producer = null;
        try {
            producer = producerFactory.create();
            Future<RecordMetadata> ack = producer.send(record);
            RecordMetadata metadata = ack.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            producer.flush();
            log.info("Event {} sent for device {} to {}-{} at offset {}",
                deviceEvent, deviceId, metadata.topic(), metadata.partition(), metadata.offset());
            return new PublishReceipt(metadata.topic(), metadata.partition(), metadata.offset());
        } catch (TimeoutException e) {
            throw new EventPublishException(EventPublishException.Reason.TIMEOUT,
                "No acknowledgment within " + sendTimeout.toMillis() + " ms for device " + deviceId, e);
        } catch (ExecutionException e) {
            throw failure(deviceId, e.getCause() != null ? e.getCause() : e);
        } catch (KafkaException e) {
            throw failure(deviceId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException(EventPublishException.Reason.INTERRUPTED,
                "Interrupted publishing event for device " + deviceId, e);
        } finally {
            if (producer != null) {
                producer.close(CLOSE_TIMEOUT);
            }
        }
    }

    private EventPublishException failure(UUID deviceId, Throwable cause) {
        if (cause instanceof org.apache.kafka.common.errors.TimeoutException) {
            return new EventPublishException(EventPublishException.Reason.TIMEOUT,
                "Broker did not acknowledge event for device " + deviceId + " in time", cause);
        }
        if (cause instanceof org.apache.kafka.common.errors.SerializationException) {
            return new EventPublishException(EventPublishException.Reason.SERIALIZATION,
                "Failed to serialize event for device " + deviceId, cause);
        }
        return new EventPublishException(EventPublishException.Reason.BROKER,
            "Broker rejected event for device " + deviceId + ": " + cause.getMessage(), cause);
    }
}
