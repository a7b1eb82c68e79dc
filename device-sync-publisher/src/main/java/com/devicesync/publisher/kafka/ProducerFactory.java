package com.devicesync.publisher.kafka;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.time.Duration;
import java.util.Properties;

/**
 * Creates the producer owned by a single publish call.
 */
@FunctionalInterface
public interface ProducerFactory {

    Producer<String, byte[]> create();

    static ProducerFactory kafka(String bootstrapServers, Duration sendTimeout) {
        Properties props = producerProperties(bootstrapServers, sendTimeout);
        return () -> new KafkaProducer<>(props);
    }

    /**
     * Every in-sync replica must acknowledge, and a send that is not
     * acknowledged within {@code sendTimeout} fails instead of lingering.
     */
    static Properties producerProperties(String bootstrapServers, Duration sendTimeout) {
        long timeoutMs = sendTimeout.toMillis();
        var props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 0);
        // delivery.timeout.ms must cover linger.ms + request.timeout.ms
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, (int) timeoutMs);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) timeoutMs);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, timeoutMs);
        return props;
    }
}
