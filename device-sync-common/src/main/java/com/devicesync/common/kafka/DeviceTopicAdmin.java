package com.devicesync.common.kafka;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.errors.TopicExistsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Creates the device lifecycle topic when it does not exist yet.
 */
public final class DeviceTopicAdmin {

    private static final Logger log = LoggerFactory.getLogger(DeviceTopicAdmin.class);

    public static final String DEVICE_TOPIC = "device";

    private DeviceTopicAdmin() {}

    public static void ensureTopic(String bootstrapServers, String topic, int partitions, short replicationFactor) {
        var props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, "10000");

        try (var admin = AdminClient.create(props)) {
            Set<String> existing = admin.listTopics().names().get(15, TimeUnit.SECONDS);
            if (existing.contains(topic)) {
                log.info("Topic '{}' already exists", topic);
                return;
            }
            admin.createTopics(List.of(new NewTopic(topic, partitions, replicationFactor)))
                .all().get(15, TimeUnit.SECONDS);
            log.info("Created topic '{}' with {} partitions", topic, partitions);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TopicExistsException) {
                log.info("Topic '{}' was created concurrently", topic);
                return;
            }
            throw new IllegalStateException("Failed to create Kafka topic " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out creating Kafka topic " + topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted creating Kafka topic " + topic, e);
        }
    }
}
