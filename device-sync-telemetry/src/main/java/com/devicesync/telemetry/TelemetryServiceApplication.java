package com.devicesync.telemetry;

import com.devicesync.common.config.SyncConfig;
import com.devicesync.common.jdbc.DataSources;
import com.devicesync.common.kafka.DeviceTopicAdmin;
import com.devicesync.common.partition.DevicePartitioner;
import com.devicesync.common.retry.CancellationSignal;
import com.devicesync.common.retry.RetryExhaustedException;
import com.devicesync.common.retry.RetryOutcome;
import com.devicesync.common.retry.RetryPolicy;
import com.devicesync.common.retry.RetryableAction;
import com.devicesync.telemetry.apply.DeviceEventApplier;
import com.devicesync.telemetry.consumer.ConsumerFactory;
import com.devicesync.telemetry.consumer.DeviceConsumerLoop;
import com.devicesync.telemetry.store.DeviceRepository;
import com.devicesync.telemetry.supervisor.WorkerSupervisor;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Telemetry service entry point: keeps {@code device_item} in sync with the
 * device topic until the JVM is asked to stop. The pool, schema and topic are
 * retried at startup with the same policy that restarts the consumer.
 */
public class TelemetryServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(TelemetryServiceApplication.class);

    public static void main(String[] args) throws Exception {
        var config = SyncConfig.load();
        String bootstrap = config.require("kafka.bootstrap-servers");
        String topic = config.get("kafka.topic", DeviceTopicAdmin.DEVICE_TOPIC);
        int partitions = config.getInt("kafka.partitions", DevicePartitioner.DEFAULT_PARTITION_COUNT);
        String groupId = config.get("consumer.group-id", ConsumerFactory.GROUP_ID);
        Duration recoveryBackoff = config.getDuration("consumer.recovery-backoff", Duration.ofSeconds(5));
        var policy = RetryPolicy.fixed(
            config.getDuration("supervisor.retry-delay", WorkerSupervisor.DEFAULT_DELAY),
            config.getInt("supervisor.max-attempts", WorkerSupervisor.DEFAULT_MAX_ATTEMPTS));

        log.info("Telemetry service starting: bootstrap={}, topic={}, group={}", bootstrap, topic, groupId);

        var signal = new CancellationSignal();
        var running = new AtomicReference<WorkerSupervisor>();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            signal.cancel();
            WorkerSupervisor supervisor = running.get();
            if (supervisor != null) {
                supervisor.close();
            }
        }, "telemetry-shutdown"));

        boolean failed;
        HikariDataSource dataSource = null;
        try {
            dataSource = startupStep("connection pool", policy, signal, () -> DataSources.create(config, "telemetry"));
            var repository = new DeviceRepository(dataSource);
            startupStep("device_item schema", policy, signal, () -> {
                repository.initSchema();
                return null;
            });
            if (Boolean.parseBoolean(config.get("kafka.create-topic", "true"))) {
                short replication = (short) config.getInt("kafka.replication-factor", 1);
                startupStep("topic " + topic, policy, signal, () -> {
                    DeviceTopicAdmin.ensureTopic(bootstrap, topic, partitions, replication);
                    return null;
                });
            }

            var applier = new DeviceEventApplier(repository);
            var consumers = ConsumerFactory.kafka(bootstrap, groupId);
            var supervisor = new WorkerSupervisor("device-consumer",
                () -> new DeviceConsumerLoop(consumers, topic, applier, recoveryBackoff), policy, signal);
            running.set(supervisor);
            supervisor.start();
            supervisor.awaitTermination(Duration.ofMillis(Long.MAX_VALUE));

            failed = supervisor.failure().isPresent();
            if (failed) {
                log.error("Device consumer exhausted its restarts, exiting");
            }
        } catch (RetryExhaustedException e) {
            log.error("Startup failed: {}", e.getMessage(), e.getCause());
            failed = true;
        } catch (CancellationException e) {
            log.warn("Startup interrupted: {}", e.getMessage());
            failed = true;
        } finally {
            if (dataSource != null) {
                dataSource.close();
            }
        }
        if (failed) {
            System.exit(1);
        }
        log.info("Telemetry service stopped");
    }

    /**
     * Runs one startup step under {@code policy}, so dependencies that come up
     * after this process are waited for.
     *
     * @throws CancellationException   if shutdown was requested before the step succeeded
     * @throws RetryExhaustedException if every attempt failed
     */
    static <T> T startupStep(String step, RetryPolicy policy, CancellationSignal signal, RetryableAction<T> action) {
        log.info("Preparing {}", step);
        RetryOutcome<T> outcome = policy.run(action, signal);
        if (outcome.isCancelled()) {
            throw new CancellationException("Shutdown requested while preparing " + step);
        }
        return outcome.value().orElse(null);
    }
}
