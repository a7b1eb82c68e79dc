package com.devicesync.telemetry.supervisor;

import com.devicesync.common.retry.CancellationSignal;
import com.devicesync.common.retry.RetryExhaustedException;
import com.devicesync.common.retry.RetryOutcome;
import com.devicesync.common.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs a {@link Worker} in the background and restarts it when it fails.
 *
 * Every attempt gets a new worker instance from the supplier. A worker that
 * returns ends supervision; one that throws is restarted after the retry
 * delay until the policy runs out of attempts, at which point the last
 * failure is available from {@link #failure()}.
 */
public class WorkerSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(3);
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    private final String name;
    private final Supplier<? extends Worker> workers;
    private final RetryPolicy policy;
    private final CancellationSignal signal;
    private final ExecutorService executor;
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Thread thread;
    private volatile RetryExhaustedException failure;

    public WorkerSupervisor(String name, Supplier<? extends Worker> workers, RetryPolicy policy,
                            CancellationSignal signal) {
        this.name = Objects.requireNonNull(name, "name");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.signal = Objects.requireNonNull(signal, "signal");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, name + "-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException(name + " supervisor already started");
        }
        thread = new Thread(this::supervise, name + "-supervisor");
        thread.start();
    }

    private void supervise() {
        log.info("Starting {} (up to {} attempts, {} ms apart)", name, policy.maxAttempts(), policy.delay().toMillis());
        try {
            RetryOutcome<Void> outcome = policy.runAsync(
                () -> CompletableFuture.runAsync(() -> workers.get().run(signal), executor), signal);
            if (outcome.isCancelled()) {
                log.info("{} cancelled after {} attempt(s)", name, outcome.attempts());
            } else {
                log.info("{} finished after {} attempt(s)", name, outcome.attempts());
            }
        } catch (RetryExhaustedException e) {
            failure = e;
            log.error("{} gave up: {}", name, e.getMessage(), e.getCause());
        } finally {
            done.countDown();
        }
    }

    /**
     * Blocks until supervision ends.
     *
     * @return false if it was still running after {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Set once the worker has failed on every attempt. */
    public Optional<RetryExhaustedException> failure() {
        return Optional.ofNullable(failure);
    }

    /** Raises the signal and waits for the current worker to return. */
    @Override
    public void close() {
        signal.cancel();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("{} worker did not stop within 30 s", name);
                executor.shutdownNow();
            }
            if (thread != null) {
                awaitTermination(Duration.ofSeconds(5));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
