package com.devicesync.common.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot shutdown signal shared by a worker, its retry policy and its
 * supervisor.
 *
 * Blocking calls that cannot observe the flag themselves (a Kafka poll, an
 * in-flight future) register a callback with {@link #onCancel(Runnable)} that
 * unblocks them.
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /** Raises the signal. Only the first call runs the registered callbacks. */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        latch.countDown();
        for (Runnable callback : callbacks) {
            runCallback(callback);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits up to {@code timeout} for the signal.
     *
     * @return {@code true} if the signal was raised before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Registers a callback run once when the signal is raised, or immediately if
     * it already has been. Close the returned registration once the guarded
     * blocking call has returned.
     */
    public Registration onCancel(Runnable callback) {
        var once = new OnceCallback(callback);
        callbacks.add(once);
        if (isCancelled()) {
            runCallback(once);
        }
        return () -> callbacks.remove(once);
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed", e);
        }
    }

    /** Handle returned by {@link #onCancel(Runnable)}. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private static final class OnceCallback implements Runnable {
        private final Runnable delegate;
        private final AtomicBoolean ran = new AtomicBoolean(false);

        OnceCallback(Runnable delegate) {
            this.delegate = delegate;
        }

        @Override
        public void run() {
            if (ran.compareAndSet(false, true)) {
                delegate.run();
            }
        }
    }
}
