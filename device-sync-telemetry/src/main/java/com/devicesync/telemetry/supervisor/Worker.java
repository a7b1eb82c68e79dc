package com.devicesync.telemetry.supervisor;

import com.devicesync.common.retry.CancellationSignal;

/**
 * Long-running background task. Returns once {@code signal} is raised; an
 * exception means the worker gave up and may be restarted by its supervisor.
 */
@FunctionalInterface
public interface Worker {

    void run(CancellationSignal signal);
}
