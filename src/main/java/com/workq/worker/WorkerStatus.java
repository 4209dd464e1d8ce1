package com.workq.worker;

import java.util.UUID;

/**
 * Snapshot of a worker at one point in time.
 *
 * @param currentJobId job being executed, {@code null} unless the worker is executing
 */
public record WorkerStatus(
        String workerId,
        String queue,
        WorkerState state,
        UUID currentJobId,
        long processed,
        long failed) {
}
