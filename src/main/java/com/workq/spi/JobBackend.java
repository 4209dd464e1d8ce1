package com.workq.spi;

/**
 * A storage medium implementing both the delivery queue and the job store.
 */
public interface JobBackend extends JobQueue, JobStore {

    /**
     * Short identifier used in logs, e.g. {@code memory} or {@code jdbc}.
     */
    String name();
}
