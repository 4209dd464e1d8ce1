package com.workq.worker;

/**
 * Receives {@link JobEvent}s on the worker thread that produced them. Implementations must be
 * thread-safe and fast; an exception thrown here is logged and does not affect the job.
 */
@FunctionalInterface
public interface JobEventListener {

    void onEvent(JobEvent event);
}
