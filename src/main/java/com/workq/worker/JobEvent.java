package com.workq.worker;

import com.workq.Job;
import com.workq.JobError;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Notification emitted by a {@link Worker} while it processes a job.
 *
 * @param duration handler execution time, {@code null} for {@link Type#STARTED}
 * @param error    handler failure, {@code null} unless the job failed
 */
public record JobEvent(
        Type type,
        UUID jobId,
        String jobType,
        String queue,
        int attempt,
        Duration duration,
        JobError error,
        Instant occurredAt) {

    public enum Type {
        STARTED,
        COMPLETED,
        /** Failed and scheduled for another attempt. */
        FAILED,
        /** Failed with no attempts left. */
        DEAD_LETTERED
    }

    static JobEvent of(Type type, Job job, Duration duration, Instant occurredAt) {
        return new JobEvent(type, job.getId(), job.getType(), job.getQueue(), job.getAttempt(), duration,
                job.getError(), occurredAt);
    }
}
