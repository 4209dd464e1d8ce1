package com.workq;

import java.time.Instant;

/**
 * Criteria for {@link com.workq.spi.JobStore#findBy(JobFilter)}. Every criterion is optional; a
 * {@code null} value matches all jobs.
 */
public record JobFilter(
        JobStatus status,
        String type,
        String queue,
        Instant createdAfter,
        Instant createdBefore,
        Integer limit) {

    public static JobFilter all() {
        return new JobFilter(null, null, null, null, null, null);
    }

    public static JobFilter byStatus(JobStatus status) {
        return all().withStatus(status);
    }

    public static JobFilter byType(String type) {
        return all().withType(type);
    }

    public static JobFilter byQueue(String queue) {
        return all().withQueue(queue);
    }

    public JobFilter withStatus(JobStatus status) {
        return new JobFilter(status, type, queue, createdAfter, createdBefore, limit);
    }

    public JobFilter withType(String type) {
        return new JobFilter(status, type, queue, createdAfter, createdBefore, limit);
    }

    public JobFilter withQueue(String queue) {
        return new JobFilter(status, type, queue, createdAfter, createdBefore, limit);
    }

    public JobFilter createdBetween(Instant after, Instant before) {
        return new JobFilter(status, type, queue, after, before, limit);
    }

    public JobFilter withLimit(Integer limit) {
        return new JobFilter(status, type, queue, createdAfter, createdBefore, limit);
    }

    public boolean matches(Job job) {
        if (status != null && job.getStatus() != status) {
            return false;
        }
        if (type != null && !type.equals(job.getType())) {
            return false;
        }
        if (queue != null && !queue.equals(job.getQueue())) {
            return false;
        }
        if (createdAfter != null && job.getCreatedAt().isBefore(createdAfter)) {
            return false;
        }
        return createdBefore == null || job.getCreatedAt().isBefore(createdBefore);
    }
}
