package com.workq.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.workq.Job;
import com.workq.JobError;
import com.workq.JobPriority;
import com.workq.JobStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * JSON form of a {@link Job} stored in the {@code job_data} column of the queue tables.
 */
record JobDocument(
        UUID id,
        String type,
        JsonNode args,
        Map<String, String> metadata,
        String queue,
        JobPriority priority,
        JobStatus status,
        int attempt,
        int maxRetries,
        Instant executeAt,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant updatedAt,
        JsonNode result,
        JobError error) {

    static JobDocument from(Job job) {
        return new JobDocument(job.getId(), job.getType(), job.getArgs(), job.getMetadata(), job.getQueue(),
                job.getPriority(), job.getStatus(), job.getAttempt(), job.getMaxRetries(), job.getExecuteAt(),
                job.getCreatedAt(), job.getStartedAt(), job.getCompletedAt(), job.getUpdatedAt(), job.getResult(),
                job.getError());
    }

    Job toJob() {
        return Job.builder()
                .id(id)
                .type(type)
                .args(args)
                .metadata(metadata)
                .queue(queue)
                .priority(priority)
                .status(status)
                .attempt(attempt)
                .maxRetries(maxRetries)
                .executeAt(executeAt)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .updatedAt(updatedAt)
                .result(result)
                .error(error)
                .build();
    }
}
