package com.workq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workq.core.JobLifecycle;
import com.workq.core.JobStateConflict;
import com.workq.spi.JobQueue;
import com.workq.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for producers and operational tooling: creates jobs, places them on their queue and
 * answers questions about their state.
 */
public class JobClient {

    private static final Logger log = LoggerFactory.getLogger(JobClient.class);

    private final JobQueue queue;
    private final JobStore store;
    private final JobLifecycle lifecycle;
    private final ObjectMapper objectMapper;

    public JobClient(JobQueue queue, JobStore store, JobLifecycle lifecycle, ObjectMapper objectMapper) {
        this.queue = queue;
        this.store = store;
        this.lifecycle = lifecycle;
        this.objectMapper = objectMapper;
    }

    /**
     * Enqueue a job with default options.
     *
     * @param args any value Jackson can convert to JSON, may be {@code null}
     */
    public UUID enqueue(String queueName, String type, Object args) {
        return enqueue(queueName, type, args, JobOptions.defaults());
    }

    /**
     * Enqueue a job. A future {@link JobOptions#getExecuteAt()} makes it a scheduled job.
     */
    public UUID enqueue(String queueName, String type, Object args, JobOptions options) {
        JobOptions resolved = (options == null ? JobOptions.defaults() : options).toBuilder()
                .queue(queueName)
                .build();
        return submit(lifecycle.create(type, toJson(args), resolved));
    }

    /**
     * Schedule a job for execution at {@code executeAt}.
     */
    public UUID schedule(String queueName, String type, Object args, Instant executeAt) {
        return schedule(queueName, type, args, executeAt, JobOptions.defaults());
    }

    public UUID schedule(String queueName, String type, Object args, Instant executeAt, JobOptions options) {
        if (executeAt == null) {
            throw new IllegalArgumentException("executeAt must not be null");
        }
        JobOptions resolved = (options == null ? JobOptions.defaults() : options).toBuilder()
                .queue(queueName)
                .executeAt(executeAt)
                .build();
        return submit(lifecycle.create(type, toJson(args), resolved));
    }

    public Optional<Job> find(UUID id) {
        return store.find(id);
    }

    public List<Job> findBy(JobFilter filter) {
        return store.findBy(filter);
    }

    public List<Job> deadLetterJobs() {
        return store.deadLetterJobs();
    }

    /**
     * Most recent jobs of a type, newest first.
     */
    public List<Job> history(String type, int limit) {
        return store.history(type, limit);
    }

    public List<String> listQueues() {
        return queue.listQueues();
    }

    public QueueStats queueStats(String queueName) {
        Map<JobStatus, Long> counts = store.countByStatus(queueName);
        return new QueueStats(
                queueName,
                queue.size(queueName),
                queue.scheduledSize(queueName),
                counts.getOrDefault(JobStatus.COMPLETED, 0L),
                counts.getOrDefault(JobStatus.DEAD, 0L) + counts.getOrDefault(JobStatus.FAILED, 0L));
    }

    public JobStatistics statistics() {
        Map<String, QueueStats> perQueue = new LinkedHashMap<>();
        for (String queueName : queue.listQueues()) {
            perQueue.put(queueName, queueStats(queueName));
        }
        Map<JobStatus, Long> counts = store.countByStatus(null);
        long succeeded = counts.getOrDefault(JobStatus.COMPLETED, 0L);
        long failed = counts.getOrDefault(JobStatus.DEAD, 0L) + counts.getOrDefault(JobStatus.FAILED, 0L);
        return new JobStatistics(succeeded + failed, succeeded, failed, perQueue);
    }

    /**
     * Gives a dead-letter job a fresh set of attempts and puts it back on its queue.
     *
     * @throws JobNotFoundException      if no job has this id
     * @throws JobStateConflictException if the job is not in the dead-letter set
     */
    public Job requeue(UUID id) {
        Job requeued = store.requeue(id).orElseThrow();
        queue.enqueue(requeued.getQueue(), requeued);
        log.info("Requeued job {} of type {} on queue {}", requeued.getId(), requeued.getType(), requeued.getQueue());
        return requeued;
    }

    /**
     * Cancels a pending or scheduled job.
     *
     * @throws JobNotFoundException      if no job has this id
     * @throws JobStateConflictException if the job is not pending or scheduled, or was claimed by a
     *                                   worker meanwhile
     */
    public Job cancel(UUID id) {
        Job job = store.find(id).orElseThrow(() -> new JobNotFoundException(id));
        lifecycle.cancel(job).orElseThrow();
        if (!queue.delete(job.getQueue(), id)) {
            throw new JobStateConflictException(JobStateConflict.of(id, job.getStatus(), "cancel",
                    "no longer waiting on queue " + job.getQueue()));
        }
        Job cancelled = store.updateStatus(id, JobStatus.CANCELLED, null).orElseThrow();
        log.debug("Cancelled job {} of type {}", id, job.getType());
        return cancelled;
    }

    private UUID submit(Job job) {
        store.save(job);
        if (job.getStatus() == JobStatus.SCHEDULED) {
            queue.schedule(job.getQueue(), job, job.getExecuteAt());
        } else {
            queue.enqueue(job.getQueue(), job);
        }
        log.debug("Submitted job {} of type {} to queue {} as {}", job.getId(), job.getType(), job.getQueue(),
                job.getStatus());
        return job.getId();
    }

    private JsonNode toJson(Object args) {
        if (args == null) {
            return null;
        }
        if (args instanceof JsonNode node) {
            return node;
        }
        try {
            return objectMapper.valueToTree(args);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Job args are not convertible to JSON: " + args.getClass().getName(), e);
        }
    }
}
