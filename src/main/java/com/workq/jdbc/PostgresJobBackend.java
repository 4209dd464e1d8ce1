package com.workq.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workq.Job;
import com.workq.JobError;
import com.workq.JobFilter;
import com.workq.JobOutcome;
import com.workq.JobStatus;
import com.workq.core.JobLifecycle;
import com.workq.core.Transition;
import com.workq.spi.JobBackend;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Multi-process backend on PostgreSQL: any number of nodes may enqueue, claim and promote against
 * the same database.
 */
public class PostgresJobBackend implements JobBackend {

    private final PostgresJobQueue queue;
    private final PostgresJobStore store;

    public PostgresJobBackend(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper, JobLifecycle lifecycle, String tablePrefix) {
        TableNames tables = TableNames.of(tablePrefix);
        JdbcSupport support = new JdbcSupport(objectMapper);
        this.queue = new PostgresJobQueue(jdbcTemplate, transactionTemplate, support, tables);
        this.store = new PostgresJobStore(jdbcTemplate, transactionTemplate, support, tables, lifecycle);
    }

    @Override
    public String name() {
        return "jdbc";
    }

    @Override
    public void enqueue(String queueName, Job job) {
        queue.enqueue(queueName, job);
    }

    @Override
    public void schedule(String queueName, Job job, Instant executeAt) {
        queue.schedule(queueName, job, executeAt);
    }

    @Override
    public Optional<Job> dequeue(String queueName) {
        return queue.dequeue(queueName);
    }

    @Override
    public Optional<Job> peek(String queueName) {
        return queue.peek(queueName);
    }

    @Override
    public int processDue(Instant now) {
        return queue.processDue(now);
    }

    @Override
    public boolean delete(String queueName, UUID jobId) {
        return queue.delete(queueName, jobId);
    }

    @Override
    public long size(String queueName) {
        return queue.size(queueName);
    }

    @Override
    public long scheduledSize(String queueName) {
        return queue.scheduledSize(queueName);
    }

    @Override
    public List<String> listQueues() {
        return queue.listQueues();
    }

    @Override
    public Job save(Job job) {
        return store.save(job);
    }

    @Override
    public Optional<Job> find(UUID id) {
        return store.find(id);
    }

    @Override
    public Transition updateStatus(UUID id, JobStatus status, JobOutcome outcome) {
        return store.updateStatus(id, status, outcome);
    }

    @Override
    public Transition recordFailure(UUID id, JobError error) {
        return store.recordFailure(id, error);
    }

    @Override
    public List<Job> findBy(JobFilter filter) {
        return store.findBy(filter);
    }

    @Override
    public List<Job> deadLetterJobs() {
        return store.deadLetterJobs();
    }

    @Override
    public Transition requeue(UUID id) {
        return store.requeue(id);
    }

    @Override
    public List<Job> history(String type, int limit) {
        return store.history(type, limit);
    }

    @Override
    public Map<JobStatus, Long> countByStatus(String queueName) {
        return store.countByStatus(queueName);
    }

    @Override
    public int purge(Set<JobStatus> statuses, Instant finishedBefore) {
        return store.purge(statuses, finishedBefore);
    }
}
