package com.workq.jdbc;

import com.workq.Job;
import com.workq.spi.JobQueue;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.workq.jdbc.JdbcSupport.timestamp;
import static com.workq.jdbc.JdbcSupport.translate;

/**
 * {@link JobQueue} on two PostgreSQL tables shared by every node: {@code workq_ready}, where a
 * {@code BIGSERIAL} sequence gives FIFO order inside each priority rank, and {@code workq_scheduled}.
 * Claims and promotions lock rows with {@code FOR UPDATE SKIP LOCKED}.
 */
public class PostgresJobQueue implements JobQueue {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JdbcSupport support;
    private final TableNames tables;

    private final String insertReadySql;
    private final String upsertScheduledSql;
    private final String dequeueSql;
    private final String peekSql;
    private final String promoteDueSql;

    PostgresJobQueue(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, JdbcSupport support,
            TableNames tables) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.support = support;
        this.tables = tables;

        this.insertReadySql = "INSERT INTO " + tables.ready()
                + " (job_id, queue_name, priority_rank, job_data) VALUES (?, ?, ?, ?::jsonb)";
        this.upsertScheduledSql = "INSERT INTO " + tables.scheduled()
                + " (job_id, queue_name, priority_rank, execute_at, job_data) VALUES (?, ?, ?, ?, ?::jsonb)"
                + " ON CONFLICT (job_id) DO UPDATE SET queue_name = EXCLUDED.queue_name,"
                + " priority_rank = EXCLUDED.priority_rank, execute_at = EXCLUDED.execute_at,"
                + " job_data = EXCLUDED.job_data";
        this.dequeueSql = """
                DELETE FROM %1$s
                WHERE seq = (
                    SELECT seq FROM %1$s
                    WHERE queue_name = ?
                    ORDER BY priority_rank, seq
                    LIMIT 1
                    FOR UPDATE SKIP LOCKED
                )
                RETURNING job_data
                """.formatted(tables.ready());
        this.peekSql = "SELECT job_data FROM " + tables.ready()
                + " WHERE queue_name = ? ORDER BY priority_rank, seq LIMIT 1";
        this.promoteDueSql = """
                WITH due AS (
                    DELETE FROM %1$s
                    WHERE job_id IN (
                        SELECT job_id FROM %1$s
                        WHERE execute_at <= ?
                        FOR UPDATE SKIP LOCKED
                    )
                    RETURNING job_id, queue_name, priority_rank, execute_at, job_data
                )
                INSERT INTO %2$s (job_id, queue_name, priority_rank, job_data)
                SELECT job_id, queue_name, priority_rank, job_data FROM due
                ORDER BY execute_at
                ON CONFLICT (job_id) DO NOTHING
                """.formatted(tables.scheduled(), tables.ready());
    }

    @Override
    public void enqueue(String queue, Job job) {
        String jobData = support.writeJob(job);
        translate("enqueue job " + job.getId(), () -> transactionTemplate.execute(status -> {
            removeEntries(job.getId());
            return jdbcTemplate.update(insertReadySql, job.getId(), queue, job.getPriority().rank(), jobData);
        }));
    }

    @Override
    public void schedule(String queue, Job job, Instant executeAt) {
        String jobData = support.writeJob(job);
        translate("schedule job " + job.getId(), () -> transactionTemplate.execute(status -> {
            jdbcTemplate.update("DELETE FROM " + tables.ready() + " WHERE job_id = ?", job.getId());
            return jdbcTemplate.update(upsertScheduledSql, job.getId(), queue, job.getPriority().rank(),
                    timestamp(executeAt), jobData);
        }));
    }

    @Override
    public Optional<Job> dequeue(String queue) {
        List<String> claimed = translate("dequeue from " + queue,
                () -> jdbcTemplate.queryForList(dequeueSql, String.class, queue));
        return claimed.stream().findFirst().map(support::readJob);
    }

    @Override
    public Optional<Job> peek(String queue) {
        List<String> head = translate("peek " + queue, () -> jdbcTemplate.queryForList(peekSql, String.class, queue));
        return head.stream().findFirst().map(support::readJob);
    }

    @Override
    public int processDue(Instant now) {
        return translate("promote due jobs", () -> jdbcTemplate.update(promoteDueSql, timestamp(now)));
    }

    @Override
    public boolean delete(String queue, UUID jobId) {
        return translate("delete job " + jobId, () -> transactionTemplate.execute(status -> {
            int removed = jdbcTemplate.update("DELETE FROM " + tables.ready()
                    + " WHERE queue_name = ? AND job_id = ?", queue, jobId);
            removed += jdbcTemplate.update("DELETE FROM " + tables.scheduled()
                    + " WHERE queue_name = ? AND job_id = ?", queue, jobId);
            return removed > 0;
        }));
    }

    @Override
    public long size(String queue) {
        return count("SELECT COUNT(*) FROM " + tables.ready() + " WHERE queue_name = ?", queue);
    }

    @Override
    public long scheduledSize(String queue) {
        return count("SELECT COUNT(*) FROM " + tables.scheduled() + " WHERE queue_name = ?", queue);
    }

    @Override
    public List<String> listQueues() {
        String sql = "SELECT queue_name FROM " + tables.ready()
                + " UNION SELECT queue_name FROM " + tables.scheduled()
                + " UNION SELECT queue_name FROM " + tables.jobs()
                + " ORDER BY queue_name";
        return translate("list queues", () -> jdbcTemplate.queryForList(sql, String.class));
    }

    private void removeEntries(UUID jobId) {
        jdbcTemplate.update("DELETE FROM " + tables.ready() + " WHERE job_id = ?", jobId);
        jdbcTemplate.update("DELETE FROM " + tables.scheduled() + " WHERE job_id = ?", jobId);
    }

    private long count(String sql, String queue) {
        Long count = translate("count " + queue, () -> jdbcTemplate.queryForObject(sql, Long.class, queue));
        return count == null ? 0L : count;
    }
}
