package com.workq.jdbc;

import com.workq.Job;
import com.workq.JobError;
import com.workq.JobFilter;
import com.workq.JobNotFoundException;
import com.workq.JobOutcome;
import com.workq.JobPriority;
import com.workq.JobStatus;
import com.workq.core.JobLifecycle;
import com.workq.core.Transition;
import com.workq.spi.JobStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.workq.jdbc.JdbcSupport.instant;
import static com.workq.jdbc.JdbcSupport.timestamp;
import static com.workq.jdbc.JdbcSupport.translate;

/**
 * {@link JobStore} on the {@code workq_jobs} table. Status changes lock the row with
 * {@code SELECT ... FOR UPDATE} and apply the lifecycle rules inside the same transaction.
 */
public class PostgresJobStore implements JobStore {

    private static final String COLUMNS = "id, type, queue_name, priority, status, args, metadata, attempt,"
            + " max_retries, execute_at, created_at, started_at, completed_at, updated_at, result,"
            + " error_message, error_type";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JdbcSupport support;
    private final TableNames tables;
    private final JobLifecycle lifecycle;
    private final RowMapper<Job> rowMapper = this::mapRow;

    private final String upsertSql;

    PostgresJobStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, JdbcSupport support,
            TableNames tables, JobLifecycle lifecycle) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.support = support;
        this.tables = tables;
        this.lifecycle = lifecycle;
        this.upsertSql = "INSERT INTO " + tables.jobs() + " (" + COLUMNS + ")"
                + " VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?)"
                + " ON CONFLICT (id) DO UPDATE SET type = EXCLUDED.type, queue_name = EXCLUDED.queue_name,"
                + " priority = EXCLUDED.priority, status = EXCLUDED.status, args = EXCLUDED.args,"
                + " metadata = EXCLUDED.metadata, attempt = EXCLUDED.attempt, max_retries = EXCLUDED.max_retries,"
                + " execute_at = EXCLUDED.execute_at, started_at = EXCLUDED.started_at,"
                + " completed_at = EXCLUDED.completed_at, updated_at = EXCLUDED.updated_at,"
                + " result = EXCLUDED.result, error_message = EXCLUDED.error_message,"
                + " error_type = EXCLUDED.error_type";
    }

    @Override
    public Job save(Job job) {
        translate("save job " + job.getId(), () -> write(job));
        return job;
    }

    @Override
    public Optional<Job> find(UUID id) {
        List<Job> found = translate("find job " + id, () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM " + tables.jobs() + " WHERE id = ?", rowMapper, id));
        return found.stream().findFirst();
    }

    @Override
    public Transition updateStatus(UUID id, JobStatus status, JobOutcome outcome) {
        return lockedTransition(id, job -> lifecycle.transitionTo(job, status, outcome));
    }

    @Override
    public Transition requeue(UUID id) {
        return lockedTransition(id, lifecycle::requeue);
    }

    @Override
    public Transition recordFailure(UUID id, JobError error) {
        return lockedTransition(id, job -> lifecycle.fail(job, error));
    }

    private Transition lockedTransition(UUID id, Function<Job, Transition> operation) {
        return translate("update job " + id, () -> transactionTemplate.execute(txStatus -> {
            List<Job> locked = jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM " + tables.jobs() + " WHERE id = ? FOR UPDATE", rowMapper, id);
            if (locked.isEmpty()) {
                throw new JobNotFoundException(id);
            }
            Transition transition = operation.apply(locked.get(0));
            transition.job().ifPresent(this::write);
            return transition;
        }));
    }

    @Override
    public List<Job> findBy(JobFilter filter) {
        JobFilter effective = filter == null ? JobFilter.all() : filter;
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + tables.jobs() + " WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (effective.status() != null) {
            sql.append(" AND status = ?");
            args.add(effective.status().name());
        }
        if (effective.type() != null) {
            sql.append(" AND type = ?");
            args.add(effective.type());
        }
        if (effective.queue() != null) {
            sql.append(" AND queue_name = ?");
            args.add(effective.queue());
        }
        if (effective.createdAfter() != null) {
            sql.append(" AND created_at >= ?");
            args.add(timestamp(effective.createdAfter()));
        }
        if (effective.createdBefore() != null) {
            sql.append(" AND created_at < ?");
            args.add(timestamp(effective.createdBefore()));
        }
        sql.append(" ORDER BY created_at ASC, id ASC");
        if (effective.limit() != null) {
            sql.append(" LIMIT ?");
            args.add(Math.max(0, effective.limit()));
        }
        return translate("find jobs", () -> jdbcTemplate.query(sql.toString(), rowMapper, args.toArray()));
    }

    @Override
    public List<Job> deadLetterJobs() {
        String sql = "SELECT " + COLUMNS + " FROM " + tables.jobs()
                + " WHERE status IN ('DEAD', 'FAILED') ORDER BY updated_at DESC";
        return translate("list dead-letter jobs", () -> jdbcTemplate.query(sql, rowMapper));
    }

    @Override
    public List<Job> history(String type, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM " + tables.jobs()
                + " WHERE type = ? ORDER BY created_at DESC, id DESC LIMIT ?";
        return translate("load history of " + type, () -> jdbcTemplate.query(sql, rowMapper, type, Math.max(0, limit)));
    }

    @Override
    public Map<JobStatus, Long> countByStatus(String queue) {
        String sql = "SELECT status, COUNT(*) AS total FROM " + tables.jobs()
                + (queue == null ? "" : " WHERE queue_name = ?") + " GROUP BY status";
        Object[] args = queue == null ? new Object[0] : new Object[] {queue};
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        translate("count jobs", () -> {
            jdbcTemplate.query(sql, rs -> {
                counts.put(JobStatus.valueOf(rs.getString("status")), rs.getLong("total"));
            }, args);
            return counts;
        });
        return counts;
    }

    @Override
    public int purge(Set<JobStatus> statuses, Instant finishedBefore) {
        if (statuses.isEmpty()) {
            return 0;
        }
        String placeholders = statuses.stream().map(status -> "?").collect(Collectors.joining(", "));
        String sql = "DELETE FROM " + tables.jobs() + " WHERE status IN (" + placeholders + ")"
                + " AND completed_at < ?";
        List<Object> args = new ArrayList<>();
        statuses.forEach(status -> args.add(status.name()));
        args.add(timestamp(finishedBefore));
        return translate("purge jobs", () -> jdbcTemplate.update(sql, args.toArray()));
    }

    private int write(Job job) {
        JobError error = job.getError();
        return jdbcTemplate.update(upsertSql,
                job.getId(),
                job.getType(),
                job.getQueue(),
                job.getPriority().name(),
                job.getStatus().name(),
                support.write(job.getArgs()),
                job.getMetadata().isEmpty() ? null : support.write(job.getMetadata()),
                job.getAttempt(),
                job.getMaxRetries(),
                timestamp(job.getExecuteAt()),
                timestamp(job.getCreatedAt()),
                timestamp(job.getStartedAt()),
                timestamp(job.getCompletedAt()),
                timestamp(job.getUpdatedAt()),
                support.write(job.getResult()),
                error == null ? null : error.message(),
                error == null ? null : error.type());
    }

    @SuppressWarnings("unchecked")
    private Job mapRow(ResultSet rs, int rowNum) throws SQLException {
        String errorType = rs.getString("error_type");
        Map<String, String> metadata = support.read(rs.getString("metadata"), Map.class);
        return Job.builder()
                .id(rs.getObject("id", UUID.class))
                .type(rs.getString("type"))
                .queue(rs.getString("queue_name"))
                .priority(JobPriority.valueOf(rs.getString("priority")))
                .status(JobStatus.valueOf(rs.getString("status")))
                .args(support.readTree(rs.getString("args")))
                .metadata(metadata)
                .attempt(rs.getInt("attempt"))
                .maxRetries(rs.getInt("max_retries"))
                .executeAt(instant(rs.getObject("execute_at", OffsetDateTime.class)))
                .createdAt(instant(rs.getObject("created_at", OffsetDateTime.class)))
                .startedAt(instant(rs.getObject("started_at", OffsetDateTime.class)))
                .completedAt(instant(rs.getObject("completed_at", OffsetDateTime.class)))
                .updatedAt(instant(rs.getObject("updated_at", OffsetDateTime.class)))
                .result(support.readTree(rs.getString("result")))
                .error(errorType == null ? null : new JobError(rs.getString("error_message"), errorType))
                .build();
    }
}
