package com.workq.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.workq.Job;
import com.workq.JobError;
import com.workq.JobOptions;
import com.workq.JobOutcome;
import com.workq.JobPriority;
import com.workq.JobStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Job state machine.
 * <p>
 * Every operation takes a job value and returns a {@link Transition} holding a new job value. Jobs
 * are never mutated, and an operation requested in an incompatible status yields a
 * {@link JobStateConflict} instead of throwing. The only inputs besides the job are the clock and
 * the backoff policy.
 */
public class JobLifecycle {

    public static final String DEFAULT_QUEUE = "default";
    public static final int DEFAULT_MAX_RETRIES = 5;

    private final Clock clock;
    private final BackoffPolicy backoffPolicy;
    private final int defaultMaxRetries;

    public JobLifecycle(Clock clock, BackoffPolicy backoffPolicy, int defaultMaxRetries) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy must not be null");
        validateMaxRetries(defaultMaxRetries);
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public JobLifecycle(Clock clock, BackoffPolicy backoffPolicy) {
        this(clock, backoffPolicy, DEFAULT_MAX_RETRIES);
    }

    /**
     * Builds a new job: {@code SCHEDULED} when the options carry a future execution time,
     * {@code PENDING} otherwise.
     */
    public Job create(String type, JsonNode args, JobOptions options) {
        JobOptions resolved = options == null ? JobOptions.defaults() : options;
        String normalizedType = normalizeRequired(type, "Job type");
        String queue = resolved.getQueue() == null ? DEFAULT_QUEUE : normalizeRequired(resolved.getQueue(), "Queue name");
        int maxRetries = resolved.getMaxRetries() == null ? defaultMaxRetries : resolved.getMaxRetries();
        validateMaxRetries(maxRetries);

        Instant now = now();
        Instant executeAt = resolved.getExecuteAt() == null ? now : truncate(resolved.getExecuteAt());
        JobStatus status = executeAt.isAfter(now) ? JobStatus.SCHEDULED : JobStatus.PENDING;
        JobPriority priority = resolved.getPriority() == null ? JobPriority.NORMAL : resolved.getPriority();

        return Job.builder()
                .id(UUID.randomUUID())
                .type(normalizedType)
                .args(args)
                .metadata(resolved.getMetadata())
                .queue(queue)
                .priority(priority)
                .status(status)
                .attempt(0)
                .maxRetries(maxRetries)
                .executeAt(executeAt)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * {@code PENDING} or due {@code SCHEDULED} to {@code RUNNING}, counting one more attempt.
     */
    public Transition start(Job job) {
        Instant now = now();
        boolean startable = job.getStatus() == JobStatus.PENDING
                || (job.getStatus() == JobStatus.SCHEDULED && job.isDue(now));
        if (!startable) {
            if (job.getStatus() == JobStatus.SCHEDULED) {
                return Transition.conflict(JobStateConflict.of(job.getId(), job.getStatus(), "start",
                        "not due before " + job.getExecuteAt()));
            }
            return Transition.conflict(JobStateConflict.of(job.getId(), job.getStatus(), "start"));
        }
        if (job.getAttempt() > job.getMaxRetries()) {
            return Transition.conflict(JobStateConflict.of(job.getId(), job.getStatus(), "start",
                    "all " + (job.getMaxRetries() + 1) + " attempts used"));
        }
        return Transition.of(job.toBuilder()
                .status(JobStatus.RUNNING)
                .attempt(job.getAttempt() + 1)
                .startedAt(job.getStartedAt() == null ? now : job.getStartedAt())
                .updatedAt(now)
                .build());
    }

    /**
     * {@code RUNNING} to {@code COMPLETED} with the handler result.
     */
    public Transition complete(Job job, JsonNode result) {
        if (job.getStatus() != JobStatus.RUNNING) {
            return Transition.conflict(JobStateConflict.of(job.getId(), job.getStatus(), "complete"));
        }
        Instant now = now();
        return Transition.of(job.toBuilder()
                .status(JobStatus.COMPLETED)
                .completedAt(now)
                .updatedAt(now)
                .result(result)
                .error(null)
                .build());
    }

    /**
     * {@code RUNNING} to {@code SCHEDULED} for a backed-off retry while the retry budget lasts,
     * otherwise to {@code DEAD}. A job with {@code maxRetries = N} is dead-lettered by its
     * {@code N+1}-th failure.
     */
    public Transition fail(Job job, JobError error) {
        if (job.getStatus() != JobStatus.RUNNING) {
            return Transition.conflict(JobStateConflict.of(job.getId(), job.getStatus(), "fail"));
        }
        Instant now = now();
        if (isRetryEligible(job)) {
            Instant retryAt = truncate(now.plus(backoffPolicy.delayFor(job.getAttempt())));
            return Transition.of(job.toBuilder()
                    .status(JobStatus.SCHEDULED)
                    .executeAt(retryAt)
                    .updatedAt(now)
                    .result(null)
                    .error(error)
                    .build());
        }
        return Transition.of(job.toBuilder()
                .status(JobStatus.DEAD)
                .completedAt(now)
                .updatedAt(now)
                .result(null)
                .error(error)
                .build());
    }

    /**
     * Records a terminal failure without retry routing.
     */
    public Transition markFailed(Job job, JobError error) {
        return terminalFailure(job, JobStatus.FAILED, error, "mark failed");
    }

    /**
     * Dead-letters a job directly, whatever retry budget it has left.
     */
    public Transition markDead(Job job, JobError error) {
        return terminalFailure(job, JobStatus.DEAD, error, "mark dead");
    }

    public Transition cancel(Job job) {
        if (job.getStatus() != JobStatus.PENDING && job.getStatus() != JobStatus.SCHEDULED) {
            return Transition.conflict(JobStateConflict.of(job.getId(), job.getStatus(), "cancel"));
        }
        Instant now = now();
        return Transition.of(job.toBuilder()
                .status(JobStatus.CANCELLED)
                .completedAt(now)
                .updatedAt(now)
                .build());
    }

    /**
     * Operator action: a dead-letter job starts over as {@code PENDING} with no attempts used.
     */
    public Transition requeue(Job job) {
        if (!job.getStatus().isDeadLetter()) {
            return Transition.conflict(JobStateConflict.of(job.getId(), job.getStatus(), "requeue"));
        }
        Instant now = now();
        return Transition.of(job.toBuilder()
                .status(JobStatus.PENDING)
                .attempt(0)
                .executeAt(now)
                .startedAt(null)
                .completedAt(null)
                .updatedAt(now)
                .result(null)
                .error(null)
                .build());
    }

    /**
     * Applies the operation that leads to {@code target}, as requested through
     * {@link com.workq.spi.JobStore#updateStatus}. {@code SCHEDULED} is only reachable through
     * {@link #fail(Job, JobError)} and is rejected.
     */
    public Transition transitionTo(Job job, JobStatus target, JobOutcome outcome) {
        return switch (target) {
            case RUNNING -> start(job);
            case COMPLETED -> complete(job, outcome == null ? null : outcome.getResult());
            case FAILED -> markFailed(job, errorOf(outcome, target));
            case DEAD -> markDead(job, errorOf(outcome, target));
            case CANCELLED -> cancel(job);
            case PENDING -> requeue(job);
            case SCHEDULED -> throw new IllegalArgumentException(
                    "SCHEDULED is set by retry routing and cannot be requested directly");
        };
    }

    public boolean isRetryEligible(Job job) {
        return job.getAttempt() <= job.getMaxRetries();
    }

    public Instant now() {
        return truncate(clock.instant());
    }

    public Clock getClock() {
        return clock;
    }

    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    private Transition terminalFailure(Job job, JobStatus target, JobError error, String operation) {
        JobStatus status = job.getStatus();
        if (status != JobStatus.RUNNING && status != JobStatus.PENDING && status != JobStatus.SCHEDULED) {
            return Transition.conflict(JobStateConflict.of(job.getId(), status, operation));
        }
        Instant now = now();
        return Transition.of(job.toBuilder()
                .status(target)
                .completedAt(now)
                .updatedAt(now)
                .result(null)
                .error(error)
                .build());
    }

    private static JobError errorOf(JobOutcome outcome, JobStatus target) {
        if (outcome != null && outcome.getError() != null) {
            return outcome.getError();
        }
        return JobError.of("Marked " + target.name().toLowerCase(Locale.ROOT) + " by operator");
    }

    // microsecond resolution, same as timestamptz
    private static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    private static String normalizeRequired(String value, String description) {
        if (value == null) {
            throw new IllegalArgumentException(description + " must not be null");
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(description + " must not be blank");
        }
        return trimmed;
    }

    private static void validateMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }
}
