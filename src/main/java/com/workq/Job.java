package com.workq;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of background work together with its lifecycle metadata.
 * <p>
 * Instances are immutable. Lifecycle transitions are computed by
 * {@link com.workq.core.JobLifecycle}, which returns new instances built with {@link #toBuilder()}.
 */
public final class Job {

    private final UUID id;
    private final String type;
    private final JsonNode args;
    private final Map<String, String> metadata;
    private final String queue;
    private final JobPriority priority;
    private final JobStatus status;
    private final int attempt;
    private final int maxRetries;
    private final Instant executeAt;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant updatedAt;
    private final JsonNode result;
    private final JobError error;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.args = absentIfNull(builder.args);
        this.metadata = builder.metadata == null || builder.metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.queue = Objects.requireNonNull(builder.queue, "queue must not be null");
        this.priority = builder.priority == null ? JobPriority.NORMAL : builder.priority;
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.attempt = builder.attempt;
        this.maxRetries = builder.maxRetries;
        this.executeAt = Objects.requireNonNull(builder.executeAt, "executeAt must not be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.updatedAt = builder.updatedAt == null ? builder.createdAt : builder.updatedAt;
        this.result = absentIfNull(builder.result);
        this.error = builder.error;
    }

    private static JsonNode absentIfNull(JsonNode node) {
        return node == null || node.isNull() ? null : node;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public UUID getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public JsonNode getArgs() {
        return args;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public String getQueue() {
        return queue;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public JobStatus getStatus() {
        return status;
    }

    public int getAttempt() {
        return attempt;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Instant getExecuteAt() {
        return executeAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public JsonNode getResult() {
        return result;
    }

    public JobError getError() {
        return error;
    }

    /**
     * Whether the job may be started at the given instant.
     */
    public boolean isDue(Instant now) {
        return !executeAt.isAfter(now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Job other)) {
            return false;
        }
        return attempt == other.attempt
                && maxRetries == other.maxRetries
                && id.equals(other.id)
                && type.equals(other.type)
                && Objects.equals(args, other.args)
                && metadata.equals(other.metadata)
                && queue.equals(other.queue)
                && priority == other.priority
                && status == other.status
                && executeAt.equals(other.executeAt)
                && createdAt.equals(other.createdAt)
                && Objects.equals(startedAt, other.startedAt)
                && Objects.equals(completedAt, other.completedAt)
                && Objects.equals(updatedAt, other.updatedAt)
                && Objects.equals(result, other.result)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, attempt, updatedAt);
    }

    @Override
    public String toString() {
        return "Job{id=" + id
                + ", type='" + type + '\''
                + ", queue='" + queue + '\''
                + ", priority=" + priority
                + ", status=" + status
                + ", attempt=" + attempt + "/" + (maxRetries + 1)
                + ", executeAt=" + executeAt
                + '}';
    }

    public static final class Builder {
        private UUID id;
        private String type;
        private JsonNode args;
        private Map<String, String> metadata;
        private String queue;
        private JobPriority priority = JobPriority.NORMAL;
        private JobStatus status;
        private int attempt;
        private int maxRetries;
        private Instant executeAt;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant updatedAt;
        private JsonNode result;
        private JobError error;

        private Builder() {
        }

        private Builder(Job job) {
            this.id = job.id;
            this.type = job.type;
            this.args = job.args;
            this.metadata = job.metadata;
            this.queue = job.queue;
            this.priority = job.priority;
            this.status = job.status;
            this.attempt = job.attempt;
            this.maxRetries = job.maxRetries;
            this.executeAt = job.executeAt;
            this.createdAt = job.createdAt;
            this.startedAt = job.startedAt;
            this.completedAt = job.completedAt;
            this.updatedAt = job.updatedAt;
            this.result = job.result;
            this.error = job.error;
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder args(JsonNode args) {
            this.args = args;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder executeAt(Instant executeAt) {
            this.executeAt = executeAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder result(JsonNode result) {
            this.result = result;
            return this;
        }

        public Builder error(JobError error) {
            this.error = error;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
