package com.workq;

import java.time.Instant;
import java.util.Map;

/**
 * Optional settings supplied when a job is created. Unset values fall back to configured defaults.
 */
public final class JobOptions {

    private static final JobOptions DEFAULTS = builder().build();

    private final String queue;
    private final JobPriority priority;
    private final Integer maxRetries;
    private final Instant executeAt;
    private final Map<String, String> metadata;

    private JobOptions(Builder builder) {
        this.queue = builder.queue;
        this.priority = builder.priority;
        this.maxRetries = builder.maxRetries;
        this.executeAt = builder.executeAt;
        this.metadata = builder.metadata == null ? Map.of() : Map.copyOf(builder.metadata);
    }

    public static JobOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .queue(queue)
                .priority(priority)
                .maxRetries(maxRetries)
                .executeAt(executeAt)
                .metadata(metadata);
    }

    public String getQueue() {
        return queue;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public Instant getExecuteAt() {
        return executeAt;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public static final class Builder {
        private String queue;
        private JobPriority priority;
        private Integer maxRetries;
        private Instant executeAt;
        private Map<String, String> metadata;

        private Builder() {
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder executeAt(Instant executeAt) {
            this.executeAt = executeAt;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public JobOptions build() {
            return new JobOptions(this);
        }
    }
}
