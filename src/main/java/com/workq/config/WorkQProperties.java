package com.workq.config;

import com.workq.core.BackoffStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "workq")
public class WorkQProperties {

    private final Backend backend = new Backend();
    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final BackgroundJobServer backgroundJobServer = new BackgroundJobServer();

    public Backend getBackend() {
        return backend;
    }

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public BackgroundJobServer getBackgroundJobServer() {
        return backgroundJobServer;
    }

    public enum BackendType {
        MEMORY,
        JDBC
    }

    public static class Backend {
        private BackendType type = BackendType.MEMORY;

        public BackendType getType() {
            return type;
        }

        public void setType(BackendType type) {
            this.type = type;
        }
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Jobs {
        private int defaultMaxRetries = 5;
        private final Backoff backoff = new Backoff();

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }

        public Backoff getBackoff() {
            return backoff;
        }
    }

    public static class Backoff {
        private BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private boolean jitter = true;

        public BackoffStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(BackoffStrategy strategy) {
            this.strategy = strategy;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }
    }

    public static class BackgroundJobServer {
        private boolean enabled = true;
        private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());
        private List<String> queues = new ArrayList<>(List.of("default"));
        private Duration pollInterval = Duration.ofSeconds(1);
        private Map<String, Duration> queuePollIntervals = new LinkedHashMap<>();
        private Duration scheduledInterval = Duration.ofSeconds(1);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private String deleteSucceededJobsAfter = "36h";
        private String deleteDeadJobsAfter = "72h";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public List<String> getQueues() {
            return queues;
        }

        public void setQueues(List<String> queues) {
            this.queues = queues;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Map<String, Duration> getQueuePollIntervals() {
            return queuePollIntervals;
        }

        public void setQueuePollIntervals(Map<String, Duration> queuePollIntervals) {
            this.queuePollIntervals = queuePollIntervals;
        }

        /**
         * Poll interval of the workers serving {@code queue}, falling back to {@link #getPollInterval()}.
         */
        public Duration pollIntervalFor(String queue) {
            Duration override = queuePollIntervals.get(queue);
            return override == null ? pollInterval : override;
        }

        public Duration getScheduledInterval() {
            return scheduledInterval;
        }

        public void setScheduledInterval(Duration scheduledInterval) {
            this.scheduledInterval = scheduledInterval;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public String getDeleteSucceededJobsAfter() {
            return deleteSucceededJobsAfter;
        }

        public void setDeleteSucceededJobsAfter(String deleteSucceededJobsAfter) {
            this.deleteSucceededJobsAfter = deleteSucceededJobsAfter;
        }

        public String getDeleteDeadJobsAfter() {
            return deleteDeadJobsAfter;
        }

        public void setDeleteDeadJobsAfter(String deleteDeadJobsAfter) {
            this.deleteDeadJobsAfter = deleteDeadJobsAfter;
        }
    }
}
