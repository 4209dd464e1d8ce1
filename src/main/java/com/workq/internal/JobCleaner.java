package com.workq.internal;

import com.workq.JobStatus;
import com.workq.config.WorkQProperties;
import com.workq.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Hourly retention cleanup of finished jobs.
 */
public class JobCleaner {

    private static final Logger log = LoggerFactory.getLogger(JobCleaner.class);
    private static final Set<JobStatus> SUCCEEDED = EnumSet.of(JobStatus.COMPLETED, JobStatus.CANCELLED);

    private final JobStore store;
    private final WorkQProperties properties;
    private final Clock clock;

    public JobCleaner(JobStore store, WorkQProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelay = 3600000)
    public void cleanup() {
        log.info("Running WorkQ retention cleanup");
        WorkQProperties.BackgroundJobServer server = properties.getBackgroundJobServer();
        purge("succeeded", SUCCEEDED, server.getDeleteSucceededJobsAfter());
        purge("dead-letter", JobStatus.deadLetterStatuses(), server.getDeleteDeadJobsAfter());
    }

    private void purge(String description, Set<JobStatus> statuses, String retentionValue) {
        if (retentionValue == null || retentionValue.isBlank()) {
            return;
        }
        try {
            Duration retention = parseDuration(retentionValue);
            Instant threshold = clock.instant().minus(retention);
            int deleted = store.purge(statuses, threshold);
            if (deleted > 0) {
                log.info("Deleted {} {} job(s) finished more than {} ago", deleted, description, retention);
            }
        } catch (RuntimeException e) {
            log.error("Failed to clean up {} jobs", description, e);
        }
    }

    /**
     * Accepts ISO-8601 durations as well as the {@code 36h} and {@code 7d} shorthand.
     */
    static Duration parseDuration(String value) {
        String trimmed = value.trim();
        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        if (shorthand.matches("\\d+h")) {
            return Duration.ofHours(Long.parseLong(shorthand.substring(0, shorthand.length() - 1)));
        }
        if (shorthand.matches("\\d+d")) {
            return Duration.ofDays(Long.parseLong(shorthand.substring(0, shorthand.length() - 1)));
        }
        try {
            return Duration.parse(trimmed);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unsupported duration value: " + value, e);
        }
    }
}
