package com.workq.internal;

import com.workq.JobStatus;
import com.workq.spi.JobStore;
import com.workq.worker.JobEvent;
import com.workq.worker.JobEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Micrometer meters for job processing. Counts per status are read from the store at most once per
 * second, however many gauges are scraped.
 */
public class WorkQMetrics implements JobEventListener {

    private static final Logger log = LoggerFactory.getLogger(WorkQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobStore store;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile Map<JobStatus, Long> cachedCounts = Map.of();
    private volatile long snapshotCapturedAtNanos;
    private volatile boolean snapshotLoaded;

    public WorkQMetrics(JobStore store, MeterRegistry meterRegistry) {
        this.store = store;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath, registering WorkQ meters");
        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("workq.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of stored WorkQ jobs")
                    .tag("status", status.name())
                    .register(meterRegistry);
        }
        Gauge.builder("workq.jobs.total", this, WorkQMetrics::totalCount)
                .description("Total number of stored WorkQ jobs")
                .register(meterRegistry);
    }

    @Override
    public void onEvent(JobEvent event) {
        String eventName = event.type().name().toLowerCase(Locale.ROOT);
        Counter.builder("workq.jobs.events")
                .description("Job lifecycle events emitted by workers")
                .tag("event", eventName)
                .tag("queue", event.queue())
                .register(meterRegistry)
                .increment();
        if (event.duration() != null) {
            String outcome = event.type() == JobEvent.Type.COMPLETED ? "success" : "failure";
            Timer.builder("workq.jobs.duration")
                    .description("Handler execution time")
                    .tag("queue", event.queue())
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .record(event.duration());
        }
    }

    double countFor(JobStatus status) {
        return snapshot().getOrDefault(status, 0L);
    }

    double totalCount() {
        return snapshot().values().stream().mapToLong(Long::longValue).sum();
    }

    private Map<JobStatus, Long> snapshot() {
        long now = System.nanoTime();
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedCounts;
        }
        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedCounts;
            }
            cachedCounts = loadCounts();
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedCounts;
        }
    }

    private Map<JobStatus, Long> loadCounts() {
        try {
            return new EnumMap<>(store.countByStatus(null));
        } catch (RuntimeException e) {
            log.trace("Failed to query job counts for metrics: {}", e.getMessage());
            return Map.of();
        }
    }
}
