package com.workq.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workq.Job;
import com.workq.JobOptions;
import com.workq.JobOutcome;
import com.workq.JobStatus;
import com.workq.core.BackoffPolicy;
import com.workq.core.JobLifecycle;
import com.workq.internal.DefaultHandlerRegistry;
import com.workq.memory.InMemoryJobBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerPoolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JobLifecycle lifecycle;
    private InMemoryJobBackend backend;
    private DefaultHandlerRegistry handlers;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        lifecycle = new JobLifecycle(Clock.systemUTC(), BackoffPolicy.constant(Duration.ofMillis(50)), 3);
        backend = new InMemoryJobBackend(lifecycle);
        handlers = new DefaultHandlerRegistry();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown(Duration.ofSeconds(5));
        }
    }

    @Test
    void everyJobIsProcessedExactlyOnce() {
        ConcurrentLinkedQueue<String> seen = new ConcurrentLinkedQueue<>();
        handlers.register("record", args -> {
            seen.add(args.get("n").asText());
            return JobOutcome.success();
        });
        int jobCount = 100;
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < jobCount; i++) {
            ids.add(submit("default", "record", i));
        }

        pool = newPool(Map.of("default", Duration.ofMillis(20)), 4);
        pool.start();

        await().atMost(10, TimeUnit.SECONDS).until(() -> seen.size() == jobCount);
        assertEquals(jobCount, new HashSet<>(seen).size());
        await().atMost(5, TimeUnit.SECONDS).until(() -> ids.stream()
                .allMatch(id -> backend.find(id).orElseThrow().getStatus() == JobStatus.COMPLETED));
    }

    @Test
    void retriedJobIsPromotedAndCompleted() {
        CountDownLatch firstAttempt = new CountDownLatch(1);
        handlers.register("flaky", args -> {
            if (firstAttempt.getCount() > 0) {
                firstAttempt.countDown();
                throw new IllegalStateException("transient");
            }
            return JobOutcome.success();
        });
        UUID id = submit("default", "flaky", 1);

        pool = newPool(Map.of("default", Duration.ofMillis(20)), 1);
        pool.start();

        await().atMost(10, TimeUnit.SECONDS)
                .until(() -> backend.find(id).orElseThrow().getStatus() == JobStatus.COMPLETED);
        assertEquals(2, backend.find(id).orElseThrow().getAttempt());
    }

    @Test
    void startsWorkersPerQueue() {
        Map<String, Duration> queues = new LinkedHashMap<>();
        queues.put("emails", Duration.ofMillis(20));
        queues.put("reports", Duration.ofMillis(50));
        pool = newPool(queues, 2);

        pool.start();

        List<WorkerStatus> statuses = pool.statuses();
        assertTrue(pool.isRunning());
        assertEquals(4, statuses.size());
        Set<String> ids = new HashSet<>();
        statuses.forEach(status -> ids.add(status.workerId()));
        assertEquals(Set.of("workq-worker-emails-1", "workq-worker-emails-2", "workq-worker-reports-1",
                "workq-worker-reports-2"), ids);
    }

    @Test
    void shutdownWaitsForRunningJob() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        handlers.register("slow", args -> {
            started.countDown();
            release.await();
            return JobOutcome.success();
        });
        UUID id = submit("default", "slow", 1);
        pool = newPool(Map.of("default", Duration.ofMillis(20)), 1);
        pool.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            release.countDown();
        });
        releaser.start();

        assertTrue(pool.shutdown(Duration.ofSeconds(5)));
        assertFalse(pool.isRunning());
        assertEquals(JobStatus.COMPLETED, backend.find(id).orElseThrow().getStatus());
        pool.statuses().forEach(status -> assertEquals(WorkerState.STOPPED, status.state()));
    }

    @Test
    void shutdownReportsTimeoutWhenJobKeepsRunning() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        handlers.register("stuck", args -> {
            started.countDown();
            release.await();
            return JobOutcome.success();
        });
        submit("default", "stuck", 1);
        pool = newPool(Map.of("default", Duration.ofMillis(20)), 1);
        pool.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        try {
            assertFalse(pool.shutdown(Duration.ofMillis(100)));
        } finally {
            release.countDown();
        }
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> newPool(Map.of("default", Duration.ofSeconds(1)), 0));
        assertThrows(IllegalArgumentException.class, () -> newPool(Map.of(), 1));
    }

    private WorkerPool newPool(Map<String, Duration> queues, int workerCount) {
        return new WorkerPool(backend, backend, handlers, lifecycle, List.of(), queues, workerCount,
                Duration.ofMillis(20));
    }

    private UUID submit(String queue, String type, int n) {
        Job job = lifecycle.create(type, MAPPER.createObjectNode().put("n", n), JobOptions.builder().queue(queue).build());
        backend.save(job);
        backend.enqueue(queue, job);
        return job.getId();
    }
}
