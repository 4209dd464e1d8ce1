package com.workq.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workq.Job;
import com.workq.JobError;
import com.workq.JobFilter;
import com.workq.JobNotFoundException;
import com.workq.JobOptions;
import com.workq.JobOutcome;
import com.workq.JobPriority;
import com.workq.JobStatus;
import com.workq.MutableClock;
import com.workq.core.BackoffPolicy;
import com.workq.core.JobLifecycle;
import com.workq.core.Transition;
import com.workq.internal.DefaultHandlerRegistry;
import com.workq.worker.Worker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behaviour every {@link JobBackend} must share. Subclasses supply the backend under test.
 */
public abstract class JobBackendContract {

    protected static final String QUEUE = "emails";
    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected MutableClock clock;
    protected JobLifecycle lifecycle;
    protected JobBackend backend;

    protected abstract JobBackend createBackend(JobLifecycle lifecycle);

    @BeforeEach
    void setUpBackend() {
        clock = MutableClock.at("2026-05-04T08:00:00Z");
        lifecycle = new JobLifecycle(clock, BackoffPolicy.constant(Duration.ofSeconds(10)), 3);
        backend = createBackend(lifecycle);
    }

    @Test
    void dequeueOnEmptyQueueReturnsNothing() {
        assertTrue(backend.dequeue(QUEUE).isEmpty());
        assertTrue(backend.peek(QUEUE).isEmpty());
        assertEquals(0, backend.size(QUEUE));
    }

    @Test
    void higherPriorityIsDeliveredFirst() {
        Job low = enqueue("send", JobPriority.LOW);
        Job normal = enqueue("send", JobPriority.NORMAL);
        Job critical = enqueue("send", JobPriority.CRITICAL);
        Job high = enqueue("send", JobPriority.HIGH);

        assertEquals(critical.getId(), backend.dequeue(QUEUE).orElseThrow().getId());
        assertEquals(high.getId(), backend.dequeue(QUEUE).orElseThrow().getId());
        assertEquals(normal.getId(), backend.dequeue(QUEUE).orElseThrow().getId());
        assertEquals(low.getId(), backend.dequeue(QUEUE).orElseThrow().getId());
        assertTrue(backend.dequeue(QUEUE).isEmpty());
    }

    @Test
    void equalPriorityIsFirstInFirstOut() {
        List<UUID> enqueued = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            enqueued.add(enqueue("send", JobPriority.NORMAL).getId());
        }

        List<UUID> dequeued = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            dequeued.add(backend.dequeue(QUEUE).orElseThrow().getId());
        }

        assertEquals(enqueued, dequeued);
    }

    @Test
    void dequeueReturnsTheEnqueuedSnapshot() {
        JsonNode args = MAPPER.createObjectNode().put("to", "ops@example.com").put("retries", 2);
        Job job = lifecycle.create("send", args, JobOptions.builder()
                .queue(QUEUE)
                .priority(JobPriority.HIGH)
                .metadata(Map.of("tenant", "acme"))
                .build());
        backend.enqueue(QUEUE, job);

        Job claimed = backend.dequeue(QUEUE).orElseThrow();

        assertEquals(job, claimed);
    }

    @Test
    void peekDoesNotRemove() {
        Job job = enqueue("send", JobPriority.NORMAL);

        assertEquals(job.getId(), backend.peek(QUEUE).orElseThrow().getId());
        assertEquals(1, backend.size(QUEUE));
        assertEquals(job.getId(), backend.dequeue(QUEUE).orElseThrow().getId());
    }

    @Test
    void queuesAreIsolated() {
        enqueue("send", JobPriority.NORMAL);

        assertTrue(backend.dequeue("reports").isEmpty());
        assertEquals(1, backend.size(QUEUE));
    }

    @Test
    void scheduledJobBecomesVisibleAfterPromotion() {
        Job job = schedule("reminder", clock.instant().plusSeconds(60));

        assertTrue(backend.dequeue(QUEUE).isEmpty());
        assertEquals(0, backend.size(QUEUE));
        assertEquals(1, backend.scheduledSize(QUEUE));
        assertEquals(0, backend.processDue(clock.instant()));

        clock.advance(Duration.ofSeconds(61));
        assertEquals(1, backend.processDue(clock.instant()));

        assertEquals(0, backend.scheduledSize(QUEUE));
        assertEquals(job.getId(), backend.dequeue(QUEUE).orElseThrow().getId());
    }

    @Test
    void promotionHappensOnce() {
        schedule("reminder", clock.instant().plusSeconds(5));
        clock.advance(Duration.ofSeconds(5));

        assertEquals(1, backend.processDue(clock.instant()));
        assertEquals(0, backend.processDue(clock.instant()));
        assertEquals(1, backend.size(QUEUE));
    }

    @Test
    void dueJobsArePromotedInExecutionOrder() {
        Job later = schedule("reminder", clock.instant().plusSeconds(20));
        Job sooner = schedule("reminder", clock.instant().plusSeconds(10));
        clock.advance(Duration.ofSeconds(30));

        assertEquals(2, backend.processDue(clock.instant()));

        assertEquals(sooner.getId(), backend.dequeue(QUEUE).orElseThrow().getId());
        assertEquals(later.getId(), backend.dequeue(QUEUE).orElseThrow().getId());
    }

    @Test
    void deleteRemovesReadyAndScheduledEntries() {
        Job ready = enqueue("send", JobPriority.NORMAL);
        Job scheduled = schedule("reminder", clock.instant().plusSeconds(60));

        assertTrue(backend.delete(QUEUE, ready.getId()));
        assertTrue(backend.delete(QUEUE, scheduled.getId()));
        assertFalse(backend.delete(QUEUE, ready.getId()));
        assertFalse(backend.delete(QUEUE, UUID.randomUUID()));

        clock.advance(Duration.ofMinutes(2));
        assertEquals(0, backend.processDue(clock.instant()));
        assertTrue(backend.dequeue(QUEUE).isEmpty());
    }

    @Test
    void listQueuesReportsQueuesWithEntries() {
        enqueue("send", JobPriority.NORMAL);
        Job report = lifecycle.create("report", null, JobOptions.builder()
                .queue("reports")
                .executeAt(clock.instant().plusSeconds(30))
                .build());
        backend.save(report);
        backend.schedule("reports", report, report.getExecuteAt());

        assertThat(backend.listQueues()).contains(QUEUE, "reports");
    }

    @Test
    void listQueuesIsSortedAndKeepsQueuesWithStoredJobs() {
        enqueue("send", JobPriority.NORMAL);
        Job archived = saveOn("archive", "compact");
        saveOn("billing", "invoice");
        backend.dequeue(QUEUE).orElseThrow();

        assertEquals(List.of("archive", "billing", QUEUE), backend.listQueues());

        backend.updateStatus(archived.getId(), JobStatus.CANCELLED, null).orElseThrow();
        clock.advance(Duration.ofHours(1));
        backend.purge(EnumSet.of(JobStatus.CANCELLED), clock.instant());

        assertEquals(List.of("billing", QUEUE), backend.listQueues());
    }

    @Test
    void concurrentDequeueDeliversEachJobOnce() throws Exception {
        int jobCount = 200;
        for (int i = 0; i < jobCount; i++) {
            enqueue("send", JobPriority.values()[i % JobPriority.values().length]);
        }

        int consumers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(consumers);
        ConcurrentLinkedQueue<UUID> delivered = new ConcurrentLinkedQueue<>();
        CountDownLatch startGate = new CountDownLatch(1);
        try {
            for (int i = 0; i < consumers; i++) {
                executor.submit(() -> {
                    startGate.await();
                    Optional<Job> next;
                    while ((next = backend.dequeue(QUEUE)).isPresent()) {
                        delivered.add(next.get().getId());
                    }
                    return null;
                });
            }
            startGate.countDown();
        } finally {
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(jobCount, delivered.size());
        assertEquals(jobCount, new HashSet<>(delivered).size());
    }

    @Test
    void savedJobCanBeFound() {
        Job job = lifecycle.create("send", MAPPER.createObjectNode().put("x", 1), JobOptions.builder()
                .queue(QUEUE)
                .metadata(Map.of("trace", "abc"))
                .build());

        backend.save(job);

        assertEquals(job, backend.find(job.getId()).orElseThrow());
        assertTrue(backend.find(UUID.randomUUID()).isEmpty());
    }

    @Test
    void saveReplacesExistingRecord() {
        Job job = save("send");
        Job running = lifecycle.start(job).orElseThrow();

        backend.save(running);

        Job stored = backend.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.RUNNING, stored.getStatus());
        assertEquals(1, stored.getAttempt());
    }

    @Test
    void updateStatusFollowsLifecycleRules() {
        Job job = save("send");
        JsonNode result = MAPPER.createObjectNode().put("delivered", true);

        Transition started = backend.updateStatus(job.getId(), JobStatus.RUNNING, null);
        Transition completed = backend.updateStatus(job.getId(), JobStatus.COMPLETED, JobOutcome.success(result));

        assertTrue(started.isSuccess());
        assertTrue(completed.isSuccess());
        Job stored = backend.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, stored.getStatus());
        assertEquals(result, stored.getResult());
        assertEquals(clock.instant(), stored.getCompletedAt());
    }

    @Test
    void updateStatusReportsConflictWithoutChangingRecord() {
        Job job = save("send");

        Transition transition = backend.updateStatus(job.getId(), JobStatus.COMPLETED, JobOutcome.success());

        assertFalse(transition.isSuccess());
        assertEquals(JobStatus.PENDING, transition.conflict().orElseThrow().status());
        assertEquals(JobStatus.PENDING, backend.find(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void updateStatusOfUnknownJobThrows() {
        UUID unknown = UUID.randomUUID();

        JobNotFoundException exception = assertThrows(JobNotFoundException.class,
                () -> backend.updateStatus(unknown, JobStatus.RUNNING, null));
        assertEquals(unknown, exception.getJobId());
        assertThrows(JobNotFoundException.class, () -> backend.requeue(unknown));
    }

    @Test
    void updateStatusRejectsScheduled() {
        Job job = save("send");

        assertThrows(IllegalArgumentException.class, () -> backend.updateStatus(job.getId(), JobStatus.SCHEDULED, null));
    }

    @Test
    void recordFailureSchedulesRetryOfRunningJob() {
        Job job = save("send");
        backend.updateStatus(job.getId(), JobStatus.RUNNING, null).orElseThrow();

        Job retrying = backend.recordFailure(job.getId(), JobError.of("smtp timeout")).orElseThrow();

        assertEquals(JobStatus.SCHEDULED, retrying.getStatus());
        assertEquals(clock.instant().plusSeconds(10), retrying.getExecuteAt());
        Job stored = backend.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.SCHEDULED, stored.getStatus());
        assertEquals("smtp timeout", stored.getError().message());
    }

    @Test
    void recordFailureDeadLettersExhaustedJob() {
        Job job = backend.save(lifecycle.create("send", null, JobOptions.builder().queue(QUEUE).maxRetries(0).build()));
        backend.updateStatus(job.getId(), JobStatus.RUNNING, null).orElseThrow();

        Job dead = backend.recordFailure(job.getId(), JobError.of("bounced")).orElseThrow();

        assertEquals(JobStatus.DEAD, dead.getStatus());
        assertEquals(List.of(job.getId()), ids(backend.deadLetterJobs()));
    }

    @Test
    void recordFailureKeepsStatusSetWhileRunning() {
        Job job = save("send");
        backend.updateStatus(job.getId(), JobStatus.RUNNING, null).orElseThrow();
        backend.updateStatus(job.getId(), JobStatus.FAILED, JobOutcome.failure("stopped by operator")).orElseThrow();

        Transition transition = backend.recordFailure(job.getId(), JobError.of("late failure"));

        assertFalse(transition.isSuccess());
        assertEquals(JobStatus.FAILED, transition.conflict().orElseThrow().status());
        Job stored = backend.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertEquals("stopped by operator", stored.getError().message());
        assertThrows(JobNotFoundException.class, () -> backend.recordFailure(UUID.randomUUID(), JobError.of("x")));
    }

    @Test
    void workerSkipsJobCancelledThroughTheStore() {
        List<UUID> handled = new ArrayList<>();
        DefaultHandlerRegistry handlers = new DefaultHandlerRegistry();
        handlers.register("send", args -> {
            handled.add(UUID.randomUUID());
            return JobOutcome.success();
        });
        Worker worker = new Worker("contract-worker", QUEUE, Duration.ofMillis(10), backend, backend, handlers,
                lifecycle, List.of());
        Job cancelled = enqueue("send", JobPriority.NORMAL);
        backend.updateStatus(cancelled.getId(), JobStatus.CANCELLED, null).orElseThrow();

        assertTrue(worker.pollOnce());

        assertTrue(handled.isEmpty());
        assertEquals(JobStatus.CANCELLED, backend.find(cancelled.getId()).orElseThrow().getStatus());
        assertEquals(0, backend.size(QUEUE));
        assertEquals(0, backend.scheduledSize(QUEUE));

        Job live = enqueue("send", JobPriority.NORMAL);
        assertTrue(worker.pollOnce());
        assertEquals(1, handled.size());
        assertEquals(JobStatus.COMPLETED, backend.find(live.getId()).orElseThrow().getStatus());
    }

    @Test
    void failedAndDeadJobsFormTheDeadLetterSet() {
        Job failed = save("send");
        Job dead = save("send");
        save("send");

        backend.updateStatus(failed.getId(), JobStatus.FAILED, JobOutcome.failure(new JobError("smtp down", "SmtpError")));
        clock.advance(Duration.ofSeconds(1));
        backend.updateStatus(dead.getId(), JobStatus.DEAD, JobOutcome.failure("gave up"));

        List<Job> deadLetter = backend.deadLetterJobs();

        assertEquals(List.of(dead.getId(), failed.getId()), deadLetter.stream().map(Job::getId).toList());
        Job storedFailed = backend.find(failed.getId()).orElseThrow();
        assertEquals(new JobError("smtp down", "SmtpError"), storedFailed.getError());
    }

    @Test
    void requeueResetsDeadLetterJob() {
        Job job = save("send");
        backend.updateStatus(job.getId(), JobStatus.RUNNING, null);
        backend.updateStatus(job.getId(), JobStatus.DEAD, JobOutcome.failure("boom"));

        Job requeued = backend.requeue(job.getId()).orElseThrow();

        assertEquals(JobStatus.PENDING, requeued.getStatus());
        assertEquals(0, requeued.getAttempt());
        assertEquals(requeued, backend.find(job.getId()).orElseThrow());
        assertTrue(backend.deadLetterJobs().isEmpty());
    }

    @Test
    void requeueOfLiveJobIsConflict() {
        Job job = save("send");

        assertFalse(backend.requeue(job.getId()).isSuccess());
    }

    @Test
    void findByFiltersAndOrdersByCreationTime() {
        Job first = save("send");
        clock.advance(Duration.ofSeconds(1));
        Job report = saveOn("reports", "report");
        clock.advance(Duration.ofSeconds(1));
        Job second = save("send");
        clock.advance(Duration.ofSeconds(1));
        Job third = save("send");
        backend.updateStatus(third.getId(), JobStatus.CANCELLED, null);

        assertEquals(List.of(first.getId(), report.getId(), second.getId(), third.getId()),
                ids(backend.findBy(JobFilter.all())));
        assertEquals(List.of(first.getId(), second.getId(), third.getId()), ids(backend.findBy(JobFilter.byType("send"))));
        assertEquals(List.of(report.getId()), ids(backend.findBy(JobFilter.byQueue("reports"))));
        assertEquals(List.of(third.getId()), ids(backend.findBy(JobFilter.byStatus(JobStatus.CANCELLED))));
        assertEquals(List.of(first.getId(), second.getId()),
                ids(backend.findBy(JobFilter.byType("send").withStatus(JobStatus.PENDING))));
        assertEquals(List.of(report.getId(), second.getId()),
                ids(backend.findBy(JobFilter.all().createdBetween(report.getCreatedAt(), third.getCreatedAt()))));
        assertEquals(List.of(first.getId()), ids(backend.findBy(JobFilter.byType("send").withLimit(1))));
    }

    @Test
    void historyIsNewestFirst() {
        Job first = save("send");
        clock.advance(Duration.ofSeconds(1));
        Job second = save("send");
        clock.advance(Duration.ofSeconds(1));
        Job third = save("send");
        save("other");

        assertEquals(List.of(third.getId(), second.getId()), ids(backend.history("send", 2)));
        assertEquals(List.of(third.getId(), second.getId(), first.getId()), ids(backend.history("send", 10)));
    }

    @Test
    void countByStatusPerQueueAndOverall() {
        Job completed = save("send");
        backend.updateStatus(completed.getId(), JobStatus.RUNNING, null);
        backend.updateStatus(completed.getId(), JobStatus.COMPLETED, JobOutcome.success());
        save("send");
        saveOn("reports", "report");

        Map<JobStatus, Long> emails = backend.countByStatus(QUEUE);
        Map<JobStatus, Long> all = backend.countByStatus(null);

        assertEquals(1L, emails.get(JobStatus.COMPLETED));
        assertEquals(1L, emails.get(JobStatus.PENDING));
        assertFalse(emails.containsKey(JobStatus.DEAD));
        assertEquals(2L, all.get(JobStatus.PENDING));
    }

    @Test
    void purgeDeletesFinishedJobsOlderThanThreshold() {
        Job old = save("send");
        backend.updateStatus(old.getId(), JobStatus.CANCELLED, null);
        clock.advance(Duration.ofHours(2));
        Job recent = save("send");
        backend.updateStatus(recent.getId(), JobStatus.CANCELLED, null);
        Job pending = save("send");

        int purged = backend.purge(EnumSet.of(JobStatus.CANCELLED, JobStatus.COMPLETED),
                clock.instant().minus(Duration.ofHours(1)));

        assertEquals(1, purged);
        assertTrue(backend.find(old.getId()).isEmpty());
        assertTrue(backend.find(recent.getId()).isPresent());
        assertTrue(backend.find(pending.getId()).isPresent());
    }

    @Test
    void purgeLeavesOtherStatusesAlone() {
        Job dead = save("send");
        backend.updateStatus(dead.getId(), JobStatus.DEAD, JobOutcome.failure("boom"));
        clock.advance(Duration.ofDays(10));

        assertEquals(0, backend.purge(Set.of(JobStatus.COMPLETED), clock.instant()));
        assertTrue(backend.find(dead.getId()).isPresent());
    }

    protected Job enqueue(String type, JobPriority priority) {
        Job job = lifecycle.create(type, null, JobOptions.builder().queue(QUEUE).priority(priority).build());
        backend.save(job);
        backend.enqueue(QUEUE, job);
        return job;
    }

    protected Job schedule(String type, Instant executeAt) {
        Job job = lifecycle.create(type, null, JobOptions.builder().queue(QUEUE).executeAt(executeAt).build());
        backend.save(job);
        backend.schedule(QUEUE, job, executeAt);
        return job;
    }

    protected Job save(String type) {
        return saveOn(QUEUE, type);
    }

    protected Job saveOn(String queue, String type) {
        return backend.save(lifecycle.create(type, null, JobOptions.builder().queue(queue).build()));
    }

    private static List<UUID> ids(List<Job> jobs) {
        return jobs.stream().map(Job::getId).toList();
    }
}
