package com.workq.memory;

import com.workq.Job;
import com.workq.JobError;
import com.workq.JobFilter;
import com.workq.JobNotFoundException;
import com.workq.JobOutcome;
import com.workq.JobPriority;
import com.workq.JobStatus;
import com.workq.core.JobLifecycle;
import com.workq.core.Transition;
import com.workq.spi.JobBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Single-process backend keeping queues and job records in memory.
 * <p>
 * All queue structure mutations run under one lock, so a job is handed to exactly one
 * {@link #dequeue(String)} caller and a scheduled entry is promoted at most once. Store records are
 * updated with per-key atomic {@link ConcurrentHashMap#compute} calls.
 */
public class InMemoryJobBackend implements JobBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobBackend.class);

    private static final Comparator<ScheduledEntry> SCHEDULED_ORDER = Comparator
            .comparing(ScheduledEntry::executeAt)
            .thenComparingLong(ScheduledEntry::sequence);

    private final JobLifecycle lifecycle;

    private final ReentrantLock queueLock = new ReentrantLock();
    private final Map<String, Map<JobPriority, Deque<Job>>> readyQueues = new HashMap<>();
    private final TreeSet<ScheduledEntry> scheduled = new TreeSet<>(SCHEDULED_ORDER);
    private final Map<UUID, ScheduledEntry> scheduledById = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private final ConcurrentHashMap<UUID, StoredJob> jobs = new ConcurrentHashMap<>();

    public InMemoryJobBackend(JobLifecycle lifecycle) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
    }

    @Override
    public String name() {
        return "memory";
    }

    // ---------------------------------------------------------------- queue

    @Override
    public void enqueue(String queue, Job job) {
        queueLock.lock();
        try {
            removeFromQueues(queue, job.getId());
            tiers(queue).get(job.getPriority()).addLast(job);
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public void schedule(String queue, Job job, Instant executeAt) {
        Objects.requireNonNull(executeAt, "executeAt must not be null");
        queueLock.lock();
        try {
            removeFromQueues(queue, job.getId());
            ScheduledEntry entry = new ScheduledEntry(queue, job, executeAt, sequence.incrementAndGet());
            scheduled.add(entry);
            scheduledById.put(job.getId(), entry);
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public Optional<Job> dequeue(String queue) {
        queueLock.lock();
        try {
            Map<JobPriority, Deque<Job>> tiers = readyQueues.get(queue);
            if (tiers == null) {
                return Optional.empty();
            }
            for (JobPriority priority : JobPriority.values()) {
                Job job = tiers.get(priority).pollFirst();
                if (job != null) {
                    return Optional.of(job);
                }
            }
            return Optional.empty();
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public Optional<Job> peek(String queue) {
        queueLock.lock();
        try {
            Map<JobPriority, Deque<Job>> tiers = readyQueues.get(queue);
            if (tiers == null) {
                return Optional.empty();
            }
            for (JobPriority priority : JobPriority.values()) {
                Job job = tiers.get(priority).peekFirst();
                if (job != null) {
                    return Optional.of(job);
                }
            }
            return Optional.empty();
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public int processDue(Instant now) {
        queueLock.lock();
        try {
            int moved = 0;
            Iterator<ScheduledEntry> iterator = scheduled.iterator();
            while (iterator.hasNext()) {
                ScheduledEntry entry = iterator.next();
                if (entry.executeAt().isAfter(now)) {
                    break;
                }
                iterator.remove();
                scheduledById.remove(entry.job().getId());
                tiers(entry.queue()).get(entry.job().getPriority()).addLast(entry.job());
                moved++;
            }
            if (moved > 0) {
                log.debug("Promoted {} due job(s)", moved);
            }
            return moved;
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public boolean delete(String queue, UUID jobId) {
        queueLock.lock();
        try {
            return removeFromQueues(queue, jobId);
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public long size(String queue) {
        queueLock.lock();
        try {
            Map<JobPriority, Deque<Job>> tiers = readyQueues.get(queue);
            if (tiers == null) {
                return 0;
            }
            long size = 0;
            for (Deque<Job> tier : tiers.values()) {
                size += tier.size();
            }
            return size;
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public long scheduledSize(String queue) {
        queueLock.lock();
        try {
            return scheduled.stream().filter(entry -> entry.queue().equals(queue)).count();
        } finally {
            queueLock.unlock();
        }
    }

    @Override
    public List<String> listQueues() {
        queueLock.lock();
        try {
            Set<String> names = new TreeSet<>();
            readyQueues.forEach((name, tiers) -> {
                if (tiers.values().stream().anyMatch(deque -> !deque.isEmpty())) {
                    names.add(name);
                }
            });
            scheduled.forEach(entry -> names.add(entry.queue()));
            jobs.values().forEach(stored -> names.add(stored.job().getQueue()));
            return List.copyOf(names);
        } finally {
            queueLock.unlock();
        }
    }

    private Map<JobPriority, Deque<Job>> tiers(String queue) {
        return readyQueues.computeIfAbsent(queue, name -> {
            Map<JobPriority, Deque<Job>> tiers = new EnumMap<>(JobPriority.class);
            for (JobPriority priority : JobPriority.values()) {
                tiers.put(priority, new ArrayDeque<>());
            }
            return tiers;
        });
    }

    // caller holds queueLock
    private boolean removeFromQueues(String queue, UUID jobId) {
        ScheduledEntry entry = scheduledById.get(jobId);
        if (entry != null && entry.queue().equals(queue)) {
            scheduledById.remove(jobId);
            scheduled.remove(entry);
            return true;
        }
        Map<JobPriority, Deque<Job>> tiers = readyQueues.get(queue);
        if (tiers == null) {
            return false;
        }
        for (Deque<Job> tier : tiers.values()) {
            if (tier.removeIf(job -> job.getId().equals(jobId))) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------- store

    @Override
    public Job save(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        jobs.compute(job.getId(), (id, existing) -> new StoredJob(job,
                existing == null ? sequence.incrementAndGet() : existing.sequence()));
        return job;
    }

    @Override
    public Optional<Job> find(UUID id) {
        StoredJob stored = jobs.get(id);
        return stored == null ? Optional.empty() : Optional.of(stored.job());
    }

    @Override
    public Transition updateStatus(UUID id, JobStatus status, JobOutcome outcome) {
        return applyTransition(id, job -> lifecycle.transitionTo(job, status, outcome));
    }

    @Override
    public Transition requeue(UUID id) {
        return applyTransition(id, lifecycle::requeue);
    }

    @Override
    public Transition recordFailure(UUID id, JobError error) {
        return applyTransition(id, job -> lifecycle.fail(job, error));
    }

    private Transition applyTransition(UUID id, Function<Job, Transition> operation) {
        Transition[] outcome = new Transition[1];
        StoredJob updated = jobs.computeIfPresent(id, (key, stored) -> {
            Transition transition = operation.apply(stored.job());
            outcome[0] = transition;
            return transition.job().map(job -> new StoredJob(job, stored.sequence())).orElse(stored);
        });
        if (updated == null) {
            throw new JobNotFoundException(id);
        }
        return outcome[0];
    }

    @Override
    public List<Job> findBy(JobFilter filter) {
        JobFilter effective = filter == null ? JobFilter.all() : filter;
        return jobs.values().stream()
                .filter(stored -> effective.matches(stored.job()))
                .sorted(Comparator.comparing((StoredJob stored) -> stored.job().getCreatedAt())
                        .thenComparingLong(StoredJob::sequence))
                .limit(effective.limit() == null ? Long.MAX_VALUE : Math.max(0, effective.limit()))
                .map(StoredJob::job)
                .collect(Collectors.toList());
    }

    @Override
    public List<Job> deadLetterJobs() {
        return jobs.values().stream()
                .map(StoredJob::job)
                .filter(job -> job.getStatus().isDeadLetter())
                .sorted(Comparator.comparing(Job::getUpdatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<Job> history(String type, int limit) {
        return jobs.values().stream()
                .filter(stored -> stored.job().getType().equals(type))
                .sorted(Comparator.comparing((StoredJob stored) -> stored.job().getCreatedAt())
                        .thenComparingLong(StoredJob::sequence)
                        .reversed())
                .limit(Math.max(0, limit))
                .map(StoredJob::job)
                .collect(Collectors.toList());
    }

    @Override
    public Map<JobStatus, Long> countByStatus(String queue) {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (StoredJob stored : jobs.values()) {
            Job job = stored.job();
            if (queue == null || queue.equals(job.getQueue())) {
                counts.merge(job.getStatus(), 1L, Long::sum);
            }
        }
        return counts;
    }

    @Override
    public int purge(Set<JobStatus> statuses, Instant finishedBefore) {
        List<UUID> candidates = new ArrayList<>();
        for (StoredJob stored : jobs.values()) {
            if (isPurgeable(stored.job(), statuses, finishedBefore)) {
                candidates.add(stored.job().getId());
            }
        }
        int purged = 0;
        for (UUID id : candidates) {
            // re-checked atomically, the job may have been requeued meanwhile
            boolean[] removed = new boolean[1];
            jobs.computeIfPresent(id, (key, stored) -> {
                if (isPurgeable(stored.job(), statuses, finishedBefore)) {
                    removed[0] = true;
                    return null;
                }
                return stored;
            });
            if (removed[0]) {
                purged++;
            }
        }
        return purged;
    }

    private static boolean isPurgeable(Job job, Set<JobStatus> statuses, Instant finishedBefore) {
        return statuses.contains(job.getStatus())
                && job.getCompletedAt() != null
                && job.getCompletedAt().isBefore(finishedBefore);
    }

    private record StoredJob(Job job, long sequence) {
    }

    private record ScheduledEntry(String queue, Job job, Instant executeAt, long sequence) {
    }
}
