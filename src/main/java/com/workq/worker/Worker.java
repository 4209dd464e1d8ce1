package com.workq.worker;

import com.workq.Job;
import com.workq.JobError;
import com.workq.JobHandler;
import com.workq.JobNotFoundException;
import com.workq.JobOutcome;
import com.workq.JobStatus;
import com.workq.core.JobLifecycle;
import com.workq.core.JobStateConflict;
import com.workq.core.Transition;
import com.workq.spi.HandlerRegistry;
import com.workq.spi.JobQueue;
import com.workq.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Claims jobs from one queue and runs them through their handler, one job at a time.
 * <p>
 * {@link #run()} loops until {@link #stop()} is called: a stop request wakes an idle worker
 * immediately, while a worker executing a job finishes that job first. {@link #pollOnce()} performs a
 * single claim and execute cycle on the calling thread.
 * <p>
 * Start, completion and failure are conditional store transitions. A job cancelled or finished in
 * the store is never run, and a status set while the job runs is kept.
 */
public class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final String workerId;
    private final String queueName;
    private final Duration pollInterval;
    private final JobQueue queue;
    private final JobStore store;
    private final HandlerRegistry handlers;
    private final JobLifecycle lifecycle;
    private final List<JobEventListener> listeners;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicBoolean runStarted = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    private volatile boolean stopRequested;
    private volatile WorkerState state = WorkerState.IDLE;
    private volatile UUID currentJobId;

    public Worker(
            String workerId,
            String queueName,
            Duration pollInterval,
            JobQueue queue,
            JobStore store,
            HandlerRegistry handlers,
            JobLifecycle lifecycle,
            List<JobEventListener> listeners) {
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        this.queueName = Objects.requireNonNull(queueName, "queueName must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.queue = queue;
        this.store = store;
        this.handlers = handlers;
        this.lifecycle = lifecycle;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    @Override
    public void run() {
        if (!runStarted.compareAndSet(false, true)) {
            if (stopRequested) {
                return;
            }
            throw new IllegalStateException("Worker " + workerId + " is already running");
        }
        log.debug("Worker {} started on queue {}", workerId, queueName);
        try {
            while (!stopRequested) {
                boolean claimed;
                try {
                    claimed = pollOnce();
                } catch (RuntimeException e) {
                    log.warn("Worker {} failed to poll queue {}, retrying in {}", workerId, queueName, pollInterval, e);
                    claimed = false;
                }
                if (!claimed && awaitStopSignal()) {
                    break;
                }
            }
        } finally {
            state = WorkerState.STOPPED;
            stopped.countDown();
            log.debug("Worker {} on queue {} stopped after {} processed and {} failed job(s)",
                    workerId, queueName, processedCount.get(), failedCount.get());
        }
    }

    /**
     * Claims at most one job and processes it to its next resting state.
     *
     * @return {@code true} if a job was claimed
     */
    public boolean pollOnce() {
        updateState(WorkerState.CLAIMING);
        Optional<Job> claimed;
        try {
            claimed = queue.dequeue(queueName);
        } finally {
            updateState(WorkerState.IDLE);
        }
        if (claimed.isEmpty()) {
            return false;
        }

        Job snapshot = claimed.get();
        Transition started;
        try {
            started = store.updateStatus(snapshot.getId(), JobStatus.RUNNING, null);
        } catch (JobNotFoundException e) {
            log.warn("Discarding claimed job {} of type {}, it is no longer stored", snapshot.getId(),
                    snapshot.getType());
            return true;
        } catch (RuntimeException startFailure) {
            handBack(snapshot, startFailure);
            throw startFailure;
        }
        if (!started.isSuccess()) {
            handleStartConflict(snapshot, started.conflict().orElseThrow());
            return true;
        }

        Job running = started.orElseThrow();

        currentJobId = running.getId();
        updateState(WorkerState.EXECUTING);
        try {
            emit(JobEvent.of(JobEvent.Type.STARTED, running, null, lifecycle.now()));
            long startedNanos = System.nanoTime();
            JobOutcome outcome = execute(running);
            Duration duration = Duration.ofNanos(System.nanoTime() - startedNanos);
            clearHandlerInterrupt(running);
            if (outcome.isSuccess()) {
                onSuccess(running, outcome, duration);
            } else {
                onFailure(running, outcome.getError(), duration);
            }
        } finally {
            currentJobId = null;
            updateState(WorkerState.IDLE);
        }
        return true;
    }

    /**
     * Requests the worker to stop. Returns immediately; use {@link #awaitStopped(Duration)} to wait
     * for the running job to finish.
     */
    public void stop() {
        stopRequested = true;
        if (state != WorkerState.STOPPED) {
            state = WorkerState.STOPPING;
        }
        stopSignal.countDown();
        if (runStarted.compareAndSet(false, true)) {
            state = WorkerState.STOPPED;
            stopped.countDown();
        }
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public WorkerStatus status() {
        return new WorkerStatus(workerId, queueName, state, currentJobId, processedCount.get(), failedCount.get());
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getQueueName() {
        return queueName;
    }

    public WorkerState getState() {
        return state;
    }

    private JobOutcome execute(Job job) {
        Optional<JobHandler> handler = handlers.resolve(job.getType());
        if (handler.isEmpty()) {
            log.warn("No handler registered for job type {}, failing job {}", job.getType(), job.getId());
            return JobOutcome.failure(JobError.handlerNotFound(job.getType()));
        }
        try {
            JobOutcome outcome = handler.get().handle(job.getArgs());
            return outcome == null ? JobOutcome.success() : outcome;
        } catch (InterruptedException e) {
            log.warn("Job {} of type {} was interrupted", job.getId(), job.getType(), e);
            return JobOutcome.failure(JobError.from(e));
        } catch (Exception e) {
            log.error("Failed to process job {} of type {}", job.getId(), job.getType(), e);
            return JobOutcome.failure(JobError.from(e));
        }
    }

    private void onSuccess(Job running, JobOutcome outcome, Duration duration) {
        Transition transition = store.updateStatus(running.getId(), JobStatus.COMPLETED, outcome);
        if (!transition.isSuccess()) {
            logDiscardedOutcome("result", transition.conflict().orElseThrow());
            return;
        }
        Job completed = transition.orElseThrow();
        processedCount.incrementAndGet();
        log.debug("Successfully completed job {} of type {} in {} ms", completed.getId(), completed.getType(),
                duration.toMillis());
        emit(JobEvent.of(JobEvent.Type.COMPLETED, completed, duration, lifecycle.now()));
    }

    private void onFailure(Job running, JobError error, Duration duration) {
        Transition transition = store.recordFailure(running.getId(), error);
        if (!transition.isSuccess()) {
            logDiscardedOutcome("failure", transition.conflict().orElseThrow());
            return;
        }
        Job failed = transition.orElseThrow();
        failedCount.incrementAndGet();
        if (failed.getStatus() == JobStatus.SCHEDULED) {
            queue.schedule(queueName, failed, failed.getExecuteAt());
            emit(JobEvent.of(JobEvent.Type.FAILED, failed, duration, lifecycle.now()));
        } else {
            emit(JobEvent.of(JobEvent.Type.DEAD_LETTERED, failed, duration, lifecycle.now()));
        }
    }

    private void handleStartConflict(Job snapshot, JobStateConflict conflict) {
        if (conflict.status() == JobStatus.SCHEDULED) {
            Job stored = store.find(snapshot.getId()).orElse(snapshot);
            log.debug("{}, rescheduling for {}", conflict.message(), stored.getExecuteAt());
            queue.schedule(queueName, stored, stored.getExecuteAt());
        } else if (conflict.status() == JobStatus.RUNNING) {
            log.warn("Discarding claimed job: {}", conflict.message());
        } else {
            log.debug("Discarding claimed job: {}", conflict.message());
        }
    }

    private void logDiscardedOutcome(String kind, JobStateConflict conflict) {
        log.warn("Discarding {} of job {}, its status changed to {} while it was running", kind,
                conflict.jobId(), conflict.status());
    }

    private void clearHandlerInterrupt(Job job) {
        if (Thread.interrupted()) {
            log.debug("Cleared interrupt status left by the handler of job {}", job.getId());
        }
    }

    private void handBack(Job snapshot, RuntimeException cause) {
        try {
            queue.enqueue(queueName, snapshot);
            log.warn("Could not record start of job {}, returned it to queue {}", snapshot.getId(), queueName);
        } catch (RuntimeException enqueueFailure) {
            cause.addSuppressed(enqueueFailure);
            log.error("Could not record start of job {} nor return it to queue {}", snapshot.getId(), queueName);
        }
    }

    private void emit(JobEvent event) {
        for (JobEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Job event listener {} failed on {} event for job {}",
                        listener.getClass().getName(), event.type(), event.jobId(), e);
            }
        }
    }

    private boolean awaitStopSignal() {
        try {
            return stopSignal.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            log.info("Worker {} was interrupted while idle, stopping", workerId);
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void updateState(WorkerState next) {
        state = stopRequested ? WorkerState.STOPPING : next;
    }
}
