package com.workq.worker;

import com.workq.core.JobLifecycle;
import com.workq.spi.HandlerRegistry;
import com.workq.spi.JobQueue;
import com.workq.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code workerCount} {@link Worker}s per queue, each on its own thread, plus one
 * {@link ScheduledJobPromoter}.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobQueue queue;
    private final JobStore store;
    private final HandlerRegistry handlers;
    private final JobLifecycle lifecycle;
    private final List<JobEventListener> listeners;
    private final Map<String, Duration> queuePollIntervals;
    private final int workerCount;
    private final Duration scheduledInterval;

    private final List<Worker> workers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();
    private ScheduledExecutorService promoterExecutor;
    private volatile boolean running;

    /**
     * @param queuePollIntervals queues to serve, in start order, with the poll interval of their workers
     */
    public WorkerPool(
            JobQueue queue,
            JobStore store,
            HandlerRegistry handlers,
            JobLifecycle lifecycle,
            List<JobEventListener> listeners,
            Map<String, Duration> queuePollIntervals,
            int workerCount,
            Duration scheduledInterval) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        if (queuePollIntervals == null || queuePollIntervals.isEmpty()) {
            throw new IllegalArgumentException("At least one queue must be configured");
        }
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.queuePollIntervals = new LinkedHashMap<>(queuePollIntervals);
        this.workerCount = workerCount;
        this.scheduledInterval = Objects.requireNonNull(scheduledInterval, "scheduledInterval must not be null");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        workers.clear();
        threads.clear();
        for (Map.Entry<String, Duration> entry : queuePollIntervals.entrySet()) {
            String queueName = entry.getKey();
            for (int i = 1; i <= workerCount; i++) {
                String workerId = "workq-worker-" + queueName + "-" + i;
                Worker worker = new Worker(workerId, queueName, entry.getValue(), queue, store, handlers, lifecycle,
                        listeners);
                Thread thread = new Thread(worker, workerId);
                workers.add(worker);
                threads.add(thread);
            }
        }
        threads.forEach(Thread::start);

        promoterExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "workq-promoter");
            thread.setDaemon(true);
            return thread;
        });
        promoterExecutor.scheduleWithFixedDelay(new ScheduledJobPromoter(queue, lifecycle.getClock()),
                0, scheduledInterval.toMillis(), TimeUnit.MILLISECONDS);
        running = true;

        log.info("Worker pool started with {} worker(s) on queues {}, promoting scheduled jobs every {}",
                workers.size(), queuePollIntervals.keySet(), scheduledInterval);
    }

    /**
     * Signals every worker to stop and waits up to {@code timeout} for running jobs to finish.
     * Jobs are never interrupted.
     *
     * @return {@code true} if every worker stopped within the timeout
     */
    public synchronized boolean shutdown(Duration timeout) {
        if (!running) {
            return true;
        }
        running = false;
        log.info("Shutting down worker pool, waiting up to {} for running jobs", timeout);
        workers.forEach(Worker::stop);

        long deadline = System.nanoTime() + timeout.toNanos();
        boolean drained = true;
        try {
            for (Worker worker : workers) {
                long remaining = Math.max(0, deadline - System.nanoTime());
                if (!worker.awaitStopped(Duration.ofNanos(remaining))) {
                    drained = false;
                    log.warn("Worker {} did not stop within {}, job {} is still running",
                            worker.getWorkerId(), timeout, worker.status().currentJobId());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        promoterExecutor.shutdownNow();
        log.info("Worker pool stopped");
        return drained;
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized List<WorkerStatus> statuses() {
        List<WorkerStatus> statuses = new ArrayList<>(workers.size());
        for (Worker worker : workers) {
            statuses.add(worker.status());
        }
        return statuses;
    }
}
