package com.workq.internal;

import com.workq.config.WorkQProperties;
import com.workq.core.JobLifecycle;
import com.workq.spi.HandlerRegistry;
import com.workq.spi.JobBackend;
import com.workq.worker.JobEventListener;
import com.workq.worker.WorkerPool;
import com.workq.worker.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Starts the {@link WorkerPool} once the application context is refreshed and every handler bean is
 * registered, and drains it when the context closes.
 */
public class BackgroundJobServer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BackgroundJobServer.class);

    private final WorkerPool workerPool;
    private final Duration shutdownTimeout;

    public BackgroundJobServer(JobBackend backend, HandlerRegistry handlers, JobLifecycle lifecycle,
            List<JobEventListener> listeners, WorkQProperties properties) {
        WorkQProperties.BackgroundJobServer server = properties.getBackgroundJobServer();
        Map<String, Duration> queues = new LinkedHashMap<>();
        for (String queue : server.getQueues()) {
            String name = queue == null ? "" : queue.trim();
            if (name.isEmpty()) {
                throw new IllegalStateException("workq.background-job-server.queues must not contain blank names");
            }
            queues.put(name, server.pollIntervalFor(name));
        }
        this.workerPool = new WorkerPool(backend, backend, handlers, lifecycle, listeners, queues,
                server.getWorkerCount(), server.getScheduledInterval());
        this.shutdownTimeout = server.getShutdownTimeout();
    }

    @Override
    public void start() {
        workerPool.start();
    }

    @Override
    public void stop() {
        if (!workerPool.shutdown(shutdownTimeout)) {
            log.warn("Background job server stopped before all running jobs finished");
        }
    }

    @Override
    public boolean isRunning() {
        return workerPool.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    public List<WorkerStatus> workerStatuses() {
        return workerPool.statuses();
    }
}
