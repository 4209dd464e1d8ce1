package com.workq.spi;

import com.workq.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Delivery structure for jobs: per queue, one FIFO sub-queue per {@link com.workq.JobPriority}
 * holding ready jobs, plus a time-ordered set of scheduled jobs that are not yet visible to
 * {@link #dequeue(String)}.
 * <p>
 * Implementations must make {@link #dequeue(String)} and {@link #processDue(Instant)} atomic:
 * concurrent callers, in this or any other process, never receive the same job and never promote
 * a scheduled job twice.
 */
public interface JobQueue {

    /**
     * Places a due job at the tail of its priority tier in the named queue.
     */
    void enqueue(String queue, Job job);

    /**
     * Holds a job until {@code executeAt}; it becomes visible once {@link #processDue(Instant)}
     * promotes it.
     */
    void schedule(String queue, Job job, Instant executeAt);

    /**
     * Removes and returns the oldest job of the highest non-empty priority tier.
     */
    Optional<Job> dequeue(String queue);

    /**
     * Same selection as {@link #dequeue(String)} without removing the job.
     */
    Optional<Job> peek(String queue);

    /**
     * Moves every scheduled job with {@code executeAt <= now} into its ready tier, in
     * {@code executeAt} order.
     *
     * @return number of jobs promoted by this call
     */
    int processDue(Instant now);

    /**
     * Removes a job from the ready or scheduled structure of the named queue.
     *
     * @return {@code true} if the job was present
     */
    boolean delete(String queue, UUID jobId);

    /**
     * Number of ready jobs in the named queue.
     */
    long size(String queue);

    /**
     * Number of jobs of the named queue waiting for their execution time.
     */
    long scheduledSize(String queue);

    /**
     * Names of the queues that hold ready or scheduled entries or that a stored job belongs to,
     * sorted by name. A queue drops out once it is drained and its jobs are purged.
     */
    List<String> listQueues();
}
