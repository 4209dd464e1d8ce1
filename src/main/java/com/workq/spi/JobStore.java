package com.workq.spi;

import com.workq.Job;
import com.workq.JobError;
import com.workq.JobFilter;
import com.workq.JobOutcome;
import com.workq.JobStatus;
import com.workq.core.Transition;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable record of jobs, independent of the delivery queue: a job stays queryable after it has
 * left the queue, and dead-lettered jobs are kept with their final error.
 */
public interface JobStore {

    /**
     * Inserts or replaces the record of the job.
     */
    Job save(Job job);

    Optional<Job> find(UUID id);

    /**
     * Moves the stored job to {@code status}, applying the lifecycle rules of that status.
     * {@code outcome} supplies the result for {@code COMPLETED} and the error for {@code FAILED} and
     * {@code DEAD}; it is ignored otherwise and may be {@code null}.
     *
     * @throws com.workq.JobNotFoundException if no job has this id
     */
    Transition updateStatus(UUID id, JobStatus status, JobOutcome outcome);

    /**
     * Records a failed attempt of a {@code RUNNING} job: a backed-off retry as {@code SCHEDULED} while
     * the retry budget lasts, otherwise {@code DEAD}. Any other stored status is a conflict.
     *
     * @throws com.workq.JobNotFoundException if no job has this id
     */
    Transition recordFailure(UUID id, JobError error);

    List<Job> findBy(JobFilter filter);

    /**
     * Jobs in {@code DEAD} or {@code FAILED} status, most recently finished first.
     */
    List<Job> deadLetterJobs();

    /**
     * Resets a dead-letter job to {@code PENDING} with no attempts used. The caller is responsible
     * for placing the returned job on a queue.
     *
     * @throws com.workq.JobNotFoundException if no job has this id
     */
    Transition requeue(UUID id);

    /**
     * Most recently created jobs of a type, newest first.
     */
    List<Job> history(String type, int limit);

    /**
     * Number of stored jobs per status for one queue, or for all queues when {@code queue} is null.
     * Statuses without jobs are absent from the map.
     */
    Map<JobStatus, Long> countByStatus(String queue);

    /**
     * Deletes jobs in one of {@code statuses} that finished before {@code finishedBefore}.
     *
     * @return number of deleted jobs
     */
    int purge(Set<JobStatus> statuses, Instant finishedBefore);
}
