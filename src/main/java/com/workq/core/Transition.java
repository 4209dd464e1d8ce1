package com.workq.core;

import com.workq.Job;
import com.workq.JobStateConflictException;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a lifecycle operation: the job after the transition, or the conflict that prevented it.
 */
public final class Transition {

    private final Job job;
    private final JobStateConflict conflict;

    private Transition(Job job, JobStateConflict conflict) {
        this.job = job;
        this.conflict = conflict;
    }

    public static Transition of(Job job) {
        return new Transition(Objects.requireNonNull(job, "job must not be null"), null);
    }

    public static Transition conflict(JobStateConflict conflict) {
        return new Transition(null, Objects.requireNonNull(conflict, "conflict must not be null"));
    }

    public boolean isSuccess() {
        return conflict == null;
    }

    public Optional<Job> job() {
        return Optional.ofNullable(job);
    }

    public Optional<JobStateConflict> conflict() {
        return Optional.ofNullable(conflict);
    }

    /**
     * Returns the transitioned job or throws {@link JobStateConflictException}.
     */
    public Job orElseThrow() {
        if (conflict != null) {
            throw new JobStateConflictException(conflict);
        }
        return job;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Transition{" + job + "}" : "Transition{conflict=" + conflict.message() + "}";
    }
}
