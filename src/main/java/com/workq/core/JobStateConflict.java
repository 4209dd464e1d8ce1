package com.workq.core;

import com.workq.JobStatus;

import java.util.UUID;

/**
 * An operation was attempted on a job whose status does not allow it.
 *
 * @param jobId     the job concerned
 * @param status    the status the job was in
 * @param operation the rejected operation, e.g. {@code complete}
 * @param message   description for logs and callers
 */
public record JobStateConflict(UUID jobId, JobStatus status, String operation, String message) {

    public static JobStateConflict of(UUID jobId, JobStatus status, String operation) {
        return new JobStateConflict(jobId, status, operation,
                "Cannot " + operation + " job " + jobId + " in status " + status);
    }

    public static JobStateConflict of(UUID jobId, JobStatus status, String operation, String reason) {
        return new JobStateConflict(jobId, status, operation,
                "Cannot " + operation + " job " + jobId + " in status " + status + ": " + reason);
    }
}
