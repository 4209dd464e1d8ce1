package com.workq;

import com.workq.core.JobStateConflict;

/**
 * Thrown when an operation is requested on a job whose status does not allow it.
 */
public class JobStateConflictException extends RuntimeException {

    private final transient JobStateConflict conflict;

    public JobStateConflictException(JobStateConflict conflict) {
        super(conflict.message());
        this.conflict = conflict;
    }

    public JobStateConflict getConflict() {
        return conflict;
    }
}
