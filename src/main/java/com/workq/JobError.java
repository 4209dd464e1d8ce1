package com.workq;

/**
 * Failure payload recorded on a job when its handler fails.
 *
 * @param message human readable description, may be {@code null} for exceptions without a message
 * @param type    exception class name or a symbolic error code
 */
public record JobError(String message, String type) {

    public static final String HANDLER_NOT_FOUND = "HandlerNotFound";
    public static final String HANDLER_FAILURE = "HandlerFailure";

    public static JobError of(String message) {
        return new JobError(message, HANDLER_FAILURE);
    }

    public static JobError from(Throwable throwable) {
        return new JobError(throwable.getMessage(), throwable.getClass().getName());
    }

    public static JobError handlerNotFound(String jobType) {
        return new JobError("No handler registered for job type '" + jobType + "'", HANDLER_NOT_FOUND);
    }
}
