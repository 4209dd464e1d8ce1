package com.workq;

/**
 * A queue or store operation could not complete because the storage backend failed.
 * Workers log it and retry after their poll interval.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
