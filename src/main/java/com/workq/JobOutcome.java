package com.workq;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Tagged result of a handler invocation: either a success carrying an optional result or a
 * failure carrying a {@link JobError}.
 */
public final class JobOutcome {

    private static final JobOutcome EMPTY_SUCCESS = new JobOutcome(true, null, null);

    private final boolean success;
    private final JsonNode result;
    private final JobError error;

    private JobOutcome(boolean success, JsonNode result, JobError error) {
        this.success = success;
        this.result = result;
        this.error = error;
    }

    public static JobOutcome success() {
        return EMPTY_SUCCESS;
    }

    public static JobOutcome success(JsonNode result) {
        return result == null ? EMPTY_SUCCESS : new JobOutcome(true, result, null);
    }

    public static JobOutcome failure(String message) {
        return failure(JobError.of(message));
    }

    public static JobOutcome failure(JobError error) {
        return new JobOutcome(false, null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return success;
    }

    public JsonNode getResult() {
        return result;
    }

    public JobError getError() {
        return error;
    }

    @Override
    public String toString() {
        return success ? "JobOutcome{success, result=" + result + "}" : "JobOutcome{failure, error=" + error + "}";
    }
}
