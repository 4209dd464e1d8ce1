package com.workq;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Executes the jobs of one type. Register instances with a
 * {@link com.workq.spi.HandlerRegistry}, or expose them as Spring beans annotated with
 * {@link com.workq.annotation.Job}.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Processes one job.
     * Any exception thrown from this method is recorded as a failure outcome for the job and
     * follows the normal retry and dead-letter path.
     *
     * @param args the job arguments as supplied by the producer, may be {@code null}
     * @return the outcome, {@code null} is treated as a success without result
     * @throws Exception if processing fails
     */
    JobOutcome handle(JsonNode args) throws Exception;
}
