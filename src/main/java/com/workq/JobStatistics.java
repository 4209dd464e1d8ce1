package com.workq;

import java.util.Map;

/**
 * Aggregated statistics over all queues.
 */
public record JobStatistics(
        long totalProcessed,
        long totalSucceeded,
        long totalFailed,
        Map<String, QueueStats> queues) {

    public JobStatistics {
        queues = queues == null ? Map.of() : Map.copyOf(queues);
    }
}
