package com.workq;

/**
 * Point-in-time statistics of one queue.
 *
 * @param queue     queue name
 * @param size      ready jobs waiting for a worker
 * @param scheduled jobs waiting for their execution time
 * @param processed jobs of this queue that completed successfully
 * @param failed    jobs of this queue in the dead-letter set
 */
public record QueueStats(String queue, long size, long scheduled, long processed, long failed) {
}
