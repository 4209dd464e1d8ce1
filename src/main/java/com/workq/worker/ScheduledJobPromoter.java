package com.workq.worker;

import com.workq.spi.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Periodic task moving due scheduled jobs into their ready queues.
 */
public class ScheduledJobPromoter implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobPromoter.class);

    private final JobQueue queue;
    private final Clock clock;

    public ScheduledJobPromoter(JobQueue queue, Clock clock) {
        this.queue = queue;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            promoteDue();
        } catch (RuntimeException e) {
            log.warn("Failed to promote due scheduled jobs", e);
        }
    }

    public int promoteDue() {
        int promoted = queue.processDue(clock.instant());
        if (promoted > 0) {
            log.debug("Promoted {} scheduled job(s) to their ready queues", promoted);
        }
        return promoted;
    }
}
