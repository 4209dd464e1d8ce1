package com.workq.internal;

import com.workq.worker.JobEvent;
import com.workq.worker.JobEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingJobEventListener implements JobEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingJobEventListener.class);

    @Override
    public void onEvent(JobEvent event) {
        switch (event.type()) {
            case STARTED -> log.debug("Started job {} of type {} on queue {} (attempt {})",
                    event.jobId(), event.jobType(), event.queue(), event.attempt());
            case COMPLETED -> log.debug("Completed job {} of type {} in {} ms",
                    event.jobId(), event.jobType(), millis(event));
            case FAILED -> log.warn("Job {} of type {} failed on attempt {}, retry scheduled: {}",
                    event.jobId(), event.jobType(), event.attempt(), errorMessage(event));
            case DEAD_LETTERED -> log.error("Job {} of type {} moved to dead letter after {} attempt(s): {}",
                    event.jobId(), event.jobType(), event.attempt(), errorMessage(event));
        }
    }

    private static long millis(JobEvent event) {
        return event.duration() == null ? 0 : event.duration().toMillis();
    }

    private static String errorMessage(JobEvent event) {
        return event.error() == null ? "unknown error" : event.error().type() + ": " + event.error().message();
    }
}
