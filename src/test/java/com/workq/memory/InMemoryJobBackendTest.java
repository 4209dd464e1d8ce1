package com.workq.memory;

import com.workq.Job;
import com.workq.JobOptions;
import com.workq.JobPriority;
import com.workq.core.JobLifecycle;
import com.workq.spi.JobBackend;
import com.workq.spi.JobBackendContract;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobBackendTest extends JobBackendContract {

    @Override
    protected JobBackend createBackend(JobLifecycle lifecycle) {
        return new InMemoryJobBackend(lifecycle);
    }

    @Test
    void reportsItsName() {
        assertEquals("memory", backend.name());
    }

    @Test
    void enqueueingAgainReplacesEarlierEntry() {
        Job job = lifecycle.create("send", null, JobOptions.builder().queue(QUEUE).priority(JobPriority.LOW).build());
        backend.enqueue(QUEUE, job);
        backend.enqueue(QUEUE, job.toBuilder().priority(JobPriority.HIGH).build());

        assertEquals(1, backend.size(QUEUE));
        assertEquals(JobPriority.HIGH, backend.dequeue(QUEUE).orElseThrow().getPriority());
        assertTrue(backend.dequeue(QUEUE).isEmpty());
    }

    @Test
    void schedulingAReadyJobMovesIt() {
        Job job = enqueue("send", JobPriority.NORMAL);

        backend.schedule(QUEUE, job, clock.instant().plusSeconds(30));

        assertEquals(0, backend.size(QUEUE));
        assertEquals(1, backend.scheduledSize(QUEUE));
        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, backend.processDue(clock.instant()));
        assertEquals(job.getId(), backend.dequeue(QUEUE).orElseThrow().getId());
    }
}
