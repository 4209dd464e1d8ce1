package com.workq;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a {@link Job}.
 */
public enum JobStatus {
    PENDING,
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    DEAD,
    CANCELLED;

    private static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, DEAD, CANCELLED);
    private static final Set<JobStatus> DEAD_LETTER = EnumSet.of(FAILED, DEAD);

    /**
     * Whether no further transition happens without operator action.
     */
    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Whether a job in this status belongs to the dead-letter set and may be requeued.
     */
    public boolean isDeadLetter() {
        return DEAD_LETTER.contains(this);
    }

    public static Set<JobStatus> deadLetterStatuses() {
        return EnumSet.copyOf(DEAD_LETTER);
    }
}
