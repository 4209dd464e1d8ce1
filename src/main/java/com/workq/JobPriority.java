package com.workq;

import java.util.Locale;

/**
 * Delivery priority of a job within its queue. Declaration order is dequeue order.
 */
public enum JobPriority {
    CRITICAL,
    HIGH,
    NORMAL,
    LOW;

    /**
     * Sort key used by storage backends, lower ranks are delivered first.
     */
    public int rank() {
        return ordinal();
    }

    public static JobPriority fromRank(int rank) {
        JobPriority[] values = values();
        if (rank < 0 || rank >= values.length) {
            throw new IllegalArgumentException("Unknown priority rank: " + rank);
        }
        return values[rank];
    }

    public static JobPriority parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
