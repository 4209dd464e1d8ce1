package com.workq.core;

public enum BackoffStrategy {
    /**
     * {@code base * 2^(attempt-1)}, capped at the maximum delay.
     */
    EXPONENTIAL,

    /**
     * {@code base * attempt}, capped at the maximum delay.
     */
    LINEAR,

    /**
     * Always the base delay.
     */
    CONSTANT
}
