package com.workq.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes the delay before a failed job is retried.
 * <p>
 * Without jitter the delay is a pure function of the attempt number. With jitter the computed
 * delay is multiplied by a uniform factor in {@code [0.5, 1.5)} so that jobs failing together do
 * not retry together.
 */
public final class BackoffPolicy {

    private static final DoubleSupplier DEFAULT_RANDOM = () -> ThreadLocalRandom.current().nextDouble();

    private final BackoffStrategy strategy;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final boolean jitter;
    private final DoubleSupplier random;

    private BackoffPolicy(Builder builder) {
        this.strategy = Objects.requireNonNull(builder.strategy, "strategy must not be null");
        this.baseDelay = Objects.requireNonNull(builder.baseDelay, "baseDelay must not be null");
        this.maxDelay = Objects.requireNonNull(builder.maxDelay, "maxDelay must not be null");
        this.jitter = builder.jitter;
        this.random = builder.random == null ? DEFAULT_RANDOM : builder.random;
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BackoffPolicy exponential(Duration baseDelay, Duration maxDelay) {
        return builder().strategy(BackoffStrategy.EXPONENTIAL).baseDelay(baseDelay).maxDelay(maxDelay).build();
    }

    public static BackoffPolicy linear(Duration baseDelay, Duration maxDelay) {
        return builder().strategy(BackoffStrategy.LINEAR).baseDelay(baseDelay).maxDelay(maxDelay).build();
    }

    public static BackoffPolicy constant(Duration delay) {
        return builder().strategy(BackoffStrategy.CONSTANT).baseDelay(delay).maxDelay(delay).build();
    }

    /**
     * Delay before the retry that follows the given (1-based) failed attempt.
     */
    public Duration delayFor(int attempt) {
        Duration delay = unjitteredDelay(Math.max(1, attempt));
        if (!jitter) {
            return delay;
        }
        double factor = 0.5 + random.getAsDouble();
        return Duration.ofNanos((long) (delay.toNanos() * factor));
    }

    private Duration unjitteredDelay(int attempt) {
        return switch (strategy) {
            case CONSTANT -> baseDelay;
            case LINEAR -> cap(multiply(baseDelay, attempt));
            case EXPONENTIAL -> {
                // 2^62 already exceeds any Duration we could cap to
                int exponent = Math.min(attempt - 1, 62);
                yield cap(multiply(baseDelay, 1L << exponent));
            }
        };
    }

    private Duration multiply(Duration duration, long factor) {
        try {
            return duration.multipliedBy(factor);
        } catch (ArithmeticException overflow) {
            return maxDelay;
        }
    }

    private Duration cap(Duration delay) {
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public BackoffStrategy getStrategy() {
        return strategy;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public boolean isJitter() {
        return jitter;
    }

    @Override
    public String toString() {
        return "BackoffPolicy{" + strategy + ", base=" + baseDelay + ", max=" + maxDelay + ", jitter=" + jitter + '}';
    }

    public static final class Builder {
        private BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private boolean jitter;
        private DoubleSupplier random;

        private Builder() {
        }

        public Builder strategy(BackoffStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * Source of uniform values in {@code [0, 1)} used for jitter.
         */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public BackoffPolicy build() {
            return new BackoffPolicy(this);
        }
    }
}
