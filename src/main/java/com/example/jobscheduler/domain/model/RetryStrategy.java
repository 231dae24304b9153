package com.example.jobscheduler.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Backoff policy applied when a job execution fails.
 * <p>
 * Strategies are immutable and are not persisted with the job, only the resulting
 * {@link RetryState} is. Three algorithms are supported:
 * - {@link Constant}: the same delay for every attempt
 * - {@link Linear}: {@code initial + increment * attempt}, clamped to the max interval
 * - {@link Exponential}: {@code initial * multiplier ^ attempt}, clamped to the max interval
 * <p>
 * Arithmetic is carried out in milliseconds. Any overflow saturates to the max interval.
 */
public abstract class RetryStrategy {

    /**
     * Delay before the retry that follows the given zero-based attempt index.
     *
     * @param attempt number of retries already consumed, must not be negative
     */
    public abstract Duration interval(int attempt);

    /**
     * Number of retries after which no further retry is scheduled.
     */
    public abstract int getMaxAttempts();

    /**
     * The smallest delay this strategy can ever produce.
     */
    public abstract Duration minInterval();

    public static RetryStrategy constant(Duration interval, int maxAttempts) {
        return new Constant(interval, maxAttempts);
    }

    public static RetryStrategy linear(Duration initialInterval, Duration increment, Duration maxInterval, int maxAttempts) {
        return new Linear(initialInterval, increment, maxInterval, maxAttempts);
    }

    public static RetryStrategy exponential(Duration initialInterval, int multiplier, Duration maxInterval, int maxAttempts) {
        return new Exponential(initialInterval, multiplier, maxInterval, maxAttempts);
    }

    private static void requireValidAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must not be negative, got " + attempt);
        }
    }

    private static void requireNonNegative(Duration duration, String name) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be a non-negative duration");
        }
    }

    private static void requireValidMaxAttempts(int maxAttempts) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("Max attempts must not be negative, got " + maxAttempts);
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Constant extends RetryStrategy {

        private final Duration interval;
        private final int maxAttempts;

        private Constant(Duration interval, int maxAttempts) {
            requireNonNegative(interval, "Interval");
            requireValidMaxAttempts(maxAttempts);
            this.interval = interval;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public Duration interval(int attempt) {
            requireValidAttempt(attempt);
            return interval;
        }

        @Override
        public Duration minInterval() {
            return interval;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Linear extends RetryStrategy {

        private final Duration initialInterval;
        private final Duration increment;
        private final Duration maxInterval;
        private final int maxAttempts;

        private Linear(Duration initialInterval, Duration increment, Duration maxInterval, int maxAttempts) {
            requireNonNegative(initialInterval, "Initial interval");
            requireNonNegative(increment, "Increment");
            requireNonNegative(maxInterval, "Max interval");
            requireValidMaxAttempts(maxAttempts);
            this.initialInterval = initialInterval;
            this.increment = increment;
            this.maxInterval = maxInterval;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public Duration interval(int attempt) {
            requireValidAttempt(attempt);
            var maxMillis = maxInterval.toMillis();
            try {
                var millis = Math.addExact(initialInterval.toMillis(), Math.multiplyExact(increment.toMillis(), (long) attempt));
                return Duration.ofMillis(Math.min(millis, maxMillis));
            } catch (ArithmeticException e) {
                return Duration.ofMillis(maxMillis);
            }
        }

        @Override
        public Duration minInterval() {
            return initialInterval;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Exponential extends RetryStrategy {

        private final Duration initialInterval;
        private final int multiplier;
        private final Duration maxInterval;
        private final int maxAttempts;

        private Exponential(Duration initialInterval, int multiplier, Duration maxInterval, int maxAttempts) {
            requireNonNegative(initialInterval, "Initial interval");
            requireNonNegative(maxInterval, "Max interval");
            requireValidMaxAttempts(maxAttempts);
            if (multiplier < 0) {
                throw new IllegalArgumentException("Multiplier must not be negative, got " + multiplier);
            }
            this.initialInterval = initialInterval;
            this.multiplier = multiplier;
            this.maxInterval = maxInterval;
            this.maxAttempts = maxAttempts;
        }

        @Override
        public Duration interval(int attempt) {
            requireValidAttempt(attempt);
            var maxMillis = maxInterval.toMillis();
            var millis = initialInterval.toMillis();

            if (attempt > 0 && multiplier == 0) {
                millis = 0;
            } else if (millis > 0 && multiplier > 1) {
                // With a multiplier of at least 2 the loop either reaches the max or overflows within 63 steps.
                try {
                    for (var i = 0; i < attempt && millis < maxMillis; i++) {
                        millis = Math.multiplyExact(millis, (long) multiplier);
                    }
                } catch (ArithmeticException e) {
                    return Duration.ofMillis(maxMillis);
                }
            }

            return Duration.ofMillis(Math.min(millis, maxMillis));
        }

        @Override
        public Duration minInterval() {
            return initialInterval;
        }
    }
}
