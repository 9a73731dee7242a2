package org.javai.resilience.retry;

import org.javai.resilience.Failure;
import org.javai.resilience.FailureType;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Immutable backoff settings and the delay calculation derived from them.
 *
 * <p>After failed attempt {@code i} (0-indexed) the delay is
 * {@code min(baseDelay * backoffMultiplier^i, maxDelay)}. With jitter enabled the
 * delay is then scaled by a factor drawn uniformly from [0.5, 1.0].
 *
 * <p>Every failure is retryable. The only exception is a circuit-open rejection when
 * {@link #failFastOnOpen()} is set, which gives up on the first rejection instead of
 * sleeping through the remaining attempts.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;
    private final boolean jitterEnabled;
    private final boolean failFastOnOpen;

    private RetryPolicy(Builder builder) {
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + builder.maxAttempts);
        }
        if (builder.baseDelay.isNegative() || builder.baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive, was: " + builder.baseDelay);
        }
        if (builder.maxDelay.compareTo(builder.baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (!(builder.backoffMultiplier >= 1.0)) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1, was: " + builder.backoffMultiplier);
        }
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.jitterEnabled = builder.jitterEnabled;
        this.failFastOnOpen = builder.failFastOnOpen;
    }

    /**
     * Three attempts, 1s base delay doubling up to 60s, with jitter.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * A single attempt; the first failure is final.
     */
    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .jitter(jitterEnabled)
                .failFastOnOpen(failFastOnOpen);
    }

    /**
     * Evaluates a failed attempt.
     *
     * @param attemptsMade attempts consumed so far, including the one that just failed
     * @param failure the failure of that attempt
     * @return Retry with the backoff delay, or GiveUp
     */
    public RetryDecision decide(int attemptsMade, Failure failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        if (attemptsMade >= maxAttempts) {
            return RetryDecision.GiveUp.because("max attempts reached");
        }
        if (failFastOnOpen && failure.is(FailureType.CIRCUIT_OPEN)) {
            return RetryDecision.GiveUp.because("circuit open");
        }
        return RetryDecision.Retry.after(delayFor(attemptsMade - 1));
    }

    /**
     * The delay to wait after failed attempt {@code failedAttemptIndex} (0-indexed),
     * jittered if enabled.
     */
    public Duration delayFor(int failedAttemptIndex) {
        Duration delay = backoffFor(failedAttemptIndex);
        if (!jitterEnabled) {
            return delay;
        }
        return jittered(delay, ThreadLocalRandom.current().nextDouble());
    }

    /**
     * The un-jittered exponential delay after failed attempt {@code failedAttemptIndex}.
     */
    public Duration backoffFor(int failedAttemptIndex) {
        if (failedAttemptIndex < 0) {
            throw new IllegalArgumentException("failedAttemptIndex must be >= 0, was: " + failedAttemptIndex);
        }
        double nanos = baseDelay.toNanos() * Math.pow(backoffMultiplier, failedAttemptIndex);
        if (nanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos(Math.round(nanos));
    }

    /**
     * Scales {@code delay} into [0.5, 1.0] of itself using {@code unit} from [0, 1).
     */
    static Duration jittered(Duration delay, double unit) {
        double factor = 0.5 + unit * 0.5;
        return Duration.ofNanos(Math.round(delay.toNanos() * factor));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public double backoffMultiplier() {
        return backoffMultiplier;
    }

    public boolean jitterEnabled() {
        return jitterEnabled;
    }

    public boolean failFastOnOpen() {
        return failFastOnOpen;
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts
                + ", baseDelay=" + baseDelay
                + ", maxDelay=" + maxDelay
                + ", backoffMultiplier=" + backoffMultiplier
                + ", jitter=" + jitterEnabled
                + ", failFastOnOpen=" + failFastOnOpen + "]";
    }

    /**
     * Builder for {@link RetryPolicy}. Unset values take the defaults.
     */
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private boolean jitterEnabled = true;
        private boolean failFastOnOpen;

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitter(boolean enabled) {
            this.jitterEnabled = enabled;
            return this;
        }

        /**
         * Give up on the first circuit-open rejection instead of consuming the
         * remaining attempts. Off by default.
         */
        public Builder failFastOnOpen(boolean failFast) {
            this.failFastOnOpen = failFast;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
