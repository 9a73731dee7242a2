package org.javai.resilience.breaker;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable circuit breaker settings.
 *
 * @param failureThreshold Recorded failures that open the circuit
 * @param recoveryTimeout Time an open circuit waits before allowing a probe
 * @param classifier Which exceptions count as failures
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration recoveryTimeout,
        FailureClassifier classifier
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
        }
        Objects.requireNonNull(recoveryTimeout, "recoveryTimeout must not be null");
        if (recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
            throw new IllegalArgumentException("recoveryTimeout must be positive, was: " + recoveryTimeout);
        }
        Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Threshold 5, recovery timeout 60s, every exception counts.
     */
    public static CircuitBreakerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .failureThreshold(failureThreshold)
                .recoveryTimeout(recoveryTimeout)
                .classifier(classifier);
    }

    public static final class Builder {
        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private Duration recoveryTimeout = DEFAULT_RECOVERY_TIMEOUT;
        private FailureClassifier classifier = FailureClassifier.all();

        private Builder() {}

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder recoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout must not be null");
            return this;
        }

        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, classifier);
        }
    }
}
