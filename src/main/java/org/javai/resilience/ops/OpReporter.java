package org.javai.resilience.ops;

import org.javai.resilience.Failure;
import org.javai.resilience.breaker.CircuitState;

import java.time.Duration;

/**
 * Reports resilience events for observability and operator notification.
 * Implementations might emit metrics, structured logs, or alerts.
 */
public interface OpReporter {

    /**
     * Reports a failure that is not part of a retry sequence
     * (cancellations, defects escaping worker threads).
     */
    void report(Failure failure);

    /**
     * Reports a failed attempt that will be retried.
     *
     * @param failure The failure of the attempt
     * @param attemptNumber The attempt that failed (1-based)
     * @param delay The backoff before the next attempt
     */
    default void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that retry attempts have been exhausted.
     *
     * @param failure The final failure
     * @param totalAttempts The total number of attempts made
     */
    default void reportRetryExhausted(Failure failure, int totalAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a circuit breaker state change.
     *
     * @param service The protected service
     * @param from The previous state
     * @param to The new state
     */
    default void reportStateTransition(String service, CircuitState from, CircuitState to) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
