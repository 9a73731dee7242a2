package org.javai.resilience;

import java.time.Instant;
import java.util.Objects;

/**
 * A failed protected call, ready for reporting and policy evaluation.
 *
 * @param id The failure identifier (namespace:name)
 * @param type Why the call produced no value
 * @param message Human-readable description
 * @param service The protected service name the call was made against
 * @param exception The wrapped operation's exception, unchanged (may be null)
 * @param lastFailure For {@link FailureType#RETRY_EXHAUSTED} and {@link FailureType#CANCELLED},
 *                    the failure of the final attempt (may be null)
 * @param attempts Attempts consumed when this failure was produced
 * @param occurredAt When the failure happened
 */
public record Failure(
        FailureId id,
        FailureType type,
        String message,
        String service,
        Throwable exception,
        Failure lastFailure,
        int attempts,
        Instant occurredAt
) {

    public Failure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
    }

    // === Factory methods, one per failure type ===

    /**
     * The wrapped operation threw. The exception is kept as-is.
     */
    public static Failure operation(String service, Throwable exception) {
        Objects.requireNonNull(exception, "exception must not be null");
        return new Failure(
                FailureId.of("operation", exception.getClass().getSimpleName()),
                FailureType.OPERATION,
                describe(exception),
                service,
                exception,
                null,
                1,
                Instant.now());
    }

    /**
     * The breaker for {@code service} refused the call while in {@code stateName}.
     */
    public static Failure circuitOpen(String service, String stateName) {
        return new Failure(
                FailureId.of("breaker", "circuit_open"),
                FailureType.CIRCUIT_OPEN,
                "Circuit breaker is " + stateName + " for service [" + service + "]",
                service,
                null,
                null,
                1,
                Instant.now());
    }

    /**
     * All attempts failed; {@code last} is the failure of the final one.
     */
    public static Failure retryExhausted(Failure last, int attempts) {
        Objects.requireNonNull(last, "last must not be null");
        return new Failure(
                FailureId.of("retry", "exhausted"),
                FailureType.RETRY_EXHAUSTED,
                "Retry exhausted after " + attempts + " attempt(s): " + last.message(),
                last.service(),
                last.exception(),
                last,
                attempts,
                Instant.now());
    }

    /**
     * The retry loop was aborted by its cancellation signal.
     *
     * @param last the failure of the most recent attempt, or null if none ran
     */
    public static Failure cancelled(String service, int attempts, Failure last) {
        return new Failure(
                FailureId.of("retry", "cancelled"),
                FailureType.CANCELLED,
                "Cancelled after " + attempts + " attempt(s) for service [" + service + "]",
                service,
                last != null ? last.exception() : null,
                last,
                attempts,
                Instant.now());
    }

    /**
     * An exception escaped a worker thread.
     */
    public static Failure defect(String operation, Throwable exception) {
        Objects.requireNonNull(exception, "exception must not be null");
        return new Failure(
                FailureId.of("defect", exception.getClass().getSimpleName()),
                FailureType.DEFECT,
                describe(exception),
                operation,
                exception,
                null,
                0,
                Instant.now());
    }

    public boolean is(FailureType candidate) {
        return type == candidate;
    }

    /**
     * Unwraps exhausted/cancelled failures down to the attempt that actually failed.
     */
    public Failure rootFailure() {
        Failure current = this;
        while (current.lastFailure() != null) {
            current = current.lastFailure();
        }
        return current;
    }

    /**
     * Diagnostic summary of the exception, or null when there is none.
     */
    public Cause cause() {
        return exception != null ? Cause.fromThrowable(exception) : null;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
}
