package org.javai.resilience.degradation;

import org.javai.resilience.Failure;

import java.util.Objects;
import java.util.Optional;

/**
 * What happened to one named primary operation during graceful degradation.
 *
 * @param <T> The type of the operation's result
 */
public sealed interface DegradationOutcome<T>
        permits DegradationOutcome.Success, DegradationOutcome.FallbackSuccess, DegradationOutcome.Failed {

    /**
     * The primary operation succeeded.
     */
    record Success<T>(T result) implements DegradationOutcome<T> {
        @Override
        public String status() {
            return "success";
        }
    }

    /**
     * The primary failed and its fallback succeeded.
     *
     * @param result the fallback's result
     * @param originalFailure why the primary failed
     */
    record FallbackSuccess<T>(T result, Failure originalFailure) implements DegradationOutcome<T> {
        public FallbackSuccess {
            Objects.requireNonNull(originalFailure, "originalFailure must not be null");
        }

        @Override
        public String status() {
            return "fallback_success";
        }
    }

    /**
     * The primary failed and either no fallback was registered or the fallback failed too.
     *
     * @param primaryFailure why the primary failed
     * @param fallbackFailure why the fallback failed, empty when there was no fallback
     */
    record Failed<T>(Failure primaryFailure, Optional<Failure> fallbackFailure) implements DegradationOutcome<T> {
        public Failed {
            Objects.requireNonNull(primaryFailure, "primaryFailure must not be null");
            Objects.requireNonNull(fallbackFailure, "fallbackFailure must not be null, use Optional.empty()");
        }

        @Override
        public String status() {
            return "failed";
        }
    }

    /**
     * Short status label: {@code success}, {@code fallback_success} or {@code failed}.
     */
    String status();

    default boolean isFailed() {
        return this instanceof Failed;
    }
}
