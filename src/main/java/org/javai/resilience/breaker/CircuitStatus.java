package org.javai.resilience.breaker;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a circuit breaker, safe to hand to callers.
 *
 * @param service The protected service name
 * @param state The state at the time of the snapshot
 * @param failureCount Recorded failures since the last success or reset
 * @param lastFailureAt When the last failure was recorded, empty if none ever was
 */
public record CircuitStatus(
        String service,
        CircuitState state,
        int failureCount,
        Optional<Instant> lastFailureAt
) {

    public CircuitStatus {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(lastFailureAt, "lastFailureAt must not be null, use Optional.empty()");
    }
}
