package org.javai.resilience.registry;

import org.javai.resilience.Failure;
import org.javai.resilience.FailureType;
import org.javai.resilience.Outcome;
import org.javai.resilience.boundary.Boundary;
import org.javai.resilience.boundary.ThrowingSupplier;
import org.javai.resilience.breaker.CircuitBreaker;
import org.javai.resilience.breaker.CircuitBreakerConfig;
import org.javai.resilience.breaker.CircuitStatus;
import org.javai.resilience.retry.CancellationToken;
import org.javai.resilience.retry.Retrier;
import org.javai.resilience.retry.RetryPolicy;

import java.util.Objects;

/**
 * Runs operations for one named service through its retry loop and circuit breaker.
 *
 * <p>Every attempt first asks the breaker for permission. A rejected attempt fails with
 * {@link FailureType#CIRCUIT_OPEN} without running the operation and, unless the policy
 * fails fast on open circuits, consumes an attempt and its backoff like any other failure.
 * An allowed attempt records its result on the breaker.
 *
 * <p>Instances are created and owned by {@link ResilienceRegistry}.
 */
public final class ProtectedExecutor {

    private final String service;
    private final CircuitBreaker breaker;
    private final Retrier retrier;
    private final Boundary boundary;

    ProtectedExecutor(String service, CircuitBreaker breaker, Retrier retrier, Boundary boundary) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.breaker = Objects.requireNonNull(breaker, "breaker must not be null");
        this.retrier = Objects.requireNonNull(retrier, "retrier must not be null");
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
    }

    public String service() {
        return service;
    }

    public CircuitBreakerConfig breakerConfig() {
        return breaker.config();
    }

    public RetryPolicy retryPolicy() {
        return retrier.policy();
    }

    public <T> Outcome<T> execute(ThrowingSupplier<? extends T, ? extends Exception> operation) {
        return execute(operation, CancellationToken.none());
    }

    public <T> Outcome<T> execute(
            ThrowingSupplier<? extends T, ? extends Exception> operation,
            CancellationToken cancellation
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        return retrier.execute(service, () -> attempt(operation), cancellation);
    }

    private <T> Outcome<T> attempt(ThrowingSupplier<? extends T, ? extends Exception> operation) {
        CircuitBreaker.Admission admission = breaker.tryAcquire();
        if (!admission.allowed()) {
            return Outcome.fail(Failure.circuitOpen(service, admission.state().wireName()));
        }

        boolean recorded = false;
        try {
            Outcome<T> result = boundary.call(service, operation);
            if (result instanceof Outcome.Fail<T> fail) {
                Failure failure = fail.failure();
                if (failure.is(FailureType.OPERATION)) {
                    breaker.recordFailure(failure.exception());
                } else {
                    breaker.recordAbandoned();
                }
            } else {
                breaker.recordSuccess();
            }
            recorded = true;
            return result;
        } finally {
            // an Error escaping the operation leaves no verdict; free the half-open probe slot
            if (!recorded) {
                breaker.recordAbandoned();
            }
        }
    }

    CircuitStatus status() {
        return breaker.status();
    }

    void reset() {
        breaker.reset();
    }
}
