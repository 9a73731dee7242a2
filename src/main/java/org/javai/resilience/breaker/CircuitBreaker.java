package org.javai.resilience.breaker;

import org.javai.resilience.MonotonicClock;
import org.javai.resilience.ops.OpReporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-service circuit breaker state machine.
 *
 * <h2>State Machine</h2>
 * <pre>
 *     CLOSED ──(failures >= threshold)──> OPEN
 *        ^                                  │
 *        │                                  │
 *    (success)                  (allow() after recovery timeout)
 *        │                                  │
 *        └──────── HALF_OPEN <──────────────┘
 *                     │
 *                 (failure)
 *                     │
 *                     └──────> OPEN
 * </pre>
 *
 * <p>The breaker does not run operations itself. Callers ask {@link #allow()} before
 * each attempt and then record the result with {@link #recordSuccess()} or
 * {@link #recordFailure(Throwable)}. The OPEN to HALF_OPEN transition is evaluated
 * lazily inside {@code allow()}.
 *
 * <h2>Thread Safety</h2>
 * Every read and write of state, failure count and last failure time happens under
 * this breaker's own lock, so a check can never interleave with a write. Breakers
 * share nothing, so contention on one service never blocks another.
 */
public final class CircuitBreaker {

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final OpReporter reporter;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private boolean probeInFlight;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, new MonotonicClock(), OpReporter.noOp());
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, OpReporter reporter) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    /**
     * Decides whether the next call may proceed.
     *
     * <ul>
     *   <li>CLOSED: always true.</li>
     *   <li>OPEN: false until the recovery timeout has elapsed since the last recorded
     *       failure; the first call after that moves to HALF_OPEN and is allowed.</li>
     *   <li>HALF_OPEN: false while the probe is outstanding.</li>
     * </ul>
     *
     * @return true if the call may proceed, false if it is rejected
     */
    public boolean allow() {
        return tryAcquire().allowed();
    }

    /**
     * Same decision as {@link #allow()}, also returning the state the decision was made in.
     */
    public Admission tryAcquire() {
        CircuitState previous;
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return new Admission(true, CircuitState.CLOSED);
                case HALF_OPEN:
                    if (probeInFlight) {
                        return new Admission(false, CircuitState.HALF_OPEN);
                    }
                    probeInFlight = true;
                    return new Admission(true, CircuitState.HALF_OPEN);
                case OPEN:
                default:
                    Duration elapsed = Duration.between(lastFailureAt, clock.instant());
                    if (elapsed.compareTo(config.recoveryTimeout()) < 0) {
                        return new Admission(false, CircuitState.OPEN);
                    }
                    previous = state;
                    state = CircuitState.HALF_OPEN;
                    probeInFlight = true;
            }
        } finally {
            lock.unlock();
        }
        reporter.reportStateTransition(name, previous, CircuitState.HALF_OPEN);
        return new Admission(true, CircuitState.HALF_OPEN);
    }

    /**
     * Records a successful call: the failure count resets and the circuit closes.
     */
    public void recordSuccess() {
        CircuitState previous;
        lock.lock();
        try {
            previous = state;
            failureCount = 0;
            probeInFlight = false;
            state = CircuitState.CLOSED;
        } finally {
            lock.unlock();
        }
        if (previous != CircuitState.CLOSED) {
            reporter.reportStateTransition(name, previous, CircuitState.CLOSED);
        }
    }

    /**
     * Records a failed call, unless the configured classifier says the exception does not count.
     *
     * <p>A counted failure increments the failure count and refreshes the last failure time.
     * In CLOSED the circuit opens once the count reaches the threshold; in HALF_OPEN it
     * reopens immediately. An uncounted failure in HALF_OPEN releases the probe slot so
     * the next call can probe again.
     *
     * @param error the exception thrown by the protected operation
     * @return true if the failure was recorded
     */
    public boolean recordFailure(Throwable error) {
        Objects.requireNonNull(error, "error must not be null");
        boolean counted = config.classifier().countsAsFailure(error);
        CircuitState previous;
        CircuitState next;
        lock.lock();
        try {
            previous = state;
            if (!counted) {
                probeInFlight = false;
                return false;
            }
            failureCount++;
            lastFailureAt = clock.instant();
            if (state == CircuitState.HALF_OPEN
                    || (state == CircuitState.CLOSED && failureCount >= config.failureThreshold())) {
                state = CircuitState.OPEN;
            }
            probeInFlight = false;
            next = state;
        } finally {
            lock.unlock();
        }
        if (previous != next) {
            reporter.reportStateTransition(name, previous, next);
        }
        return true;
    }

    /**
     * Records an allowed call that ended without a verdict (it was cancelled).
     * Counts are untouched; an outstanding half-open probe slot is released.
     */
    public void recordAbandoned() {
        lock.lock();
        try {
            probeInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the circuit closed and clears the failure count.
     * The last failure time is kept for diagnostics.
     */
    public void reset() {
        CircuitState previous;
        lock.lock();
        try {
            previous = state;
            state = CircuitState.CLOSED;
            failureCount = 0;
            probeInFlight = false;
        } finally {
            lock.unlock();
        }
        if (previous != CircuitState.CLOSED) {
            reporter.reportStateTransition(name, previous, CircuitState.CLOSED);
        }
    }

    /**
     * Returns a consistent snapshot of this breaker.
     */
    public CircuitStatus status() {
        lock.lock();
        try {
            return new CircuitStatus(name, state, failureCount, Optional.ofNullable(lastFailureAt));
        } finally {
            lock.unlock();
        }
    }

    public CircuitState state() {
        return status().state();
    }

    /**
     * The result of asking the breaker for permission.
     *
     * @param allowed whether the call may proceed
     * @param state the state the breaker was in when it decided
     */
    public record Admission(boolean allowed, CircuitState state) {}
}
