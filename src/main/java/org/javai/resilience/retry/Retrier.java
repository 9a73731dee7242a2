package org.javai.resilience.retry;

import org.javai.resilience.Failure;
import org.javai.resilience.FailureType;
import org.javai.resilience.Outcome;
import org.javai.resilience.ops.OpReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Drives attempts according to a {@link RetryPolicy}.
 * Operates entirely over Outcome values; no exceptions escape.
 *
 * <p>Each failed attempt except the last is reported through
 * {@link OpReporter#reportRetryAttempt} and followed by the policy's backoff delay,
 * which suspends only the calling thread. When the policy gives up, the last failure
 * is wrapped as {@link FailureType#RETRY_EXHAUSTED} with the number of attempts consumed.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = new Retrier(RetryPolicy.defaults(), new Log4jOpReporter());
 *
 * Outcome<Response> result = retrier.execute(
 *     "loki",
 *     () -> boundary.call("loki", () -> client.ready())
 * );
 * }</pre>
 */
public final class Retrier {

    private final RetryPolicy policy;
    private final OpReporter reporter;
    private final Sleeper sleeper;

    public Retrier(RetryPolicy policy, OpReporter reporter) {
        this(policy, reporter, Sleeper.blocking());
    }

    public Retrier(RetryPolicy policy, OpReporter reporter, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Executes an attempt with retry according to the configured policy.
     *
     * @param service The protected service name, for reporting
     * @param attempt Produces the Outcome of one attempt
     * @return The first successful Outcome, or the exhausted failure
     */
    public <T> Outcome<T> execute(String service, Supplier<Outcome<T>> attempt) {
        return execute(service, attempt, CancellationToken.none());
    }

    /**
     * Executes an attempt with retry, aborting as soon as {@code cancellation} fires.
     * A cancelled loop returns a {@link FailureType#CANCELLED} failure, whether it was
     * waiting between attempts or about to start one.
     */
    public <T> Outcome<T> execute(String service, Supplier<Outcome<T>> attempt, CancellationToken cancellation) {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        int attemptsMade = 0;
        Failure lastFailure = null;

        while (true) {
            if (cancellation.isCancelled()) {
                return cancelled(service, attemptsMade, lastFailure);
            }

            Outcome<T> result = attempt.get();
            attemptsMade++;

            if (!(result instanceof Outcome.Fail<T> fail)) {
                return result;
            }
            Failure failure = fail.failure();
            if (failure.is(FailureType.CANCELLED)) {
                Failure interrupted = failure.lastFailure() != null ? failure.lastFailure() : lastFailure;
                return cancelled(service, attemptsMade, interrupted);
            }
            lastFailure = failure;

            RetryDecision decision = policy.decide(attemptsMade, failure);
            if (decision instanceof RetryDecision.GiveUp) {
                Failure exhausted = Failure.retryExhausted(failure, attemptsMade);
                reporter.reportRetryExhausted(exhausted, attemptsMade);
                return Outcome.fail(exhausted);
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            reporter.reportRetryAttempt(failure, attemptsMade, delay);
            if (!pause(delay, cancellation)) {
                return cancelled(service, attemptsMade, lastFailure);
            }
        }
    }

    private <T> Outcome<T> cancelled(String service, int attemptsMade, Failure lastFailure) {
        Failure failure = Failure.cancelled(service, attemptsMade, lastFailure);
        reporter.report(failure);
        return Outcome.fail(failure);
    }

    /**
     * @return false if the wait was cut short by cancellation or interruption
     */
    private boolean pause(Duration delay, CancellationToken cancellation) {
        try {
            return !sleeper.sleep(delay, cancellation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Waits between attempts. Replaceable so tests can run without real delays.
     */
    @FunctionalInterface
    public interface Sleeper {

        /**
         * @return true if the cancellation token fired while waiting
         */
        boolean sleep(Duration delay, CancellationToken cancellation) throws InterruptedException;

        /**
         * Blocks the calling thread on the cancellation token for the delay.
         */
        static Sleeper blocking() {
            return (delay, cancellation) -> cancellation.await(delay);
        }
    }
}
