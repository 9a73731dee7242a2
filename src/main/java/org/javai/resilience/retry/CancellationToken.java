package org.javai.resilience.retry;

import org.javai.resilience.MonotonicClock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Abort signal for a retry loop, optionally with a deadline.
 *
 * <p>Once cancelled (explicitly or by the deadline passing) a token stays cancelled.
 * A retry loop sleeping in {@link #await(Duration)} wakes up as soon as
 * {@link #cancel()} is called.
 */
public final class CancellationToken {

    private static final Clock MONOTONIC = new MonotonicClock();
    private static final CancellationToken NONE = new CancellationToken(null, MONOTONIC);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * A token cancelled only through {@link #cancel()}.
     */
    public static CancellationToken create() {
        return new CancellationToken(null, MONOTONIC);
    }

    /**
     * A token that cancels itself once {@code timeout} has elapsed.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        return withTimeout(timeout, MONOTONIC);
    }

    static CancellationToken withTimeout(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    /**
     * Triggers cancellation.
     *
     * @throws UnsupportedOperationException on {@link #none()}
     */
    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("the shared none() token cannot be cancelled");
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        if (cancelled.getCount() == 0) {
            return true;
        }
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Blocks the calling thread for up to {@code duration}, returning early on cancellation.
     *
     * @return true if the token is cancelled when the wait ends
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean await(Duration duration) throws InterruptedException {
        if (isCancelled()) {
            return true;
        }
        Duration wait = duration;
        if (deadline != null) {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.compareTo(wait) < 0) {
                wait = remaining;
            }
        }
        if (!wait.isNegative() && !wait.isZero()) {
            cancelled.await(wait.toNanos(), TimeUnit.NANOSECONDS);
        }
        return isCancelled();
    }
}
