package org.javai.resilience;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A {@link Clock} driven by {@link System#nanoTime()}.
 *
 * <p>Instants start at the wall-clock time the clock was created and then advance only with
 * elapsed nanoTime, so stepping the system clock backwards or forwards does not move them.
 * Use it for measuring intervals. Instants from two different instances are not comparable.
 */
public final class MonotonicClock extends Clock {

    private final Instant origin;
    private final long originNanos;

    public MonotonicClock() {
        this(Instant.now(), System.nanoTime());
    }

    private MonotonicClock(Instant origin, long originNanos) {
        this.origin = origin;
        this.originNanos = originNanos;
    }

    @Override
    public Instant instant() {
        return origin.plusNanos(System.nanoTime() - originNanos);
    }

    @Override
    public long millis() {
        return instant().toEpochMilli();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
