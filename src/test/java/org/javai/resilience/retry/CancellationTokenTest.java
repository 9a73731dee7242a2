package org.javai.resilience.retry;

import org.javai.resilience.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void none_isNeverCancelledAndCannotBeCancelled() {
        assertThat(CancellationToken.none().isCancelled()).isFalse();
        assertThatThrownBy(() -> CancellationToken.none().cancel())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void cancel_isSticky() {
        CancellationToken token = CancellationToken.create();
        assertThat(token.isCancelled()).isFalse();

        token.cancel();
        token.cancel();

        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void withTimeout_cancelsOnceDeadlinePasses() {
        MutableClock clock = new MutableClock();
        CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(5), clock);

        clock.advance(Duration.ofSeconds(4));
        assertThat(token.isCancelled()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void await_returnsImmediatelyWhenAlreadyCancelled() throws InterruptedException {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        long started = System.nanoTime();
        assertThat(token.await(Duration.ofMinutes(1))).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void await_elapsesWithoutCancellation() throws InterruptedException {
        assertThat(CancellationToken.create().await(Duration.ofMillis(10))).isFalse();
    }

    @Test
    void await_isCutShortByDeadline() throws InterruptedException {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(50));

        long started = System.nanoTime();
        boolean cancelled = token.await(Duration.ofMinutes(1));

        assertThat(cancelled).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }
}
