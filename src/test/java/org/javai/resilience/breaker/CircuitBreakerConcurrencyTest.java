package org.javai.resilience.breaker;

import org.javai.resilience.MutableClock;
import org.javai.resilience.ops.OpReporter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CircuitBreakerConcurrencyTest {

    @Test
    void concurrentFailuresAreAllCounted() throws InterruptedException {
        int threads = 16;
        int failuresPerThread = 250;
        CircuitBreaker breaker = new CircuitBreaker("elastic", CircuitBreakerConfig.builder()
                .failureThreshold(Integer.MAX_VALUE)
                .build(), new MutableClock(), OpReporter.noOp());

        runConcurrently(threads, () -> {
            for (int i = 0; i < failuresPerThread; i++) {
                breaker.allow();
                breaker.recordFailure(new IOException("refused"));
            }
        });

        assertThat(breaker.status().failureCount()).isEqualTo(threads * failuresPerThread);
        assertThat(breaker.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void onlyOneConcurrentCallerGetsTheHalfOpenProbe() throws InterruptedException {
        MutableClock clock = new MutableClock();
        CircuitBreaker breaker = new CircuitBreaker("elastic", CircuitBreakerConfig.builder()
                .failureThreshold(1)
                .build(), clock, OpReporter.noOp());
        breaker.recordFailure(new IOException("refused"));
        clock.advance(CircuitBreakerConfig.DEFAULT_RECOVERY_TIMEOUT);

        AtomicInteger allowed = new AtomicInteger();
        runConcurrently(32, () -> {
            if (breaker.allow()) {
                allowed.incrementAndGet();
            }
        });

        assertThat(allowed.get()).isEqualTo(1);
        assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);
    }

    private static void runConcurrently(int threads, Runnable task) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        try {
            for (int t = 0; t < threads; t++) {
                executor.execute(() -> {
                    try {
                        start.await();
                        task.run();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }
}
