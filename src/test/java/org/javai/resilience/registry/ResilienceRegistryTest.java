package org.javai.resilience.registry;

import org.javai.resilience.Failure;
import org.javai.resilience.FailureType;
import org.javai.resilience.MutableClock;
import org.javai.resilience.Outcome;
import org.javai.resilience.breaker.CircuitBreakerConfig;
import org.javai.resilience.breaker.CircuitState;
import org.javai.resilience.breaker.CircuitStatus;
import org.javai.resilience.config.ResilienceSettings;
import org.javai.resilience.ops.OpReporter;
import org.javai.resilience.retry.CancellationToken;
import org.javai.resilience.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ResilienceRegistryTest {

    private MutableClock clock;
    private List<Duration> sleeps;
    private List<String> transitions;
    private ResilienceRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        sleeps = Collections.synchronizedList(new ArrayList<>());
        transitions = Collections.synchronizedList(new ArrayList<>());

        OpReporter reporter = new OpReporter() {
            @Override
            public void report(Failure failure) {
            }

            @Override
            public void reportStateTransition(String service, CircuitState from, CircuitState to) {
                transitions.add(service + ":" + from + "->" + to);
            }
        };

        registry = ResilienceRegistry.builder()
                .clock(clock)
                .reporter(reporter)
                .sleeper((delay, cancellation) -> {
                    sleeps.add(delay);
                    return cancellation.isCancelled();
                })
                .build();
    }

    @Test
    void getOrCreate_returnsSameExecutorForSameName() {
        ProtectedExecutor first = registry.getOrCreate("loki");
        ProtectedExecutor second = registry.getOrCreate("loki");

        assertThat(second).isSameAs(first);
        assertThat(registry.getOrCreate("tempo")).isNotSameAs(first);
        assertThat(registry.services()).containsExactly("loki", "tempo");
    }

    @Test
    void getOrCreate_ignoresConfigForExistingName() {
        ProtectedExecutor first = registry.getOrCreate("loki",
                CircuitBreakerConfig.builder().failureThreshold(2).build(), RetryPolicy.noRetry());

        ProtectedExecutor second = registry.getOrCreate("loki",
                CircuitBreakerConfig.builder().failureThreshold(9).build(), RetryPolicy.defaults());

        assertThat(second).isSameAs(first);
        assertThat(second.breakerConfig().failureThreshold()).isEqualTo(2);
        assertThat(second.retryPolicy().maxAttempts()).isEqualTo(1);
    }

    @Test
    void getOrCreate_withoutConfigUsesDefaults() {
        ProtectedExecutor executor = registry.getOrCreate("loki");

        assertThat(executor.breakerConfig().failureThreshold()).isEqualTo(5);
        assertThat(executor.breakerConfig().recoveryTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(executor.retryPolicy().maxAttempts()).isEqualTo(3);
    }

    @Test
    void getOrCreate_concurrentFirstUseCreatesOneExecutor() throws InterruptedException {
        Set<ProtectedExecutor> seen = ConcurrentHashMap.newKeySet();

        runConcurrently(32, () -> seen.add(registry.getOrCreate("prometheus")));

        assertThat(seen).hasSize(1);
        assertThat(registry.services()).containsExactly("prometheus");
    }

    @Test
    void status_unknownServiceIsEmptyAndNotCreated() {
        assertThat(registry.status("never-seen")).isEmpty();
        assertThat(registry.services()).isEmpty();
    }

    @Test
    void reset_unknownServiceReportsNotFoundWithoutCreating() {
        assertThat(registry.reset("never-seen")).isEqualTo(ResetResult.NOT_FOUND);
        assertThat(registry.services()).isEmpty();
    }

    @Test
    void execute_opensAfterThresholdRejectsThenRecoversViaProbe() {
        registry.getOrCreate("grafana",
                CircuitBreakerConfig.builder().failureThreshold(5).recoveryTimeout(Duration.ofSeconds(60)).build(),
                RetryPolicy.noRetry());

        for (int i = 0; i < 5; i++) {
            Outcome<String> result = registry.execute("grafana", () -> {
                throw new IOException("connection refused");
            });
            assertThat(result.isFail()).isTrue();
        }
        CircuitStatus opened = registry.status("grafana").orElseThrow();
        assertThat(opened.state()).isEqualTo(CircuitState.OPEN);
        assertThat(opened.failureCount()).isEqualTo(5);

        AtomicInteger invocations = new AtomicInteger();
        Outcome<String> rejected = registry.execute("grafana", () -> {
            invocations.incrementAndGet();
            return "healthy";
        });
        assertThat(invocations.get()).isZero();
        Failure rejection = ((Outcome.Fail<String>) rejected).failure();
        assertThat(rejection.rootFailure().type()).isEqualTo(FailureType.CIRCUIT_OPEN);
        assertThat(rejection.rootFailure().message()).isEqualTo("Circuit breaker is open for service [grafana]");

        clock.advance(Duration.ofSeconds(60));
        Outcome<String> probe = registry.execute("grafana", () -> {
            invocations.incrementAndGet();
            return "healthy";
        });

        assertThat(probe.getOrThrow()).isEqualTo("healthy");
        assertThat(invocations.get()).isEqualTo(1);
        CircuitStatus status = registry.status("grafana").orElseThrow();
        assertThat(status.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(status.failureCount()).isZero();
        assertThat(transitions).containsExactly(
                "grafana:CLOSED->OPEN", "grafana:OPEN->HALF_OPEN", "grafana:HALF_OPEN->CLOSED");
    }

    @Test
    void execute_operationFailurePassesOriginalExceptionThrough() {
        IOException refused = new IOException("connection refused");
        registry.getOrCreate("loki", null, RetryPolicy.noRetry());

        Outcome<String> result = registry.execute("loki", () -> {
            throw refused;
        });

        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.RETRY_EXHAUSTED);
        assertThat(failure.attempts()).isEqualTo(1);
        assertThat(failure.lastFailure().type()).isEqualTo(FailureType.OPERATION);
        assertThat(failure.exception()).isSameAs(refused);
    }

    @Test
    void execute_retryRechecksBreakerOnEveryAttempt() {
        registry.getOrCreate("loki",
                CircuitBreakerConfig.builder().failureThreshold(2).build(),
                RetryPolicy.builder().maxAttempts(4).baseDelay(Duration.ofMillis(100)).jitter(false).build());
        AtomicInteger invocations = new AtomicInteger();

        Outcome<String> result = registry.execute("loki", () -> {
            invocations.incrementAndGet();
            throw new IOException("push failed");
        });

        // two real failures open the circuit; the last two attempts are rejected
        assertThat(invocations.get()).isEqualTo(2);
        assertThat(sleeps).hasSize(3);
        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.attempts()).isEqualTo(4);
        assertThat(failure.lastFailure().type()).isEqualTo(FailureType.CIRCUIT_OPEN);
    }

    @Test
    void execute_failFastOnOpenStopsAtFirstRejection() {
        registry.getOrCreate("loki",
                CircuitBreakerConfig.builder().failureThreshold(2).build(),
                RetryPolicy.builder().maxAttempts(4).baseDelay(Duration.ofMillis(100)).jitter(false)
                        .failFastOnOpen(true).build());

        Outcome<String> result = registry.execute("loki", () -> {
            throw new IOException("push failed");
        });

        assertThat(sleeps).hasSize(2);
        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.attempts()).isEqualTo(3);
        assertThat(failure.lastFailure().type()).isEqualTo(FailureType.CIRCUIT_OPEN);
    }

    @Test
    void execute_successAfterRetryResetsFailureCount() {
        registry.getOrCreate("tempo", null,
                RetryPolicy.builder().maxAttempts(3).baseDelay(Duration.ofMillis(10)).jitter(false).build());
        AtomicInteger invocations = new AtomicInteger();

        Outcome<String> result = registry.execute("tempo", () -> {
            if (invocations.incrementAndGet() < 3) {
                throw new IOException("not ready");
            }
            return "ready";
        });

        assertThat(result.getOrThrow()).isEqualTo("ready");
        assertThat(registry.status("tempo").orElseThrow().failureCount()).isZero();
        assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
    }

    @Test
    void execute_errorDuringHalfOpenProbeLeavesBreakerAbleToProbeAgain() {
        registry.getOrCreate("otlp",
                CircuitBreakerConfig.builder().failureThreshold(1).build(), RetryPolicy.noRetry());
        registry.execute("otlp", () -> {
            throw new IOException("collector unreachable");
        });
        clock.advance(Duration.ofSeconds(60));

        assertThatThrownBy(() -> registry.execute("otlp", () -> {
            throw new AssertionError("exporter bug");
        })).isInstanceOf(AssertionError.class);
        assertThat(registry.status("otlp").orElseThrow().state()).isEqualTo(CircuitState.HALF_OPEN);

        Outcome<String> healthy = registry.execute("otlp", () -> "exported");

        assertThat(healthy.getOrThrow()).isEqualTo("exported");
        assertThat(registry.status("otlp").orElseThrow().state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void execute_interruptedOperationCountsAttemptsActuallyMade() {
        registry.getOrCreate("tempo", null,
                RetryPolicy.builder().maxAttempts(3).baseDelay(Duration.ofMillis(10)).jitter(false).build());
        AtomicInteger invocations = new AtomicInteger();

        Outcome<String> result = registry.execute("tempo", () -> {
            if (invocations.incrementAndGet() == 1) {
                throw new IOException("not ready");
            }
            throw new InterruptedException("shutdown");
        });
        boolean interrupted = Thread.interrupted();

        assertThat(interrupted).isTrue();
        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.CANCELLED);
        assertThat(failure.attempts()).isEqualTo(2);
        assertThat(failure.exception()).isInstanceOf(InterruptedException.class);
        assertThat(registry.status("tempo").orElseThrow().failureCount()).isEqualTo(1);
    }

    @Test
    void execute_cancelledTokenDoesNotRunOperation() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        AtomicInteger invocations = new AtomicInteger();

        Outcome<String> result = registry.execute("tempo", () -> {
            invocations.incrementAndGet();
            return "ready";
        }, token);

        assertThat(invocations.get()).isZero();
        assertThat(((Outcome.Fail<String>) result).failure().type()).isEqualTo(FailureType.CANCELLED);
    }

    @Test
    void reset_closesOpenCircuitAndClearsCount() {
        registry.getOrCreate("grafana",
                CircuitBreakerConfig.builder().failureThreshold(1).build(), RetryPolicy.noRetry());
        registry.execute("grafana", () -> {
            throw new IOException("down");
        });
        assertThat(registry.status("grafana").orElseThrow().state()).isEqualTo(CircuitState.OPEN);

        assertThat(registry.reset("grafana")).isEqualTo(ResetResult.RESET);

        CircuitStatus status = registry.status("grafana").orElseThrow();
        assertThat(status.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(status.failureCount()).isZero();
        assertThat(registry.execute("grafana", () -> "up").getOrThrow()).isEqualTo("up");
    }

    @Test
    void allStatuses_isSortedByName() {
        registry.getOrCreate("tempo");
        registry.getOrCreate("grafana");
        registry.getOrCreate("loki");

        assertThat(registry.allStatuses()).containsOnlyKeys("grafana", "loki", "tempo");
        assertThat(registry.allStatuses().keySet()).containsExactly("grafana", "loki", "tempo");
    }

    @Test
    void settings_supplyPerServiceConfiguration() {
        ResilienceRegistry configured = ResilienceRegistry.builder()
                .settings(ResilienceSettings.loadFromClasspath("resilience-test.json"))
                .reporter(OpReporter.noOp())
                .build();

        assertThat(configured.getOrCreate("loki").retryPolicy().maxAttempts()).isEqualTo(5);
        assertThat(configured.getOrCreate("loki").retryPolicy().failFastOnOpen()).isTrue();
        assertThat(configured.getOrCreate("grafana").breakerConfig().failureThreshold()).isEqualTo(1);
        assertThat(configured.getOrCreate("tempo").breakerConfig().failureThreshold()).isEqualTo(3);
    }

    @Test
    void concurrentFailuresOnOneServiceAreAllCounted() throws InterruptedException {
        int threads = 16;
        int callsPerThread = 50;
        registry.getOrCreate("elastic",
                CircuitBreakerConfig.builder().failureThreshold(Integer.MAX_VALUE).build(),
                RetryPolicy.noRetry());

        runConcurrently(threads, () -> {
            for (int i = 0; i < callsPerThread; i++) {
                registry.execute("elastic", () -> {
                    throw new IOException("refused");
                });
            }
        });

        assertThat(registry.status("elastic").orElseThrow().failureCount()).isEqualTo(threads * callsPerThread);
    }

    @Test
    void servicesDoNotShareBreakerState() {
        registry.getOrCreate("grafana",
                CircuitBreakerConfig.builder().failureThreshold(1).build(), RetryPolicy.noRetry());
        registry.execute("grafana", () -> {
            throw new IOException("down");
        });

        assertThat(registry.execute("loki", () -> "up").getOrThrow()).isEqualTo("up");
        assertThat(registry.status("grafana").orElseThrow().state()).isEqualTo(CircuitState.OPEN);
        assertThat(registry.status("loki").orElseThrow().state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void defaultRegistry_reportsThroughLog4j() {
        ResilienceRegistry defaults = new ResilienceRegistry();
        defaults.getOrCreate("otlp", CircuitBreakerConfig.builder().failureThreshold(1).build(), RetryPolicy.noRetry());

        Outcome<String> result = defaults.execute("otlp", () -> {
            throw new IOException("collector unreachable");
        });

        assertThat(result.isFail()).isTrue();
        assertThat(defaults.status("otlp").orElseThrow().state()).isEqualTo(CircuitState.OPEN);
    }

    private static void runConcurrently(int threads, Runnable task) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        for (int i = 0; i < threads; i++) {
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
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();
    }
}
