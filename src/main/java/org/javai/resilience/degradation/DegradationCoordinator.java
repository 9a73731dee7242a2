package org.javai.resilience.degradation;

import org.javai.resilience.Failure;
import org.javai.resilience.Outcome;
import org.javai.resilience.boundary.ThrowingSupplier;
import org.javai.resilience.ops.OpReporter;
import org.javai.resilience.ops.OperationalExceptionHandler;
import org.javai.resilience.ops.log4j.Log4jOpReporter;
import org.javai.resilience.registry.ResilienceRegistry;
import org.javai.resilience.retry.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs named primary operations through the registry and substitutes a fallback when a
 * primary fails.
 *
 * <p>Each primary runs independently, in parallel, under its own name. When it fails and a
 * fallback is registered for that name, the fallback runs under {@code name + "_fallback"},
 * with breaker and retry state separate from the primary's. Failures become
 * {@link DegradationOutcome} values; {@link #executeWithFallback} never throws for a failed
 * operation.
 *
 * <pre>{@code
 * try (DegradationCoordinator coordinator = new DegradationCoordinator(registry)) {
 *     Map<String, DegradationOutcome<String>> outcomes = coordinator.executeWithFallback(
 *             Map.of("otlp", otlpExport, "loki", lokiPush),
 *             Map.of("otlp", fileExport));
 * }
 * }</pre>
 */
public final class DegradationCoordinator implements AutoCloseable {

    public static final String FALLBACK_SUFFIX = "_fallback";

    private static final Logger log = LoggerFactory.getLogger(DegradationCoordinator.class);
    private static final int DEFAULT_PARALLELISM = 4;

    private final ResilienceRegistry registry;
    private final ExecutorService executor;
    private final OpReporter reporter;

    /**
     * A coordinator with its own pool of {@value #DEFAULT_PARALLELISM} worker threads that
     * logs defects through Log4j2.
     */
    public DegradationCoordinator(ResilienceRegistry registry) {
        this(registry, DEFAULT_PARALLELISM, new Log4jOpReporter());
    }

    /**
     * A coordinator with its own pool; defects escaping worker threads go to {@code reporter}.
     */
    public DegradationCoordinator(ResilienceRegistry registry, int parallelism, OpReporter reporter) {
        this(registry,
                Executors.newFixedThreadPool(parallelism,
                        new OperationalExceptionHandler(reporter).threadFactory("degradation")),
                reporter);
    }

    /**
     * A coordinator running on a caller-supplied executor. {@link #close()} shuts it down.
     */
    public DegradationCoordinator(ResilienceRegistry registry, ExecutorService executor, OpReporter reporter) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    public <T> Map<String, DegradationOutcome<T>> executeWithFallback(
            Map<String, ? extends ThrowingSupplier<? extends T, ? extends Exception>> primaries,
            Map<String, ? extends ThrowingSupplier<? extends T, ? extends Exception>> fallbacks
    ) {
        return executeWithFallback(primaries, fallbacks, CancellationToken.none());
    }

    /**
     * Runs every primary, falling back where one fails.
     *
     * @param primaries operations keyed by service name
     * @param fallbacks alternates keyed by the same names; may be empty
     * @param cancellation passed to every protected call
     * @return one outcome per primary, in the iteration order of {@code primaries}
     */
    public <T> Map<String, DegradationOutcome<T>> executeWithFallback(
            Map<String, ? extends ThrowingSupplier<? extends T, ? extends Exception>> primaries,
            Map<String, ? extends ThrowingSupplier<? extends T, ? extends Exception>> fallbacks,
            CancellationToken cancellation
    ) {
        Objects.requireNonNull(primaries, "primaries must not be null");
        Objects.requireNonNull(fallbacks, "fallbacks must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        Map<String, CompletableFuture<DegradationOutcome<T>>> pending = new LinkedHashMap<>();
        primaries.forEach((name, primary) -> pending.put(name, CompletableFuture.supplyAsync(
                () -> runWithFallback(name, primary, fallbacks.get(name), cancellation), executor)));

        Map<String, DegradationOutcome<T>> outcomes = new LinkedHashMap<>();
        pending.forEach((name, future) -> outcomes.put(name, await(name, future)));

        long degraded = outcomes.values().stream().filter(o -> !(o instanceof DegradationOutcome.Success)).count();
        if (degraded > 0) {
            log.info("{} of {} operations degraded", degraded, outcomes.size());
        }
        return outcomes;
    }

    private <T> DegradationOutcome<T> runWithFallback(
            String name,
            ThrowingSupplier<? extends T, ? extends Exception> primary,
            ThrowingSupplier<? extends T, ? extends Exception> fallback,
            CancellationToken cancellation
    ) {
        Outcome<T> primaryOutcome = registry.execute(name, primary, cancellation);
        if (!(primaryOutcome instanceof Outcome.Fail<T> primaryFail)) {
            return new DegradationOutcome.Success<>(primaryOutcome.getOrThrow());
        }
        Failure primaryFailure = primaryFail.failure();
        if (fallback == null) {
            return new DegradationOutcome.Failed<>(primaryFailure, Optional.empty());
        }

        log.debug("Primary for [{}] failed ({}); trying fallback", name, primaryFailure.message());
        Outcome<T> fallbackOutcome = registry.execute(name + FALLBACK_SUFFIX, fallback, cancellation);
        if (fallbackOutcome instanceof Outcome.Fail<T> fallbackFail) {
            return new DegradationOutcome.Failed<>(primaryFailure, Optional.of(fallbackFail.failure()));
        }
        return new DegradationOutcome.FallbackSuccess<>(fallbackOutcome.getOrThrow(), primaryFailure);
    }

    private <T> DegradationOutcome<T> await(String name, CompletableFuture<DegradationOutcome<T>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            Failure defect = Failure.defect(name, cause);
            reporter.report(defect);
            return new DegradationOutcome.Failed<>(defect, Optional.empty());
        }
    }

    /**
     * Package-private for testing.
     */
    OpReporter reporter() {
        return reporter;
    }

    /**
     * Stops accepting work and waits briefly for running operations to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
