package org.javai.resilience.registry;

import org.javai.resilience.MonotonicClock;
import org.javai.resilience.Outcome;
import org.javai.resilience.boundary.Boundary;
import org.javai.resilience.boundary.ThrowingSupplier;
import org.javai.resilience.breaker.CircuitBreaker;
import org.javai.resilience.breaker.CircuitBreakerConfig;
import org.javai.resilience.breaker.CircuitStatus;
import org.javai.resilience.config.ResilienceSettings;
import org.javai.resilience.ops.OpReporter;
import org.javai.resilience.ops.log4j.Log4jOpReporter;
import org.javai.resilience.retry.CancellationToken;
import org.javai.resilience.retry.Retrier;
import org.javai.resilience.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns one circuit breaker and one retry policy per service name.
 *
 * <p>Entries are created on first reference and live as long as the registry; a reset
 * changes an entry in place and never removes it. Creation is atomic, so concurrent first
 * uses of a name share a single breaker. Lookups of existing entries do not lock, and each
 * breaker guards its own state, so calls against different services never contend.
 *
 * <p>There is no shared instance. Construct one and pass it to whatever needs it:
 * <pre>{@code
 * ResilienceRegistry registry = ResilienceRegistry.builder()
 *     .settings(ResilienceSettings.loadFromClasspath("resilience.json"))
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * Outcome<Integer> status = registry.execute("grafana", () -> probe.health());
 * }</pre>
 *
 * <p>Callers only ever see {@link ProtectedExecutor}s and immutable {@link CircuitStatus}
 * snapshots, never the breakers themselves.
 */
public final class ResilienceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ResilienceRegistry.class);

    private final ConcurrentMap<String, ProtectedExecutor> executors = new ConcurrentHashMap<>();
    private final ResilienceSettings settings;
    private final OpReporter reporter;
    private final Clock clock;
    private final Retrier.Sleeper sleeper;

    private ResilienceRegistry(Builder builder) {
        this.settings = builder.settings;
        this.reporter = builder.reporter != null ? builder.reporter : new Log4jOpReporter();
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
    }

    /**
     * A registry with default settings that logs through Log4j2.
     */
    public ResilienceRegistry() {
        this(builder());
    }

    public static Builder builder() {
        return new Builder();
    }

    public ResilienceSettings settings() {
        return settings;
    }

    /**
     * Returns the executor for {@code service}, creating it from the settings if needed.
     */
    public ProtectedExecutor getOrCreate(String service) {
        return getOrCreate(service, null, null);
    }

    /**
     * Returns the executor for {@code service}, creating it with the given configuration if
     * this is the first reference. Configuration passed for an existing service is ignored.
     *
     * @param breakerConfig breaker settings, or null for the configured default
     * @param retryPolicy retry settings, or null for the configured default
     */
    public ProtectedExecutor getOrCreate(String service, CircuitBreakerConfig breakerConfig, RetryPolicy retryPolicy) {
        Objects.requireNonNull(service, "service must not be null");
        ProtectedExecutor existing = executors.get(service);
        if (existing != null) {
            return existing;
        }
        return executors.computeIfAbsent(service, name -> create(name, breakerConfig, retryPolicy));
    }

    public <T> Outcome<T> execute(String service, ThrowingSupplier<? extends T, ? extends Exception> operation) {
        return getOrCreate(service).execute(operation);
    }

    public <T> Outcome<T> execute(
            String service,
            ThrowingSupplier<? extends T, ? extends Exception> operation,
            CancellationToken cancellation
    ) {
        return getOrCreate(service).execute(operation, cancellation);
    }

    /**
     * Snapshot of one service's breaker. Empty if the service was never referenced;
     * asking never creates an entry.
     */
    public Optional<CircuitStatus> status(String service) {
        Objects.requireNonNull(service, "service must not be null");
        return Optional.ofNullable(executors.get(service)).map(ProtectedExecutor::status);
    }

    /**
     * Snapshots of every registered service, ordered by name.
     */
    public Map<String, CircuitStatus> allStatuses() {
        Map<String, CircuitStatus> statuses = new TreeMap<>();
        executors.forEach((service, executor) -> statuses.put(service, executor.status()));
        return statuses;
    }

    public Set<String> services() {
        return new TreeSet<>(executors.keySet());
    }

    /**
     * Forces the service's circuit closed and clears its failure count.
     * An unknown service is reported as {@link ResetResult#NOT_FOUND} and left unregistered.
     */
    public ResetResult reset(String service) {
        Objects.requireNonNull(service, "service must not be null");
        ProtectedExecutor executor = executors.get(service);
        if (executor == null) {
            log.info("No circuit breaker found for service [{}]; nothing to reset", service);
            return ResetResult.NOT_FOUND;
        }
        executor.reset();
        log.info("Reset circuit breaker for service [{}]", service);
        return ResetResult.RESET;
    }

    private ProtectedExecutor create(String service, CircuitBreakerConfig breakerConfig, RetryPolicy retryPolicy) {
        CircuitBreakerConfig effectiveBreaker = breakerConfig != null ? breakerConfig : settings.breakerConfigFor(service);
        RetryPolicy effectiveRetry = retryPolicy != null ? retryPolicy : settings.retryPolicyFor(service);
        log.debug("Registering service [{}] with threshold={}, recoveryTimeout={}, {}",
                service, effectiveBreaker.failureThreshold(), effectiveBreaker.recoveryTimeout(), effectiveRetry);
        return new ProtectedExecutor(
                service,
                new CircuitBreaker(service, effectiveBreaker, clock, reporter),
                new Retrier(effectiveRetry, reporter, sleeper),
                Boundary.instance());
    }

    /**
     * Builder for a {@link ResilienceRegistry}. Every setting is optional.
     */
    public static final class Builder {
        private ResilienceSettings settings = ResilienceSettings.defaults();
        private OpReporter reporter;
        private Clock clock = new MonotonicClock();
        private Retrier.Sleeper sleeper = Retrier.Sleeper.blocking();

        private Builder() {}

        public Builder settings(ResilienceSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        /**
         * Sets the reporter for retries, exhaustion and state transitions
         * (defaults to {@link Log4jOpReporter}).
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the clock breakers use for failure timestamps and recovery timeouts
         * (defaults to a {@link MonotonicClock}).
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets how retry loops wait between attempts.
         */
        public Builder sleeper(Retrier.Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public ResilienceRegistry build() {
            return new ResilienceRegistry(this);
        }
    }
}
