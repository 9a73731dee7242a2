package org.javai.resilience.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.resilience.breaker.CircuitBreakerConfig;
import org.javai.resilience.retry.RetryPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Default and per-service breaker and retry settings used by the registry when a caller
 * does not supply its own.
 *
 * <p>Settings can be built in code or loaded from JSON. A service entry only needs the
 * values it overrides; the rest come from {@code defaults}. Unknown properties are ignored.
 *
 * <pre>{@code
 * {
 *   "defaults": {
 *     "circuitBreaker": { "failureThreshold": 5, "recoveryTimeoutMs": 60000 },
 *     "retry": { "maxAttempts": 3, "baseDelayMs": 1000, "maxDelayMs": 60000,
 *                "backoffMultiplier": 2.0, "jitter": true, "failFastOnOpen": false }
 *   },
 *   "services": {
 *     "loki": { "retry": { "maxAttempts": 5 } }
 *   }
 * }
 * }</pre>
 */
public final class ResilienceSettings {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CircuitBreakerConfig defaultBreaker;
    private final RetryPolicy defaultRetry;
    private final Map<String, CircuitBreakerConfig> breakerOverrides;
    private final Map<String, RetryPolicy> retryOverrides;

    private ResilienceSettings(Builder builder) {
        this.defaultBreaker = builder.defaultBreaker;
        this.defaultRetry = builder.defaultRetry;
        this.breakerOverrides = Map.copyOf(builder.breakerOverrides);
        this.retryOverrides = Map.copyOf(builder.retryOverrides);
    }

    /**
     * Built-in defaults with no per-service overrides.
     */
    public static ResilienceSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses settings from a JSON document.
     *
     * @throws UncheckedIOException if the document cannot be read or parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ResilienceSettings load(InputStream json) {
        Objects.requireNonNull(json, "json must not be null");
        Document document;
        try {
            document = MAPPER.readValue(json, Document.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read resilience settings", e);
        }
        return fromDocument(document);
    }

    /**
     * Loads settings from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static ResilienceSettings loadFromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        InputStream in = ResilienceSettings.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Resilience settings resource not found: " + resource);
        }
        try (in) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not close resilience settings resource " + resource, e);
        }
    }

    public CircuitBreakerConfig defaultBreaker() {
        return defaultBreaker;
    }

    public RetryPolicy defaultRetry() {
        return defaultRetry;
    }

    public CircuitBreakerConfig breakerConfigFor(String service) {
        return breakerOverrides.getOrDefault(service, defaultBreaker);
    }

    public RetryPolicy retryPolicyFor(String service) {
        return retryOverrides.getOrDefault(service, defaultRetry);
    }

    private static ResilienceSettings fromDocument(Document document) {
        Builder builder = builder();
        Section defaults = document.defaults();
        if (defaults != null) {
            builder.defaultBreaker(applyBreaker(CircuitBreakerConfig.defaults(), defaults.circuitBreaker()));
            builder.defaultRetry(applyRetry(RetryPolicy.defaults(), defaults.retry()));
        }
        if (document.services() != null) {
            document.services().forEach((service, section) -> {
                if (section == null) {
                    return;
                }
                if (section.circuitBreaker() != null) {
                    builder.breaker(service, applyBreaker(builder.defaultBreaker, section.circuitBreaker()));
                }
                if (section.retry() != null) {
                    builder.retry(service, applyRetry(builder.defaultRetry, section.retry()));
                }
            });
        }
        return builder.build();
    }

    private static CircuitBreakerConfig applyBreaker(CircuitBreakerConfig base, BreakerSection section) {
        if (section == null) {
            return base;
        }
        CircuitBreakerConfig.Builder builder = base.toBuilder();
        if (section.failureThreshold() != null) {
            builder.failureThreshold(section.failureThreshold());
        }
        if (section.recoveryTimeoutMs() != null) {
            builder.recoveryTimeout(Duration.ofMillis(section.recoveryTimeoutMs()));
        }
        return builder.build();
    }

    private static RetryPolicy applyRetry(RetryPolicy base, RetrySection section) {
        if (section == null) {
            return base;
        }
        RetryPolicy.Builder builder = base.toBuilder();
        if (section.maxAttempts() != null) {
            builder.maxAttempts(section.maxAttempts());
        }
        if (section.baseDelayMs() != null) {
            builder.baseDelay(Duration.ofMillis(section.baseDelayMs()));
        }
        if (section.maxDelayMs() != null) {
            builder.maxDelay(Duration.ofMillis(section.maxDelayMs()));
        }
        if (section.backoffMultiplier() != null) {
            builder.backoffMultiplier(section.backoffMultiplier());
        }
        if (section.jitter() != null) {
            builder.jitter(section.jitter());
        }
        if (section.failFastOnOpen() != null) {
            builder.failFastOnOpen(section.failFastOnOpen());
        }
        return builder.build();
    }

    // JSON shape

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(Section defaults, Map<String, Section> services) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Section(BreakerSection circuitBreaker, RetrySection retry) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BreakerSection(Integer failureThreshold, Long recoveryTimeoutMs) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RetrySection(
            Integer maxAttempts,
            Long baseDelayMs,
            Long maxDelayMs,
            Double backoffMultiplier,
            Boolean jitter,
            Boolean failFastOnOpen
    ) {}

    public static final class Builder {
        private CircuitBreakerConfig defaultBreaker = CircuitBreakerConfig.defaults();
        private RetryPolicy defaultRetry = RetryPolicy.defaults();
        private final Map<String, CircuitBreakerConfig> breakerOverrides = new HashMap<>();
        private final Map<String, RetryPolicy> retryOverrides = new HashMap<>();

        private Builder() {}

        public Builder defaultBreaker(CircuitBreakerConfig config) {
            this.defaultBreaker = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder defaultRetry(RetryPolicy policy) {
            this.defaultRetry = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public Builder breaker(String service, CircuitBreakerConfig config) {
            breakerOverrides.put(
                    Objects.requireNonNull(service, "service must not be null"),
                    Objects.requireNonNull(config, "config must not be null"));
            return this;
        }

        public Builder retry(String service, RetryPolicy policy) {
            retryOverrides.put(
                    Objects.requireNonNull(service, "service must not be null"),
                    Objects.requireNonNull(policy, "policy must not be null"));
            return this;
        }

        public ResilienceSettings build() {
            return new ResilienceSettings(this);
        }
    }
}
