package org.javai.resilience.cli;

import org.javai.resilience.breaker.CircuitState;
import org.javai.resilience.breaker.CircuitStatus;
import org.javai.resilience.registry.ResetResult;
import org.javai.resilience.registry.ResilienceRegistry;

import java.io.PrintStream;
import java.util.Map;
import java.util.Objects;

/**
 * Operator-facing status and reset commands over a {@link ResilienceRegistry}.
 * Rendering only; all resilience behavior lives in the registry.
 */
public final class ResilienceCommands {

    private final ResilienceRegistry registry;

    public ResilienceCommands(ResilienceRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Prints one line per monitored service with its circuit state and failure count.
     */
    public void printStatus(PrintStream out) {
        Map<String, CircuitStatus> statuses = registry.allStatuses();
        if (statuses.isEmpty()) {
            out.println("ℹ️  No services being monitored for resilience");
            return;
        }

        out.println();
        out.println("📊 Resilience Status:");
        for (CircuitStatus status : statuses.values()) {
            out.printf("   %s %s: %s%n", iconFor(status.state()), status.service(), status.state().wireName());
            if (status.failureCount() > 0) {
                out.printf("      Failures: %d%n", status.failureCount());
            }
        }

        out.println();
        out.println("💡 To reset a circuit breaker:");
        out.println("   reset-circuit-breaker <service_name>");
    }

    /**
     * Resets one service's circuit and prints the result.
     */
    public ResetResult reset(String service, PrintStream out) {
        out.printf("🔄 Resetting circuit breaker for %s...%n", service);
        ResetResult result = registry.reset(service);
        switch (result) {
            case RESET -> out.printf("✅ Reset circuit breaker for %s%n", service);
            case NOT_FOUND -> out.printf("❌ No circuit breaker found for %s%n", service);
        }
        return result;
    }

    static String iconFor(CircuitState state) {
        return switch (state) {
            case CLOSED -> "✅";
            case HALF_OPEN -> "⚠️";
            case OPEN -> "❌";
        };
    }
}
