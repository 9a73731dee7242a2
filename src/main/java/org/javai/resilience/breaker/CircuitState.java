package org.javai.resilience.breaker;

/**
 * The states of a per-service circuit breaker.
 */
public enum CircuitState {
    /** Normal operation; every call is allowed. */
    CLOSED("closed"),
    /** Failing; calls are rejected until the recovery timeout elapses. */
    OPEN("open"),
    /** Probing; a single trial call decides between CLOSED and OPEN. */
    HALF_OPEN("half_open");

    private final String wireName;

    CircuitState(String wireName) {
        this.wireName = wireName;
    }

    /**
     * The lowercase name used in status output and metrics events.
     */
    public String wireName() {
        return wireName;
    }
}
