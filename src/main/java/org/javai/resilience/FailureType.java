package org.javai.resilience;

/**
 * Distinguishes why a protected call did not produce a value.
 */
public enum FailureType {
    /**
     * The wrapped operation ran and threw.
     * The original exception is carried unchanged in {@link Failure#exception()}.
     */
    OPERATION,

    /**
     * The circuit breaker rejected the call. The wrapped operation never ran.
     */
    CIRCUIT_OPEN,

    /**
     * Every permitted attempt failed. Wraps the last attempt's failure
     * together with the number of attempts consumed.
     */
    RETRY_EXHAUSTED,

    /**
     * The caller's cancellation signal fired before an attempt succeeded.
     */
    CANCELLED,

    /**
     * Programming error escaping a worker thread.
     * Only ever reported, never returned from a protected call.
     */
    DEFECT
}
