package org.javai.resilience.registry;

/**
 * Result of a manual circuit reset.
 */
public enum ResetResult {
    /** The circuit was forced closed and its failure count cleared. */
    RESET,
    /** No circuit is registered under that name; nothing was created. */
    NOT_FOUND
}
