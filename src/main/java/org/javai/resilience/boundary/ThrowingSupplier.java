package org.javai.resilience.boundary;

/**
 * A supplier that may throw a checked exception.
 * This is the shape of every protected operation.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
