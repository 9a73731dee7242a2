package org.javai.resilience.breaker;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether an operation exception counts against a circuit breaker.
 * Exceptions that do not count still fail the attempt; they just leave the
 * breaker's failure count untouched.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * @param throwable The exception thrown by the protected operation
     * @return true if the breaker should record it as a failure
     */
    boolean countsAsFailure(Throwable throwable);

    /**
     * Every exception counts.
     */
    static FailureClassifier all() {
        return throwable -> true;
    }

    /**
     * Only exceptions assignable to one of the given types count.
     */
    @SafeVarargs
    static FailureClassifier ofType(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> counted = List.of(types);
        if (counted.isEmpty()) {
            throw new IllegalArgumentException("at least one exception type is required");
        }
        return throwable -> {
            Objects.requireNonNull(throwable, "throwable must not be null");
            return counted.stream().anyMatch(type -> type.isInstance(throwable));
        };
    }
}
