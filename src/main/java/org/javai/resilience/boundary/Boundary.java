package org.javai.resilience.boundary;

import org.javai.resilience.Failure;
import org.javai.resilience.Outcome;

import java.util.Objects;

/**
 * The single point where a protected operation's exceptions are translated into Outcomes.
 * After passing through a Boundary, code operates entirely in outcome-space.
 *
 * <p>Any {@link Exception}, checked or not, is an operation failure: the wrapped call's own
 * error, kept unchanged in {@link Failure#exception()}. An {@link InterruptedException} is the
 * exception to that rule; it restores the interrupt flag and yields a cancelled failure
 * counting a single attempt, which {@link org.javai.resilience.retry.Retrier} replaces with
 * the attempts its loop actually made.
 * {@link Error}s are not caught.</p>
 *
 * <pre>{@code
 * Outcome<Integer> status = boundary.call("grafana", () -> probe.get("/api/health"));
 * }</pre>
 */
public final class Boundary {

    private static final Boundary INSTANCE = new Boundary();

    private Boundary() {}

    public static Boundary instance() {
        return INSTANCE;
    }

    /**
     * Executes work that may throw, translating any exception into an Outcome.
     *
     * @param service The protected service name, recorded on the failure
     * @param work The work to execute
     * @return Ok with the result, or Fail with an operation failure
     */
    public <T> Outcome<T> call(String service, ThrowingSupplier<? extends T, ? extends Exception> work) {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(work, "work must not be null");

        @SuppressWarnings("unchecked")
        ThrowingSupplier<? extends T, Exception> supplier = (ThrowingSupplier<? extends T, Exception>) work;
        try {
            return Outcome.ok(supplier.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.fail(Failure.cancelled(service, 1, Failure.operation(service, e)));
        } catch (Exception e) {
            return Outcome.fail(Failure.operation(service, e));
        }
    }
}
