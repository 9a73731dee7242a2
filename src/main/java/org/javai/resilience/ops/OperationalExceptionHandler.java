package org.javai.resilience.ops;

import org.javai.resilience.Failure;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Catches exceptions that escape worker threads (defects) and reports them to operations.
 *
 * <p>Protected calls turn operation exceptions into {@link org.javai.resilience.Outcome} values,
 * so anything reaching this handler is a programming error, not a downstream failure.</p>
 *
 * <p>For thread pools:</p>
 * <pre>{@code
 * ExecutorService executor = Executors.newFixedThreadPool(4, handler.threadFactory("degradation"));
 * }</pre>
 */
public final class OperationalExceptionHandler implements UncaughtExceptionHandler {

    private final OpReporter reporter;

    public OperationalExceptionHandler(OpReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        reporter.report(Failure.defect("UncaughtException:" + thread.getName(), throwable));
    }

    /**
     * Installs this handler on a specific thread.
     */
    public void installOn(Thread thread) {
        thread.setUncaughtExceptionHandler(this);
    }

    /**
     * Creates a named, daemon ThreadFactory that installs this handler on all created threads.
     */
    public ThreadFactory threadFactory(String namePrefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                installOn(thread);
                return thread;
            }
        };
    }
}
