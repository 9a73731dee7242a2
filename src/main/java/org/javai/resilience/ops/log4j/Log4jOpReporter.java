package org.javai.resilience.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.Cause;
import org.javai.resilience.Failure;
import org.javai.resilience.breaker.CircuitState;
import org.javai.resilience.ops.OpReporter;

import java.time.Duration;

/**
 * Reports resilience events using Log4j2.
 *
 * <p>Levels:
 * <ul>
 *   <li>failed attempts that will be retried → WARN</li>
 *   <li>retry exhaustion → WARN</li>
 *   <li>circuit state transitions → INFO</li>
 *   <li>other failures by type: {@code DEFECT} → ERROR, {@code CANCELLED} → INFO, otherwise WARN</li>
 * </ul>
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker CIRCUIT_MARKER = MarkerManager.getMarker("CIRCUIT");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.resilience.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure))
			.withMarker(FAILURE_MARKER)
			.withThrowable(failure.exception())
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		logger.atWarn()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} failed for service [{}]: {}. Retrying in {} ms (code={})",
				attemptNumber,
				failure.service(),
				failure.message(),
				delay.toMillis(),
				failure.id());
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted for service [{}] after {} attempts: {} (code={})",
				failure.service(),
				totalAttempts,
				failure.message(),
				failure.rootFailure().id());
	}

	@Override
	public void reportStateTransition(String service, CircuitState from, CircuitState to) {
		logger.atInfo()
			.withMarker(CIRCUIT_MARKER)
			.log("Circuit for service [{}] moved from {} to {}", service, from.wireName(), to.wireName());
	}

	private String formatFailureMessage(Failure failure) {
		return """
			Failure for service [%s]: %s \
			| code=%s, type=%s, attempts=%d%s\
			""".formatted(
				failure.service(),
				failure.message(),
				failure.id(),
				failure.type(),
				failure.attempts(),
				formatCause(failure.cause())
			).trim();
	}

	private static String formatCause(Cause cause) {
		return cause != null ? ", cause=" + cause.type() : "";
	}

	private static Level levelFor(Failure failure) {
		return switch (failure.type()) {
			case DEFECT -> Level.ERROR;
			case CANCELLED -> Level.INFO;
			case OPERATION, CIRCUIT_OPEN, RETRY_EXHAUSTED -> Level.WARN;
		};
	}
}
