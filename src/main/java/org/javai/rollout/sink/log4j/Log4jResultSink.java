package org.javai.rollout.sink.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.rollout.ComparisonResult;
import org.javai.rollout.ContextValue;
import org.javai.rollout.Observation;
import org.javai.rollout.sink.ResultSink;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Publishes comparison records using Log4j2 structured logging.
 *
 * <p>Every record is logged with the {@code EXPERIMENT} marker:
 * <ul>
 *   <li>matches → INFO</li>
 *   <li>mismatches → WARN, additionally marked {@code MISMATCH}</li>
 * </ul>
 *
 * <p>Filter on the markers to route mismatches to their own appender.
 */
public class Log4jResultSink implements ResultSink {

	public static final Marker EXPERIMENT_MARKER = MarkerManager.getMarker("EXPERIMENT");
	public static final Marker MISMATCH_MARKER = MarkerManager.getMarker("MISMATCH").addParents(EXPERIMENT_MARKER);

	private final Logger logger;

	/**
	 * Creates a Log4jResultSink using the default logger name.
	 */
	public Log4jResultSink() {
		this(LogManager.getLogger("org.javai.rollout.Experiments"));
	}

	/**
	 * Creates a Log4jResultSink with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jResultSink(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jResultSink with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jResultSink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void publish(ComparisonResult result) {
		Level level = result.matched() ? Level.INFO : Level.WARN;
		Marker marker = result.matched() ? EXPERIMENT_MARKER : MISMATCH_MARKER;

		logger.atLevel(level)
			.withMarker(marker)
			.log(formatMessage(result));
	}

	private String formatMessage(ComparisonResult result) {
		return """
			Experiment [%s] %s \
			| control=%s, candidates=[%s]%s\
			""".formatted(
				result.experimentName(),
				result.matched() ? "matched" : "MISMATCHED",
				formatObservation(result.control()),
				result.candidates().stream()
						.map(Log4jResultSink::formatObservation)
						.collect(Collectors.joining("; ")),
				formatContexts(result.contexts())
			).trim();
	}

	private static String formatObservation(Observation<Object> observation) {
		String outcome = observation.error()
				.map(error -> "error=" + error.type() + (error.message() != null ? "(" + error.message() + ")" : ""))
				.orElseGet(() -> "value=" + observation.value());
		return observation.name() + "{" + outcome + ", durationMs=" + observation.duration().toMillis() + "}";
	}

	private static String formatContexts(Map<String, ContextValue> contexts) {
		if (contexts == null || contexts.isEmpty()) {
			return "";
		}
		return ", context={" + contexts.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue().asText())
				.collect(Collectors.joining(", ")) + "}";
	}
}
