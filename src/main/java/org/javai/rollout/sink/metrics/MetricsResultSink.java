package org.javai.rollout.sink.metrics;

import org.javai.rollout.ComparisonResult;
import org.javai.rollout.ContextKeys;
import org.javai.rollout.ContextValue;
import org.javai.rollout.Observation;
import org.javai.rollout.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Publishes comparison records as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one flat JSON object per record, suitable for metrics aggregation: the
 * tracking key, whether the candidates matched, and the duration and error type of
 * every observation. Observation values are never written.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"comparison","timestamp":"2024-01-20T10:30:00Z","trackingKey":"shop.checkout","matched":false,"controlDurationMs":12,"candidateDurationMs":9,"candidateError":"java.lang.IllegalStateException"}
 * }</pre>
 *
 * <p>Constructor options:</p>
 * <ul>
 *   <li>{@link #MetricsResultSink()} - no namespace, default logger</li>
 *   <li>{@link #MetricsResultSink(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsResultSink(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsResultSink implements ResultSink {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.rollout.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;

	/**
	 * Creates a MetricsResultSink with no namespace and the default logger.
	 */
	public MetricsResultSink() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsResultSink with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsResultSink(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsResultSink with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsResultSink(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsResultSink(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void publish(ComparisonResult result) {
		try {
			logger.info(buildComparisonJson(result));
		} catch (Exception e) {
			// Metrics must not break the application
		}
	}

	private String buildComparisonJson(ComparisonResult result) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "comparison", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(timestampOf(result)), false);
		appendField(sb, "trackingKey", buildTrackingKey(result), false);
		appendRaw(sb, "matched", String.valueOf(result.matched()));
		appendObservation(sb, "control", result.control());
		for (Observation<Object> candidate : result.candidates()) {
			appendObservation(sb, candidate.name(), candidate);
		}
		sb.append("}");
		return sb.toString();
	}

	private static Instant timestampOf(ComparisonResult result) {
		if (result.contexts().get(ContextKeys.TIMESTAMP) instanceof ContextValue.Timestamp ts) {
			return ts.value();
		}
		return Instant.now();
	}

	private void appendObservation(StringBuilder sb, String prefix, Observation<Object> observation) {
		appendRaw(sb, prefix + "DurationMs", String.valueOf(observation.duration().toMillis()));
		observation.error().ifPresent(error -> appendField(sb, prefix + "Error", error.type(), false));
	}

	private String buildTrackingKey(ComparisonResult result) {
		if (namespace.isEmpty()) {
			return result.experimentName();
		}
		return namespace + "." + result.experimentName();
	}

	private static void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(escapeJson(key)).append("\":");
		if (value == null) {
			sb.append("null");
		} else {
			sb.append("\"").append(escapeJson(value)).append("\"");
		}
	}

	private static void appendRaw(StringBuilder sb, String key, String rawValue) {
		sb.append(",\"").append(escapeJson(key)).append("\":").append(rawValue);
	}

	private static String escapeJson(String value) {
		StringBuilder sb = new StringBuilder(value.length());
		for (char c : value.toCharArray()) {
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.toString();
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return "";
		}
		String trimmed = namespace.trim();
		return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
	}
}
