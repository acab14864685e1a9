package org.javai.rollout.sink;

import org.javai.rollout.ComparisonResult;
import org.javai.rollout.ContextValue;
import org.javai.rollout.Observation;

import java.io.PrintStream;
import java.util.Map;
import java.util.Objects;

/**
 * Prints a human-readable summary of each record. Handy during development;
 * prefer {@link org.javai.rollout.sink.log4j.Log4jResultSink} in production.
 */
public class ConsoleResultSink implements ResultSink {

	private static final String SEPARATOR = "----------------------------------";

	private final PrintStream out;

	public ConsoleResultSink() {
		this(System.out);
	}

	public ConsoleResultSink(PrintStream out) {
		this.out = Objects.requireNonNull(out, "out must not be null");
	}

	@Override
	public void publish(ComparisonResult result) {
		StringBuilder sb = new StringBuilder();
		sb.append("Experiment: ").append(result.experimentName()).append('\n');
		sb.append("Result: ").append(result.matched() ? "MATCH" : "MISMATCH").append('\n');
		appendObservation(sb, "Control", result.control());
		for (Observation<Object> candidate : result.candidates()) {
			appendObservation(sb, "Candidate " + candidate.name(), candidate);
		}
		for (Map.Entry<String, ContextValue> entry : result.contexts().entrySet()) {
			sb.append("Context - ").append(entry.getKey()).append(": ")
			  .append(entry.getValue().asText()).append('\n');
		}
		sb.append(SEPARATOR);
		out.println(sb);
	}

	private static void appendObservation(StringBuilder sb, String label, Observation<Object> observation) {
		if (observation.failed()) {
			sb.append(label).append(" error: ")
			  .append(observation.error().map(e -> e.type() + ": " + e.message()).orElse("unknown"))
			  .append('\n');
		} else {
			sb.append(label).append(" value: ").append(observation.value()).append('\n');
		}
		sb.append(label).append(" duration: ")
		  .append(observation.durationNanos() / 1_000_000.0).append("ms\n");
	}
}
