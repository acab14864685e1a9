package org.javai.rollout.sink.metrics;

import org.javai.rollout.ComparisonResult;
import org.javai.rollout.ContextValue;
import org.javai.rollout.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.Marker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetricsResultSinkTest {

	private static final Instant NOW = Instant.parse("2024-01-20T10:30:00Z");

	private List<String> capturedMessages;
	private Logger capturingLogger;
	private MetricsResultSink sink;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
		sink = new MetricsResultSink(null, capturingLogger);
	}

	@Test
	void publish_emitsComparisonEventAsJsonLine() {
		sink.publish(result("checkout", true, Observation.success("candidate", "A", 9_000_000)));

		assertThat(capturedMessages).hasSize(1);
		String json = capturedMessages.get(0);
		assertThat(json).startsWith("{");
		assertThat(json).endsWith("}");
		assertThat(json).contains("\"eventType\":\"comparison\"");
		assertThat(json).contains("\"timestamp\":\"2024-01-20T10:30:00Z\"");
		assertThat(json).contains("\"trackingKey\":\"checkout\"");
		assertThat(json).contains("\"matched\":true");
		assertThat(json).contains("\"controlDurationMs\":12");
		assertThat(json).contains("\"candidateDurationMs\":9");
	}

	@Test
	void publish_withNamespace_prependsToTrackingKey() {
		MetricsResultSink withNamespace = new MetricsResultSink("shop.", capturingLogger);

		withNamespace.publish(result("checkout", true, Observation.success("candidate", "A", 0)));

		assertThat(capturedMessages.get(0)).contains("\"trackingKey\":\"shop.checkout\"");
	}

	@Test
	void publish_candidateError_includesErrorType() {
		sink.publish(result("checkout", false,
				Observation.failure("candidate", new IllegalStateException("boom"), 0)));

		String json = capturedMessages.get(0);
		assertThat(json).contains("\"matched\":false");
		assertThat(json).contains("\"candidateError\":\"java.lang.IllegalStateException\"");
	}

	@Test
	void publish_neverWritesValues() {
		sink.publish(result("checkout", false, Observation.success("candidate", "card-4111", 0)));

		assertThat(capturedMessages.get(0)).doesNotContain("card-4111");
	}

	@Test
	void publish_escapesSpecialCharacters() {
		sink.publish(result("check\"out\n", true, Observation.success("candidate", "A", 0)));

		assertThat(capturedMessages.get(0)).contains("\"trackingKey\":\"check\\\"out\\n\"");
	}

	@Test
	void publish_loggerFailure_swallowed() {
		MetricsResultSink failing = new MetricsResultSink(null, new ThrowingLogger());

		assertThatCode(() -> failing.publish(result("checkout", true, Observation.success("candidate", "A", 0))))
				.doesNotThrowAnyException();
	}

	private static ComparisonResult result(String name, boolean matched, Observation<Object> candidate) {
		return new ComparisonResult(name,
				Observation.success(Observation.CONTROL, "A", 12_000_000),
				List.of(candidate),
				matched,
				Map.of("timestamp", ContextValue.of(NOW)));
	}

	private static class CapturingLogger implements Logger {
		private final List<String> messages;

		CapturingLogger(List<String> messages) {
			this.messages = messages;
		}

		@Override
		public String getName() { return "test"; }

		@Override
		public boolean isTraceEnabled() { return false; }

		@Override
		public void trace(String msg) {}

		@Override
		public void trace(String format, Object arg) {}

		@Override
		public void trace(String format, Object arg1, Object arg2) {}

		@Override
		public void trace(String format, Object... arguments) {}

		@Override
		public void trace(String msg, Throwable t) {}

		@Override
		public boolean isTraceEnabled(Marker marker) { return false; }

		@Override
		public void trace(Marker marker, String msg) {}

		@Override
		public void trace(Marker marker, String format, Object arg) {}

		@Override
		public void trace(Marker marker, String format, Object arg1, Object arg2) {}

		@Override
		public void trace(Marker marker, String format, Object... arguments) {}

		@Override
		public void trace(Marker marker, String msg, Throwable t) {}

		@Override
		public boolean isDebugEnabled() { return false; }

		@Override
		public void debug(String msg) {}

		@Override
		public void debug(String format, Object arg) {}

		@Override
		public void debug(String format, Object arg1, Object arg2) {}

		@Override
		public void debug(String format, Object... arguments) {}

		@Override
		public void debug(String msg, Throwable t) {}

		@Override
		public boolean isDebugEnabled(Marker marker) { return false; }

		@Override
		public void debug(Marker marker, String msg) {}

		@Override
		public void debug(Marker marker, String format, Object arg) {}

		@Override
		public void debug(Marker marker, String format, Object arg1, Object arg2) {}

		@Override
		public void debug(Marker marker, String format, Object... arguments) {}

		@Override
		public void debug(Marker marker, String msg, Throwable t) {}

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public void info(String msg) {
			messages.add(msg);
		}

		@Override
		public void info(String format, Object arg) {}

		@Override
		public void info(String format, Object arg1, Object arg2) {}

		@Override
		public void info(String format, Object... arguments) {}

		@Override
		public void info(String msg, Throwable t) {}

		@Override
		public boolean isInfoEnabled(Marker marker) { return true; }

		@Override
		public void info(Marker marker, String msg) {}

		@Override
		public void info(Marker marker, String format, Object arg) {}

		@Override
		public void info(Marker marker, String format, Object arg1, Object arg2) {}

		@Override
		public void info(Marker marker, String format, Object... arguments) {}

		@Override
		public void info(Marker marker, String msg, Throwable t) {}

		@Override
		public boolean isWarnEnabled() { return false; }

		@Override
		public void warn(String msg) {}

		@Override
		public void warn(String format, Object arg) {}

		@Override
		public void warn(String format, Object... arguments) {}

		@Override
		public void warn(String format, Object arg1, Object arg2) {}

		@Override
		public void warn(String msg, Throwable t) {}

		@Override
		public boolean isWarnEnabled(Marker marker) { return false; }

		@Override
		public void warn(Marker marker, String msg) {}

		@Override
		public void warn(Marker marker, String format, Object arg) {}

		@Override
		public void warn(Marker marker, String format, Object arg1, Object arg2) {}

		@Override
		public void warn(Marker marker, String format, Object... arguments) {}

		@Override
		public void warn(Marker marker, String msg, Throwable t) {}

		@Override
		public boolean isErrorEnabled() { return false; }

		@Override
		public void error(String msg) {}

		@Override
		public void error(String format, Object arg) {}

		@Override
		public void error(String format, Object arg1, Object arg2) {}

		@Override
		public void error(String format, Object... arguments) {}

		@Override
		public void error(String msg, Throwable t) {}

		@Override
		public boolean isErrorEnabled(Marker marker) { return false; }

		@Override
		public void error(Marker marker, String msg) {}

		@Override
		public void error(Marker marker, String format, Object arg) {}

		@Override
		public void error(Marker marker, String format, Object arg1, Object arg2) {}

		@Override
		public void error(Marker marker, String format, Object... arguments) {}

		@Override
		public void error(Marker marker, String msg, Throwable t) {}
	}

	/**
	 * A logger that throws exceptions for testing exception handling.
	 */
	private static class ThrowingLogger extends CapturingLogger {
		ThrowingLogger() {
			super(new ArrayList<>());
		}

		@Override
		public void info(String msg) {
			throw new RuntimeException("Simulated logging failure");
		}
	}
}
