package org.javai.rollout.sink;

import org.javai.rollout.ComparisonResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link ResultSink} that delegates to multiple sinks.
 *
 * <p>All configured sinks receive every record. If a sink throws, the error is
 * logged and the remaining sinks still run.
 *
 * <p>Example usage:
 * <pre>{@code
 * ResultSink sink = CompositeResultSink.of(
 *     new Log4jResultSink(),
 *     new MetricsResultSink("checkout")
 * );
 *
 * // Or using the builder for more control:
 * ResultSink sink = CompositeResultSink.builder()
 *     .add(new Log4jResultSink())
 *     .addIf(storeResults, new StoringResultSink(store))
 *     .build();
 * }</pre>
 */
public final class CompositeResultSink implements ResultSink {

	private static final Logger log = LoggerFactory.getLogger(CompositeResultSink.class);

	private final List<ResultSink> sinks;

	private CompositeResultSink(List<ResultSink> sinks) {
		this.sinks = List.copyOf(sinks);
	}

	public static CompositeResultSink of(ResultSink... sinks) {
		return new CompositeResultSink(Arrays.asList(sinks));
	}

	public static CompositeResultSink of(Collection<? extends ResultSink> sinks) {
		return new CompositeResultSink(new ArrayList<>(sinks));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void publish(ComparisonResult result) {
		for (ResultSink sink : sinks) {
			try {
				sink.publish(result);
			} catch (Exception e) {
				log.warn("ResultSink {} failed to publish experiment [{}]: {}",
						sink.getClass().getName(), result.experimentName(), e.getMessage());
			}
		}
	}

	/**
	 * Returns the number of sinks in this composite.
	 */
	public int size() {
		return sinks.size();
	}

	/**
	 * Builder for creating a {@link CompositeResultSink}.
	 */
	public static final class Builder {
		private final List<ResultSink> sinks = new ArrayList<>();

		private Builder() {}

		public Builder add(ResultSink sink) {
			if (sink != null) {
				sinks.add(sink);
			}
			return this;
		}

		public Builder addAll(Collection<? extends ResultSink> sinks) {
			for (ResultSink sink : sinks) {
				add(sink);
			}
			return this;
		}

		/**
		 * Conditionally adds a sink based on a flag.
		 */
		public Builder addIf(boolean condition, ResultSink sink) {
			if (condition) {
				add(sink);
			}
			return this;
		}

		public CompositeResultSink build() {
			return new CompositeResultSink(sinks);
		}
	}
}
