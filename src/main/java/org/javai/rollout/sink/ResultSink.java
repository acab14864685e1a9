package org.javai.rollout.sink;

import org.javai.rollout.ComparisonResult;

/**
 * Consumes comparison records, e.g. to log them, emit metrics or store them for analysis.
 *
 * <p>Implementations must not throw back into the engine: a failure to publish is
 * the sink's own concern. The engine guards every call regardless.
 */
@FunctionalInterface
public interface ResultSink {

    /**
     * Publishes one comparison record.
     */
    void publish(ComparisonResult result);

    /**
     * A sink that drops every record.
     */
    static ResultSink noOp() {
        return result -> {};
    }

    /**
     * Creates a composite sink that fans out to all given sinks.
     *
     * @param sinks the sinks to delegate to
     * @return a composite sink
     */
    static ResultSink composite(ResultSink... sinks) {
        return CompositeResultSink.of(sinks);
    }
}
