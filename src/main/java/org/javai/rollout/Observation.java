package org.javai.rollout;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * One timed execution of a control or candidate code path.
 *
 * @param name "control" or the candidate's name
 * @param outcome what the code path returned or raised
 * @param durationNanos wall-clock duration of the execution, never negative
 * @param <T> the value type
 */
public record Observation<T>(String name, Outcome<T> outcome, long durationNanos) {

    public static final String CONTROL = "control";

    public Observation {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (durationNanos < 0) {
            throw new IllegalArgumentException("durationNanos must be >= 0, was " + durationNanos);
        }
    }

    public static <T> Observation<T> success(String name, T value, long durationNanos) {
        return new Observation<>(name, Outcome.ok(value), durationNanos);
    }

    public static <T> Observation<T> failure(String name, Throwable error, long durationNanos) {
        return new Observation<>(name, Outcome.fail(error), durationNanos);
    }

    /**
     * Returns the value, or null when the execution raised an error.
     */
    public T value() {
        return outcome.getOrElse(null);
    }

    public Optional<ErrorKind> error() {
        return outcome.errorKind();
    }

    public boolean failed() {
        return outcome.isFail();
    }

    public Duration duration() {
        return Duration.ofNanos(durationNanos);
    }

    /**
     * Returns a copy whose value has been transformed; failures are carried over unchanged.
     */
    public <U> Observation<U> map(Function<? super T, ? extends U> mapper) {
        return new Observation<>(name, outcome.map(mapper), durationNanos);
    }
}
