package org.javai.rollout;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The result of executing one code path: either {@link Ok} carrying the value it
 * returned, or {@link Fail} carrying the error it raised.
 *
 * <p>Outcomes let the experiment machinery treat a raised error as data. A candidate
 * that throws becomes a {@code Fail} that is compared and published like any other
 * result, while the runner decides separately whether a control {@code Fail} is
 * re-raised to the caller.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value. The value may be null.
     *
     * @param value the value the code path returned
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public Optional<ErrorKind> errorKind() {
            return Optional.empty();
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }
    }

    /**
     * A failed outcome containing the raised error and its publishable description.
     *
     * @param error the error the code path raised
     * @param kind the error's description for comparison records
     */
    record Fail<T>(Throwable error, ErrorKind kind) implements Outcome<T> {

        /**
         * Canonical constructor with validation.
         */
        public Fail {
            Objects.requireNonNull(error, "error must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
        }

        /**
         * Creates a Fail outcome describing the error with {@link ErrorKind#fromThrowable}.
         *
         * @param error the error the code path raised
         */
        public Fail(Throwable error) {
            this(error, ErrorKind.fromThrowable(error));
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public Optional<ErrorKind> errorKind() {
            return Optional.of(kind);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(error, kind);
        }
    }

    boolean isOk();

    default boolean isFail() {
        return !isOk();
    }

    /**
     * Returns the error description if this outcome failed.
     *
     * @return the error kind, or empty for a successful outcome
     */
    Optional<ErrorKind> errorKind();

    T getOrElse(T defaultValue);

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Throwable error) {
        return new Fail<>(error);
    }
}
