package org.javai.rollout;

import java.time.Instant;
import java.util.Objects;

/**
 * A typed value carried in comparison contexts and eligibility attributes.
 *
 * <p>Contexts are explicit {@code String -> ContextValue} maps rather than
 * arbitrary objects, so every sink can render them without reflection:
 * <pre>{@code
 * Map<String, ContextValue> context = Map.of(
 *     "order_id", ContextValue.of(4711L),
 *     "channel", ContextValue.of("mobile"),
 *     "express", ContextValue.of(true));
 * }</pre>
 */
public sealed interface ContextValue
        permits ContextValue.Text, ContextValue.Integral, ContextValue.Decimal,
                ContextValue.Flag, ContextValue.Timestamp {

    record Text(String value) implements ContextValue {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public boolean asBoolean() {
            if ("true".equalsIgnoreCase(value.trim())) {
                return true;
            }
            if ("false".equalsIgnoreCase(value.trim())) {
                return false;
            }
            throw new IllegalArgumentException("Not a boolean value: '" + value + "'");
        }
    }

    record Integral(long value) implements ContextValue {
        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    record Decimal(double value) implements ContextValue {
        @Override
        public String asText() {
            return Double.toString(value);
        }
    }

    record Flag(boolean value) implements ContextValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public boolean asBoolean() {
            return value;
        }
    }

    record Timestamp(Instant value) implements ContextValue {
        public Timestamp {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String asText() {
            return value.toString();
        }
    }

    /**
     * Renders the value as text, for logs and list-valued attributes.
     */
    String asText();

    /**
     * Interprets the value as a boolean.
     *
     * @throws IllegalArgumentException if the value is neither a flag nor the text true/false
     */
    default boolean asBoolean() {
        throw new IllegalArgumentException("Not a boolean value: " + this);
    }

    static ContextValue of(String value) {
        return new Text(value);
    }

    static ContextValue of(long value) {
        return new Integral(value);
    }

    static ContextValue of(double value) {
        return new Decimal(value);
    }

    static ContextValue of(boolean value) {
        return new Flag(value);
    }

    static ContextValue of(Instant value) {
        return new Timestamp(value);
    }

    /**
     * Converts an arbitrary object. Numbers, booleans, instants and character
     * sequences keep their type; anything else is captured by {@code toString()}.
     *
     * @throws NullPointerException if value is null
     */
    static ContextValue of(Object value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof ContextValue contextValue) {
            return contextValue;
        }
        if (value instanceof Boolean b) {
            return new Flag(b);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new Integral(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            return new Decimal(n.doubleValue());
        }
        if (value instanceof Instant instant) {
            return new Timestamp(instant);
        }
        return new Text(value.toString());
    }
}
