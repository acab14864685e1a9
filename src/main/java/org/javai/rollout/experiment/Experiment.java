package org.javai.rollout.experiment;

import org.javai.rollout.ContextValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A named pair of code paths to compare: the trusted control, whose result is always
 * returned, and a candidate run in its shadow.
 *
 * <p>Experiments are immutable; the {@code with...} methods return modified copies.
 *
 * <pre>{@code
 * Experiment<Price, IOException> pricing = Experiment
 *     .of("pricing", () -> legacy.price(cart), () -> engine.price(cart))
 *     .comparedBy(ObservationComparator.byValue(Price::sameAmount))
 *     .cleanedBy(Price::amount)
 *     .withContext("cart_size", cart.size());
 *
 * Price price = runner.run(pricing);
 * }</pre>
 *
 * @param name the experiment name used in comparison records
 * @param control the trusted code path
 * @param candidate the code path under evaluation
 * @param candidateName the name of the candidate observation
 * @param comparator decides whether the candidate agreed with the control
 * @param cleaner transforms values before they are published, e.g. to redact fields
 * @param context caller context merged into the comparison record
 * @param <T> the value type
 * @param <E> the checked exception the control may throw
 */
public record Experiment<T, E extends Exception>(
        String name,
        ThrowingSupplier<T, E> control,
        ThrowingSupplier<T, ? extends Exception> candidate,
        String candidateName,
        ObservationComparator<T> comparator,
        Function<? super T, ?> cleaner,
        Map<String, ContextValue> context
) {

    public static final String DEFAULT_CANDIDATE_NAME = "candidate";

    public Experiment {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(control, "control must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(candidateName, "candidateName must not be null");
        Objects.requireNonNull(comparator, "comparator must not be null");
        Objects.requireNonNull(cleaner, "cleaner must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static <T, E extends Exception> Experiment<T, E> of(
            String name,
            ThrowingSupplier<T, E> control,
            ThrowingSupplier<T, ? extends Exception> candidate) {
        return new Experiment<>(name, control, candidate, DEFAULT_CANDIDATE_NAME,
                ObservationComparator.standard(), value -> value, Map.of());
    }

    public Experiment<T, E> comparedBy(ObservationComparator<T> comparator) {
        return new Experiment<>(name, control, candidate, candidateName, comparator, cleaner, context);
    }

    public Experiment<T, E> cleanedBy(Function<? super T, ?> cleaner) {
        return new Experiment<>(name, control, candidate, candidateName, comparator, cleaner, context);
    }

    public Experiment<T, E> candidateNamed(String candidateName) {
        return new Experiment<>(name, control, candidate, candidateName, comparator, cleaner, context);
    }

    public Experiment<T, E> withContext(String key, Object value) {
        Map<String, ContextValue> merged = new LinkedHashMap<>(context);
        merged.put(Objects.requireNonNull(key, "key must not be null"), ContextValue.of(value));
        return new Experiment<>(name, control, candidate, candidateName, comparator, cleaner, merged);
    }

    public Experiment<T, E> withContext(Map<String, ContextValue> extra) {
        Map<String, ContextValue> merged = new LinkedHashMap<>(context);
        merged.putAll(extra);
        return new Experiment<>(name, control, candidate, candidateName, comparator, cleaner, merged);
    }
}
