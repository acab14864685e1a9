package org.javai.rollout.experiment;

import org.javai.rollout.ContextValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The asynchronous counterpart of {@link Experiment}: both code paths return a pending
 * result instead of an immediate one.
 *
 * <p>The suppliers are invoked on the caller's thread; whatever work they start runs
 * wherever they schedule it. A supplier that throws instead of returning a stage is
 * treated as a failed execution.
 *
 * @param <T> the value type
 */
public record AsyncExperiment<T>(
        String name,
        Supplier<? extends CompletionStage<T>> control,
        Supplier<? extends CompletionStage<T>> candidate,
        String candidateName,
        ObservationComparator<T> comparator,
        Function<? super T, ?> cleaner,
        Map<String, ContextValue> context
) {

    public AsyncExperiment {
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

    public static <T> AsyncExperiment<T> of(
            String name,
            Supplier<? extends CompletionStage<T>> control,
            Supplier<? extends CompletionStage<T>> candidate) {
        return new AsyncExperiment<>(name, control, candidate, Experiment.DEFAULT_CANDIDATE_NAME,
                ObservationComparator.standard(), value -> value, Map.of());
    }

    public AsyncExperiment<T> comparedBy(ObservationComparator<T> comparator) {
        return new AsyncExperiment<>(name, control, candidate, candidateName, comparator, cleaner, context);
    }

    public AsyncExperiment<T> cleanedBy(Function<? super T, ?> cleaner) {
        return new AsyncExperiment<>(name, control, candidate, candidateName, comparator, cleaner, context);
    }

    public AsyncExperiment<T> candidateNamed(String candidateName) {
        return new AsyncExperiment<>(name, control, candidate, candidateName, comparator, cleaner, context);
    }

    public AsyncExperiment<T> withContext(String key, Object value) {
        Map<String, ContextValue> merged = new LinkedHashMap<>(context);
        merged.put(Objects.requireNonNull(key, "key must not be null"), ContextValue.of(value));
        return new AsyncExperiment<>(name, control, candidate, candidateName, comparator, cleaner, merged);
    }

    public AsyncExperiment<T> withContext(Map<String, ContextValue> extra) {
        Map<String, ContextValue> merged = new LinkedHashMap<>(context);
        merged.putAll(extra);
        return new AsyncExperiment<>(name, control, candidate, candidateName, comparator, cleaner, merged);
    }
}
