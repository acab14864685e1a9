package org.javai.rollout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The record of one dual-path execution, handed to a result sink and then discarded.
 *
 * <p>Observation values are the cleaned values: whatever clean transform the experiment
 * declared has already been applied. {@code matched} was computed on the raw values.
 * Error presence is kept on each observation, so a sink can tell a candidate that
 * crashed from one that legitimately disagreed.
 *
 * @param experimentName the experiment name
 * @param control the control observation
 * @param candidates the candidate observations, in execution order
 * @param matched whether the candidates agreed with the control
 * @param contexts engine and caller supplied context, in insertion order
 */
public record ComparisonResult(
        String experimentName,
        Observation<Object> control,
        List<Observation<Object>> candidates,
        boolean matched,
        Map<String, ContextValue> contexts
) {

    public ComparisonResult {
        Objects.requireNonNull(experimentName, "experimentName must not be null");
        Objects.requireNonNull(control, "control must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("at least one candidate observation is required");
        }
        candidates = List.copyOf(candidates);
        contexts = contexts == null ? Map.of() : copyInOrder(contexts);
    }

    private static Map<String, ContextValue> copyInOrder(Map<String, ContextValue> contexts) {
        Map<String, ContextValue> copy = new LinkedHashMap<>();
        contexts.forEach((key, value) -> copy.put(
                Objects.requireNonNull(key, "context key must not be null"),
                Objects.requireNonNull(value, "context value must not be null")));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the first candidate observation.
     */
    public Observation<Object> candidate() {
        return candidates.get(0);
    }

    /**
     * Returns true when at least one candidate raised an error and the control did not.
     */
    public boolean candidateFailed() {
        return !control.failed() && candidates.stream().anyMatch(Observation::failed);
    }
}
