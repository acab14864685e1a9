package org.javai.rollout.experiment;

import org.javai.rollout.ContextKeys;
import org.javai.rollout.ContextValue;
import org.javai.rollout.bucketing.Bucketing;
import org.javai.rollout.config.RolloutSettings;
import org.javai.rollout.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Compares two implementations whose roles are picked by a condition: the implementation
 * matching the condition is the control and the other one the candidate.
 *
 * <p>Unlike {@link ExperimentRunner}, both implementations always run; the condition only
 * decides which value the caller receives. Publication still honors the
 * publish-results switch.
 *
 * <p>The comparison is recorded as {@code <name>_<experimentType>} with the condition
 * and experiment type in its context. The candidate observation is named
 * {@value #WHEN_TRUE} or {@value #WHEN_FALSE} after the implementation it ran.
 *
 * <pre>{@code
 * Quote quote = conditional.runRollout("quote-engine", customerId, 25,
 *     () -> newEngine.quote(request),
 *     () -> oldEngine.quote(request));
 * }</pre>
 */
public class ConditionalRunner {

    private static final Logger log = LoggerFactory.getLogger(ConditionalRunner.class);

    public static final String DEFAULT_EXPERIMENT_TYPE = "A";
    public static final String WHEN_TRUE = "when_true";
    public static final String WHEN_FALSE = "when_false";

    private final RolloutSettings settings;
    private final ResultSink sink;
    private final ExperimentExecutor executor;

    public ConditionalRunner(RolloutSettings settings, ResultSink sink) {
        this(settings, sink, new ExperimentExecutor());
    }

    public ConditionalRunner(RolloutSettings settings, ResultSink sink, ExperimentExecutor executor) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public <T, E extends Exception> T runConditional(String name,
                                                     boolean condition,
                                                     ThrowingSupplier<T, E> whenTrue,
                                                     ThrowingSupplier<T, E> whenFalse) throws E {
        return runConditional(name, condition, whenTrue, whenFalse, DEFAULT_EXPERIMENT_TYPE, Map.of());
    }

    /**
     * Runs both implementations, returning the value of the one matching {@code condition}.
     *
     * @param name base experiment name
     * @param condition picks the control
     * @param whenTrue implementation used as control when the condition holds
     * @param whenFalse implementation used as control when it does not
     * @param experimentType suffix distinguishing variants of the same experiment
     * @param context caller context merged into the comparison record
     * @return the control's value
     * @throws E the exception the control threw
     */
    public <T, E extends Exception> T runConditional(String name,
                                                     boolean condition,
                                                     ThrowingSupplier<T, E> whenTrue,
                                                     ThrowingSupplier<T, E> whenFalse,
                                                     String experimentType,
                                                     Map<String, ContextValue> context) throws E {
        return runConditional(name, condition, whenTrue, whenFalse, experimentType, context,
                currentPercentage(name), Map.of());
    }

    public <T, E extends Exception> T runRollout(String name,
                                                 long subjectId,
                                                 int percentage,
                                                 ThrowingSupplier<T, E> newImplementation,
                                                 ThrowingSupplier<T, E> oldImplementation) throws E {
        return runRollout(name, subjectId, percentage, newImplementation, oldImplementation,
                DEFAULT_EXPERIMENT_TYPE, Map.of());
    }

    /**
     * Buckets the subject against {@code percentage}; subjects inside the rollout receive the
     * new implementation's value, the others the old one's. Both run either way.
     */
    public <T, E extends Exception> T runRollout(String name,
                                                 long subjectId,
                                                 int percentage,
                                                 ThrowingSupplier<T, E> newImplementation,
                                                 ThrowingSupplier<T, E> oldImplementation,
                                                 String experimentType,
                                                 Map<String, ContextValue> context) throws E {
        boolean inRolloutGroup = Bucketing.inBucket(subjectId, percentage);
        return runConditional(name, inRolloutGroup, newImplementation, oldImplementation, experimentType, context,
                percentage, rolloutContext(subjectId, inRolloutGroup));
    }

    public <T> CompletableFuture<T> runConditionalAsync(String name,
                                                        boolean condition,
                                                        Supplier<? extends CompletionStage<T>> whenTrue,
                                                        Supplier<? extends CompletionStage<T>> whenFalse) {
        return runConditionalAsync(name, condition, whenTrue, whenFalse, DEFAULT_EXPERIMENT_TYPE, Map.of());
    }

    public <T> CompletableFuture<T> runConditionalAsync(String name,
                                                        boolean condition,
                                                        Supplier<? extends CompletionStage<T>> whenTrue,
                                                        Supplier<? extends CompletionStage<T>> whenFalse,
                                                        String experimentType,
                                                        Map<String, ContextValue> context) {
        return runConditionalAsync(name, condition, whenTrue, whenFalse, experimentType, context,
                currentPercentage(name), Map.of());
    }

    public <T> CompletableFuture<T> runRolloutAsync(String name,
                                                    long subjectId,
                                                    int percentage,
                                                    Supplier<? extends CompletionStage<T>> newImplementation,
                                                    Supplier<? extends CompletionStage<T>> oldImplementation) {
        return runRolloutAsync(name, subjectId, percentage, newImplementation, oldImplementation,
                DEFAULT_EXPERIMENT_TYPE, Map.of());
    }

    public <T> CompletableFuture<T> runRolloutAsync(String name,
                                                    long subjectId,
                                                    int percentage,
                                                    Supplier<? extends CompletionStage<T>> newImplementation,
                                                    Supplier<? extends CompletionStage<T>> oldImplementation,
                                                    String experimentType,
                                                    Map<String, ContextValue> context) {
        boolean inRolloutGroup = Bucketing.inBucket(subjectId, percentage);
        return runConditionalAsync(name, inRolloutGroup, newImplementation, oldImplementation, experimentType,
                context, percentage, rolloutContext(subjectId, inRolloutGroup));
    }

    private <T, E extends Exception> T runConditional(String name,
                                                      boolean condition,
                                                      ThrowingSupplier<T, E> whenTrue,
                                                      ThrowingSupplier<T, E> whenFalse,
                                                      String experimentType,
                                                      Map<String, ContextValue> context,
                                                      int percentage,
                                                      Map<String, ContextValue> extraContext) throws E {
        Experiment<T, E> experiment = condition
                ? Experiment.of(fullName(name, experimentType), whenTrue, whenFalse).candidateNamed(WHEN_FALSE)
                : Experiment.of(fullName(name, experimentType), whenFalse, whenTrue).candidateNamed(WHEN_TRUE);
        return executor.execute(experiment.withContext(context), percentage,
                conditionContext(condition, experimentType, extraContext), sinkFor(name));
    }

    private <T> CompletableFuture<T> runConditionalAsync(String name,
                                                         boolean condition,
                                                         Supplier<? extends CompletionStage<T>> whenTrue,
                                                         Supplier<? extends CompletionStage<T>> whenFalse,
                                                         String experimentType,
                                                         Map<String, ContextValue> context,
                                                         int percentage,
                                                         Map<String, ContextValue> extraContext) {
        AsyncExperiment<T> experiment = condition
                ? AsyncExperiment.of(fullName(name, experimentType), whenTrue, whenFalse).candidateNamed(WHEN_FALSE)
                : AsyncExperiment.of(fullName(name, experimentType), whenFalse, whenTrue).candidateNamed(WHEN_TRUE);
        return executor.executeAsync(experiment.withContext(context), percentage,
                conditionContext(condition, experimentType, extraContext), sinkFor(name));
    }

    private int currentPercentage(String name) {
        try {
            return settings.percentage();
        } catch (RuntimeException e) {
            log.warn("Could not read rollout percentage for experiment [{}], recording 0: {}", name, e.toString());
            return 0;
        }
    }

    /**
     * Returns the sink for this call. An unreadable publish switch publishes nothing.
     */
    private ResultSink sinkFor(String name) {
        try {
            return settings.shouldPublishResults() ? sink : ResultSink.noOp();
        } catch (RuntimeException e) {
            log.warn("Could not read publish switch for experiment [{}], publishing nothing: {}", name, e.toString());
            return ResultSink.noOp();
        }
    }

    private static String fullName(String name, String experimentType) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(experimentType, "experimentType must not be null");
        return name + "_" + experimentType;
    }

    private static Map<String, ContextValue> conditionContext(boolean condition,
                                                              String experimentType,
                                                              Map<String, ContextValue> extraContext) {
        Map<String, ContextValue> context = new LinkedHashMap<>();
        context.put(ContextKeys.CONDITION_VALUE, ContextValue.of(condition));
        context.put(ContextKeys.EXPERIMENT_TYPE, ContextValue.of(experimentType));
        context.putAll(extraContext);
        return context;
    }

    private static Map<String, ContextValue> rolloutContext(long subjectId, boolean inRolloutGroup) {
        return Map.of(
                ContextKeys.SUBJECT_ID, ContextValue.of(subjectId),
                ContextKeys.IN_ROLLOUT_GROUP, ContextValue.of(inRolloutGroup));
    }
}
