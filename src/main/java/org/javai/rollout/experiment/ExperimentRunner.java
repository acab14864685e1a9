package org.javai.rollout.experiment;

import org.javai.rollout.ContextKeys;
import org.javai.rollout.ContextValue;
import org.javai.rollout.Verdict;
import org.javai.rollout.bucketing.Bucketing;
import org.javai.rollout.bucketing.Sampler;
import org.javai.rollout.config.RolloutConfig;
import org.javai.rollout.config.RolloutSettings;
import org.javai.rollout.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a candidate in the shadow of a trusted control when the rollout admits the call.
 *
 * <p>Every call re-reads the rollout configuration. When the rollout is disabled, or the
 * call falls outside the rollout percentage, only the control runs and its value is
 * returned directly: the candidate is never invoked and nothing is published. The same
 * holds when the configuration cannot be read.
 * Otherwise both run and their comparison goes to the sink, unless publishing is
 * switched off, in which case the comparison is computed and dropped.
 *
 * <p>Three gates are available:
 * <ul>
 *   <li>{@link #run(Experiment)} samples calls with no regard to the caller</li>
 *   <li>{@link #runFor(long, Experiment)} buckets by subject, so a subject consistently
 *       lands in or out of the rollout</li>
 *   <li>{@link #runWith(Verdict, long, Experiment)} additionally requires an eligible
 *       verdict from an {@link org.javai.rollout.eligibility.EligibilityPolicy}</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * ExperimentRunner runner = new ExperimentRunner(settings, new Log4jResultSink());
 *
 * Receipt receipt = runner.runFor(customerId, Experiment.of("checkout",
 *     () -> legacyCheckout.submit(order),
 *     () -> newCheckout.submit(order)));
 * }</pre>
 */
public class ExperimentRunner {

    private static final Logger log = LoggerFactory.getLogger(ExperimentRunner.class);

    private static final RolloutConfig UNREADABLE = new RolloutConfig(false, 0, false);

    private final RolloutSettings settings;
    private final ResultSink sink;
    private final Sampler sampler;
    private final ExperimentExecutor executor;

    public ExperimentRunner(RolloutSettings settings, ResultSink sink) {
        this(settings, sink, Sampler.shared(), new ExperimentExecutor());
    }

    public ExperimentRunner(RolloutSettings settings, ResultSink sink, Sampler sampler, ExperimentExecutor executor) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Returns a runner sharing this runner's configuration but publishing to {@code sink}.
     */
    public ExperimentRunner withSink(ResultSink sink) {
        return new ExperimentRunner(settings, sink, sampler, executor);
    }

    public <T, E extends Exception> T run(String name,
                                          ThrowingSupplier<T, E> control,
                                          ThrowingSupplier<T, ? extends Exception> candidate) throws E {
        return run(Experiment.of(name, control, candidate));
    }

    public <T, E extends Exception> T run(String name,
                                          ThrowingSupplier<T, E> control,
                                          ThrowingSupplier<T, ? extends Exception> candidate,
                                          Map<String, ContextValue> context) throws E {
        return run(Experiment.of(name, control, candidate).withContext(context));
    }

    /**
     * Runs the experiment for a sampled share of calls.
     */
    public <T, E extends Exception> T run(Experiment<T, E> experiment) throws E {
        RolloutConfig config = currentConfig(experiment.name());
        if (!config.enabled() || !sampler.sample(config.percentage())) {
            return executor.controlOnly(experiment);
        }
        return executor.execute(experiment, config.percentage(), Map.of(), sinkFor(config));
    }

    /**
     * Runs the experiment when the subject's bucket falls within the rollout percentage.
     */
    public <T, E extends Exception> T runFor(long subjectId, Experiment<T, E> experiment) throws E {
        RolloutConfig config = currentConfig(experiment.name());
        if (!config.enabled() || !Bucketing.inBucket(subjectId, config.percentage())) {
            return executor.controlOnly(experiment);
        }
        return executor.execute(experiment, config.percentage(), subjectContext(subjectId), sinkFor(config));
    }

    /**
     * Runs the experiment when the verdict is eligible and the subject's bucket falls
     * within the rollout percentage. The rollout gate is re-checked because configuration
     * may have changed since the verdict was reached.
     */
    public <T, E extends Exception> T runWith(Verdict verdict, long subjectId, Experiment<T, E> experiment) throws E {
        Objects.requireNonNull(verdict, "verdict must not be null");
        if (!verdict.eligible()) {
            return executor.controlOnly(experiment);
        }
        return runFor(subjectId, experiment);
    }

    /**
     * Asynchronous form of {@link #run(Experiment)}.
     */
    public <T> CompletableFuture<T> runAsync(AsyncExperiment<T> experiment) {
        RolloutConfig config = currentConfig(experiment.name());
        if (!config.enabled() || !sampler.sample(config.percentage())) {
            return executor.controlOnly(experiment);
        }
        return executor.executeAsync(experiment, config.percentage(), Map.of(), sinkFor(config));
    }

    /**
     * Asynchronous form of {@link #runFor(long, Experiment)}.
     */
    public <T> CompletableFuture<T> runAsyncFor(long subjectId, AsyncExperiment<T> experiment) {
        RolloutConfig config = currentConfig(experiment.name());
        if (!config.enabled() || !Bucketing.inBucket(subjectId, config.percentage())) {
            return executor.controlOnly(experiment);
        }
        return executor.executeAsync(experiment, config.percentage(), subjectContext(subjectId), sinkFor(config));
    }

    /**
     * Asynchronous form of {@link #runWith(Verdict, long, Experiment)}.
     */
    public <T> CompletableFuture<T> runAsyncWith(Verdict verdict, long subjectId, AsyncExperiment<T> experiment) {
        Objects.requireNonNull(verdict, "verdict must not be null");
        if (!verdict.eligible()) {
            return executor.controlOnly(experiment);
        }
        return runAsyncFor(subjectId, experiment);
    }

    /**
     * Reads the rollout switches for one decision. An unreadable store disables the
     * rollout for this call, so the control still runs.
     */
    private RolloutConfig currentConfig(String experimentName) {
        try {
            return settings.rolloutConfig();
        } catch (RuntimeException e) {
            log.warn("Could not read rollout configuration for experiment [{}], running control only: {}",
                    experimentName, e.toString());
            return UNREADABLE;
        }
    }

    private ResultSink sinkFor(RolloutConfig config) {
        return config.publishResults() ? sink : ResultSink.noOp();
    }

    private static Map<String, ContextValue> subjectContext(long subjectId) {
        return Map.of(
                ContextKeys.SUBJECT_ID, ContextValue.of(subjectId),
                ContextKeys.IN_ROLLOUT_GROUP, ContextValue.of(true));
    }
}
