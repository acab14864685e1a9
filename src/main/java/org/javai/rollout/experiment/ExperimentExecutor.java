package org.javai.rollout.experiment;

import org.javai.rollout.ComparisonResult;
import org.javai.rollout.ContextKeys;
import org.javai.rollout.ContextValue;
import org.javai.rollout.Observation;
import org.javai.rollout.Outcome;
import org.javai.rollout.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Runs both code paths of an experiment, compares them and publishes the comparison.
 *
 * <p>This is the machinery shared by {@link ExperimentRunner} and {@link ConditionalRunner};
 * the runners decide whether an experiment runs at all and which context it carries.
 *
 * <p>Rules applied on every execution:
 * <ul>
 *   <li>The control runs first, then the candidate. Both complete before comparison.</li>
 *   <li>The caller always receives the control's value, or the control's exception
 *       (the same instance) after the comparison has been published.</li>
 *   <li>Candidate failures of any kind except {@link VirtualMachineError} are captured
 *       on the candidate observation and never propagated.</li>
 *   <li>A throwing comparator counts as a mismatch. A throwing cleaner replaces the
 *       published value with the cleaner's error.</li>
 *   <li>A throwing sink is logged and ignored.</li>
 * </ul>
 */
public class ExperimentExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExperimentExecutor.class);

    private final Clock clock;
    private final LongSupplier nanoTime;

    public ExperimentExecutor() {
        this(Clock.systemUTC(), System::nanoTime);
    }

    /**
     * Creates an executor with explicit time sources. Useful for testing.
     *
     * @param clock supplies the {@code timestamp} context value
     * @param nanoTime monotonic time source used to measure durations
     */
    public ExperimentExecutor(Clock clock, LongSupplier nanoTime) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime must not be null");
    }

    /**
     * Runs the control alone, with no measurement and no publication.
     */
    public <T, E extends Exception> T controlOnly(Experiment<T, E> experiment) throws E {
        return experiment.control().get();
    }

    /**
     * Starts the control alone, with no measurement and no publication.
     */
    public <T> CompletableFuture<T> controlOnly(AsyncExperiment<T> experiment) {
        return start(experiment.control());
    }

    /**
     * Runs both code paths and publishes the comparison to {@code sink}.
     *
     * @param experiment the experiment to run
     * @param percentage the rollout percentage recorded in the context
     * @param engineContext extra engine context, e.g. subject or condition
     * @param sink where the comparison goes
     * @return the control's value
     * @throws E the exception the control threw
     */
    public <T, E extends Exception> T execute(Experiment<T, E> experiment,
                                              int percentage,
                                              Map<String, ContextValue> engineContext,
                                              ResultSink sink) throws E {
        Observation<T> control = observeControl(experiment.control());
        Observation<T> candidate = observeCandidate(experiment.candidateName(), experiment.candidate());

        publish(experiment.name(), control, candidate, experiment.comparator(), experiment.cleaner(),
                contexts(percentage, engineContext, experiment.context()), sink);

        return ExperimentExecutor.<T, E>valueOrRethrow(control);
    }

    /**
     * Starts both code paths and publishes the comparison to {@code sink} once both have
     * completed. The returned future completes like the control's stage.
     *
     * <p>Cancelling the returned future cancels the candidate's future. The candidate's
     * cancellation is never surfaced to the caller.
     */
    public <T> CompletableFuture<T> executeAsync(AsyncExperiment<T> experiment,
                                                 int percentage,
                                                 Map<String, ContextValue> engineContext,
                                                 ResultSink sink) {
        Map<String, ContextValue> contexts = contexts(percentage, engineContext, experiment.context());

        long controlStart = nanoTime.getAsLong();
        CompletableFuture<T> controlFuture = start(experiment.control());
        CompletableFuture<Observation<T>> controlObservation =
                controlFuture.handle((value, error) -> observed(Observation.CONTROL, value, error, controlStart));

        long candidateStart = nanoTime.getAsLong();
        CompletableFuture<T> candidateFuture = startCandidate(experiment.candidateName(), experiment.candidate());
        CompletableFuture<Observation<T>> candidateObservation =
                candidateFuture.handle((value, error) -> observed(experiment.candidateName(), value, error, candidateStart));

        CompletableFuture<T> result = new CompletableFuture<>();
        controlObservation.thenCombine(candidateObservation, (control, candidate) -> {
            publish(experiment.name(), control, candidate, experiment.comparator(), experiment.cleaner(),
                    contexts, sink);
            return control;
        }).whenComplete((control, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else if (control.outcome() instanceof Outcome.Fail<T> fail) {
                result.completeExceptionally(fail.error());
            } else {
                result.complete(control.value());
            }
        });

        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                candidateFuture.cancel(true);
            }
        });
        return result;
    }

    private <T, E extends Exception> Observation<T> observeControl(ThrowingSupplier<T, E> control) {
        long start = nanoTime.getAsLong();
        try {
            T value = control.get();
            return Observation.success(Observation.CONTROL, value, elapsedSince(start));
        } catch (Exception e) {
            return Observation.failure(Observation.CONTROL, e, elapsedSince(start));
        }
    }

    private <T> Observation<T> observeCandidate(String name, ThrowingSupplier<T, ? extends Exception> candidate) {
        long start = nanoTime.getAsLong();
        try {
            T value = candidate.get();
            return Observation.success(name, value, elapsedSince(start));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.debug("Candidate [{}] failed: {}", name, t.toString());
            return Observation.failure(name, t, elapsedSince(start));
        }
    }

    private <T> Observation<T> observed(String name, T value, Throwable error, long start) {
        long elapsed = elapsedSince(start);
        return error == null
                ? Observation.success(name, value, elapsed)
                : Observation.failure(name, unwrap(error), elapsed);
    }

    @SuppressWarnings("unchecked")
    private static <T, E extends Exception> T valueOrRethrow(Observation<T> control) throws E {
        if (control.outcome() instanceof Outcome.Fail<T> fail) {
            Throwable error = fail.error();
            if (error instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw (E) error;
        }
        return control.value();
    }

    private <T> void publish(String experimentName,
                             Observation<T> control,
                             Observation<T> candidate,
                             ObservationComparator<T> comparator,
                             Function<? super T, ?> cleaner,
                             Map<String, ContextValue> contexts,
                             ResultSink sink) {
        boolean matched = compare(experimentName, comparator, control, candidate);
        ComparisonResult result = new ComparisonResult(
                experimentName,
                clean(experimentName, control, cleaner),
                List.of(clean(experimentName, candidate, cleaner)),
                matched,
                contexts);
        try {
            sink.publish(result);
        } catch (Exception e) {
            log.warn("ResultSink failed to publish experiment [{}]: {}", experimentName, e.getMessage());
        }
    }

    private static <T> boolean compare(String experimentName,
                                       ObservationComparator<T> comparator,
                                       Observation<T> control,
                                       Observation<T> candidate) {
        try {
            return comparator.matches(control, candidate);
        } catch (Exception e) {
            log.warn("Comparator of experiment [{}] failed, recording a mismatch: {}", experimentName, e.toString());
            return false;
        }
    }

    private static <T> Observation<Object> clean(String experimentName,
                                                 Observation<T> observation,
                                                 Function<? super T, ?> cleaner) {
        try {
            return observation.map(cleaner);
        } catch (Exception e) {
            log.warn("Cleaner of experiment [{}] failed on [{}]: {}", experimentName, observation.name(), e.toString());
            return new Observation<>(observation.name(), Outcome.fail(e), observation.durationNanos());
        }
    }

    private Map<String, ContextValue> contexts(int percentage,
                                               Map<String, ContextValue> engineContext,
                                               Map<String, ContextValue> callerContext) {
        Map<String, ContextValue> contexts = new LinkedHashMap<>();
        contexts.put(ContextKeys.TIMESTAMP, ContextValue.of(clock.instant()));
        contexts.put(ContextKeys.ROLLOUT_PERCENTAGE, ContextValue.of(percentage));
        if (engineContext != null) {
            contexts.putAll(engineContext);
        }
        if (callerContext != null) {
            callerContext.forEach(contexts::putIfAbsent);
        }
        return contexts;
    }

    private long elapsedSince(long start) {
        return Math.max(0L, nanoTime.getAsLong() - start);
    }

    private static <T> CompletableFuture<T> start(Supplier<? extends CompletionStage<T>> supplier) {
        try {
            CompletionStage<T> stage = supplier.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new NullPointerException("supplier returned a null stage"));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Starts the candidate like {@link #start}, but contains anything it throws except a
     * {@link VirtualMachineError}, matching {@link #observeCandidate}.
     */
    private static <T> CompletableFuture<T> startCandidate(String name, Supplier<? extends CompletionStage<T>> supplier) {
        try {
            return start(supplier);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.debug("Candidate [{}] failed to start: {}", name, t.toString());
            return CompletableFuture.failedFuture(t);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
