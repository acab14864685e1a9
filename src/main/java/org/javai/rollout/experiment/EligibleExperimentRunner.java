package org.javai.rollout.experiment;

import org.javai.rollout.ContextKeys;
import org.javai.rollout.ContextValue;
import org.javai.rollout.Verdict;
import org.javai.rollout.eligibility.EligibilityCriteria;
import org.javai.rollout.eligibility.EligibilityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Evaluates the eligibility policy for a subject and runs the experiment only when the
 * subject is eligible. Ineligible subjects get the control alone.
 *
 * <p>Comparison records of eligible runs carry the subject's details: its id and type,
 * whether behavioral or contextual data was present, and the verdict's reason.
 *
 * <pre>{@code
 * EligibleExperimentRunner eligible = new EligibleExperimentRunner(policy, runner);
 *
 * Document document = eligible.run(
 *     EligibilityCriteria.builder(customerId).subjectType("Premium").region("EU").build(),
 *     Experiment.of("document-validation", () -> legacy.validate(doc), () -> validator.validate(doc)));
 * }</pre>
 */
public class EligibleExperimentRunner {

    private static final Logger log = LoggerFactory.getLogger(EligibleExperimentRunner.class);

    private final EligibilityPolicy policy;
    private final ExperimentRunner runner;

    public EligibleExperimentRunner(EligibilityPolicy policy, ExperimentRunner runner) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    public <T, E extends Exception> T run(EligibilityCriteria criteria, Experiment<T, E> experiment) throws E {
        Verdict verdict = policy.evaluate(criteria);
        log.debug("Subject {} for experiment [{}]: {}", criteria.subjectId(), experiment.name(), verdict);
        return runner.runWith(verdict, criteria.subjectId(), experiment.withContext(details(criteria, verdict)));
    }

    public <T> CompletableFuture<T> runAsync(EligibilityCriteria criteria, AsyncExperiment<T> experiment) {
        Verdict verdict = policy.evaluate(criteria);
        log.debug("Subject {} for experiment [{}]: {}", criteria.subjectId(), experiment.name(), verdict);
        return runner.runAsyncWith(verdict, criteria.subjectId(), experiment.withContext(details(criteria, verdict)));
    }

    private static Map<String, ContextValue> details(EligibilityCriteria criteria, Verdict verdict) {
        Map<String, ContextValue> details = new LinkedHashMap<>();
        if (criteria.subjectType() != null) {
            details.put(ContextKeys.SUBJECT_TYPE, ContextValue.of(criteria.subjectType()));
        }
        details.put(ContextKeys.HAS_BEHAVIORAL_DATA, ContextValue.of(!criteria.behavioralAttributes().isEmpty()));
        details.put(ContextKeys.HAS_CONTEXTUAL_DATA, ContextValue.of(!criteria.contextualAttributes().isEmpty()));
        details.put(ContextKeys.VERDICT_REASON, ContextValue.of(verdict.reason()));
        return details;
    }
}
