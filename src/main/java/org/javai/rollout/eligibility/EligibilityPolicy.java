package org.javai.rollout.eligibility;

import org.javai.rollout.Verdict;
import org.javai.rollout.bucketing.Bucketing;
import org.javai.rollout.config.EligibilityConfig;
import org.javai.rollout.config.RolloutConfig;
import org.javai.rollout.config.RolloutSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decides whether a subject takes part in the comparison.
 *
 * <p>Evaluation short-circuits on the first failure:
 * <ol>
 *   <li>rollout disabled: ineligible</li>
 *   <li>criteria validation inactive: eligible iff the subject is inside the percentage</li>
 *   <li>otherwise the percentage gate, then the functional criteria, and when multiple
 *       criteria are enabled also the behavioral and contextual criteria</li>
 * </ol>
 *
 * <p>Configuration is re-read on every call. Any error raised while evaluating is
 * logged and turned into an ineligible verdict: a broken dependency never switches
 * an untested code path on.
 */
public class EligibilityPolicy {

    private static final Logger log = LoggerFactory.getLogger(EligibilityPolicy.class);

    private final RolloutSettings settings;
    private final Criterion functional;
    private final Criterion behavioral;
    private final Criterion contextual;

    public EligibilityPolicy(RolloutSettings settings,
                             Criterion functional,
                             Criterion behavioral,
                             Criterion contextual) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.functional = Objects.requireNonNull(functional, "functional must not be null");
        this.behavioral = Objects.requireNonNull(behavioral, "behavioral must not be null");
        this.contextual = Objects.requireNonNull(contextual, "contextual must not be null");
    }

    /**
     * Creates a policy with the standard criteria and the given external eligibility service.
     */
    public static EligibilityPolicy standard(RolloutSettings settings, ExternalEligibility external) {
        return new EligibilityPolicy(settings,
                new FunctionalCriteria(external),
                BehavioralCriteria.standard(),
                new ContextualCriteria());
    }

    public Verdict evaluate(EligibilityCriteria criteria) {
        Objects.requireNonNull(criteria, "criteria must not be null");
        try {
            return evaluateUnguarded(criteria);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.error("Eligibility evaluation failed for subject {}", criteria.subjectId(), t);
            return Verdict.ineligible("evaluation error: " + t.getMessage());
        }
    }

    private Verdict evaluateUnguarded(EligibilityCriteria criteria) {
        RolloutConfig rollout = settings.rolloutConfig();
        if (!rollout.enabled()) {
            return Verdict.ineligible("rollout disabled");
        }

        EligibilityConfig config = settings.eligibilityConfig();
        boolean inBucket = Bucketing.inBucket(criteria.subjectId(), rollout.percentage());

        if (!config.criteriaValidationActive()) {
            return inBucket
                    ? Verdict.eligible("within " + rollout.percentage() + "% rollout, no criteria validation")
                    : Verdict.ineligible("outside " + rollout.percentage() + "% rollout");
        }

        if (!inBucket) {
            return Verdict.ineligible("outside " + rollout.percentage() + "% rollout");
        }

        Verdict verdict = functional.evaluate(criteria, config);
        if (!verdict.eligible() || !config.multipleCriteriaEnabled()) {
            return verdict;
        }

        verdict = behavioral.evaluate(criteria, config);
        if (!verdict.eligible()) {
            return verdict;
        }

        verdict = contextual.evaluate(criteria, config);
        if (!verdict.eligible()) {
            return verdict;
        }

        return Verdict.eligible("all criteria met");
    }
}
