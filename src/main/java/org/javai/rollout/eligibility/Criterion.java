package org.javai.rollout.eligibility;

import org.javai.rollout.Verdict;
import org.javai.rollout.config.EligibilityConfig;

/**
 * One layer of the eligibility policy.
 * Implementations may throw; the policy converts any error into an ineligible verdict.
 */
@FunctionalInterface
public interface Criterion {

    Verdict evaluate(EligibilityCriteria criteria, EligibilityConfig config);
}
