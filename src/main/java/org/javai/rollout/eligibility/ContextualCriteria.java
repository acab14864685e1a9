package org.javai.rollout.eligibility;

import org.javai.rollout.ContextValue;
import org.javai.rollout.Verdict;
import org.javai.rollout.config.EligibilityConfig;

import java.util.Optional;

/**
 * Where the request comes from. A request without a region, or a policy without
 * allowed regions, passes.
 */
public class ContextualCriteria implements Criterion {

    @Override
    public Verdict evaluate(EligibilityCriteria criteria, EligibilityConfig config) {
        Optional<String> region = criteria.contextual(EligibilityCriteria.REGION)
                .map(ContextValue::asText)
                .map(String::trim)
                .filter(r -> !r.isEmpty());

        if (region.isPresent()
                && !config.allowedRegions().isEmpty()
                && !config.allowedRegions().contains(region.get())) {
            return Verdict.ineligible("region not allowed: " + region.get());
        }
        return Verdict.eligible("contextual criteria met");
    }
}
