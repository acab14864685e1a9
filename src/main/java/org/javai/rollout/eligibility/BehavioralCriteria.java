package org.javai.rollout.eligibility;

import org.javai.rollout.Verdict;
import org.javai.rollout.config.EligibilityConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * What the subject has done. Every rule must pass; rules run in the order they were added.
 *
 * <pre>{@code
 * BehavioralCriteria criteria = BehavioralCriteria.standard()
 *     .and(BehavioralRule.atLeastWhenPresent("account_age_days", 30));
 * }</pre>
 */
public final class BehavioralCriteria implements Criterion {

    private final List<BehavioralRule> rules;

    private BehavioralCriteria(List<BehavioralRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Requires {@link EligibilityCriteria#PURCHASE_HISTORY} to be true when present.
     */
    public static BehavioralCriteria standard() {
        return new BehavioralCriteria(List.of(BehavioralRule.trueWhenPresent(EligibilityCriteria.PURCHASE_HISTORY)));
    }

    public static BehavioralCriteria of(BehavioralRule... rules) {
        return new BehavioralCriteria(List.of(rules));
    }

    /**
     * Returns criteria with one more rule appended.
     */
    public BehavioralCriteria and(BehavioralRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        List<BehavioralRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new BehavioralCriteria(extended);
    }

    public List<BehavioralRule> rules() {
        return rules;
    }

    @Override
    public Verdict evaluate(EligibilityCriteria criteria, EligibilityConfig config) {
        for (BehavioralRule rule : rules) {
            if (!rule.test(criteria)) {
                return Verdict.ineligible("behavioral rule failed: " + rule.name());
            }
        }
        return Verdict.eligible("behavioral criteria met");
    }
}
