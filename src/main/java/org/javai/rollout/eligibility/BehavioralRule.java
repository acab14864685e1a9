package org.javai.rollout.eligibility;

import java.util.Objects;

/**
 * A predicate over what the subject has done.
 */
public interface BehavioralRule {

    /**
     * A stable name used in verdict reasons.
     */
    String name();

    /**
     * Returns whether the subject passes this rule.
     *
     * @throws IllegalArgumentException if an attribute holds a value of the wrong shape
     */
    boolean test(EligibilityCriteria criteria);

    /**
     * Requires the attribute to be true when present. An absent attribute passes.
     */
    static BehavioralRule trueWhenPresent(String attribute) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        return new BehavioralRule() {
            @Override
            public String name() {
                return attribute;
            }

            @Override
            public boolean test(EligibilityCriteria criteria) {
                return criteria.behavioral(attribute)
                        .map(value -> value.asBoolean())
                        .orElse(true);
            }
        };
    }

    /**
     * Requires the numeric attribute to be at least {@code threshold} when present.
     * Text values are parsed as numbers. An absent attribute passes.
     */
    static BehavioralRule atLeastWhenPresent(String attribute, double threshold) {
        Objects.requireNonNull(attribute, "attribute must not be null");
        return new BehavioralRule() {
            @Override
            public String name() {
                return attribute + ">=" + threshold;
            }

            @Override
            public boolean test(EligibilityCriteria criteria) {
                return criteria.behavioral(attribute)
                        .map(value -> Double.parseDouble(value.asText()) >= threshold)
                        .orElse(true);
            }
        };
    }
}
