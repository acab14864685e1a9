package org.javai.rollout.eligibility;

import org.javai.rollout.ContextValue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable snapshot of the subject a request is made for, built fresh per call.
 *
 * @param subjectId the subject whose id seeds bucketing
 * @param subjectType the subject's type (e.g. "Premium"), may be null
 * @param groups the groups the subject belongs to
 * @param behavioralAttributes what the subject has done (e.g. purchase history)
 * @param contextualAttributes where and how the request is made (region, allowlist id, external check flag)
 */
public record EligibilityCriteria(
        long subjectId,
        String subjectType,
        Set<String> groups,
        Map<String, ContextValue> behavioralAttributes,
        Map<String, ContextValue> contextualAttributes
) {

    /** Contextual attribute holding an identifier checked against the allowlist. */
    public static final String ALLOWLIST_ID = "allowlist_id";

    /** Contextual attribute requesting a check with the external eligibility service. */
    public static final String CHECK_EXTERNAL = "check_external";

    /** Contextual attribute holding the subject's region. */
    public static final String REGION = "region";

    /** Behavioral attribute flagging that the subject has purchase history. */
    public static final String PURCHASE_HISTORY = "purchase_history";

    public EligibilityCriteria {
        groups = groups == null ? Set.of() : Set.copyOf(groups);
        behavioralAttributes = behavioralAttributes == null ? Map.of() : Map.copyOf(behavioralAttributes);
        contextualAttributes = contextualAttributes == null ? Map.of() : Map.copyOf(contextualAttributes);
    }

    public static EligibilityCriteria forSubject(long subjectId) {
        return builder(subjectId).build();
    }

    public static Builder builder(long subjectId) {
        return new Builder(subjectId);
    }

    public Optional<ContextValue> behavioral(String attribute) {
        return Optional.ofNullable(behavioralAttributes.get(attribute));
    }

    public Optional<ContextValue> contextual(String attribute) {
        return Optional.ofNullable(contextualAttributes.get(attribute));
    }

    public static final class Builder {
        private final long subjectId;
        private String subjectType;
        private Set<String> groups = Set.of();
        private final Map<String, ContextValue> behavioral = new HashMap<>();
        private final Map<String, ContextValue> contextual = new HashMap<>();

        private Builder(long subjectId) {
            this.subjectId = subjectId;
        }

        public Builder subjectType(String subjectType) {
            this.subjectType = subjectType;
            return this;
        }

        public Builder groups(String... groups) {
            this.groups = Set.copyOf(Arrays.asList(groups));
            return this;
        }

        public Builder behavioral(String attribute, Object value) {
            behavioral.put(Objects.requireNonNull(attribute), ContextValue.of(value));
            return this;
        }

        public Builder contextual(String attribute, Object value) {
            contextual.put(Objects.requireNonNull(attribute), ContextValue.of(value));
            return this;
        }

        public Builder allowlistId(String identifier) {
            return contextual(ALLOWLIST_ID, identifier);
        }

        public Builder checkExternal(boolean check) {
            return contextual(CHECK_EXTERNAL, check);
        }

        public Builder region(String region) {
            return contextual(REGION, region);
        }

        public EligibilityCriteria build() {
            return new EligibilityCriteria(subjectId, subjectType, groups, behavioral, contextual);
        }
    }
}
