package org.javai.rollout.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A snapshot of the layered eligibility policy as read for one evaluation.
 *
 * <p>All sets compare case-insensitively. Allowlist identifiers are stored normalized
 * (see {@link #normalizeIdentifier(String)}).
 *
 * @param criteriaValidationActive when false only the percentage gate applies
 * @param multipleCriteriaEnabled when true functional, behavioral and contextual criteria must all pass
 * @param allowedSubjectTypes subject types admitted; empty admits all
 * @param allowedAllowlistIds identifiers admitted; empty admits all
 * @param allowedRegions regions admitted; empty admits all
 * @param allowedGroups groups of which a subject must belong to at least one; empty admits all
 */
public record EligibilityConfig(
        boolean criteriaValidationActive,
        boolean multipleCriteriaEnabled,
        Set<String> allowedSubjectTypes,
        Set<String> allowedAllowlistIds,
        Set<String> allowedRegions,
        Set<String> allowedGroups
) {

    public EligibilityConfig {
        allowedSubjectTypes = caseInsensitive(allowedSubjectTypes);
        allowedAllowlistIds = caseInsensitive(normalized(allowedAllowlistIds));
        allowedRegions = caseInsensitive(allowedRegions);
        allowedGroups = caseInsensitive(allowedGroups);
    }

    /**
     * A configuration with criteria validation switched off and no allowlists.
     */
    public static EligibilityConfig percentageOnly() {
        return new EligibilityConfig(false, false, Set.of(), Set.of(), Set.of(), Set.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Strips every character that is not a letter or digit, e.g. {@code "123.456.789-09"}
     * becomes {@code "12345678909"}. Returns an empty string for null.
     */
    public static String normalizeIdentifier(String identifier) {
        if (identifier == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(identifier.length());
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static Collection<String> normalized(Collection<String> identifiers) {
        if (identifiers == null) {
            return null;
        }
        return identifiers.stream()
                .map(EligibilityConfig::normalizeIdentifier)
                .toList();
    }

    private static Set<String> caseInsensitive(Collection<String> values) {
        TreeSet<String> set = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    set.add(value.trim());
                }
            }
        }
        return Collections.unmodifiableSet(set);
    }

    public static final class Builder {
        private boolean criteriaValidationActive;
        private boolean multipleCriteriaEnabled;
        private Set<String> allowedSubjectTypes = Set.of();
        private Set<String> allowedAllowlistIds = Set.of();
        private Set<String> allowedRegions = Set.of();
        private Set<String> allowedGroups = Set.of();

        private Builder() {}

        public Builder criteriaValidationActive(boolean active) {
            this.criteriaValidationActive = active;
            return this;
        }

        public Builder multipleCriteriaEnabled(boolean enabled) {
            this.multipleCriteriaEnabled = enabled;
            return this;
        }

        public Builder allowedSubjectTypes(String... types) {
            this.allowedSubjectTypes = Set.copyOf(Arrays.asList(types));
            return this;
        }

        public Builder allowedAllowlistIds(String... ids) {
            this.allowedAllowlistIds = Set.copyOf(Arrays.asList(ids));
            return this;
        }

        public Builder allowedRegions(String... regions) {
            this.allowedRegions = Set.copyOf(Arrays.asList(regions));
            return this;
        }

        public Builder allowedGroups(String... groups) {
            this.allowedGroups = Set.copyOf(Arrays.asList(groups));
            return this;
        }

        public EligibilityConfig build() {
            return new EligibilityConfig(criteriaValidationActive, multipleCriteriaEnabled,
                    allowedSubjectTypes, allowedAllowlistIds, allowedRegions, allowedGroups);
        }
    }
}
