package org.javai.rollout.eligibility;

import org.javai.rollout.ContextValue;
import org.javai.rollout.Verdict;
import org.javai.rollout.config.EligibilityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Who the subject is: subject type, group membership, identifier allowlist and the
 * external eligibility service.
 *
 * <p>Checks run in that order and stop at the first failure. The external service is
 * only consulted when the request carries {@link EligibilityCriteria#CHECK_EXTERNAL};
 * a request that asks for the check but has no identifier fails it.
 */
public class FunctionalCriteria implements Criterion {

    private static final Logger log = LoggerFactory.getLogger(FunctionalCriteria.class);

    private final ExternalEligibility external;

    public FunctionalCriteria(ExternalEligibility external) {
        this.external = Objects.requireNonNull(external, "external must not be null");
    }

    @Override
    public Verdict evaluate(EligibilityCriteria criteria, EligibilityConfig config) {
        if (!config.allowedSubjectTypes().isEmpty()
                && (criteria.subjectType() == null || !config.allowedSubjectTypes().contains(criteria.subjectType()))) {
            return Verdict.ineligible("subject type not allowed: " + criteria.subjectType());
        }

        if (!config.allowedGroups().isEmpty()
                && criteria.groups().stream().noneMatch(config.allowedGroups()::contains)) {
            return Verdict.ineligible("subject belongs to no allowed group");
        }

        Optional<String> identifier = criteria.contextual(EligibilityCriteria.ALLOWLIST_ID)
                .map(ContextValue::asText)
                .map(EligibilityConfig::normalizeIdentifier)
                .filter(id -> !id.isEmpty());

        if (identifier.isPresent()
                && !config.allowedAllowlistIds().isEmpty()
                && !config.allowedAllowlistIds().contains(identifier.get())) {
            return Verdict.ineligible("identifier not in allowlist");
        }

        boolean checkExternal = criteria.contextual(EligibilityCriteria.CHECK_EXTERNAL)
                .map(ContextValue::asBoolean)
                .orElse(false);
        if (checkExternal) {
            return checkExternally(identifier, criteria.subjectId());
        }

        return Verdict.eligible("functional criteria met");
    }

    private Verdict checkExternally(Optional<String> identifier, long subjectId) {
        if (identifier.isEmpty()) {
            return Verdict.ineligible("external check failed: no identifier");
        }
        boolean eligible = external.isEligible(identifier.get(), subjectId);
        log.debug("External eligibility for subject {}: {}", subjectId, eligible);
        return eligible
                ? Verdict.eligible("external eligibility confirmed")
                : Verdict.ineligible("external eligibility denied");
    }
}
