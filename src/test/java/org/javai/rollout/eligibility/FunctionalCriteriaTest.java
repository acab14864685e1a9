package org.javai.rollout.eligibility;

import org.javai.rollout.Verdict;
import org.javai.rollout.config.EligibilityConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FunctionalCriteriaTest {

    private List<String> externalCalls;
    private boolean externalAnswer;
    private FunctionalCriteria criteria;

    @BeforeEach
    void setUp() {
        externalCalls = new ArrayList<>();
        externalAnswer = true;
        criteria = new FunctionalCriteria((identifier, subjectId) -> {
            externalCalls.add(identifier + "/" + subjectId);
            return externalAnswer;
        });
    }

    @Test
    void emptyConfig_passes() {
        Verdict verdict = criteria.evaluate(EligibilityCriteria.forSubject(1), EligibilityConfig.percentageOnly());

        assertThat(verdict.eligible()).isTrue();
        assertThat(verdict.reason()).isEqualTo("functional criteria met");
    }

    @Test
    void subjectType_matchedCaseInsensitively() {
        EligibilityConfig config = EligibilityConfig.builder().allowedSubjectTypes("Premium").build();

        assertThat(criteria.evaluate(EligibilityCriteria.builder(1).subjectType("PREMIUM").build(), config).eligible())
                .isTrue();
        assertThat(criteria.evaluate(EligibilityCriteria.builder(1).subjectType("Basic").build(), config))
                .isEqualTo(Verdict.ineligible("subject type not allowed: Basic"));
    }

    @Test
    void subjectType_missing_failsWhenTypesConfigured() {
        EligibilityConfig config = EligibilityConfig.builder().allowedSubjectTypes("Premium").build();

        assertThat(criteria.evaluate(EligibilityCriteria.forSubject(1), config).eligible()).isFalse();
    }

    @Test
    void groups_requireOneAllowedGroup() {
        EligibilityConfig config = EligibilityConfig.builder().allowedGroups("beta").build();

        assertThat(criteria.evaluate(EligibilityCriteria.builder(1).groups("staff", "BETA").build(), config).eligible())
                .isTrue();
        assertThat(criteria.evaluate(EligibilityCriteria.builder(1).groups("staff").build(), config).reason())
                .isEqualTo("subject belongs to no allowed group");
        assertThat(criteria.evaluate(EligibilityCriteria.forSubject(1), config).eligible()).isFalse();
    }

    @Test
    void allowlist_identifierNormalizedBeforeLookup() {
        EligibilityConfig config = EligibilityConfig.builder().allowedAllowlistIds("12345678909").build();

        Verdict verdict = criteria.evaluate(
                EligibilityCriteria.builder(1).allowlistId("123.456.789-09").build(), config);

        assertThat(verdict.eligible()).isTrue();
    }

    @Test
    void allowlist_unknownIdentifier_fails() {
        EligibilityConfig config = EligibilityConfig.builder().allowedAllowlistIds("12345678909").build();

        Verdict verdict = criteria.evaluate(EligibilityCriteria.builder(1).allowlistId("999").build(), config);

        assertThat(verdict).isEqualTo(Verdict.ineligible("identifier not in allowlist"));
    }

    @Test
    void allowlist_listedIdentifierWithoutExternalCheck_neverCallsExternal() {
        EligibilityConfig config = EligibilityConfig.builder().allowedAllowlistIds("12345678909").build();

        Verdict verdict = criteria.evaluate(
                EligibilityCriteria.builder(1).allowlistId("123.456.789-09").checkExternal(false).build(), config);

        assertThat(verdict.eligible()).isTrue();
        assertThat(externalCalls).isEmpty();
    }

    @Test
    void externalCheck_passesNormalizedIdentifierAndSubject() {
        Verdict verdict = criteria.evaluate(
                EligibilityCriteria.builder(42).allowlistId("12.34").checkExternal(true).build(),
                EligibilityConfig.percentageOnly());

        assertThat(verdict).isEqualTo(Verdict.eligible("external eligibility confirmed"));
        assertThat(externalCalls).containsExactly("1234/42");
    }

    @Test
    void externalCheck_denied_fails() {
        externalAnswer = false;

        Verdict verdict = criteria.evaluate(
                EligibilityCriteria.builder(42).allowlistId("1234").checkExternal(true).build(),
                EligibilityConfig.percentageOnly());

        assertThat(verdict).isEqualTo(Verdict.ineligible("external eligibility denied"));
    }

    @Test
    void externalCheck_withoutIdentifier_failsWithoutCalling() {
        Verdict verdict = criteria.evaluate(
                EligibilityCriteria.builder(42).allowlistId(" .- ").checkExternal(true).build(),
                EligibilityConfig.percentageOnly());

        assertThat(verdict).isEqualTo(Verdict.ineligible("external check failed: no identifier"));
        assertThat(externalCalls).isEmpty();
    }

    @Test
    void externalCheck_textFlagAccepted() {
        Verdict verdict = criteria.evaluate(
                EligibilityCriteria.builder(42).allowlistId("1234").contextual(EligibilityCriteria.CHECK_EXTERNAL, "true").build(),
                EligibilityConfig.percentageOnly());

        assertThat(externalCalls).hasSize(1);
        assertThat(verdict.eligible()).isTrue();
    }
}
