package org.javai.rollout.eligibility;

/**
 * A synchronous oracle deciding whether an identifier may join the rollout,
 * typically backed by another service. Its answer is authoritative for the
 * external sub-check of the functional criteria.
 */
@FunctionalInterface
public interface ExternalEligibility {

    /**
     * @param normalizedIdentifier the identifier with every non-alphanumeric character removed
     * @param subjectId the subject making the request
     * @return true if the subject is eligible
     */
    boolean isEligible(String normalizedIdentifier, long subjectId);

    /**
     * An oracle that rejects everyone. The default when no service is wired in,
     * so a requested external check never admits a subject by accident.
     */
    static ExternalEligibility denyAll() {
        return (identifier, subjectId) -> false;
    }
}
