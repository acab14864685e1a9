package org.javai.rollout.config;

/**
 * Keys read and written in the shared configuration store.
 */
public final class ConfigKeys {

    private ConfigKeys() {
        // Constants
    }

    public static final String ROLLOUT_ENABLED = "rollout:enabled";
    public static final String ROLLOUT_PERCENTAGE = "rollout:percentage";
    public static final String PUBLISH_RESULTS = "rollout:publish_results";

    public static final String CRITERIA_ACTIVE = "rollout:criteria_active";
    public static final String MULTIPLE_CRITERIA = "rollout:multiple_criteria";
    public static final String ALLOWED_SUBJECT_TYPES = "rollout:subject_types";
    public static final String ALLOWED_ALLOWLIST_IDS = "rollout:allowlist_ids";
    public static final String ALLOWED_REGIONS = "rollout:allowed_regions";
    public static final String ALLOWED_GROUPS = "rollout:allowed_groups";
}
