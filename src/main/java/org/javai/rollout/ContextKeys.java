package org.javai.rollout;

/**
 * Context keys populated by the engine. Caller context never overwrites these.
 */
public final class ContextKeys {

    public static final String TIMESTAMP = "timestamp";
    public static final String ROLLOUT_PERCENTAGE = "rollout_percentage";
    public static final String SUBJECT_ID = "subject_id";
    public static final String IN_ROLLOUT_GROUP = "in_rollout_group";
    public static final String CONDITION_VALUE = "condition_value";
    public static final String EXPERIMENT_TYPE = "experiment_type";
    public static final String SUBJECT_TYPE = "subject_type";
    public static final String HAS_BEHAVIORAL_DATA = "has_behavioral_data";
    public static final String HAS_CONTEXTUAL_DATA = "has_contextual_data";
    public static final String VERDICT_REASON = "verdict_reason";

    private ContextKeys() {}
}
