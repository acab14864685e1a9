package org.javai.rollout.config;

/**
 * A snapshot of the rollout switches as read for one decision.
 *
 * @param enabled whether the rollout is active at all
 * @param percentage share of subjects admitted to the comparison, always in [0, 100]
 * @param publishResults whether comparison records are forwarded to the sink
 */
public record RolloutConfig(boolean enabled, int percentage, boolean publishResults) {

    public RolloutConfig {
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("percentage must be in [0, 100], was " + percentage);
        }
    }
}
