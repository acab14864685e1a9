package org.javai.rollout.config;

import org.javai.rollout.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The read/write boundary between the rollout engine and the shared configuration store.
 *
 * <p>Every read goes to the {@link ConfigProvider}; nothing is cached, so a change
 * written by any replica takes effect on the next decision. Writes are validated
 * here: an out-of-range percentage is rejected with a {@link ConfigurationException}
 * before anything is stored.
 *
 * <p>Usage:
 * <pre>{@code
 * RolloutSettings settings = new RolloutSettings(new InMemoryConfigProvider());
 * settings.enableRollout(true);
 * settings.setPercentage(25);
 *
 * RolloutConfig current = settings.rolloutConfig();
 * }</pre>
 */
public class RolloutSettings {

    private static final Logger log = LoggerFactory.getLogger(RolloutSettings.class);

    static final boolean DEFAULT_ENABLED = true;
    static final boolean DEFAULT_PUBLISH_RESULTS = true;

    private final ConfigProvider provider;
    private final AtomicInteger lastValidPercentage = new AtomicInteger(0);

    public RolloutSettings(ConfigProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    // === Rollout switches ===

    public RolloutConfig rolloutConfig() {
        return new RolloutConfig(isEnabled(), percentage(), shouldPublishResults());
    }

    /**
     * Returns the stored switch. A missing or blank value reads as enabled; any value
     * other than {@code true} or {@code false} reads as disabled.
     */
    public boolean isEnabled() {
        return readSwitch(ConfigKeys.ROLLOUT_ENABLED, DEFAULT_ENABLED);
    }

    /**
     * Returns the stored percentage. A stored value outside [0, 100], or one that is
     * not a number, reads as the last valid value this instance observed (initially 0).
     */
    public int percentage() {
        String raw = provider.getString(ConfigKeys.ROLLOUT_PERCENTAGE, null);
        if (raw == null) {
            return 0;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value >= 0 && value <= 100) {
                lastValidPercentage.set(value);
                return value;
            }
            log.warn("Stored rollout percentage {} is outside [0, 100]", value);
        } catch (NumberFormatException e) {
            log.warn("Stored rollout percentage '{}' is not a number", raw);
        }
        return lastValidPercentage.get();
    }

    /**
     * Returns the stored switch, read like {@link #isEnabled()}.
     */
    public boolean shouldPublishResults() {
        return readSwitch(ConfigKeys.PUBLISH_RESULTS, DEFAULT_PUBLISH_RESULTS);
    }

    public void enableRollout(boolean enabled) {
        provider.setString(ConfigKeys.ROLLOUT_ENABLED, Boolean.toString(enabled));
        log.info("Rollout {}", enabled ? "enabled" : "disabled");
    }

    /**
     * Stores the rollout percentage.
     *
     * @throws ConfigurationException if percentage is outside [0, 100]; nothing is stored
     */
    public void setPercentage(int percentage) {
        requireValidPercentage(percentage);
        provider.setString(ConfigKeys.ROLLOUT_PERCENTAGE, Integer.toString(percentage));
        lastValidPercentage.set(percentage);
        log.info("Rollout percentage set to {}%", percentage);
    }

    public void setPublishResults(boolean publish) {
        provider.setString(ConfigKeys.PUBLISH_RESULTS, Boolean.toString(publish));
    }

    // === Eligibility policy ===

    public EligibilityConfig eligibilityConfig() {
        return new EligibilityConfig(
                provider.getBoolean(ConfigKeys.CRITERIA_ACTIVE, false),
                provider.getBoolean(ConfigKeys.MULTIPLE_CRITERIA, false),
                readSet(ConfigKeys.ALLOWED_SUBJECT_TYPES),
                readSet(ConfigKeys.ALLOWED_ALLOWLIST_IDS),
                readSet(ConfigKeys.ALLOWED_REGIONS),
                readSet(ConfigKeys.ALLOWED_GROUPS)
        );
    }

    /**
     * Writes every eligibility key from the given configuration.
     */
    public void configureEligibility(EligibilityConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        provider.setString(ConfigKeys.CRITERIA_ACTIVE, Boolean.toString(config.criteriaValidationActive()));
        provider.setString(ConfigKeys.MULTIPLE_CRITERIA, Boolean.toString(config.multipleCriteriaEnabled()));
        provider.setList(ConfigKeys.ALLOWED_SUBJECT_TYPES, config.allowedSubjectTypes());
        provider.setList(ConfigKeys.ALLOWED_ALLOWLIST_IDS, config.allowedAllowlistIds());
        provider.setList(ConfigKeys.ALLOWED_REGIONS, config.allowedRegions());
        provider.setList(ConfigKeys.ALLOWED_GROUPS, config.allowedGroups());
        log.info("Eligibility policy updated: criteriaActive={}, multipleCriteria={}",
                config.criteriaValidationActive(), config.multipleCriteriaEnabled());
    }

    /**
     * Updates criteria validation and the rollout switches together.
     *
     * <p>The percentage is validated before anything is written. {@code subjectTypes}
     * and {@code allowlistIds} are left untouched when null. Enabling criteria
     * validation also enables the rollout; disabling it disables the rollout.
     *
     * @throws ConfigurationException if percentage is outside [0, 100]; nothing is stored
     */
    public void configureAdvanced(boolean criteriaActive,
                                  int percentage,
                                  boolean multipleCriteria,
                                  Collection<String> subjectTypes,
                                  Collection<String> allowlistIds) {
        requireValidPercentage(percentage);

        provider.setString(ConfigKeys.CRITERIA_ACTIVE, Boolean.toString(criteriaActive));
        provider.setString(ConfigKeys.MULTIPLE_CRITERIA, Boolean.toString(multipleCriteria));
        if (subjectTypes != null) {
            provider.setList(ConfigKeys.ALLOWED_SUBJECT_TYPES, subjectTypes);
        }
        if (allowlistIds != null) {
            provider.setList(ConfigKeys.ALLOWED_ALLOWLIST_IDS, allowlistIds.stream()
                    .map(EligibilityConfig::normalizeIdentifier)
                    .toList());
        }
        enableRollout(criteriaActive);
        setPercentage(percentage);

        log.info("Advanced rollout configuration updated: active={}, percentage={}%, multipleCriteria={}",
                criteriaActive, percentage, multipleCriteria);
    }

    private boolean readSwitch(String key, boolean defaultValue) {
        String raw = provider.getString(key, null);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String trimmed = raw.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if (!"false".equalsIgnoreCase(trimmed)) {
            log.warn("Stored value '{}' of {} is not a boolean, reading it as false", raw, key);
        }
        return false;
    }

    private Set<String> readSet(String key) {
        return Set.copyOf(provider.getList(key));
    }

    private static void requireValidPercentage(int percentage) {
        if (percentage < 0 || percentage > 100) {
            throw new ConfigurationException(ConfigKeys.ROLLOUT_PERCENTAGE,
                    "Rollout percentage must be between 0 and 100, was " + percentage);
        }
    }
}
