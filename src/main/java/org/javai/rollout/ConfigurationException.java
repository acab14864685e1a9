package org.javai.rollout;

/**
 * Thrown when a configuration write is rejected. The previously stored value is unchanged.
 */
public class ConfigurationException extends RolloutException {

    private final String key;

    public ConfigurationException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * The configuration key whose write was rejected.
     */
    public String key() {
        return key;
    }
}
