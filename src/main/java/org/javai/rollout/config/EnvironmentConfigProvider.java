package org.javai.rollout.config;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves configuration from system properties with environment variable fallbacks.
 *
 * <p>Key {@code rollout:percentage} is looked up as system property
 * {@code rollout.percentage}, then as environment variable {@code ROLLOUT_PERCENTAGE}.
 * Writes go to an in-process overlay that takes precedence over both sources, so an
 * operator update is visible on the next read without touching the environment.
 */
public class EnvironmentConfigProvider implements ConfigProvider {

    private final InMemoryConfigProvider overlay = new InMemoryConfigProvider();
    private final Function<String, String> systemProperties;
    private final Function<String, String> environment;

    public EnvironmentConfigProvider() {
        this(System::getProperty, System::getenv);
    }

    /**
     * Creates a provider over explicit lookups. Useful for testing.
     */
    EnvironmentConfigProvider(Function<String, String> systemProperties, Function<String, String> environment) {
        this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    @Override
    public String getString(String key, String defaultValue) {
        String value = overlay.getString(key, null);
        if (value == null) {
            value = systemProperties.apply(propertyName(key));
        }
        if (value == null || value.isBlank()) {
            value = environment.apply(environmentName(key));
        }
        return value == null || value.isBlank() ? defaultValue : value;
    }

    @Override
    public void setString(String key, String value) {
        overlay.setString(key, value);
    }

    static String propertyName(String key) {
        return key.replace(':', '.');
    }

    static String environmentName(String key) {
        return key.replaceAll("[^A-Za-z0-9]", "_").toUpperCase(Locale.ROOT);
    }
}
