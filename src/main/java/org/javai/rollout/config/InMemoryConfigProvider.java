package org.javai.rollout.config;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A process-local {@link ConfigProvider}. Useful for tests and single-replica deployments.
 */
public class InMemoryConfigProvider implements ConfigProvider {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    public InMemoryConfigProvider() {
    }

    public InMemoryConfigProvider(Map<String, String> initialValues) {
        values.putAll(initialValues);
    }

    @Override
    public String getString(String key, String defaultValue) {
        Objects.requireNonNull(key, "key must not be null");
        String value = values.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    @Override
    public void setString(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }
}
