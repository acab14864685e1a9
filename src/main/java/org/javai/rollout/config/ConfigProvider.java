package org.javai.rollout.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Scalar key-value access to the shared configuration store.
 *
 * <p>Implementations must make each single-key read and write atomic: a concurrent
 * reader observes either the old or the new value, never a partial one. No
 * multi-key transactional guarantee is required.
 */
public interface ConfigProvider {

    /**
     * Returns the stored value, or {@code defaultValue} if the key is missing or blank.
     */
    String getString(String key, String defaultValue);

    void setString(String key, String value);

    /**
     * Returns the stored value parsed as an int, or {@code defaultValue} if the key is
     * missing or does not hold an integer.
     */
    default int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Returns the stored value parsed as a boolean. Only the literals {@code true} and
     * {@code false} (case-insensitive) are recognized; anything else yields the default.
     */
    default boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        return defaultValue;
    }

    /**
     * Reads a comma-joined list. Entries are trimmed and blank entries dropped.
     */
    default List<String> getList(String key) {
        String value = getString(key, "");
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    default void setList(String key, Collection<String> values) {
        setString(key, values.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(",")));
    }
}
