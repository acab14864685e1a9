package org.javai.rollout.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class EnvironmentConfigProviderTest {

    private final Map<String, String> properties = new HashMap<>();
    private final Map<String, String> environment = new HashMap<>();
    private final EnvironmentConfigProvider provider =
            new EnvironmentConfigProvider(properties::get, environment::get);

    @Test
    void keyNames_mapToPropertyAndEnvironmentNames() {
        assertThat(EnvironmentConfigProvider.propertyName("rollout:percentage")).isEqualTo("rollout.percentage");
        assertThat(EnvironmentConfigProvider.environmentName("rollout:publish_results"))
                .isEqualTo("ROLLOUT_PUBLISH_RESULTS");
    }

    @Test
    void getString_prefersSystemPropertyOverEnvironment() {
        properties.put("rollout.percentage", "30");
        environment.put("ROLLOUT_PERCENTAGE", "60");

        assertThat(provider.getInt(ConfigKeys.ROLLOUT_PERCENTAGE, 0)).isEqualTo(30);
    }

    @Test
    void getString_fallsBackToEnvironment() {
        environment.put("ROLLOUT_PERCENTAGE", "60");

        assertThat(provider.getInt(ConfigKeys.ROLLOUT_PERCENTAGE, 0)).isEqualTo(60);
    }

    @Test
    void getString_nothingConfigured_returnsDefault() {
        assertThat(provider.getString(ConfigKeys.ROLLOUT_PERCENTAGE, "0")).isEqualTo("0");
    }

    @Test
    void setString_overlayWinsOnRead() {
        properties.put("rollout.enabled", "true");

        provider.setString(ConfigKeys.ROLLOUT_ENABLED, "false");

        assertThat(provider.getBoolean(ConfigKeys.ROLLOUT_ENABLED, true)).isFalse();
        assertThat(properties).containsEntry("rollout.enabled", "true");
    }
}
