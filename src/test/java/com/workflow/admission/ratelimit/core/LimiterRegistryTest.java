package com.workflow.admission.ratelimit.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LimiterRegistryTest {

    private final LimiterRegistry registry = new LimiterRegistry();

    @Test
    void create_then_get_returns_config() {
        registry.create("login", 3, 900, 7200);

        LimiterConfig c = registry.get("login");
        assertThat(c.points()).isEqualTo(3);
        assertThat(c.durationSeconds()).isEqualTo(900);
        assertThat(c.blockDurationSeconds()).isEqualTo(7200);
        assertThat(c.blocksOnExceed()).isTrue();
    }

    @Test
    void register_replaces_existing_limiter() {
        registry.create("api", 100, 60, 300);
        registry.create("api", 50, 60, 0);

        assertThat(registry.get("api").points()).isEqualTo(50);
        assertThat(registry.names()).containsExactly("api");
    }

    @Test
    void create_if_absent_keeps_first_registration() {
        registry.createIfAbsent(LimiterConfig.of("api:pro", 200, 60, 300));
        LimiterConfig second = registry.createIfAbsent(LimiterConfig.of("api:pro", 1, 60, 300));

        assertThat(second.points()).isEqualTo(200);
    }

    @Test
    void unknown_limiter_is_a_configuration_error() {
        assertThatThrownBy(() -> registry.get("nope"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nope");
        assertThat(registry.contains("nope")).isFalse();
    }

    @Test
    void invalid_configs_are_rejected() {
        assertThatThrownBy(() -> registry.create("x", 0, 60, 0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> registry.create("x", 1, 0, 0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> registry.create("x", 1, 60, -1)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> registry.create(" ", 1, 60, 0)).isInstanceOf(ConfigurationException.class);
        assertThat(registry.names()).isEmpty();
    }

    @Test
    void names_are_sorted() {
        registry.create("webhook", 1000, 60, 60);
        registry.create("api", 100, 60, 300);
        registry.create("login", 3, 900, 7200);

        assertThat(registry.names()).containsExactly("api", "login", "webhook");
    }
}
