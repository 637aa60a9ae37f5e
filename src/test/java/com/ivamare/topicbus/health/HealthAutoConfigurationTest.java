package com.ivamare.topicbus.health;

import com.ivamare.topicbus.TopicBusAutoConfiguration;
import com.ivamare.topicbus.backend.BackendManager;
import com.ivamare.topicbus.lifecycle.LifecycleController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(TopicBusAutoConfiguration.class, HealthAutoConfiguration.class));

    @Test
    @DisplayName("should create BackendHealthIndicator when enabled")
    void shouldCreateHealthIndicatorWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(BackendHealthIndicator.class);
        });
    }

    @Test
    @DisplayName("should not create BackendHealthIndicator when disabled")
    void shouldNotCreateHealthIndicatorWhenDisabled() {
        contextRunner
            .withPropertyValues("topicbus.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(BackendHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should not create duplicate health indicator if one exists")
    void shouldNotCreateDuplicateHealthIndicator() {
        contextRunner
            .withUserConfiguration(CustomHealthIndicatorConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(BackendHealthIndicator.class);
                assertThat(context.getBean(BackendHealthIndicator.class))
                    .isSameAs(CustomHealthIndicatorConfig.CUSTOM_INDICATOR);
            });
    }

    @Configuration
    static class CustomHealthIndicatorConfig {
        static final BackendHealthIndicator CUSTOM_INDICATOR =
            new BackendHealthIndicator(new BackendManager(), mock(LifecycleController.class));

        @Bean
        public BackendHealthIndicator customIndicator() {
            return CUSTOM_INDICATOR;
        }
    }
}
