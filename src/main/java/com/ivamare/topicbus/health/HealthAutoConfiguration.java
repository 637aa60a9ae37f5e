package com.ivamare.topicbus.health;

import com.ivamare.topicbus.TopicBusAutoConfiguration;
import com.ivamare.topicbus.backend.BackendManager;
import com.ivamare.topicbus.lifecycle.LifecycleController;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Topic Bus health indicators.
 */
@AutoConfiguration(after = TopicBusAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnBean({BackendManager.class, LifecycleController.class})
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(BackendHealthIndicator.class)
    public BackendHealthIndicator topicBusHealthIndicator(
            BackendManager backendManager,
            LifecycleController lifecycleController) {
        return new BackendHealthIndicator(backendManager, lifecycleController);
    }
}
