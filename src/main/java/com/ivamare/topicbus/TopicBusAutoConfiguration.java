package com.ivamare.topicbus;

import com.ivamare.topicbus.backend.BackendManager;
import com.ivamare.topicbus.handler.impl.SubscriberScanner;
import com.ivamare.topicbus.lifecycle.LifecycleController;
import com.ivamare.topicbus.registry.SubscriberLoader;
import com.ivamare.topicbus.registry.TopicRegistry;
import com.ivamare.topicbus.registry.impl.DefaultTopicRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

/**
 * Auto-configuration for Topic Bus.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Topic Registry</li>
 *   <li>Backend Manager with the memory and redis backends</li>
 *   <li>Subscriber Scanner and Loader</li>
 *   <li>Lifecycle Controller</li>
 *   <li>LOG_LEVEL handling</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * topicbus.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "topicbus", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TopicBusProperties.class)
public class TopicBusAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper topicBusObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- Logging ---

    @Bean
    @ConditionalOnMissingBean
    public TopicBusLogging topicBusLogging(Environment environment) {
        return new TopicBusLogging(
            LoggingSystem.get(TopicBusAutoConfiguration.class.getClassLoader()),
            environment.getProperty(TopicBusLogging.LOG_LEVEL_VARIABLE)
        );
    }

    // --- Registry ---

    @Bean
    @ConditionalOnMissingBean
    public TopicRegistry topicRegistry() {
        return new DefaultTopicRegistry();
    }

    // --- Backends ---

    @Bean
    @ConditionalOnMissingBean
    public BackendManager backendManager(ObjectMapper objectMapper, TopicBusProperties properties) {
        return BackendManager.withDefaults(objectMapper, properties.getBackends());
    }

    // --- Subscribers ---

    // Static and lazily resolved: the scanner is a BeanPostProcessor.

    @Bean
    @ConditionalOnMissingBean
    public static SubscriberScanner subscriberScanner(
            ObjectProvider<TopicRegistry> registry,
            ObjectProvider<BackendManager> backendManager,
            ObjectProvider<ObjectMapper> objectMapper) {
        return new SubscriberScanner(registry::getObject, backendManager::getObject, objectMapper::getObject);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriberLoader subscriberLoader(SubscriberScanner scanner, TopicBusProperties properties) {
        return new SubscriberLoader(scanner, properties.getSubscribersPackage());
    }

    // --- Lifecycle ---

    @Bean
    @ConditionalOnMissingBean
    public LifecycleController lifecycleController(
            TopicRegistry registry,
            BackendManager backendManager,
            TopicBusProperties properties) {
        return new LifecycleController(registry, backendManager, properties.getDefaultBackend());
    }
}
