package com.ivamare.topicbus;

import com.ivamare.topicbus.lifecycle.LifecycleController;
import com.ivamare.topicbus.registry.SubscriberLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;

/**
 * Auto-start configuration for the topic bus lifecycle.
 *
 * <p>Enable with:
 * <pre>
 * topicbus:
 *   auto-start: true
 *   load-subscribers: true   # optional, scan subscribers-package first
 * </pre>
 *
 * <p>Handlers are bound when the application is ready; health checks are
 * unregistered and backends closed on shutdown.
 */
@AutoConfiguration(after = TopicBusAutoConfiguration.class)
@ConditionalOnBean(LifecycleController.class)
@ConditionalOnProperty(prefix = "topicbus", name = "auto-start", havingValue = "true")
public class LifecycleAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LifecycleAutoStartConfiguration.class);

    private final LifecycleController lifecycleController;
    private final SubscriberLoader subscriberLoader;
    private final TopicBusProperties properties;

    public LifecycleAutoStartConfiguration(
            LifecycleController lifecycleController,
            SubscriberLoader subscriberLoader,
            TopicBusProperties properties) {
        this.lifecycleController = lifecycleController;
        this.subscriberLoader = subscriberLoader;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startLifecycle() {
        if (lifecycleController.isStarted()) {
            log.warn("Topic bus already started");
            return;
        }
        if (properties.isLoadSubscribers()) {
            subscriberLoader.loadAll();
        }
        lifecycleController.start(false);
    }

    @PreDestroy
    public void stopLifecycle() {
        if (!lifecycleController.isStarted()) {
            return;
        }
        log.info("Stopping topic bus...");
        lifecycleController.tearDown();
        lifecycleController.shutdown();
        log.info("Topic bus stopped");
    }
}
