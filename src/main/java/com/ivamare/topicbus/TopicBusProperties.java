package com.ivamare.topicbus;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for Topic Bus.
 *
 * <p>Example configuration:
 * <pre>
 * topicbus:
 *   enabled: true
 *   default-backend: memory
 *   subscribers-package: com.example.subscribers
 *   load-subscribers: true
 *   auto-start: true
 *   backends:
 *     memory:
 *       health_check: true
 *     redis:
 *       host: localhost
 *       port: 6379
 *       broadcast_errors: true
 *       health_check: true
 * </pre>
 */
@ConfigurationProperties(prefix = "topicbus")
public class TopicBusProperties {

    /**
     * Enable/disable Topic Bus auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Backend for subscribers that do not name one.
     */
    private String defaultBackend = "memory";

    /**
     * Base package scanned by SubscriberLoader.loadAll().
     */
    private String subscribersPackage = "subscribers";

    /**
     * Load subscribers from the subscribers package before auto-start.
     */
    private boolean loadSubscribers = false;

    /**
     * Start the lifecycle on application ready.
     */
    private boolean autoStart = false;

    /**
     * Options per backend name, passed to the backend factory on construction.
     */
    private Map<String, Map<String, Object>> backends = new HashMap<>();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDefaultBackend() {
        return defaultBackend;
    }

    public void setDefaultBackend(String defaultBackend) {
        this.defaultBackend = defaultBackend;
    }

    public String getSubscribersPackage() {
        return subscribersPackage;
    }

    public void setSubscribersPackage(String subscribersPackage) {
        this.subscribersPackage = subscribersPackage;
    }

    public boolean isLoadSubscribers() {
        return loadSubscribers;
    }

    public void setLoadSubscribers(boolean loadSubscribers) {
        this.loadSubscribers = loadSubscribers;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Map<String, Map<String, Object>> getBackends() {
        return backends;
    }

    public void setBackends(Map<String, Map<String, Object>> backends) {
        this.backends = backends;
    }

    /**
     * Get backend options, returning an empty map if not configured.
     *
     * @param backend backend name
     * @return backend options (never null)
     */
    public Map<String, Object> getBackendOptions(String backend) {
        return backends.getOrDefault(backend, Map.of());
    }
}
