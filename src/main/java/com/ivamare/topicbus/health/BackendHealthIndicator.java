package com.ivamare.topicbus.health;

import com.ivamare.topicbus.backend.Backend;
import com.ivamare.topicbus.backend.BackendManager;
import com.ivamare.topicbus.lifecycle.LifecycleController;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for Topic Bus backends.
 *
 * <p>Reports:
 * <ul>
 *   <li>Whether the lifecycle has started</li>
 *   <li>Per backend, whether it reports health and whether its health check is registered</li>
 * </ul>
 * DOWN if a started backend reports health but its health check is not registered.
 */
public class BackendHealthIndicator implements HealthIndicator {

    private final BackendManager backendManager;
    private final LifecycleController lifecycleController;

    public BackendHealthIndicator(BackendManager backendManager, LifecycleController lifecycleController) {
        this.backendManager = backendManager;
        this.lifecycleController = lifecycleController;
    }

    @Override
    public Health health() {
        Map<String, Backend> backends = backendManager.backends();
        if (!lifecycleController.isStarted() || backends.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "Topic bus not started")
                .build();
        }

        Map<String, BackendStatus> statuses = new LinkedHashMap<>();
        boolean healthy = true;
        for (Map.Entry<String, Backend> entry : backends.entrySet()) {
            Backend backend = entry.getValue();
            BackendStatus status = new BackendStatus(backend.reportHealth(), backend.isHealthCheckRegistered());
            statuses.put(entry.getKey(), status);
            if (status.reportsHealth() && !status.healthCheckRegistered()) {
                healthy = false;
            }
        }

        Health.Builder builder = healthy ? Health.up() : Health.down();
        return builder
            .withDetail("backends", statuses)
            .build();
    }

    record BackendStatus(boolean reportsHealth, boolean healthCheckRegistered) {}
}
