package com.ivamare.topicbus.backend;

import java.util.Map;

/**
 * Constructs a backend from backend-specific options (e.g., host, port, health_check).
 */
@FunctionalInterface
public interface BackendFactory {

    /**
     * Create a backend.
     *
     * @param options Backend-specific options, never null
     * @return the backend
     * @throws Exception if the backend cannot be constructed
     */
    Backend create(Map<String, Object> options) throws Exception;
}
