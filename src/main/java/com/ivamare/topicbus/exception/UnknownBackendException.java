package com.ivamare.topicbus.exception;

import java.util.Set;

/**
 * Thrown when a backend is requested by a name that has no registered factory.
 */
public class UnknownBackendException extends TopicBusException {

    private final String backendName;

    public UnknownBackendException(String backendName, Set<String> knownBackends) {
        super("Unknown backend '" + backendName + "', known backends: " + knownBackends);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
