package com.ivamare.topicbus.exception;

/**
 * Thrown when a backend factory fails to construct its backend.
 */
public class BackendInitializationException extends TopicBusException {

    private final String backendName;

    public BackendInitializationException(String backendName, Throwable cause) {
        super("Failed to initialize backend '" + backendName + "': " + cause.getMessage(), cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
