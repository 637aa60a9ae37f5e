package com.ivamare.topicbus.exception;

/**
 * Thrown when a declaring class has no backend association and no default backend is configured.
 */
public class BackendConfigurationException extends TopicBusException {

    private final Class<?> owner;

    public BackendConfigurationException(Class<?> owner) {
        super("No backend enabled for " + owner.getName() + " and no default backend configured");
        this.owner = owner;
    }

    public Class<?> getOwner() {
        return owner;
    }
}
