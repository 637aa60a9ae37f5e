package com.ivamare.topicbus.exception;

/**
 * Thrown when a handler or backend association is declared after the lifecycle has started.
 */
public class RegistrationClosedException extends TopicBusException {

    private final String subject;

    public RegistrationClosedException(String subject) {
        super("Registry is sealed, cannot register " + subject + " after start");
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }
}
