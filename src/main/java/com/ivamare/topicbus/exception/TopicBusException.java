package com.ivamare.topicbus.exception;

/**
 * Base exception for all Topic Bus errors.
 */
public class TopicBusException extends RuntimeException {

    public TopicBusException(String message) {
        super(message);
    }

    public TopicBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
