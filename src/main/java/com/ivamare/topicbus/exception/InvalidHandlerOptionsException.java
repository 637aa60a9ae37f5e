package com.ivamare.topicbus.exception;

/**
 * Thrown when handler options are malformed (unknown key, wrong type, non-positive timeout).
 */
public class InvalidHandlerOptionsException extends TopicBusException {

    public InvalidHandlerOptionsException(String message) {
        super(message);
    }
}
