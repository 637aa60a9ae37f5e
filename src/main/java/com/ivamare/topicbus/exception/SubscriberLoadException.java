package com.ivamare.topicbus.exception;

/**
 * Thrown when a subscriber class cannot be located, loaded or instantiated.
 */
public class SubscriberLoadException extends TopicBusException {

    private final String subscriber;

    public SubscriberLoadException(String subscriber, String message) {
        super("Cannot load subscriber " + subscriber + ": " + message);
        this.subscriber = subscriber;
    }

    public SubscriberLoadException(String subscriber, Throwable cause) {
        super("Cannot load subscriber " + subscriber + ": " + cause.getMessage(), cause);
        this.subscriber = subscriber;
    }

    public String getSubscriber() {
        return subscriber;
    }
}
