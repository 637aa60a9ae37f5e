package com.ivamare.topicbus.handler;

import com.ivamare.topicbus.model.MessageContext;

/**
 * Functional interface for topic handlers.
 *
 * <p>Handlers process a message payload and optionally return a result. For
 * reply handlers the result is sent back to the requester; a returned
 * {@link com.ivamare.topicbus.model.Reply} is passed through as is, any other
 * value is wrapped in a successful reply. Slot and listener results are ignored.
 */
@FunctionalInterface
public interface TopicHandler {

    /**
     * Process a message.
     *
     * @param payload The decoded message payload
     * @param context Delivery context
     * @return Optional result (may be null)
     * @throws Exception on processing failure
     */
    Object handle(Object payload, MessageContext context) throws Exception;
}
