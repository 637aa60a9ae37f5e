package com.ivamare.topicbus.model;

import java.time.Instant;

/**
 * Context provided to topic handlers during execution.
 *
 * @param topic The concrete topic the message was published on
 * @param pattern The subscription topic that matched (may contain wildcards)
 * @param sender Identifier of the publisher, also used to route replies
 * @param backend Name of the backend that delivered the message
 * @param receivedAt When the backend received the message
 */
public record MessageContext(
    String topic,
    String pattern,
    String sender,
    String backend,
    Instant receivedAt
) {
}
