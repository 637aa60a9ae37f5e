package com.ivamare.topicbus.model;

import com.ivamare.topicbus.handler.TopicHandler;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable descriptor of one topic handler and its execution policy.
 *
 * @param topic Topic key, may contain glob wildcards interpreted by the backend
 * @param kind Handler kind, selects the backend binding operation
 * @param exclusive Whether the handler belongs to the competing-consumer group of its owner
 * @param timeout Maximum execution time
 * @param fork Whether the handler runs isolated from the dispatch loop
 * @param handler The handler callable
 * @param owner The declaring class
 */
public record HandlerSpec(
    String topic,
    HandlerKind kind,
    boolean exclusive,
    Duration timeout,
    boolean fork,
    TopicHandler handler,
    Class<?> owner
) {

    public HandlerSpec {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(owner, "owner");
    }

    /**
     * Create a spec from declaration options.
     */
    public static HandlerSpec of(String topic, HandlerKind kind, HandlerOptions options,
                                 TopicHandler handler, Class<?> owner) {
        return new HandlerSpec(topic, kind, options.exclusive(), options.timeout(), options.fork(),
            handler, owner);
    }

    /**
     * Name of the competing-consumer group, the declaring class name.
     */
    public String exclusiveGroup() {
        return owner.getName();
    }

    public long timeoutSeconds() {
        return timeout.toSeconds();
    }

    public boolean isReply() {
        return kind == HandlerKind.REPLY;
    }
}
