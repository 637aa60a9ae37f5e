package com.ivamare.topicbus.backend;

import com.ivamare.topicbus.model.HandlerSpec;
import com.ivamare.topicbus.model.Reply;

import java.util.concurrent.CompletableFuture;

/**
 * Transport that accepts wired topic handlers and dispatches messages to them.
 *
 * <p>The backend reads the execution policy from each {@link HandlerSpec}:
 * exclusive handlers compete within the group named by
 * {@link HandlerSpec#exclusiveGroup()}, {@code fork} handlers run isolated from
 * the dispatch loop, and a reply handler exceeding its timeout must answer the
 * requester with {@link Reply#timeout()} instead of leaving it unanswered.
 *
 * <p>Instances are created by a {@link BackendFactory} and memoized per name by
 * {@link BackendManager}.
 */
public interface Backend {

    /**
     * Name this backend was registered under.
     *
     * @return backend name (e.g., "redis")
     */
    String name();

    /**
     * Bind a raw listener.
     *
     * @param topic Topic pattern
     * @param spec Handler descriptor
     */
    void addListener(String topic, HandlerSpec spec);

    /**
     * Bind a fire-and-forget handler.
     *
     * @param topic Topic pattern
     * @param spec Handler descriptor
     */
    void slot(String topic, HandlerSpec spec);

    /**
     * Bind a request/reply handler.
     *
     * @param topic Topic pattern
     * @param spec Handler descriptor
     */
    void replyTo(String topic, HandlerSpec spec);

    /**
     * Whether this backend publishes health check heartbeats.
     *
     * @return true if health reporting is enabled
     */
    boolean reportHealth();

    /**
     * Start publishing the health check. Idempotent.
     */
    void registerHealthCheck();

    /**
     * Stop publishing the health check. Idempotent.
     */
    void unregisterHealthCheck();

    /**
     * Whether the health check is currently registered.
     *
     * @return true between register and unregister
     */
    boolean isHealthCheckRegistered();

    /**
     * Publish a message without expecting a reply.
     *
     * @param topic Concrete topic
     * @param payload Message payload
     * @return Future completing once the message has been handed off
     */
    CompletableFuture<Void> publish(String topic, Object payload);

    /**
     * Publish a message and wait for the first reply.
     *
     * @param topic Concrete topic
     * @param payload Message payload
     * @return Future completing with the reply
     */
    CompletableFuture<Reply> request(String topic, Object payload);

    /**
     * Release connections and executors.
     */
    default void close() {
    }
}
