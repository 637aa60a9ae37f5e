package com.ivamare.topicbus.registry;

import com.ivamare.topicbus.model.HandlerSpec;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-wide store of declared topic handlers.
 *
 * <p>Maps each topic to the ordered list of handlers declared for it and
 * tracks every declaring class together with the backend it binds to. The
 * registry never deduplicates: declaring the same topic twice keeps both
 * entries, in declaration order.
 *
 * <p>Registration is expected to complete before the lifecycle starts. Once
 * {@link #seal()} has been called, further registrations are rejected until
 * {@link #reset()}.
 */
public interface TopicRegistry {

    /**
     * Append a handler under its topic.
     *
     * @param spec The handler descriptor
     * @throws com.ivamare.topicbus.exception.RegistrationClosedException if sealed
     */
    void register(HandlerSpec spec);

    /**
     * Record a declaring class. Idempotent.
     *
     * @param owner The declaring class
     */
    void registerOwner(Class<?> owner);

    /**
     * Associate a declaring class with a backend name, replacing any earlier association.
     *
     * @param owner The declaring class
     * @param backendName The backend name
     * @throws com.ivamare.topicbus.exception.RegistrationClosedException if sealed
     */
    void associateBackend(Class<?> owner, String backendName);

    /**
     * Get the backend name a declaring class is associated with.
     *
     * @param owner The declaring class
     * @return backend name if one was associated
     */
    Optional<String> backendOf(Class<?> owner);

    /**
     * Get the handlers declared for a topic, in declaration order.
     *
     * @param topic The topic
     * @return read-only list, empty if nothing was declared
     */
    List<HandlerSpec> subscribers(String topic);

    /**
     * Get all declared handlers grouped by topic, topics in first-declaration order.
     *
     * @return read-only topic to handlers map
     */
    Map<String, List<HandlerSpec>> subscribers();

    /**
     * Get every declaring class ever registered, in registration order.
     *
     * @return read-only set of owners
     */
    Set<Class<?>> owners();

    /**
     * Total number of handler entries across all topics.
     *
     * @return handler count
     */
    int size();

    /**
     * Close registration. Called when the lifecycle starts.
     */
    void seal();

    boolean isSealed();

    /**
     * Remove all handlers, owners and associations and re-open registration. Useful for testing.
     */
    void reset();
}
