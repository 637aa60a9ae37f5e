package com.ivamare.topicbus.registry;

import com.ivamare.topicbus.backend.Backend;
import com.ivamare.topicbus.backend.BackendManager;
import com.ivamare.topicbus.handler.TopicHandler;
import com.ivamare.topicbus.model.HandlerKind;
import com.ivamare.topicbus.model.HandlerOptions;
import com.ivamare.topicbus.model.HandlerSpec;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declaration API bound to one declaring class.
 *
 * <p>Every handler declared through a registrar is owned by that class: the
 * owner decides the exclusive group name and the backend the handler is
 * wired to. Handler and owner always come from the call itself, never from
 * options.
 *
 * <p>Example:
 * <pre>
 * Registrar registrar = Registrar.forOwner(registry, backendManager, OrderSubscriber.class);
 * registrar.enableBackend("redis", Map.of("host", "localhost"));
 * registrar.slot("orders.created", HandlerOptions.builder().exclusive(true).timeoutSeconds(30).build(),
 *     (payload, context) -&gt; handleCreated(payload));
 * registrar.replyTo("orders.get", (payload, context) -&gt; lookup(payload));
 * </pre>
 */
public class Registrar {

    private final TopicRegistry registry;
    private final BackendManager backendManager;
    private final Class<?> owner;

    private Registrar(TopicRegistry registry, BackendManager backendManager, Class<?> owner) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.backendManager = Objects.requireNonNull(backendManager, "backendManager");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    /**
     * Create a registrar for a declaring class and record the class as an owner.
     *
     * @param registry Target registry
     * @param backendManager Backend resolver
     * @param owner Declaring class
     * @return registrar bound to the owner
     */
    public static Registrar forOwner(TopicRegistry registry, BackendManager backendManager, Class<?> owner) {
        Registrar registrar = new Registrar(registry, backendManager, owner);
        registry.registerOwner(owner);
        return registrar;
    }

    public Class<?> owner() {
        return owner;
    }

    // --- Declarations ---

    public void listenTo(String topic, TopicHandler handler) {
        listenTo(topic, HandlerOptions.defaults(), handler);
    }

    public void listenTo(String topic, Map<String, ?> options, TopicHandler handler) {
        listenTo(topic, HandlerOptions.fromMap(options), handler);
    }

    /**
     * Declare a raw listener.
     *
     * @param topic Topic, may contain wildcards
     * @param options Execution policy
     * @param handler Handler callable
     */
    public void listenTo(String topic, HandlerOptions options, TopicHandler handler) {
        declare(topic, HandlerKind.LISTENER, options, handler);
    }

    public void replyTo(String topic, TopicHandler handler) {
        replyTo(topic, HandlerOptions.defaults(), handler);
    }

    public void replyTo(String topic, Map<String, ?> options, TopicHandler handler) {
        replyTo(topic, HandlerOptions.fromMap(options), handler);
    }

    /**
     * Declare a request/reply handler.
     *
     * @param topic Topic, may contain wildcards
     * @param options Execution policy
     * @param handler Handler callable, its return value is the reply
     */
    public void replyTo(String topic, HandlerOptions options, TopicHandler handler) {
        declare(topic, HandlerKind.REPLY, options, handler);
    }

    public void slot(String topic, TopicHandler handler) {
        slot(topic, HandlerOptions.defaults(), handler);
    }

    public void slot(String topic, Map<String, ?> options, TopicHandler handler) {
        slot(topic, HandlerOptions.fromMap(options), handler);
    }

    /**
     * Declare a fire-and-forget handler.
     *
     * @param topic Topic, may contain wildcards
     * @param options Execution policy
     * @param handler Handler callable
     */
    public void slot(String topic, HandlerOptions options, TopicHandler handler) {
        declare(topic, HandlerKind.SLOT, options, handler);
    }

    // --- Queries ---

    /**
     * Handlers declared for a topic by any owner, in declaration order.
     */
    public List<HandlerSpec> subscribers(String topic) {
        return registry.subscribers(topic);
    }

    /**
     * All declared handlers by topic.
     */
    public Map<String, List<HandlerSpec>> subscribers() {
        return registry.subscribers();
    }

    // --- Backend association ---

    /**
     * Associate this owner with a backend and return the (memoized) backend instance.
     *
     * @param name Backend name
     * @param options Backend options, used only if the backend is constructed by this call
     * @return the backend
     * @throws com.ivamare.topicbus.exception.UnknownBackendException if the name is unknown
     */
    public Backend enableBackend(String name, Map<String, Object> options) {
        useBackend(name);
        return backendManager.getOrCreate(name, options);
    }

    public Backend getBackend(String name) {
        return enableBackend(name, Map.of());
    }

    /**
     * Associate this owner with a backend without constructing it yet.
     *
     * @param name Backend name
     * @throws com.ivamare.topicbus.exception.UnknownBackendException if the name is unknown
     */
    public void useBackend(String name) {
        backendManager.requireKnown(name);
        registry.associateBackend(owner, name);
    }

    public Optional<String> backend() {
        return registry.backendOf(owner);
    }

    private void declare(String topic, HandlerKind kind, HandlerOptions options, TopicHandler handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(handler, "handler");
        HandlerOptions effective = options != null ? options : HandlerOptions.defaults();
        registry.register(HandlerSpec.of(topic, kind, effective, handler, owner));
    }
}
