package com.ivamare.topicbus.registry.impl;

import com.ivamare.topicbus.exception.RegistrationClosedException;
import com.ivamare.topicbus.model.HandlerSpec;
import com.ivamare.topicbus.registry.TopicRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default implementation of TopicRegistry.
 *
 * <p>Writes are serialized; per-topic lists are copy-on-write so readers never
 * observe a partially appended list.
 */
public class DefaultTopicRegistry implements TopicRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultTopicRegistry.class);

    private final Map<String, List<HandlerSpec>> topics = new LinkedHashMap<>();
    private final Set<Class<?>> owners = new LinkedHashSet<>();
    private final Map<Class<?>, String> backendAssociations = new ConcurrentHashMap<>();
    private volatile boolean sealed = false;

    @Override
    public synchronized void register(HandlerSpec spec) {
        if (sealed) {
            throw new RegistrationClosedException("handler for topic " + spec.topic());
        }
        owners.add(spec.owner());
        topics.computeIfAbsent(spec.topic(), t -> new CopyOnWriteArrayList<>()).add(spec);
        log.debug("Registered {} handler for {} (owner={}, exclusive={}, timeout={}s, fork={})",
            spec.kind().getValue(), spec.topic(), spec.owner().getName(),
            spec.exclusive(), spec.timeoutSeconds(), spec.fork());
    }

    @Override
    public synchronized void registerOwner(Class<?> owner) {
        if (owners.add(owner)) {
            log.debug("Registered subscriber {}", owner.getName());
        }
    }

    @Override
    public synchronized void associateBackend(Class<?> owner, String backendName) {
        if (sealed) {
            throw new RegistrationClosedException("backend " + backendName + " for " + owner.getName());
        }
        owners.add(owner);
        backendAssociations.put(owner, backendName);
        log.debug("Associated {} with backend {}", owner.getName(), backendName);
    }

    @Override
    public Optional<String> backendOf(Class<?> owner) {
        return Optional.ofNullable(backendAssociations.get(owner));
    }

    @Override
    public synchronized List<HandlerSpec> subscribers(String topic) {
        List<HandlerSpec> specs = topics.get(topic);
        return specs != null ? Collections.unmodifiableList(specs) : List.of();
    }

    @Override
    public synchronized Map<String, List<HandlerSpec>> subscribers() {
        Map<String, List<HandlerSpec>> view = new LinkedHashMap<>();
        topics.forEach((topic, specs) -> view.put(topic, Collections.unmodifiableList(specs)));
        return Collections.unmodifiableMap(view);
    }

    @Override
    public synchronized Set<Class<?>> owners() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(owners));
    }

    @Override
    public synchronized int size() {
        return topics.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public void seal() {
        sealed = true;
    }

    @Override
    public boolean isSealed() {
        return sealed;
    }

    @Override
    public synchronized void reset() {
        topics.clear();
        owners.clear();
        backendAssociations.clear();
        sealed = false;
    }
}
