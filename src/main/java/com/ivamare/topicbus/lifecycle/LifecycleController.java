package com.ivamare.topicbus.lifecycle;

import com.ivamare.topicbus.backend.Backend;
import com.ivamare.topicbus.backend.BackendManager;
import com.ivamare.topicbus.exception.BackendConfigurationException;
import com.ivamare.topicbus.model.HandlerSpec;
import com.ivamare.topicbus.registry.TopicRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires declared handlers into their backends and drives start and teardown.
 *
 * <p>Start seals the registry, partitions it by backend, binds every handler
 * through the backend operation matching its kind and registers health checks.
 * Teardown only reverses the health checks; bound handlers stay bound until
 * {@link #shutdown()} closes the backends.
 *
 * <p>Any backend failure aborts the remaining sequence and propagates.
 */
public class LifecycleController {

    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    private final TopicRegistry registry;
    private final BackendManager backendManager;
    private final String defaultBackend;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile CompletableFuture<Void> shutdownSignal = new CompletableFuture<>();

    /**
     * @param registry Handler registry
     * @param backendManager Backend resolver
     * @param defaultBackend Backend for owners without an explicit association (nullable)
     */
    public LifecycleController(TopicRegistry registry, BackendManager backendManager, String defaultBackend) {
        this.registry = registry;
        this.backendManager = backendManager;
        this.defaultBackend = defaultBackend;
    }

    /**
     * Partition the registry by backend.
     *
     * <p>Topics keep registry order within each backend and handlers keep their
     * per-topic declaration order. Every handler lands in exactly one bucket.
     *
     * @return backend name to topic to handlers
     * @throws BackendConfigurationException if an owner has no backend and no default is configured
     */
    public Map<String, Map<String, List<HandlerSpec>>> groupByBackend() {
        Map<String, Map<String, List<HandlerSpec>>> buckets = new LinkedHashMap<>();
        registry.subscribers().forEach((topic, specs) -> {
            for (HandlerSpec spec : specs) {
                buckets.computeIfAbsent(resolveBackend(spec.owner()), b -> new LinkedHashMap<>())
                    .computeIfAbsent(topic, t -> new ArrayList<>())
                    .add(spec);
            }
        });
        return buckets;
    }

    public void start() {
        start(false);
    }

    /**
     * Bind every declared handler to its backend and register health checks.
     *
     * @param block If true, do not return until {@link #shutdown()} is called
     *              or the calling thread is interrupted
     * @throws IllegalStateException if already started
     */
    public void start(boolean block) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Topic bus already started");
        }
        try {
            bindAll();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        if (block) {
            log.debug("Blocking until shutdown");
            awaitShutdown();
        }
    }

    private void bindAll() {
        registry.seal();
        Map<String, Map<String, List<HandlerSpec>>> buckets = groupByBackend();

        buckets.forEach((backendName, topics) -> {
            Backend backend = backendManager.getOrCreate(backendName);
            int bound = 0;
            for (Map.Entry<String, List<HandlerSpec>> entry : topics.entrySet()) {
                for (HandlerSpec spec : entry.getValue()) {
                    bind(backend, entry.getKey(), spec);
                    bound++;
                }
            }
            if (backend.reportHealth()) {
                backend.registerHealthCheck();
            }
            log.info("Started backend {} with {} handlers on {} topics", backendName, bound, topics.size());
        });
    }

    /**
     * Unregister health checks of every backend that handlers are currently declared for.
     *
     * <p>Backends that were never constructed, or were already closed by
     * {@link #shutdown()}, are skipped.
     */
    public void tearDown() {
        Map<String, Map<String, List<HandlerSpec>>> buckets = groupByBackend();
        for (String backendName : buckets.keySet()) {
            backendManager.get(backendName).ifPresent(backend -> {
                if (backend.reportHealth()) {
                    backend.unregisterHealthCheck();
                }
                log.info("Tore down backend {}", backendName);
            });
        }
    }

    /**
     * Release callers blocked in {@link #start(boolean)} and close all backends.
     */
    public void shutdown() {
        log.info("Shutting down topic bus");
        shutdownSignal.complete(null);
        backendManager.closeAll();
        started.set(false);
    }

    /**
     * Wait until {@link #shutdown()} is called.
     *
     * <p>Returns early, with the interrupt flag restored, if the calling thread is interrupted.
     */
    public void awaitShutdown() {
        try {
            shutdownSignal.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for shutdown");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Shutdown signal failed", e.getCause());
        }
    }

    /**
     * Future completing when {@link #shutdown()} is called.
     */
    public CompletableFuture<Void> shutdownSignal() {
        return shutdownSignal;
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Unseal the registry and arm a fresh shutdown signal. Useful for testing.
     */
    public void reset() {
        registry.reset();
        started.set(false);
        shutdownSignal = new CompletableFuture<>();
    }

    private String resolveBackend(Class<?> owner) {
        return registry.backendOf(owner)
            .or(() -> Optional.ofNullable(defaultBackend))
            .orElseThrow(() -> new BackendConfigurationException(owner));
    }

    private void bind(Backend backend, String topic, HandlerSpec spec) {
        switch (spec.kind()) {
            case SLOT -> backend.slot(topic, spec);
            case REPLY -> backend.replyTo(topic, spec);
            case LISTENER -> backend.addListener(topic, spec);
        }
    }
}
