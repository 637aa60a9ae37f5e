package com.ivamare.topicbus.backend;

import com.ivamare.topicbus.backend.memory.InMemoryBackend;
import com.ivamare.topicbus.backend.redis.RedisBackend;
import com.ivamare.topicbus.exception.BackendInitializationException;
import com.ivamare.topicbus.exception.UnknownBackendException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves backends by name.
 *
 * <p>Holds one factory per backend name and at most one constructed instance
 * per name. The options used for construction are the configured defaults for
 * that name overlaid with the options supplied on the first request; later
 * requests return the cached instance and ignore their options.
 */
public class BackendManager {

    private static final Logger log = LoggerFactory.getLogger(BackendManager.class);

    private final Map<String, BackendFactory> factories = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> configuredOptions;
    private final Map<String, Backend> instances = Collections.synchronizedMap(new LinkedHashMap<>());

    public BackendManager() {
        this(Map.of());
    }

    /**
     * @param configuredOptions Default options per backend name (e.g., from application properties)
     */
    public BackendManager(Map<String, Map<String, Object>> configuredOptions) {
        this.configuredOptions = configuredOptions != null ? Map.copyOf(configuredOptions) : Map.of();
    }

    /**
     * Create a manager with the built-in {@code memory} and {@code redis} backends registered.
     *
     * @param objectMapper Mapper used by backends that serialize payloads
     * @param configuredOptions Default options per backend name
     * @return new manager
     */
    public static BackendManager withDefaults(ObjectMapper objectMapper,
                                              Map<String, Map<String, Object>> configuredOptions) {
        BackendManager manager = new BackendManager(configuredOptions);
        manager.registerFactory(InMemoryBackend.NAME, InMemoryBackend::new);
        manager.registerFactory(RedisBackend.NAME, options -> RedisBackend.connect(options, objectMapper));
        return manager;
    }

    /**
     * Register a factory under a backend name, replacing any previous one.
     *
     * @param name Backend name
     * @param factory The factory
     */
    public void registerFactory(String name, BackendFactory factory) {
        factories.put(name, factory);
        log.debug("Registered backend factory {}", name);
    }

    public boolean isKnown(String name) {
        return name != null && factories.containsKey(name);
    }

    /**
     * Fail unless a factory is registered for the name.
     *
     * @param name Backend name
     * @throws UnknownBackendException if unknown
     */
    public void requireKnown(String name) {
        if (!isKnown(name)) {
            throw new UnknownBackendException(name, factories.keySet());
        }
    }

    /**
     * Get or construct the backend using its configured options.
     */
    public Backend getOrCreate(String name) {
        return getOrCreate(name, Map.of());
    }

    /**
     * Get or construct the backend.
     *
     * @param name Backend name
     * @param options Options overlaid on the configured ones, used only on first construction
     * @return the memoized backend
     * @throws UnknownBackendException if no factory is registered for the name
     * @throws BackendInitializationException if the factory fails
     */
    public Backend getOrCreate(String name, Map<String, Object> options) {
        requireKnown(name);
        synchronized (instances) {
            Backend existing = instances.get(name);
            if (existing != null) {
                return existing;
            }
            Backend backend = construct(name, options);
            instances.put(name, backend);
            return backend;
        }
    }

    /**
     * Get an already constructed backend.
     *
     * @param name Backend name
     * @return the backend if it was constructed
     */
    public Optional<Backend> get(String name) {
        return Optional.ofNullable(instances.get(name));
    }

    /**
     * All constructed backends, in construction order.
     *
     * @return read-only snapshot
     */
    public Map<String, Backend> backends() {
        synchronized (instances) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(instances));
        }
    }

    /**
     * Close and forget every constructed backend.
     */
    public void closeAll() {
        Map<String, Backend> snapshot;
        synchronized (instances) {
            snapshot = new LinkedHashMap<>(instances);
            instances.clear();
        }
        snapshot.forEach((name, backend) -> {
            log.info("Closing backend {}", name);
            backend.close();
        });
    }

    private Backend construct(String name, Map<String, Object> options) {
        Map<String, Object> merged = new HashMap<>(configuredOptions.getOrDefault(name, Map.of()));
        if (options != null) {
            merged.putAll(options);
        }
        try {
            Backend backend = factories.get(name).create(merged);
            log.info("Initialized backend {}", name);
            return backend;
        } catch (Exception e) {
            throw new BackendInitializationException(name, e);
        }
    }
}
