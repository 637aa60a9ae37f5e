package com.ivamare.topicbus.backend.redis;

import com.ivamare.topicbus.backend.Backend;
import com.ivamare.topicbus.backend.HandlerInvoker;
import com.ivamare.topicbus.model.HandlerSpec;
import com.ivamare.topicbus.model.MessageContext;
import com.ivamare.topicbus.model.Reply;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Redis pub/sub backend built on Lettuce.
 *
 * <p>Every bound topic becomes a pattern subscription. Messages travel as a
 * JSON {@link Envelope}; each publish carries a fresh sender id, and replies
 * are published on {@code topicbus.response.<sender>}. Exclusive groups are
 * enforced with a {@code SET NX EX} lock per group, channel and sender, so at
 * most one process of a group handles a given message.
 *
 * <p>Health reporting adds this process to the {@code topicbus.known_host.health}
 * hash and removes it again on unregister.
 */
public class RedisBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(RedisBackend.class);

    public static final String NAME = "redis";
    public static final String RESPONSE_PREFIX = "topicbus.response.";
    public static final String ERROR_TOPIC = "topicbus.errors";
    public static final String HEALTH_KEY = "topicbus.known_host.health";

    private final RedisBackendOptions options;
    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final StatefulRedisPubSubConnection<String, String> pubSub;
    private final ObjectMapper objectMapper;
    private final HandlerInvoker invoker;
    private final String ident = UUID.randomUUID().toString();

    private final Map<String, List<HandlerSpec>> handlersByPattern = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Reply>> pendingRequests = new ConcurrentHashMap<>();
    private volatile boolean healthCheckRegistered = false;

    /**
     * Create a backend over existing connections.
     *
     * @param options Backend options
     * @param client Owning client, shut down on close (nullable)
     * @param connection Command connection used for publishing, locks and health
     * @param pubSub Subscription connection
     * @param objectMapper Envelope serializer
     */
    public RedisBackend(
            RedisBackendOptions options,
            RedisClient client,
            StatefulRedisConnection<String, String> connection,
            StatefulRedisPubSubConnection<String, String> pubSub,
            ObjectMapper objectMapper) {
        this.options = options;
        this.client = client;
        this.connection = connection;
        this.pubSub = pubSub;
        this.objectMapper = objectMapper;
        this.invoker = new HandlerInvoker(NAME, options.broadcastErrors() ? this::broadcastError : null);

        pubSub.addListener(new RedisPubSubAdapter<String, String>() {
            @Override
            public void message(String pattern, String channel, String message) {
                onMessage(pattern, channel, message);
            }

            @Override
            public void message(String channel, String message) {
                onResponse(channel, message);
            }
        });
    }

    /**
     * Connect to Redis and create a backend.
     *
     * @param rawOptions Backend options (host, port, broadcast_errors, health_check, request_timeout)
     * @param objectMapper Envelope serializer
     * @return connected backend
     */
    public static RedisBackend connect(Map<String, Object> rawOptions, ObjectMapper objectMapper) {
        RedisBackendOptions options = RedisBackendOptions.fromMap(rawOptions);
        RedisClient client = RedisClient.create(RedisURI.builder()
            .withHost(options.host())
            .withPort(options.port())
            .build());
        log.info("Connecting to Redis at {}:{}", options.host(), options.port());
        return new RedisBackend(options, client, client.connect(), client.connectPubSub(), objectMapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void addListener(String topic, HandlerSpec spec) {
        bind(topic, spec);
    }

    @Override
    public void slot(String topic, HandlerSpec spec) {
        bind(topic, spec);
    }

    @Override
    public void replyTo(String topic, HandlerSpec spec) {
        bind(topic, spec);
    }

    @Override
    public CompletableFuture<Void> publish(String topic, Object payload) {
        return send(topic, payload, Reply.OK, UUID.randomUUID().toString());
    }

    @Override
    public CompletableFuture<Reply> request(String topic, Object payload) {
        String sender = UUID.randomUUID().toString();
        String responseChannel = RESPONSE_PREFIX + sender;
        CompletableFuture<Reply> reply = new CompletableFuture<>();
        pendingRequests.put(sender, reply);
        pubSub.sync().subscribe(responseChannel);

        send(topic, payload, Reply.OK, sender).whenComplete((ignored, error) -> {
            if (error != null) {
                reply.completeExceptionally(error);
            }
        });

        return reply
            .orTimeout(options.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(error -> {
                log.warn("Request on {} failed: {}", topic, error.getMessage());
                return Reply.timeout();
            })
            .whenComplete((result, error) -> {
                pendingRequests.remove(sender);
                pubSub.async().unsubscribe(responseChannel);
            });
    }

    @Override
    public boolean reportHealth() {
        return options.healthCheck();
    }

    @Override
    public void registerHealthCheck() {
        if (healthCheckRegistered) {
            return;
        }
        connection.sync().hset(HEALTH_KEY, ident, "active");
        healthCheckRegistered = true;
        log.info("Registered health check for {}", ident);
    }

    @Override
    public void unregisterHealthCheck() {
        if (!healthCheckRegistered) {
            return;
        }
        connection.sync().hdel(HEALTH_KEY, ident);
        healthCheckRegistered = false;
        log.info("Unregistered health check for {}", ident);
    }

    @Override
    public boolean isHealthCheckRegistered() {
        return healthCheckRegistered;
    }

    @Override
    public void close() {
        invoker.close();
        pubSub.close();
        connection.close();
        if (client != null) {
            client.shutdown();
        }
    }

    public String ident() {
        return ident;
    }

    private void bind(String topic, HandlerSpec spec) {
        handlersByPattern.computeIfAbsent(topic, pattern -> {
            pubSub.sync().psubscribe(pattern);
            log.debug("Subscribed to pattern {}", pattern);
            return new CopyOnWriteArrayList<>();
        }).add(spec);
        log.debug("Bound {} handler on {} (owner={})", spec.kind().getValue(), topic, spec.owner().getSimpleName());
    }

    void onMessage(String pattern, String channel, String message) {
        List<HandlerSpec> specs = handlersByPattern.get(pattern);
        if (specs == null || specs.isEmpty()) {
            return;
        }
        Envelope envelope;
        try {
            envelope = objectMapper.readValue(message, Envelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping undecodable message on {}: {}", channel, e.getOriginalMessage());
            return;
        }
        for (HandlerSpec spec : specs) {
            if (spec.exclusive()) {
                acquireGroupLock(spec, channel, envelope.sender()).thenAccept(acquired -> {
                    if (acquired) {
                        dispatch(spec, pattern, channel, envelope);
                    }
                });
            } else {
                dispatch(spec, pattern, channel, envelope);
            }
        }
    }

    void onResponse(String channel, String message) {
        if (!channel.startsWith(RESPONSE_PREFIX)) {
            return;
        }
        CompletableFuture<Reply> pending = pendingRequests.get(channel.substring(RESPONSE_PREFIX.length()));
        if (pending == null) {
            return;
        }
        try {
            Envelope envelope = objectMapper.readValue(message, Envelope.class);
            pending.complete(new Reply(envelope.code(), envelope.data()));
        } catch (JsonProcessingException e) {
            pending.complete(Reply.error("Undecodable reply: " + e.getOriginalMessage()));
        }
    }

    private void dispatch(HandlerSpec spec, String pattern, String channel, Envelope envelope) {
        MessageContext context = new MessageContext(channel, pattern, envelope.sender(), NAME, Instant.now());
        invoker.invoke(spec, envelope.data(), context).thenAccept(reply -> {
            if (spec.isReply()) {
                send(RESPONSE_PREFIX + envelope.sender(), reply.data(), reply.code(), ident);
            }
        });
    }

    private CompletableFuture<Boolean> acquireGroupLock(HandlerSpec spec, String channel, String sender) {
        String key = spec.exclusiveGroup() + ":" + channel + ":" + sender;
        long expiry = Math.max(1L, spec.timeoutSeconds() + 1);
        return connection.async()
            .set(key, ident, SetArgs.Builder.nx().ex(expiry))
            .toCompletableFuture()
            .thenApply("OK"::equals);
    }

    private CompletableFuture<Void> send(String channel, Object data, int code, String sender) {
        String json;
        try {
            json = objectMapper.writeValueAsString(new Envelope(data, code, sender));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        return connection.async().publish(channel, json)
            .toCompletableFuture()
            .thenAccept(receivers -> log.debug("Published to {} ({} receivers)", channel, receivers));
    }

    private void broadcastError(HandlerSpec spec, MessageContext context, Throwable error) {
        Map<String, Object> report = Map.of(
            "topic", context.topic(),
            "code", Reply.ERROR,
            "sender", ident,
            "timestamp", Instant.now().toString(),
            "error", String.valueOf(error.getMessage())
        );
        send(ERROR_TOPIC, report, Reply.ERROR, ident);
    }

    /**
     * Wire representation of a message.
     *
     * @param data Payload
     * @param code Status code, 200 for regular publishes
     * @param sender Publisher id, replies go to {@code topicbus.response.<sender>}
     */
    public record Envelope(Object data, int code, String sender) {
    }
}
