package com.ivamare.topicbus.backend.memory;

import com.ivamare.topicbus.backend.Backend;
import com.ivamare.topicbus.backend.BackendOptions;
import com.ivamare.topicbus.backend.HandlerInvoker;
import com.ivamare.topicbus.backend.TopicPattern;
import com.ivamare.topicbus.model.HandlerSpec;
import com.ivamare.topicbus.model.MessageContext;
import com.ivamare.topicbus.model.Reply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process backend. Messages never leave the JVM.
 *
 * <p>Options:
 * <ul>
 *   <li>{@code health_check} (Boolean, default false) - report health</li>
 *   <li>{@code health_interval} (seconds, default 30) - heartbeat period</li>
 * </ul>
 *
 * <p>Each exclusive group (same subscription pattern, same declaring class)
 * receives a message once, members taking turns.
 */
public class InMemoryBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackend.class);

    public static final String NAME = "memory";
    public static final String HEALTH_CHECK = "health_check";
    public static final String HEALTH_INTERVAL = "health_interval";

    private final String ident = UUID.randomUUID().toString();
    private final boolean healthCheck;
    private final long healthIntervalSeconds;
    private final HandlerInvoker invoker;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> groupCursors = new ConcurrentHashMap<>();
    private final AtomicLong heartbeats = new AtomicLong();

    private ScheduledExecutorService heartbeatScheduler;
    private ScheduledFuture<?> heartbeat;
    private volatile Instant lastHeartbeat;

    public InMemoryBackend(Map<String, Object> options) {
        this.healthCheck = BackendOptions.flag(options, HEALTH_CHECK);
        this.healthIntervalSeconds = Math.max(1L, BackendOptions.number(options, HEALTH_INTERVAL, 30L));
        this.invoker = new HandlerInvoker(NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void addListener(String topic, HandlerSpec spec) {
        subscribe(topic, spec);
    }

    @Override
    public void slot(String topic, HandlerSpec spec) {
        subscribe(topic, spec);
    }

    @Override
    public void replyTo(String topic, HandlerSpec spec) {
        subscribe(topic, spec);
    }

    /**
     * Deliver to every matching subscription.
     *
     * @return Future completing when every delivered handler has finished
     */
    @Override
    public CompletableFuture<Void> publish(String topic, Object payload) {
        String sender = UUID.randomUUID().toString();
        List<CompletableFuture<Reply>> deliveries = new ArrayList<>();
        for (Subscription subscription : recipients(topic)) {
            deliveries.add(deliver(subscription, topic, sender, payload));
        }
        log.debug("Published to {}, {} recipients", topic, deliveries.size());
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]));
    }

    /**
     * Deliver to every matching subscription and complete with the first reply
     * from a reply handler, or {@link Reply#notFound()} if no reply handler matches.
     */
    @Override
    public CompletableFuture<Reply> request(String topic, Object payload) {
        String sender = UUID.randomUUID().toString();
        CompletableFuture<Reply> first = new CompletableFuture<>();
        int replyHandlers = 0;
        for (Subscription subscription : recipients(topic)) {
            CompletableFuture<Reply> delivery = deliver(subscription, topic, sender, payload);
            if (subscription.spec().isReply()) {
                replyHandlers++;
                delivery.thenAccept(first::complete);
            }
        }
        if (replyHandlers == 0) {
            log.debug("No reply handler for {}", topic);
            return CompletableFuture.completedFuture(Reply.notFound());
        }
        return first;
    }

    @Override
    public boolean reportHealth() {
        return healthCheck;
    }

    @Override
    public synchronized void registerHealthCheck() {
        if (heartbeat != null) {
            return;
        }
        CustomizableThreadFactory threads = new CustomizableThreadFactory("topicbus-memory-health-");
        threads.setDaemon(true);
        heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(threads);
        heartbeat = heartbeatScheduler.scheduleAtFixedRate(this::beat, 0, healthIntervalSeconds, TimeUnit.SECONDS);
        log.info("Registered health check for {} (interval={}s)", ident, healthIntervalSeconds);
    }

    @Override
    public synchronized void unregisterHealthCheck() {
        if (heartbeat == null) {
            return;
        }
        heartbeat.cancel(false);
        heartbeatScheduler.shutdownNow();
        heartbeat = null;
        heartbeatScheduler = null;
        log.info("Unregistered health check for {}", ident);
    }

    @Override
    public synchronized boolean isHealthCheckRegistered() {
        return heartbeat != null;
    }

    @Override
    public void close() {
        unregisterHealthCheck();
        invoker.close();
        subscriptions.clear();
    }

    public long heartbeatCount() {
        return heartbeats.get();
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public String ident() {
        return ident;
    }

    private void subscribe(String topic, HandlerSpec spec) {
        subscriptions.add(new Subscription(topic, TopicPattern.compile(topic), spec));
        log.debug("Bound {} handler on {} (owner={})", spec.kind().getValue(), topic, spec.owner().getSimpleName());
    }

    private List<Subscription> recipients(String topic) {
        List<Subscription> recipients = new ArrayList<>();
        Map<String, List<Subscription>> groups = new LinkedHashMap<>();
        for (Subscription subscription : subscriptions) {
            if (!subscription.matcher().matches(topic)) {
                continue;
            }
            if (subscription.spec().exclusive()) {
                String group = subscription.pattern() + "|" + subscription.spec().exclusiveGroup();
                groups.computeIfAbsent(group, g -> new ArrayList<>()).add(subscription);
            } else {
                recipients.add(subscription);
            }
        }
        groups.forEach((group, members) -> {
            int turn = groupCursors.computeIfAbsent(group, g -> new AtomicInteger()).getAndIncrement();
            recipients.add(members.get(Math.floorMod(turn, members.size())));
        });
        return recipients;
    }

    private CompletableFuture<Reply> deliver(Subscription subscription, String topic, String sender, Object payload) {
        MessageContext context = new MessageContext(topic, subscription.pattern(), sender, NAME, Instant.now());
        return invoker.invoke(subscription.spec(), payload, context);
    }

    private void beat() {
        lastHeartbeat = Instant.now();
        heartbeats.incrementAndGet();
    }

    private record Subscription(String pattern, TopicPattern matcher, HandlerSpec spec) {
    }
}
