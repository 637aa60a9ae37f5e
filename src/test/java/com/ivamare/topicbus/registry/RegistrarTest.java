package com.ivamare.topicbus.registry;

import com.ivamare.topicbus.backend.Backend;
import com.ivamare.topicbus.backend.BackendManager;
import com.ivamare.topicbus.exception.InvalidHandlerOptionsException;
import com.ivamare.topicbus.exception.UnknownBackendException;
import com.ivamare.topicbus.handler.TopicHandler;
import com.ivamare.topicbus.model.HandlerKind;
import com.ivamare.topicbus.model.HandlerOptions;
import com.ivamare.topicbus.model.HandlerSpec;
import com.ivamare.topicbus.registry.impl.DefaultTopicRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Registrar")
class RegistrarTest {

    private DefaultTopicRegistry registry;
    private BackendManager backendManager;
    private AtomicInteger constructions;
    private Registrar registrar;

    static class OrderSubscriber {}

    static class PaymentSubscriber {}

    @BeforeEach
    void setUp() {
        registry = new DefaultTopicRegistry();
        backendManager = new BackendManager();
        constructions = new AtomicInteger();
        backendManager.registerFactory("mem", options -> {
            constructions.incrementAndGet();
            return mock(Backend.class);
        });
        registrar = Registrar.forOwner(registry, backendManager, OrderSubscriber.class);
    }

    @Test
    @DisplayName("forOwner should register owner")
    void forOwnerShouldRegisterOwner() {
        assertTrue(registry.owners().contains(OrderSubscriber.class));
        assertEquals(OrderSubscriber.class, registrar.owner());
    }

    @Nested
    @DisplayName("declaration")
    class DeclarationTests {

        @Test
        @DisplayName("listenTo should apply defaults")
        void listenToShouldApplyDefaults() {
            registrar.listenTo("t", Map.of(), (payload, ctx) -> null);

            HandlerSpec spec = registry.subscribers("t").get(0);
            assertEquals(HandlerKind.LISTENER, spec.kind());
            assertFalse(spec.exclusive());
            assertEquals(Duration.ofSeconds(600), spec.timeout());
            assertFalse(spec.fork());
            assertEquals(OrderSubscriber.class, spec.owner());
        }

        @Test
        @DisplayName("should ignore caller supplied handler and subscriber")
        void shouldIgnoreCallerSuppliedHandlerAndSubscriber() {
            TopicHandler realHandler = (payload, ctx) -> "real";
            Map<String, Object> options = new HashMap<>();
            options.put("handler", "bogus");
            options.put("subscriber", "bogus");

            registrar.listenTo("t", options, realHandler);

            HandlerSpec spec = registry.subscribers("t").get(0);
            assertSame(realHandler, spec.handler());
            assertEquals(OrderSubscriber.class, spec.owner());
        }

        @Test
        @DisplayName("replyTo should force reply kind")
        void replyToShouldForceReplyKind() {
            registrar.replyTo("orders.get", (payload, ctx) -> null);

            assertEquals(HandlerKind.REPLY, registry.subscribers("orders.get").get(0).kind());
        }

        @Test
        @DisplayName("slot should force slot kind and keep options")
        void slotShouldForceSlotKindAndKeepOptions() {
            registrar.slot("orders.created", Map.of("exclusive", true, "timeout", 30), (payload, ctx) -> null);

            HandlerSpec spec = registry.subscribers("orders.created").get(0);
            assertEquals(HandlerKind.SLOT, spec.kind());
            assertTrue(spec.exclusive());
            assertEquals(30, spec.timeoutSeconds());
            assertEquals(OrderSubscriber.class.getName(), spec.exclusiveGroup());
        }

        @Test
        @DisplayName("caller cannot override kind through options")
        void callerCannotOverrideKindThroughOptions() {
            registrar.slot("t", Map.of("type", "reply"), (payload, ctx) -> null);

            assertEquals(HandlerKind.SLOT, registry.subscribers("t").get(0).kind());
        }

        @Test
        @DisplayName("should accept typed options")
        void shouldAcceptTypedOptions() {
            registrar.listenTo("t", HandlerOptions.builder().fork(true).build(), (payload, ctx) -> null);

            assertTrue(registry.subscribers("t").get(0).fork());
        }

        @Test
        @DisplayName("should reject malformed options")
        void shouldRejectMalformedOptions() {
            assertThrows(InvalidHandlerOptionsException.class, () ->
                registrar.slot("t", Map.of("retries", 3), (payload, ctx) -> null));
            assertTrue(registry.subscribers("t").isEmpty());
        }

        @Test
        @DisplayName("two owners on same topic should yield two entries")
        void twoOwnersOnSameTopicShouldYieldTwoEntries() {
            Registrar other = Registrar.forOwner(registry, backendManager, PaymentSubscriber.class);

            registrar.slot("orders.created", (payload, ctx) -> null);
            other.slot("orders.created", (payload, ctx) -> null);

            List<HandlerSpec> specs = registrar.subscribers("orders.created");
            assertEquals(2, specs.size());
            assertEquals(OrderSubscriber.class, specs.get(0).owner());
            assertEquals(PaymentSubscriber.class, specs.get(1).owner());
        }

        @Test
        @DisplayName("subscribers without topic should return every topic")
        void subscribersWithoutTopicShouldReturnEveryTopic() {
            registrar.slot("a", (payload, ctx) -> null);
            registrar.replyTo("b", (payload, ctx) -> null);
            registrar.listenTo("c", (payload, ctx) -> null);

            assertEquals(List.of("a", "b", "c"), List.copyOf(registrar.subscribers().keySet()));
        }
    }

    @Nested
    @DisplayName("backend")
    class BackendTests {

        @Test
        @DisplayName("enableBackend should associate and construct once")
        void enableBackendShouldAssociateAndConstructOnce() {
            Backend first = registrar.enableBackend("mem", Map.of("health_check", true));
            Backend second = Registrar.forOwner(registry, backendManager, PaymentSubscriber.class)
                .enableBackend("mem", Map.of());

            assertSame(first, second);
            assertEquals(1, constructions.get());
            assertEquals("mem", registrar.backend().orElseThrow());
        }

        @Test
        @DisplayName("getBackend should be an alias of enableBackend")
        void getBackendShouldBeAnAliasOfEnableBackend() {
            Backend enabled = registrar.enableBackend("mem", Map.of());

            assertSame(enabled, registrar.getBackend("mem"));
        }

        @Test
        @DisplayName("useBackend should not construct")
        void useBackendShouldNotConstruct() {
            registrar.useBackend("mem");

            assertEquals(0, constructions.get());
            assertEquals("mem", registrar.backend().orElseThrow());
        }

        @Test
        @DisplayName("unknown backend should fail immediately")
        void unknownBackendShouldFailImmediately() {
            UnknownBackendException e = assertThrows(UnknownBackendException.class, () ->
                registrar.enableBackend("rabbit", Map.of()));

            assertEquals("rabbit", e.getBackendName());
            assertTrue(registrar.backend().isEmpty());
        }
    }
}
