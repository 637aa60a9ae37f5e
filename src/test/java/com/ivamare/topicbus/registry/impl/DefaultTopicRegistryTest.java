package com.ivamare.topicbus.registry.impl;

import com.ivamare.topicbus.exception.RegistrationClosedException;
import com.ivamare.topicbus.handler.TopicHandler;
import com.ivamare.topicbus.model.HandlerKind;
import com.ivamare.topicbus.model.HandlerOptions;
import com.ivamare.topicbus.model.HandlerSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultTopicRegistry")
class DefaultTopicRegistryTest {

    private DefaultTopicRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultTopicRegistry();
    }

    private static HandlerSpec spec(String topic, Class<?> owner) {
        TopicHandler handler = (payload, ctx) -> null;
        return HandlerSpec.of(topic, HandlerKind.SLOT, HandlerOptions.defaults(), handler, owner);
    }

    static class OrderService {}

    static class BillingService {}

    @Nested
    @DisplayName("register")
    class RegisterTests {

        @Test
        @DisplayName("should keep declaration order within topic")
        void shouldKeepDeclarationOrderWithinTopic() {
            HandlerSpec first = spec("orders.created", OrderService.class);
            HandlerSpec second = spec("orders.created", BillingService.class);
            HandlerSpec third = spec("orders.created", OrderService.class);

            registry.register(first);
            registry.register(second);
            registry.register(third);

            assertEquals(List.of(first, second, third), registry.subscribers("orders.created"));
        }

        @Test
        @DisplayName("should not deduplicate same topic and owner")
        void shouldNotDeduplicateSameTopicAndOwner() {
            registry.register(spec("orders.created", OrderService.class));
            registry.register(spec("orders.created", OrderService.class));

            assertEquals(2, registry.subscribers("orders.created").size());
            assertEquals(2, registry.size());
        }

        @Test
        @DisplayName("should keep topics in first declaration order")
        void shouldKeepTopicsInFirstDeclarationOrder() {
            registry.register(spec("b", OrderService.class));
            registry.register(spec("a", OrderService.class));
            registry.register(spec("b", BillingService.class));

            assertEquals(List.of("b", "a"), List.copyOf(registry.subscribers().keySet()));
        }

        @Test
        @DisplayName("should track owners")
        void shouldTrackOwners() {
            registry.register(spec("a", OrderService.class));
            registry.registerOwner(BillingService.class);
            registry.registerOwner(OrderService.class);

            assertEquals(List.of(OrderService.class, BillingService.class), List.copyOf(registry.owners()));
        }

        @Test
        @DisplayName("should return empty list for unknown topic")
        void shouldReturnEmptyListForUnknownTopic() {
            assertTrue(registry.subscribers("nothing").isEmpty());
        }
    }

    @Nested
    @DisplayName("view")
    class ViewTests {

        @Test
        @DisplayName("should return read only views")
        void shouldReturnReadOnlyViews() {
            registry.register(spec("a", OrderService.class));

            Map<String, List<HandlerSpec>> all = registry.subscribers();

            assertThrows(UnsupportedOperationException.class, () -> all.remove("a"));
            assertThrows(UnsupportedOperationException.class, () -> registry.subscribers("a").clear());
        }

        @Test
        @DisplayName("topic list should reflect later appends")
        void topicListShouldReflectLaterAppends() {
            registry.register(spec("a", OrderService.class));
            List<HandlerSpec> view = registry.subscribers("a");

            registry.register(spec("a", BillingService.class));

            assertEquals(2, view.size());
        }
    }

    @Nested
    @DisplayName("backend association")
    class BackendAssociationTests {

        @Test
        @DisplayName("should associate and replace backend")
        void shouldAssociateAndReplaceBackend() {
            registry.associateBackend(OrderService.class, "memory");
            registry.associateBackend(OrderService.class, "redis");

            assertEquals("redis", registry.backendOf(OrderService.class).orElseThrow());
            assertTrue(registry.owners().contains(OrderService.class));
        }

        @Test
        @DisplayName("should return empty when not associated")
        void shouldReturnEmptyWhenNotAssociated() {
            assertTrue(registry.backendOf(BillingService.class).isEmpty());
        }
    }

    @Nested
    @DisplayName("seal")
    class SealTests {

        @Test
        @DisplayName("should reject registration when sealed")
        void shouldRejectRegistrationWhenSealed() {
            registry.seal();

            assertTrue(registry.isSealed());
            assertThrows(RegistrationClosedException.class, () ->
                registry.register(spec("a", OrderService.class)));
            assertThrows(RegistrationClosedException.class, () ->
                registry.associateBackend(OrderService.class, "memory"));
        }

        @Test
        @DisplayName("reset should clear and unseal")
        void resetShouldClearAndUnseal() {
            registry.register(spec("a", OrderService.class));
            registry.associateBackend(OrderService.class, "memory");
            registry.seal();

            registry.reset();

            assertFalse(registry.isSealed());
            assertEquals(0, registry.size());
            assertTrue(registry.owners().isEmpty());
            assertTrue(registry.backendOf(OrderService.class).isEmpty());
            registry.register(spec("a", OrderService.class));
            assertEquals(1, registry.size());
        }
    }
}
