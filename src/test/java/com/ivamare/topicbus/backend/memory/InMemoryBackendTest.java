package com.ivamare.topicbus.backend.memory;

import com.ivamare.topicbus.handler.TopicHandler;
import com.ivamare.topicbus.model.HandlerKind;
import com.ivamare.topicbus.model.HandlerOptions;
import com.ivamare.topicbus.model.HandlerSpec;
import com.ivamare.topicbus.model.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisplayName("InMemoryBackend")
class InMemoryBackendTest {

    private InMemoryBackend backend;

    static class WorkerA {}

    static class WorkerB {}

    @BeforeEach
    void setUp() {
        backend = new InMemoryBackend(Map.of());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private static HandlerSpec spec(String topic, HandlerKind kind, HandlerOptions options,
                                    TopicHandler handler, Class<?> owner) {
        return HandlerSpec.of(topic, kind, options, handler, owner);
    }

    private static TopicHandler recording(List<String> log, String name) {
        return (payload, context) -> {
            log.add(name + ":" + payload);
            return null;
        };
    }

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("should deliver to every matching non-exclusive handler")
        void shouldDeliverToAllMatching() throws Exception {
            List<String> log = new CopyOnWriteArrayList<>();
            backend.slot("orders.created", spec("orders.created", HandlerKind.SLOT,
                HandlerOptions.defaults(), recording(log, "slot"), WorkerA.class));
            backend.addListener("orders.*", spec("orders.*", HandlerKind.LISTENER,
                HandlerOptions.defaults(), recording(log, "listener"), WorkerB.class));
            backend.addListener("payments.*", spec("payments.*", HandlerKind.LISTENER,
                HandlerOptions.defaults(), recording(log, "payments"), WorkerB.class));

            backend.publish("orders.created", 1).get(5, TimeUnit.SECONDS);

            assertThat(log).containsExactlyInAnyOrder("slot:1", "listener:1");
        }

        @Test
        @DisplayName("should deliver once per exclusive group, rotating members")
        void shouldDeliverOncePerExclusiveGroup() throws Exception {
            List<String> log = new CopyOnWriteArrayList<>();
            HandlerOptions exclusive = HandlerOptions.builder().exclusive(true).build();
            backend.slot("jobs", spec("jobs", HandlerKind.SLOT, exclusive, recording(log, "a1"), WorkerA.class));
            backend.slot("jobs", spec("jobs", HandlerKind.SLOT, exclusive, recording(log, "a2"), WorkerA.class));
            backend.slot("jobs", spec("jobs", HandlerKind.SLOT, exclusive, recording(log, "b"), WorkerB.class));

            backend.publish("jobs", 1).get(5, TimeUnit.SECONDS);
            backend.publish("jobs", 2).get(5, TimeUnit.SECONDS);

            assertThat(log).containsExactlyInAnyOrder("a1:1", "b:1", "a2:2", "b:2");
        }

        @Test
        @DisplayName("should complete with no recipients")
        void shouldCompleteWithNoRecipients() throws Exception {
            backend.publish("nobody.listens", 1).get(5, TimeUnit.SECONDS);

            assertThat(backend.subscriptionCount()).isZero();
        }
    }

    @Nested
    @DisplayName("request")
    class RequestTests {

        @Test
        @DisplayName("should complete with the reply handler's result")
        void shouldCompleteWithReply() throws Exception {
            backend.replyTo("svc.*", spec("svc.*", HandlerKind.REPLY, HandlerOptions.defaults(),
                (payload, context) -> context.topic() + "=" + payload, WorkerA.class));

            Reply reply = backend.request("svc.echo", "hi").get(5, TimeUnit.SECONDS);

            assertThat(reply).isEqualTo(Reply.ok("svc.echo=hi"));
        }

        @Test
        @DisplayName("should answer not found without a reply handler")
        void shouldAnswerNotFound() throws Exception {
            backend.slot("svc.echo", spec("svc.echo", HandlerKind.SLOT, HandlerOptions.defaults(),
                (payload, context) -> "ignored", WorkerA.class));

            Reply reply = backend.request("svc.echo", "hi").get(5, TimeUnit.SECONDS);

            assertThat(reply.code()).isEqualTo(Reply.NOT_FOUND);
        }

        @Test
        @DisplayName("should answer 409 when the reply handler times out")
        void shouldAnswerTimeout() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            HandlerOptions quick = HandlerOptions.builder().timeout(Duration.ofMillis(100)).build();
            backend.replyTo("svc.slow", spec("svc.slow", HandlerKind.REPLY, quick,
                (payload, context) -> {
                    release.await(5, TimeUnit.SECONDS);
                    return "late";
                }, WorkerA.class));

            Reply reply = backend.request("svc.slow", null).get(5, TimeUnit.SECONDS);
            release.countDown();

            assertThat(reply).isEqualTo(Reply.timeout());
            assertThat(reply.code()).isEqualTo(Reply.TIMEOUT);
        }

        @Test
        @DisplayName("should answer error when the reply handler fails")
        void shouldAnswerError() throws Exception {
            backend.replyTo("svc.fail", spec("svc.fail", HandlerKind.REPLY, HandlerOptions.defaults(),
                (payload, context) -> {
                    throw new IllegalStateException("broken");
                }, WorkerA.class));

            Reply reply = backend.request("svc.fail", null).get(5, TimeUnit.SECONDS);

            assertThat(reply).isEqualTo(Reply.error("broken"));
        }
    }

    @Nested
    @DisplayName("health check")
    class HealthTests {

        @Test
        @DisplayName("should not report health by default")
        void shouldNotReportHealthByDefault() {
            assertThat(backend.reportHealth()).isFalse();
        }

        @Test
        @DisplayName("should accept string options")
        void shouldAcceptStringOptions() {
            InMemoryBackend configured = new InMemoryBackend(Map.of("health_check", "true", "health_interval", "0"));
            try {
                assertThat(configured.reportHealth()).isTrue();
            } finally {
                configured.close();
            }
        }

        @Test
        @DisplayName("should beat while registered and stop after unregister")
        void shouldBeatWhileRegistered() {
            InMemoryBackend reporting = new InMemoryBackend(Map.of("health_check", true, "health_interval", 1));
            try {
                reporting.registerHealthCheck();
                reporting.registerHealthCheck();

                assertThat(reporting.isHealthCheckRegistered()).isTrue();
                await().atMost(5, TimeUnit.SECONDS).until(() -> reporting.heartbeatCount() >= 1);
                assertThat(reporting.lastHeartbeat()).isNotNull();

                reporting.unregisterHealthCheck();
                assertThat(reporting.isHealthCheckRegistered()).isFalse();
            } finally {
                reporting.close();
            }
        }
    }
}
