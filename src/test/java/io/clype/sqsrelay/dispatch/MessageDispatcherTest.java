package io.clype.sqsrelay.dispatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.clype.sqsrelay.codec.MessageCodec;
import io.clype.sqsrelay.codec.PayloadReader;
import io.clype.sqsrelay.handler.MessageHandler;
import io.clype.sqsrelay.metrics.MessageQueueMetrics;
import io.clype.sqsrelay.model.DeliveryContext;
import io.clype.sqsrelay.model.MessageDispatchException;
import io.clype.sqsrelay.model.OutboundMessage;
import io.clype.sqsrelay.model.RedrivePolicy;
import io.clype.sqsrelay.model.TopicRoute;
import io.clype.sqsrelay.support.InMemoryQueueTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MessageDispatcherTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private InMemoryQueueTransport queues;
    private MessageCodec codec;
    private SimpleMeterRegistry registry;
    private Scheduler scheduler;
    private MessageDispatcher dispatcher;
    private String queueUrl;

    @BeforeEach
    void setUp() {
        queues = new InMemoryQueueTransport();
        codec = new MessageCodec();
        registry = new SimpleMeterRegistry();
        scheduler = Schedulers.newBoundedElastic(2, 100, "dispatcher-test");
        dispatcher = new MessageDispatcher(queues, codec, scheduler, 10, new MessageQueueMetrics(registry));
        queueUrl = queues.createQueue("orders", Map.of()).block();
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private void send(String body) {
        queues.sendMessage(OutboundMessage.standard(queueUrl, body, Map.of("tenant", "acme"))).block();
    }

    private String dispatchRaw(MessageHandler<String> handler) {
        return dispatcher.dispatch(queueUrl, WAIT, PayloadReader.raw(codec), handler,
                DeliveryContext.direct(), false).block();
    }

    @Test
    void acknowledgedMessageIsDeleted() {
        send(codec.encodeRaw("hello"));

        String ids = dispatchRaw((MessageHandler.SingleKey<String>) (payload, key, attributes) -> true);

        assertThat(ids).isNotEmpty();
        assertEquals(0, queues.messageCount("orders"));
        assertEquals(1.0, registry.counter("message.queue.acknowledged", "destination", "orders").count());
    }

    @Test
    void emptyReceiveYieldsEmptyString() {
        StepVerifier.create(dispatcher.dispatch(queueUrl, WAIT, PayloadReader.raw(codec),
                        (MessageHandler.SingleKey<String>) (payload, key, attributes) -> true,
                        DeliveryContext.direct(), false))
                .expectNext("")
                .verifyComplete();
    }

    @Test
    void abandonedMessageRedeliversAfterVisibilityTimeout() {
        send(codec.encodeRaw("hello"));
        MessageHandler.SingleKey<String> reject = (payload, key, attributes) -> false;

        String first = dispatchRaw(reject);
        assertEquals(1, queues.messageCount("orders"));

        // still invisible
        assertEquals("", dispatchRaw(reject));

        queues.advance(InMemoryQueueTransport.VISIBILITY_TIMEOUT.plusSeconds(1));
        String second = dispatchRaw((MessageHandler.SingleKey<String>) (payload, key, attributes) -> true);

        assertEquals(first, second);
        assertEquals(0, queues.messageCount("orders"));
        assertEquals(1.0, registry.counter("message.queue.abandoned", "destination", "orders").count());
    }

    @Test
    void messageMovesToDeadLetterQueueAfterThreeFailedReceives() {
        String deadLetterUrl = queues.createQueue("orders-dl", Map.of()).block();
        assertThat(deadLetterUrl).isNotNull();
        queues.setQueueAttributes(queueUrl, Map.of(RedrivePolicy.ATTRIBUTE_NAME,
                codec.toJson(RedrivePolicy.forDeadLetterQueue(InMemoryQueueTransport.arnOf("orders-dl"))))).block();
        send(codec.encodeRaw("poison"));
        MessageHandler.SingleKey<String> reject = (payload, key, attributes) -> false;

        for (int attempt = 0; attempt < RedrivePolicy.MAX_RECEIVE_COUNT; attempt++) {
            assertThat(dispatchRaw(reject)).isNotEmpty();
            queues.advance(InMemoryQueueTransport.VISIBILITY_TIMEOUT.plusSeconds(1));
        }

        assertEquals("", dispatchRaw(reject));
        assertEquals(0, queues.messageCount("orders"));
        assertThat(queues.bodies("orders-dl")).containsExactly(codec.encodeRaw("poison"));
    }

    @Test
    void handlerFailureLeavesMessageAndRaisesDispatchException() {
        send(codec.encodeRaw("hello"));
        MessageHandler.SingleKey<String> failing = (payload, key, attributes) -> {
            throw new IllegalStateException("boom");
        };

        StepVerifier.create(dispatcher.dispatch(queueUrl, WAIT, PayloadReader.raw(codec), failing,
                        DeliveryContext.direct(), false))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(MessageDispatchException.class);
                    assertThat(e.getCause()).hasMessage("boom");
                    assertThat(((MessageDispatchException) e).getMessageId()).isNotBlank();
                })
                .verify(Duration.ofSeconds(5));

        assertEquals(1, queues.messageCount("orders"));
        assertEquals(0, queues.callCount("DeleteMessage"));
        assertEquals(1.0, registry.counter("message.queue.handler.failures", "destination", "orders").count());
    }

    @Test
    void undecodablePayloadIsTreatedLikeHandlerFailure() {
        send("not json");

        StepVerifier.create(dispatcher.dispatch(queueUrl, WAIT, PayloadReader.typed(codec, Map.class),
                        (MessageHandler.SingleKey<Map>) (payload, key, attributes) -> true,
                        DeliveryContext.direct(), false))
                .expectError(MessageDispatchException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(1, queues.messageCount("orders"));
    }

    @Test
    void processesBatchInReceiveOrderAndEachMessageIndependently() {
        send(codec.encodeRaw("one"));
        send(codec.encodeRaw("two"));
        send(codec.encodeRaw("three"));
        List<String> seen = new ArrayList<>();

        String ids = dispatchRaw((MessageHandler.SingleKey<String>) (payload, key, attributes) -> {
            seen.add(payload);
            return !payload.equals("two");
        });

        assertThat(seen).containsExactly("one", "two", "three");
        assertThat(ids.split(",")).hasSize(3);
        assertThat(queues.bodies("orders")).containsExactly(codec.encodeRaw("two"));
    }

    @Test
    void directDeliveryPassesTransportAttributes() {
        send(codec.encodeRaw("hello"));
        List<Map<String, String>> seen = new ArrayList<>();

        dispatchRaw((MessageHandler.SingleKey<String>) (payload, key, attributes) -> seen.add(attributes));

        assertThat(seen).containsExactly(Map.of("tenant", "acme"));
    }

    @Test
    void topicDeliveryUnwrapsEnvelopeAndPassesRoute() {
        String envelope = "{\"Type\":\"Notification\",\"MessageId\":\"n-1\",\"TopicArn\":\"arn:t:events\","
                + "\"Message\":\"" + codec.encodeRaw("hello") + "\","
                + "\"MessageAttributes\":{\"routingKey\":{\"Type\":\"String\",\"Value\":\"created\"}}}";
        queues.sendMessage(OutboundMessage.standard(queueUrl, envelope, Map.of())).block();
        List<Object> seen = new ArrayList<>();

        dispatcher.dispatch(queueUrl, WAIT, PayloadReader.raw(codec),
                (MessageHandler.SingleKeyWithOriginTopic<String>) (payload, topic, key, attributes) -> {
                    seen.add(payload);
                    seen.add(topic);
                    seen.add(key);
                    seen.add(attributes);
                    return true;
                },
                DeliveryContext.of(TopicRoute.of("events", "created")), true).block();

        assertThat(seen).containsExactly("hello", "events", "created", Map.of("routingKey", "created"));
    }

    @Test
    void passesWaitTimeAndNullForOrderedReceives() {
        dispatchRaw((MessageHandler.SingleKey<String>) (payload, key, attributes) -> true);
        dispatcher.dispatch(queueUrl, null, PayloadReader.raw(codec),
                (MessageHandler.SingleKey<String>) (payload, key, attributes) -> true,
                DeliveryContext.direct(), false).block();

        assertThat(queues.receiveWaits()).containsExactly(WAIT, null);
    }

    @Test
    void callerDispatchRunsHandlerOnCallingThreadWithoutWait() {
        send(codec.encodeRaw("hello"));
        Thread caller = Thread.currentThread();
        List<Thread> handlerThreads = new ArrayList<>();

        String ids = dispatcher.dispatchOnCaller(queueUrl, PayloadReader.raw(codec),
                (MessageHandler.SingleKey<String>) (payload, key, attributes) -> handlerThreads.add(Thread.currentThread()),
                DeliveryContext.direct());

        assertThat(ids).isNotEmpty();
        assertThat(handlerThreads).containsExactly(caller);
        assertThat(queues.receiveWaits()).containsExactly((Duration) null);
        assertEquals(0, queues.messageCount("orders"));
    }

    @Test
    void callerDispatchOfEmptyQueueYieldsEmptyString() {
        assertEquals("", dispatcher.dispatchOnCaller(queueUrl, PayloadReader.raw(codec),
                (MessageHandler.SingleKey<String>) (payload, key, attributes) -> true, DeliveryContext.direct()));
    }

    @Test
    void rejectsBatchSizeOutsideTransportLimits() {
        assertThrows(IllegalArgumentException.class,
                () -> new MessageDispatcher(queues, codec, scheduler, 0, null));
        assertThrows(IllegalArgumentException.class,
                () -> new MessageDispatcher(queues, codec, scheduler, 11, null));
    }
}
