package io.clype.sqsrelay.provision;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.clype.sqsrelay.codec.MessageCodec;
import io.clype.sqsrelay.metrics.MessageQueueMetrics;
import io.clype.sqsrelay.model.RedrivePolicy;
import io.clype.sqsrelay.model.TransportException;
import io.clype.sqsrelay.support.InMemoryQueueTransport;
import io.clype.sqsrelay.support.InMemoryTopicTransport;
import io.clype.sqsrelay.transport.QueueTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class QueueProvisionerTest {

    private InMemoryQueueTransport queues;
    private InMemoryTopicTransport topics;
    private SimpleMeterRegistry registry;
    private TopicProvisioner topicProvisioner;
    private QueueProvisioner provisioner;

    @BeforeEach
    void setUp() {
        queues = new InMemoryQueueTransport();
        topics = new InMemoryTopicTransport(queues);
        registry = new SimpleMeterRegistry();
        topicProvisioner = new TopicProvisioner(topics);
        provisioner = new QueueProvisioner(queues, topicProvisioner, new MessageCodec(),
                new MessageQueueMetrics(registry));
    }

    @Test
    void createsQueueWithDeadLetterAndRedrivePolicy() {
        StepVerifier.create(provisioner.createQueueWithDeadLetter("orders", false))
                .expectNext(InMemoryQueueTransport.urlOf("orders"))
                .verifyComplete();

        assertThat(queues.queueNames()).containsExactlyInAnyOrder("orders", "orders-dl");
        assertEquals("{\"maxReceiveCount\":\"3\",\"deadLetterTargetArn\":\""
                        + InMemoryQueueTransport.arnOf("orders-dl") + "\"}",
                queues.attributes("orders").get(RedrivePolicy.ATTRIBUTE_NAME));
        assertThat(queues.attributes("orders-dl")).doesNotContainKey(RedrivePolicy.ATTRIBUTE_NAME);
    }

    @Test
    void orderedQueuesArePairedWithOrderedDeadLetterQueue() {
        StepVerifier.create(provisioner.createQueueWithDeadLetter("payments", true))
                .expectNext(InMemoryQueueTransport.urlOf("payments.fifo"))
                .verifyComplete();

        assertThat(queues.queueNames()).containsExactlyInAnyOrder("payments.fifo", "payments-dl.fifo");
        assertEquals("true", queues.attributes("payments.fifo").get(QueueTransport.FIFO_QUEUE_ATTRIBUTE));
        assertEquals("true", queues.attributes("payments-dl.fifo").get(QueueTransport.FIFO_QUEUE_ATTRIBUTE));
    }

    @Test
    void provisioningTwiceYieldsSameQueueAndNoSecondDeadLetterQueue() {
        String first = provisioner.createQueueWithDeadLetter("orders", false).block();
        String second = provisioner.createQueueWithDeadLetter("orders", false).block();

        assertEquals(first, second);
        assertThat(queues.queueNames()).containsExactlyInAnyOrder("orders", "orders-dl");
    }

    @Test
    void deadLetterQueuesGetNoFurtherPairing() {
        provisioner.createQueueWithDeadLetter("orders-dl", false).block();

        assertThat(queues.queueNames()).containsExactly("orders-dl");
    }

    @Test
    void provisioningFailureCompletesEmptyAndIsCounted() {
        queues.failOn("SetQueueAttributes", new TransportException("SetQueueAttributes", 500));

        StepVerifier.create(provisioner.createQueueWithDeadLetter("orders", false))
                .verifyComplete();

        assertEquals(1.0, registry.counter("message.queue.provisioning.failures", "destination", "orders").count());
    }

    @Test
    void getOrCreateCreatesMissingQueue() {
        StepVerifier.create(provisioner.getOrCreateQueueUrl("orders", false))
                .expectNext(InMemoryQueueTransport.urlOf("orders"))
                .verifyComplete();

        assertThat(queues.exists("orders-dl")).isTrue();
    }

    @Test
    void getOrCreatePropagatesOtherTransportErrors() {
        queues.failOn("GetQueueUrl", new TransportException("GetQueueUrl", 403));

        StepVerifier.create(provisioner.getOrCreateQueueUrl("orders", false))
                .expectError(TransportException.class)
                .verify(Duration.ofSeconds(5));

        assertThat(queues.exists("orders")).isFalse();
    }

    @Test
    void deleteRemovesDeadLetterSubscriptionAndQueue() {
        String queueUrl = provisioner.createQueueWithDeadLetter("orders", false).block();
        String topicArn = topicProvisioner.getOrCreateTopicArn("events").block();
        String subscriptionArn = topics.subscribeQueue(topicArn, InMemoryQueueTransport.arnOf("orders")).block();
        assertThat(queueUrl).isNotNull();
        assertThat(subscriptionArn).isNotNull();

        StepVerifier.create(provisioner.deleteQueueWithDeadLetter("orders", "events", false))
                .expectNext(true)
                .verifyComplete();

        assertThat(queues.queueNames()).isEmpty();
        assertEquals(0, topics.subscriptionCount("events"));
        assertThat(topics.topicExists("events")).isTrue();
    }

    @Test
    void deleteSkipsMissingDeadLetterQueueAndMissingTopic() {
        queues.createQueue("orders", Map.of()).block();

        StepVerifier.create(provisioner.deleteQueueWithDeadLetter("orders", "never-created", false))
                .expectNext(true)
                .verifyComplete();

        assertThat(queues.queueNames()).isEmpty();
        assertThat(topics.topicExists("never-created")).isFalse();
    }

    @Test
    void deleteOfMissingQueueReportsFailure() {
        StepVerifier.create(provisioner.deleteQueueWithDeadLetter("ghost", null, false))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void deleteOfOrderedQueueUsesFifoNames() {
        provisioner.createQueueWithDeadLetter("payments", true).block();

        StepVerifier.create(provisioner.deleteQueueWithDeadLetter("payments", "events", true))
                .expectNext(true)
                .verifyComplete();

        assertThat(queues.queueNames()).isEmpty();
        assertEquals(0, topics.callCount("FindTopic"));
    }
}
