package io.clype.sqsrelay.transport;

import java.util.List;

import io.clype.sqsrelay.model.OutboundMessage;
import io.clype.sqsrelay.model.TopicSubscription;

import reactor.core.publisher.Mono;

/**
 * Topic operations the library needs from the underlying transport.
 */
public interface TopicTransport extends AutoCloseable {

    /** Subscription attribute holding the filter policy document. */
    String FILTER_POLICY_ATTRIBUTE = "FilterPolicy";

    /**
     * Finds a topic by name.
     *
     * @return the topic ARN, or an empty Mono when no topic has that name
     */
    Mono<String> findTopic(String topicName);

    /**
     * Creates a topic, or returns the existing one of that name.
     *
     * @return the topic ARN
     */
    Mono<String> createTopic(String topicName);

    Mono<Void> deleteTopic(String topicArn);

    /**
     * Publishes to the topic ARN in {@link OutboundMessage#destination()}.
     *
     * @return the provider message id
     */
    Mono<String> publish(OutboundMessage message);

    Mono<List<TopicSubscription>> listSubscriptions(String topicArn);

    /**
     * Subscribes a queue to a topic over the queue protocol.
     *
     * @return the subscription ARN
     */
    Mono<String> subscribeQueue(String topicArn, String queueArn);

    Mono<Void> unsubscribe(String subscriptionArn);

    Mono<Void> setSubscriptionAttribute(String subscriptionArn, String attributeName, String attributeValue);

    @Override
    void close();
}
