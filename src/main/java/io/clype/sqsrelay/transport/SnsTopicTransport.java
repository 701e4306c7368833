package io.clype.sqsrelay.transport;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.sqsrelay.model.OutboundMessage;
import io.clype.sqsrelay.model.TopicSubscription;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sns.model.CreateTopicRequest;
import software.amazon.awssdk.services.sns.model.DeleteTopicRequest;
import software.amazon.awssdk.services.sns.model.ListSubscriptionsByTopicRequest;
import software.amazon.awssdk.services.sns.model.ListTopicsRequest;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.SetSubscriptionAttributesRequest;
import software.amazon.awssdk.services.sns.model.SubscribeRequest;
import software.amazon.awssdk.services.sns.model.Topic;
import software.amazon.awssdk.services.sns.model.UnsubscribeRequest;

/**
 * {@link TopicTransport} backed by the AWS SNS async client.
 *
 * <p>The client is owned by this transport and closed with it.</p>
 */
public class SnsTopicTransport implements TopicTransport {

    private static final Logger log = LoggerFactory.getLogger(SnsTopicTransport.class);

    private static final String STRING_DATA_TYPE = "String";

    private final SnsAsyncClient snsClient;
    private final AtomicBoolean closed = new AtomicBoolean();

    public SnsTopicTransport(SnsAsyncClient snsClient) {
        this.snsClient = Objects.requireNonNull(snsClient, "snsClient cannot be null");
    }

    /**
     * Scans every page of the topic listing for an ARN whose last segment is {@code topicName}.
     */
    @Override
    public Mono<String> findTopic(String topicName) {
        String suffix = ":" + topicName;
        return Flux.from(snsClient.listTopicsPaginator(ListTopicsRequest.builder().build()).topics())
                .map(Topic::topicArn)
                .filter(arn -> arn != null && arn.endsWith(suffix))
                .next();
    }

    @Override
    public Mono<String> createTopic(String topicName) {
        CreateTopicRequest request = CreateTopicRequest.builder().name(topicName).build();
        return Mono.fromFuture(() -> snsClient.createTopic(request))
                .map(response -> TransportResponses.ensureSuccess("CreateTopic", response).topicArn());
    }

    @Override
    public Mono<Void> deleteTopic(String topicArn) {
        DeleteTopicRequest request = DeleteTopicRequest.builder().topicArn(topicArn).build();
        return Mono.fromFuture(() -> snsClient.deleteTopic(request))
                .doOnNext(response -> TransportResponses.ensureSuccess("DeleteTopic", response))
                .then();
    }

    @Override
    public Mono<String> publish(OutboundMessage message) {
        PublishRequest.Builder builder = PublishRequest.builder()
                .topicArn(message.destination())
                .message(message.body());

        if (!message.attributes().isEmpty()) {
            Map<String, MessageAttributeValue> attributes = new LinkedHashMap<>();
            message.attributes().forEach((name, value) -> attributes.put(name, MessageAttributeValue.builder()
                    .dataType(STRING_DATA_TYPE)
                    .stringValue(value)
                    .build()));
            builder.messageAttributes(attributes);
        }
        if (message.isOrdered()) {
            builder.messageGroupId(message.messageGroupId())
                    .messageDeduplicationId(message.messageDeduplicationId());
        }
        PublishRequest request = builder.build();

        return Mono.fromFuture(() -> snsClient.publish(request))
                .map(response -> TransportResponses.ensureSuccess("Publish", response).messageId());
    }

    @Override
    public Mono<List<TopicSubscription>> listSubscriptions(String topicArn) {
        ListSubscriptionsByTopicRequest request = ListSubscriptionsByTopicRequest.builder()
                .topicArn(topicArn)
                .build();
        return Flux.from(snsClient.listSubscriptionsByTopicPaginator(request).subscriptions())
                .map(s -> new TopicSubscription(s.subscriptionArn(), s.protocol(), s.endpoint()))
                .collectList();
    }

    @Override
    public Mono<String> subscribeQueue(String topicArn, String queueArn) {
        SubscribeRequest request = SubscribeRequest.builder()
                .topicArn(topicArn)
                .protocol(TopicSubscription.QUEUE_PROTOCOL)
                .endpoint(queueArn)
                .returnSubscriptionArn(true)
                .build();
        return Mono.fromFuture(() -> snsClient.subscribe(request))
                .map(response -> TransportResponses.ensureSuccess("Subscribe", response).subscriptionArn());
    }

    @Override
    public Mono<Void> unsubscribe(String subscriptionArn) {
        UnsubscribeRequest request = UnsubscribeRequest.builder().subscriptionArn(subscriptionArn).build();
        return Mono.fromFuture(() -> snsClient.unsubscribe(request))
                .doOnNext(response -> TransportResponses.ensureSuccess("Unsubscribe", response))
                .then();
    }

    @Override
    public Mono<Void> setSubscriptionAttribute(String subscriptionArn, String attributeName, String attributeValue) {
        SetSubscriptionAttributesRequest request = SetSubscriptionAttributesRequest.builder()
                .subscriptionArn(subscriptionArn)
                .attributeName(attributeName)
                .attributeValue(attributeValue)
                .build();
        return Mono.fromFuture(() -> snsClient.setSubscriptionAttributes(request))
                .doOnNext(response -> TransportResponses.ensureSuccess("SetSubscriptionAttributes", response))
                .then();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            snsClient.close();
            log.debug("SNS client closed");
        }
    }
}
