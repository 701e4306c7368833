package io.clype.sqsrelay.provision;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.sqsrelay.model.TopicSubscription;
import io.clype.sqsrelay.transport.TopicTransport;

import reactor.core.publisher.Mono;

import static io.clype.sqsrelay.codec.LogSanitizer.sanitizeForLog;

/**
 * Resolves topics by name, creating them on first reference.
 */
public class TopicProvisioner {

    private static final Logger log = LoggerFactory.getLogger(TopicProvisioner.class);

    private final TopicTransport topicTransport;

    public TopicProvisioner(TopicTransport topicTransport) {
        this.topicTransport = Objects.requireNonNull(topicTransport, "topicTransport cannot be null");
    }

    /**
     * Returns the ARN of the named topic, creating the topic when it does not exist.
     * Transport failures propagate.
     */
    public Mono<String> getOrCreateTopicArn(String topicName) {
        return topicTransport.findTopic(topicName)
                .switchIfEmpty(Mono.defer(() -> topicTransport.createTopic(topicName)
                        .doOnNext(arn -> log.info("Created topic '{}'", sanitizeForLog(topicName)))));
    }

    /**
     * Returns the ARN of the named topic, or an empty Mono when it does not exist.
     */
    public Mono<String> findTopicArn(String topicName) {
        return topicTransport.findTopic(topicName);
    }

    /**
     * Deletes the named topic. A topic that does not exist counts as deleted.
     * Transport failures propagate.
     */
    public Mono<Void> deleteTopic(String topicName) {
        return topicTransport.findTopic(topicName)
                .flatMap(arn -> topicTransport.deleteTopic(arn)
                        .doOnSuccess(v -> log.info("Deleted topic '{}'", sanitizeForLog(topicName))))
                .then();
    }

    /**
     * Returns the ARN of the subscription delivering {@code topicArn} to {@code queueArn}, or an
     * empty Mono when the queue is not subscribed.
     */
    public Mono<String> findSubscription(String topicArn, String queueArn) {
        return topicTransport.listSubscriptions(topicArn)
                .flatMap(subscriptions -> Mono.justOrEmpty(subscriptions.stream()
                        .filter(subscription -> subscription.targetsQueue(queueArn))
                        .map(TopicSubscription::subscriptionArn)
                        .findFirst()));
    }

    public Mono<Void> unsubscribe(String subscriptionArn) {
        return topicTransport.unsubscribe(subscriptionArn);
    }
}
