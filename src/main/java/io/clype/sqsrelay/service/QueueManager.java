package io.clype.sqsrelay.service;

import reactor.core.publisher.Mono;

/**
 * Queue administration.
 */
public interface QueueManager {

    /**
     * Creates the queue and its dead-letter queue with a redrive policy.
     *
     * @return the queue URL; empty when provisioning failed
     */
    Mono<String> createQueueWithDeadLetter(String queueName, boolean ordered);

    default Mono<String> createQueueWithDeadLetter(String queueName) {
        return createQueueWithDeadLetter(queueName, false);
    }

    /**
     * Deletes the dead-letter queue, the subscription to {@code topicName} when given, then the queue.
     *
     * @return whether every step succeeded
     */
    Mono<Boolean> deleteQueueWithDeadLetter(String queueName, String topicName, boolean ordered);

    default Mono<Boolean> deleteQueueWithDeadLetter(String queueName, String topicName) {
        return deleteQueueWithDeadLetter(queueName, topicName, false);
    }

    /**
     * Subscribes the queue to the topic, filtered on {@code routingKey} and optionally {@code metaKey}.
     *
     * @return whether the queue is subscribed; {@code false} on failure
     */
    Mono<Boolean> ensureQueueIsSubscribedToTopic(String topicName, String queueName, String routingKey,
                                                 String metaKey);

    default Mono<Boolean> ensureQueueIsSubscribedToTopic(String topicName, String queueName, String routingKey) {
        return ensureQueueIsSubscribedToTopic(topicName, queueName, routingKey, null);
    }
}
