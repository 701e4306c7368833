package io.clype.sqsrelay.service;

import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Best-effort sending: every operation reports failure as {@code false} and never errors.
 *
 * <p>Custom attributes are reduced to ASCII letters before sending; attributes that end up empty,
 * or that would shadow the routing attributes, are not sent.</p>
 */
public interface MessageSender extends AutoCloseable {

    /**
     * Publishes {@code payload} as JSON to {@code topicName}, tagged with {@code routingKey} and,
     * when not blank, {@code metaKey}. The topic is created if it does not exist.
     *
     * @return whether the topic accepted the message
     */
    Mono<Boolean> broadcast(String topicName, String routingKey, Object payload,
                            Map<String, String> customAttributes, String metaKey);

    default Mono<Boolean> broadcast(String topicName, String routingKey, Object payload,
                                    Map<String, String> customAttributes) {
        return broadcast(topicName, routingKey, payload, customAttributes, null);
    }

    default Mono<Boolean> broadcast(String topicName, String routingKey, Object payload) {
        return broadcast(topicName, routingKey, payload, null, null);
    }

    /**
     * As {@link #broadcast(String, String, Object, Map, String)}, with {@code text} sent Base64 encoded.
     */
    Mono<Boolean> broadcastString(String topicName, String routingKey, String text,
                                  Map<String, String> customAttributes, String metaKey);

    default Mono<Boolean> broadcastString(String topicName, String routingKey, String text,
                                          Map<String, String> customAttributes) {
        return broadcastString(topicName, routingKey, text, customAttributes, null);
    }

    default Mono<Boolean> broadcastString(String topicName, String routingKey, String text) {
        return broadcastString(topicName, routingKey, text, null, null);
    }

    /**
     * Sends {@code payload} as JSON straight to a standard queue, creating the queue (and its
     * dead-letter queue) if needed.
     *
     * @return whether the queue accepted the message
     */
    Mono<Boolean> enqueue(String queueName, Object payload, Map<String, String> customAttributes);

    default Mono<Boolean> enqueue(String queueName, Object payload) {
        return enqueue(queueName, payload, null);
    }

    Mono<Boolean> enqueueString(String queueName, String text, Map<String, String> customAttributes);

    default Mono<Boolean> enqueueString(String queueName, String text) {
        return enqueueString(queueName, text, null);
    }

    /**
     * Sends {@code payload} as JSON to an ordered queue and waits for the result. The group id
     * and deduplication id are passed to the queue unchanged.
     */
    boolean enqueueFifo(String queueName, String groupId, String deduplicationId, Object payload,
                        Map<String, String> customAttributes);

    default boolean enqueueFifo(String queueName, String groupId, String deduplicationId, Object payload) {
        return enqueueFifo(queueName, groupId, deduplicationId, payload, null);
    }

    boolean enqueueStringFifo(String queueName, String groupId, String deduplicationId, String text,
                              Map<String, String> customAttributes);

    default boolean enqueueStringFifo(String queueName, String groupId, String deduplicationId, String text) {
        return enqueueStringFifo(queueName, groupId, deduplicationId, text, null);
    }

    @Override
    void close();
}
