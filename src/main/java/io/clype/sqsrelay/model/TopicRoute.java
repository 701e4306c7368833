package io.clype.sqsrelay.model;

import java.util.Objects;

/**
 * Binds a queue to a topic under a single routing key and an optional meta key.
 *
 * @param topicName  the topic to subscribe to
 * @param routingKey routing-key value the subscription filters on
 * @param metaKey    optional meta-key value, or {@code null}
 */
public record TopicRoute(String topicName, String routingKey, String metaKey) {

    public TopicRoute {
        Objects.requireNonNull(topicName, "topicName cannot be null");
        Objects.requireNonNull(routingKey, "routingKey cannot be null");
    }

    public static TopicRoute of(String topicName, String routingKey) {
        return new TopicRoute(topicName, routingKey, null);
    }

    public TopicRoute withMetaKey(String metaKey) {
        return new TopicRoute(topicName, routingKey, metaKey);
    }

    public FilterPolicy filterPolicy() {
        return FilterPolicy.of(routingKey, metaKey);
    }
}
