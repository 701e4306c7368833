package io.clype.sqsrelay.model;

import java.util.List;
import java.util.Objects;

/**
 * Binds a queue to a topic under any of several routing keys and an optional meta key.
 *
 * @param topicName   the topic to subscribe to
 * @param routingKeys routing-key values, any of which the subscription accepts
 * @param metaKey     optional meta-key value, or {@code null}
 */
public record TopicMultiRoute(String topicName, List<String> routingKeys, String metaKey) {

    public TopicMultiRoute {
        Objects.requireNonNull(topicName, "topicName cannot be null");
        Objects.requireNonNull(routingKeys, "routingKeys cannot be null");
        routingKeys = List.copyOf(routingKeys);
    }

    public static TopicMultiRoute of(String topicName, List<String> routingKeys) {
        return new TopicMultiRoute(topicName, routingKeys, null);
    }

    public TopicMultiRoute withMetaKey(String metaKey) {
        return new TopicMultiRoute(topicName, routingKeys, metaKey);
    }

    public FilterPolicy filterPolicy() {
        return FilterPolicy.of(routingKeys, metaKey);
    }
}
