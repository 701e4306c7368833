package io.clype.sqsrelay.model;

import java.util.List;
import java.util.Map;

/**
 * What a handler is told about the message it is processing, besides the payload.
 *
 * @param originTopic the topic the message was consumed through, or {@code null} for direct delivery
 * @param routingKey  the routing key the caller dequeued with (single-key operations)
 * @param routingKeys the routing keys the caller dequeued with (multi-key operations)
 * @param attributes  the message attributes, name to value
 */
public record DeliveryContext(
    String originTopic,
    String routingKey,
    List<String> routingKeys,
    Map<String, String> attributes
) {

    public DeliveryContext {
        routingKeys = routingKeys == null ? List.of() : List.copyOf(routingKeys);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public DeliveryContext withAttributes(Map<String, String> attributes) {
        return new DeliveryContext(originTopic, routingKey, routingKeys, attributes);
    }

    public static DeliveryContext direct() {
        return new DeliveryContext(null, null, List.of(), Map.of());
    }

    public static DeliveryContext of(TopicRoute route) {
        return new DeliveryContext(route.topicName(), route.routingKey(), List.of(route.routingKey()), Map.of());
    }

    public static DeliveryContext of(TopicMultiRoute route) {
        return new DeliveryContext(route.topicName(), null, route.routingKeys(), Map.of());
    }
}
