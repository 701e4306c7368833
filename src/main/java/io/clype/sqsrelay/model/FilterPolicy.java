package io.clype.sqsrelay.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Subscription filter policy over the routing key and the optional meta key.
 *
 * <p>Serializes (through the library's JSON codec) to the provider's filter-policy grammar with a
 * fixed key order, routing key first:</p>
 * <pre>{@code
 * {"routingKey":["orders"]}
 * {"routingKey":["orders"],"metaKey":["eu"]}
 * {"routingKey":["orders","refunds"]}
 * }</pre>
 * <p>Multiple routing keys are OR-ed by the provider.</p>
 *
 * @param routingKeys allowed routing-key values (at least one, none blank)
 * @param metaKey     allowed meta-key value, or {@code null} when the policy does not filter on it
 */
public record FilterPolicy(List<String> routingKeys, String metaKey) {

    public FilterPolicy {
        Objects.requireNonNull(routingKeys, "routingKeys cannot be null");
        if (routingKeys.isEmpty()) {
            throw new IllegalArgumentException("At least one routing key must be provided");
        }
        for (String key : routingKeys) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Routing keys cannot be blank");
            }
        }
        routingKeys = List.copyOf(routingKeys);
        metaKey = (metaKey == null || metaKey.isBlank()) ? null : metaKey;
    }

    public static FilterPolicy of(String routingKey, String metaKey) {
        return new FilterPolicy(List.of(Objects.requireNonNull(routingKey, "routingKey cannot be null")), metaKey);
    }

    public static FilterPolicy of(List<String> routingKeys, String metaKey) {
        return new FilterPolicy(routingKeys, metaKey);
    }

    /**
     * The JSON shape of this policy. Insertion order is the serialized key order.
     */
    @JsonValue
    public Map<String, List<String>> clauses() {
        Map<String, List<String>> clauses = new LinkedHashMap<>();
        clauses.put(QueueNames.ROUTING_KEY_NAME, routingKeys);
        if (metaKey != null) {
            clauses.put(QueueNames.META_KEY_NAME, List.of(metaKey));
        }
        return clauses;
    }
}
