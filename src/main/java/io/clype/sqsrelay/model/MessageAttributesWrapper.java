package io.clype.sqsrelay.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The attributes section of a message body, keyed by attribute name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageAttributesWrapper(
    @JsonProperty("MessageAttributes") Map<String, CustomMessageAttribute> messageAttributes
) {

    public static MessageAttributesWrapper empty() {
        return new MessageAttributesWrapper(Map.of());
    }

    /**
     * Reduces the typed attributes to a plain name to value map, in body order.
     * Attributes without a value are skipped.
     */
    public Map<String, String> toStringMap() {
        Map<String, String> result = new LinkedHashMap<>();
        if (messageAttributes == null) {
            return result;
        }
        messageAttributes.forEach((name, attribute) -> {
            if (attribute != null && attribute.value() != null) {
                result.put(name, attribute.value());
            }
        });
        return result;
    }
}
