package io.clype.sqsrelay.model;

import java.util.Map;

/**
 * Result of decoding an inbound message body.
 *
 * @param payload    the inner payload text; for topic deliveries this is the unwrapped notification
 *                   message, otherwise the body itself
 * @param attributes attribute name to value, never null
 */
public record DecodedEnvelope(String payload, Map<String, String> attributes) {

    public DecodedEnvelope {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
