package io.clype.sqsrelay.model;

import java.util.Map;
import java.util.Objects;

/**
 * A message about to be sent to a queue or published to a topic.
 *
 * @param destination            queue URL or topic ARN
 * @param body                   encoded payload
 * @param attributes             sanitized string attributes
 * @param messageGroupId         FIFO group id, {@code null} for standard destinations
 * @param messageDeduplicationId FIFO deduplication id, passed to the transport unchanged
 */
public record OutboundMessage(
    String destination,
    String body,
    Map<String, String> attributes,
    String messageGroupId,
    String messageDeduplicationId
) {

    public OutboundMessage {
        Objects.requireNonNull(destination, "destination cannot be null");
        Objects.requireNonNull(body, "body cannot be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static OutboundMessage standard(String destination, String body, Map<String, String> attributes) {
        return new OutboundMessage(destination, body, attributes, null, null);
    }

    public boolean isOrdered() {
        return messageGroupId != null;
    }
}
