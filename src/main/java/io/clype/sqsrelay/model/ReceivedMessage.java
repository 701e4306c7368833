package io.clype.sqsrelay.model;

import java.util.Map;
import java.util.Objects;

/**
 * A message returned by a queue receive, abstracted from the provider SDK type.
 *
 * @param messageId     provider message id
 * @param receiptHandle handle used to delete (acknowledge) this particular receive
 * @param body          raw message body
 * @param attributes    string-typed message attributes sent with the message
 */
public record ReceivedMessage(
    String messageId,
    String receiptHandle,
    String body,
    Map<String, String> attributes
) {

    public ReceivedMessage {
        Objects.requireNonNull(messageId, "messageId cannot be null");
        Objects.requireNonNull(receiptHandle, "receiptHandle cannot be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
