package io.clype.sqsrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The outer envelope a topic wraps around a message when delivering it to a subscribed queue.
 * Only the fields the dispatcher reads are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TopicNotification(
    @JsonProperty("Type") String type,
    @JsonProperty("MessageId") String messageId,
    @JsonProperty("TopicArn") String topicArn,
    @JsonProperty("Message") String message
) {}
