package io.clype.sqsrelay.model;

/**
 * Thrown when a received message could not be decoded or its handler failed.
 *
 * <p>The message has been left unacknowledged, so the transport redelivers it once its
 * visibility timeout elapses and dead-letters it after the maximum receive count.</p>
 */
public class MessageDispatchException extends RuntimeException {

    private final String messageId;

    public MessageDispatchException(String messageId, Throwable cause) {
        super("Failed to process message " + messageId + ": " + cause.getMessage(), cause);
        this.messageId = messageId;
    }

    public String getMessageId() {
        return messageId;
    }
}
