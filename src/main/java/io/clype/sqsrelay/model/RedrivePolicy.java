package io.clype.sqsrelay.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Queue attribute linking a main queue to its dead-letter queue.
 *
 * <p>The transport moves a message to {@code deadLetterTargetArn} once it has been received
 * {@code maxReceiveCount} times without being deleted. The count is serialized as a string,
 * which is what the transport expects.</p>
 *
 * @param maxReceiveCount     receives allowed before dead-lettering
 * @param deadLetterTargetArn provider identifier of the dead-letter queue
 */
@JsonPropertyOrder({"maxReceiveCount", "deadLetterTargetArn"})
public record RedrivePolicy(String maxReceiveCount, String deadLetterTargetArn) {

    /** Queue attribute name the policy is stored under. */
    public static final String ATTRIBUTE_NAME = "RedrivePolicy";

    /** Receives allowed before a message is moved to the dead-letter queue. */
    public static final int MAX_RECEIVE_COUNT = 3;

    public RedrivePolicy {
        Objects.requireNonNull(maxReceiveCount, "maxReceiveCount cannot be null");
        Objects.requireNonNull(deadLetterTargetArn, "deadLetterTargetArn cannot be null");
    }

    public static RedrivePolicy forDeadLetterQueue(String deadLetterTargetArn) {
        return new RedrivePolicy(String.valueOf(MAX_RECEIVE_COUNT), deadLetterTargetArn);
    }
}
