package io.clype.sqsrelay.model;

/**
 * An existing topic subscription.
 *
 * @param subscriptionArn provider identifier of the subscription
 * @param protocol        delivery protocol ({@code sqs} for queues)
 * @param endpoint        delivery endpoint (the queue ARN for {@code sqs})
 */
public record TopicSubscription(String subscriptionArn, String protocol, String endpoint) {

    public static final String QUEUE_PROTOCOL = "sqs";

    /**
     * Whether this subscription delivers to the given queue. Endpoints compare case-insensitively.
     */
    public boolean targetsQueue(String queueArn) {
        return queueArn != null
                && QUEUE_PROTOCOL.equalsIgnoreCase(protocol)
                && queueArn.equalsIgnoreCase(endpoint);
    }
}
