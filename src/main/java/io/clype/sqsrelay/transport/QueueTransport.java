package io.clype.sqsrelay.transport;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import io.clype.sqsrelay.model.OutboundMessage;
import io.clype.sqsrelay.model.QueueNotFoundException;
import io.clype.sqsrelay.model.ReceivedMessage;

import reactor.core.publisher.Mono;

/**
 * Queue operations the library needs from the underlying transport.
 *
 * <p>Implementations report error statuses as {@link io.clype.sqsrelay.model.TransportException}
 * and a missing queue on {@link #getQueueUrl(String)} as {@link QueueNotFoundException}.
 * Visibility timeout, redrive and FIFO deduplication are enforced by the transport.</p>
 */
public interface QueueTransport extends AutoCloseable {

    /** Attribute holding the queue's provider identifier. */
    String QUEUE_ARN_ATTRIBUTE = "QueueArn";

    /** Attribute holding the queue's access policy document. */
    String POLICY_ATTRIBUTE = "Policy";

    /** Attribute marking a queue as FIFO at creation. */
    String FIFO_QUEUE_ATTRIBUTE = "FifoQueue";

    /**
     * Creates a queue, or returns the existing one of that name.
     *
     * @return the queue URL
     */
    Mono<String> createQueue(String queueName, Map<String, String> attributes);

    Mono<Void> deleteQueue(String queueUrl);

    /**
     * Looks a queue up by name.
     *
     * @return the queue URL; errors with {@link QueueNotFoundException} when there is no such queue
     */
    Mono<String> getQueueUrl(String queueName);

    Mono<Map<String, String>> getQueueAttributes(String queueUrl, List<String> attributeNames);

    Mono<Void> setQueueAttributes(String queueUrl, Map<String, String> attributes);

    /**
     * Receives one batch, requesting all message attributes.
     *
     * @param waitTime long-poll wait, or {@code null} to send no wait time
     */
    Mono<List<ReceivedMessage>> receiveMessages(String queueUrl, int maxMessages, Duration waitTime);

    Mono<Void> deleteMessage(String queueUrl, String receiptHandle);

    /**
     * Sends a message to the queue URL in {@link OutboundMessage#destination()}.
     *
     * @return the provider message id
     */
    Mono<String> sendMessage(OutboundMessage message);

    @Override
    void close();
}
