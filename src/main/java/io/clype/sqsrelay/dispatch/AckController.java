package io.clype.sqsrelay.dispatch;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.sqsrelay.metrics.MessageQueueMetrics;
import io.clype.sqsrelay.model.ReceivedMessage;
import io.clype.sqsrelay.transport.QueueTransport;

import reactor.core.publisher.Mono;

/**
 * Applies an {@link AckOutcome} to a received message.
 *
 * <p>Acknowledging deletes the message through its receipt handle. Abandoning makes no transport
 * call at all: the message stays invisible until its visibility timeout runs out and is then
 * redelivered. A failed delete propagates, and the message is redelivered in that case too.</p>
 */
public class AckController {

    private static final Logger log = LoggerFactory.getLogger(AckController.class);

    private final QueueTransport queueTransport;
    private final MessageQueueMetrics metrics;

    public AckController(QueueTransport queueTransport, MessageQueueMetrics metrics) {
        this.queueTransport = Objects.requireNonNull(queueTransport, "queueTransport cannot be null");
        this.metrics = metrics;
    }

    public Mono<Void> resolve(String queueUrl, ReceivedMessage message, AckOutcome outcome) {
        if (outcome == AckOutcome.ABANDON) {
            return Mono.fromRunnable(() -> {
                log.debug("Leaving message {} for redelivery", message.messageId());
                if (metrics != null) {
                    metrics.recordAbandoned(queueUrl);
                }
            });
        }
        return queueTransport.deleteMessage(queueUrl, message.receiptHandle())
                .doOnSuccess(v -> {
                    log.debug("Acknowledged message {}", message.messageId());
                    if (metrics != null) {
                        metrics.recordAcknowledged(queueUrl);
                    }
                });
    }
}
