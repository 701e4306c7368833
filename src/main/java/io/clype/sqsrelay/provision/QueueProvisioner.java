package io.clype.sqsrelay.provision;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.sqsrelay.codec.MessageCodec;
import io.clype.sqsrelay.metrics.MessageQueueMetrics;
import io.clype.sqsrelay.model.QueueNames;
import io.clype.sqsrelay.model.QueueNotFoundException;
import io.clype.sqsrelay.model.RedrivePolicy;
import io.clype.sqsrelay.model.TransportException;
import io.clype.sqsrelay.transport.QueueTransport;

import reactor.core.publisher.Mono;

import static io.clype.sqsrelay.codec.LogSanitizer.sanitizeForLog;

/**
 * Creates and deletes queues together with their dead-letter queues.
 *
 * <p>Provisioning is idempotent by name: the transport returns the existing queue when asked to
 * create one that already exists, so repeated calls yield the same URL and never a second
 * dead-letter queue.</p>
 *
 * <p><b>Error Handling:</b> {@link #createQueueWithDeadLetter} and {@link #deleteQueueWithDeadLetter}
 * report failures through their result (empty / {@code false}) and a WARN log; they never error.
 * {@link #getOrCreateQueueUrl} treats a missing queue as the cue to create it, and propagates every
 * other transport failure.</p>
 */
public class QueueProvisioner {

    private static final Logger log = LoggerFactory.getLogger(QueueProvisioner.class);

    private final QueueTransport queueTransport;
    private final TopicProvisioner topicProvisioner;
    private final MessageCodec codec;
    private final MessageQueueMetrics metrics;

    /**
     * Creates a provisioner.
     *
     * @param queueTransport   queue operations
     * @param topicProvisioner used to find the topic whose subscription is removed on delete
     * @param codec            serializes the redrive policy
     * @param metrics          optional metrics collector (may be null)
     */
    public QueueProvisioner(QueueTransport queueTransport, TopicProvisioner topicProvisioner,
                            MessageCodec codec, MessageQueueMetrics metrics) {
        this.queueTransport = Objects.requireNonNull(queueTransport, "queueTransport cannot be null");
        this.topicProvisioner = Objects.requireNonNull(topicProvisioner, "topicProvisioner cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.metrics = metrics;
    }

    /**
     * Creates a queue and, unless {@code queueName} already denotes a dead-letter queue, its paired
     * dead-letter queue, then attaches a redrive policy (max receive count 3) to the main queue.
     *
     * @param queueName logical queue name (without the FIFO suffix)
     * @param ordered   whether both queues are FIFO
     * @return the main queue URL, or an empty Mono when provisioning failed
     */
    public Mono<String> createQueueWithDeadLetter(String queueName, boolean ordered) {
        Objects.requireNonNull(queueName, "queueName cannot be null");

        return queueTransport.createQueue(QueueNames.physicalName(queueName, ordered), creationAttributes(ordered))
                .flatMap(queueUrl -> QueueNames.isDeadLetter(queueName)
                        ? Mono.just(queueUrl)
                        : attachDeadLetterQueue(queueName, ordered, queueUrl).thenReturn(queueUrl))
                .doOnNext(queueUrl -> log.info("Provisioned queue '{}' (ordered: {})",
                        sanitizeForLog(queueName), ordered))
                .onErrorResume(e -> {
                    log.warn("Failed to provision queue '{}': {}", sanitizeForLog(queueName),
                            sanitizeForLog(e.getMessage()));
                    if (metrics != null) {
                        metrics.recordProvisioningFailure(queueName);
                    }
                    return Mono.empty();
                });
    }

    /**
     * Deletes the dead-letter queue, then any subscription of the queue to {@code topicName}
     * (standard queues only), then the main queue.
     *
     * <p>A dead-letter queue or topic that does not exist is skipped; a main queue that does not
     * exist fails the operation.</p>
     *
     * @param queueName logical queue name (without the FIFO suffix)
     * @param topicName topic the queue may be subscribed to, or {@code null}
     * @param ordered   whether the queues are FIFO
     * @return whether every step succeeded
     */
    public Mono<Boolean> deleteQueueWithDeadLetter(String queueName, String topicName, boolean ordered) {
        Objects.requireNonNull(queueName, "queueName cannot be null");
        String mainQueueName = QueueNames.physicalName(queueName, ordered);

        Mono<Void> removeSubscription = ordered || topicName == null || topicName.isEmpty()
                ? Mono.empty()
                : removeTopicSubscription(topicName, mainQueueName);

        return deleteDeadLetterQueue(queueName, ordered)
                .then(removeSubscription)
                .then(queueTransport.getQueueUrl(mainQueueName))
                .flatMap(queueTransport::deleteQueue)
                .then(Mono.fromCallable(() -> {
                    log.info("Deleted queue '{}' and its dead-letter queue", sanitizeForLog(queueName));
                    return true;
                }))
                .onErrorResume(e -> {
                    log.warn("Failed to delete queue '{}': {}", sanitizeForLog(queueName),
                            sanitizeForLog(e.getMessage()));
                    return Mono.just(false);
                });
    }

    /**
     * Looks the queue up by name and provisions it (with its dead-letter queue) when missing.
     *
     * @return the queue URL; empty when the queue was missing and could not be created
     */
    public Mono<String> getOrCreateQueueUrl(String queueName, boolean ordered) {
        Objects.requireNonNull(queueName, "queueName cannot be null");
        return queueTransport.getQueueUrl(QueueNames.physicalName(queueName, ordered))
                .onErrorResume(QueueNotFoundException.class, e -> {
                    log.debug("Queue '{}' not found, creating it", sanitizeForLog(queueName));
                    return createQueueWithDeadLetter(queueName, ordered);
                });
    }

    /**
     * Returns the provider identifier (ARN) of a queue URL.
     */
    public Mono<String> getQueueArn(String queueUrl) {
        return queueTransport.getQueueAttributes(queueUrl, List.of(QueueTransport.QUEUE_ARN_ATTRIBUTE))
                .flatMap(attributes -> {
                    String arn = attributes.get(QueueTransport.QUEUE_ARN_ATTRIBUTE);
                    if (arn == null || arn.isBlank()) {
                        return Mono.error(new TransportException(
                                "Queue " + queueUrl + " returned no " + QueueTransport.QUEUE_ARN_ATTRIBUTE, null));
                    }
                    return Mono.just(arn);
                });
    }

    private Mono<Void> attachDeadLetterQueue(String queueName, boolean ordered, String mainQueueUrl) {
        return queueTransport.createQueue(QueueNames.deadLetterName(queueName, ordered), creationAttributes(ordered))
                .flatMap(this::getQueueArn)
                .flatMap(deadLetterArn -> queueTransport.setQueueAttributes(mainQueueUrl, Map.of(
                        RedrivePolicy.ATTRIBUTE_NAME,
                        codec.toJson(RedrivePolicy.forDeadLetterQueue(deadLetterArn)))));
    }

    private Mono<Void> deleteDeadLetterQueue(String queueName, boolean ordered) {
        String deadLetterName = QueueNames.deadLetterName(queueName, ordered);
        return queueTransport.getQueueUrl(deadLetterName)
                .flatMap(queueTransport::deleteQueue)
                .onErrorResume(QueueNotFoundException.class, e -> {
                    log.debug("Dead-letter queue '{}' does not exist, skipping", sanitizeForLog(deadLetterName));
                    return Mono.empty();
                });
    }

    private Mono<Void> removeTopicSubscription(String topicName, String mainQueueName) {
        return topicProvisioner.findTopicArn(topicName)
                .flatMap(topicArn -> queueTransport.getQueueUrl(mainQueueName)
                        .flatMap(this::getQueueArn)
                        .flatMap(queueArn -> topicProvisioner.findSubscription(topicArn, queueArn)))
                .flatMap(subscriptionArn -> topicProvisioner.unsubscribe(subscriptionArn)
                        .doOnSuccess(v -> log.info("Removed subscription of '{}' to topic '{}'",
                                sanitizeForLog(mainQueueName), sanitizeForLog(topicName))));
    }

    private static Map<String, String> creationAttributes(boolean ordered) {
        return ordered ? Map.of(QueueTransport.FIFO_QUEUE_ATTRIBUTE, "true") : Map.of();
    }
}
