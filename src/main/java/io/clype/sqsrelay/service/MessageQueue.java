package io.clype.sqsrelay.service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import io.clype.sqsrelay.codec.AttributeSanitizer;
import io.clype.sqsrelay.codec.MessageCodec;
import io.clype.sqsrelay.codec.PayloadReader;
import io.clype.sqsrelay.dispatch.MessageDispatcher;
import io.clype.sqsrelay.handler.MessageHandler;
import io.clype.sqsrelay.metrics.MessageQueueMetrics;
import io.clype.sqsrelay.model.DeliveryContext;
import io.clype.sqsrelay.model.OutboundMessage;
import io.clype.sqsrelay.model.QueueNames;
import io.clype.sqsrelay.model.QueueProvisioningException;
import io.clype.sqsrelay.model.TopicMultiRoute;
import io.clype.sqsrelay.model.TopicRoute;
import io.clype.sqsrelay.provision.QueueProvisioner;
import io.clype.sqsrelay.provision.TopicProvisioner;
import io.clype.sqsrelay.subscription.GuavaSubscriptionCache;
import io.clype.sqsrelay.subscription.SubscriptionCache;
import io.clype.sqsrelay.subscription.SubscriptionReconciler;
import io.clype.sqsrelay.transport.QueueTransport;
import io.clype.sqsrelay.transport.SnsTopicTransport;
import io.clype.sqsrelay.transport.SqsQueueTransport;
import io.clype.sqsrelay.transport.TopicTransport;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import static io.clype.sqsrelay.codec.LogSanitizer.sanitizeForLog;

/**
 * Queue and topic messaging with dead-letter queues, filtered topic subscriptions and
 * handler-driven acknowledgement.
 *
 * <p>This facade provides:</p>
 * <ul>
 *   <li><b>Lazy provisioning:</b> Topics and queues are created on first reference. Every standard
 *       or ordered queue gets a dead-letter queue ({@code <name>-dl}) and a redrive policy moving a
 *       message there after 3 unsuccessful receives.</li>
 *   <li><b>Routed broadcast:</b> Messages published to a topic carry a {@code routingKey} (and
 *       optional {@code metaKey}) attribute. Queues subscribe with a matching filter policy.</li>
 *   <li><b>Acknowledged dispatch:</b> A handler returning {@code true} deletes its message; any
 *       other outcome leaves it for redelivery.</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * try (MessageQueue queue = new MessageQueue(sqsClient, snsClient)) {
 *     queue.broadcast("orders", "created", new OrderCreated("o-1")).block();
 *
 *     String ids = queue.dequeue("billing", TopicRoute.of("orders", "created"), OrderCreated.class,
 *             (order, routingKey, attributes) -> billing.charge(order)).block();
 * }
 * }</pre>
 *
 * <p><b>Error Handling:</b> Sends and administration report failures as {@code false} (or an
 * empty result). Receives propagate failures after leaving the in-flight message unacknowledged.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Concurrent callers share the subscription
 * cache; see {@link SubscriptionCache} for the first-use race.</p>
 *
 * <p><b>Resource Management:</b> {@link #close()} disposes the dispatch scheduler, clears the
 * subscription cache and closes both transports. This class implements {@link DisposableBean}, so
 * a Spring context closes it on shutdown.</p>
 *
 * @see io.clype.sqsrelay.config.MessageQueueAutoConfiguration
 */
public class MessageQueue implements MessageSender, MessageReceiver, QueueManager, TopicManager, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(MessageQueue.class);

    /** Default long-poll wait for standard queues. */
    public static final Duration DEFAULT_WAIT_TIME = Duration.ofSeconds(10);

    /** Longest long-poll wait the queue transport accepts. */
    public static final Duration MAX_WAIT_TIME = Duration.ofSeconds(20);

    /** Minimum number of dispatch threads. */
    public static final int DEFAULT_MIN_DISPATCH_THREADS = 8;

    private final QueueTransport queueTransport;
    private final TopicTransport topicTransport;
    private final MessageCodec codec;
    private final Duration waitTime;
    private final SubscriptionCache subscriptionCache;
    private final MessageQueueMetrics metrics;
    private final Scheduler dispatchScheduler;
    private final TopicProvisioner topicProvisioner;
    private final QueueProvisioner queueProvisioner;
    private final SubscriptionReconciler subscriptionReconciler;
    private final MessageDispatcher dispatcher;

    /**
     * Creates a MessageQueue on AWS clients with the default wait time and no metrics.
     *
     * @param sqsClient the SQS async client
     * @param snsClient the SNS async client
     */
    public MessageQueue(SqsAsyncClient sqsClient, SnsAsyncClient snsClient) {
        this(sqsClient, snsClient, DEFAULT_WAIT_TIME);
    }

    /**
     * Creates a MessageQueue on AWS clients with no metrics.
     *
     * @param sqsClient the SQS async client
     * @param snsClient the SNS async client
     * @param waitTime  long-poll wait for standard queue receives (0 to 20 seconds)
     */
    public MessageQueue(SqsAsyncClient sqsClient, SnsAsyncClient snsClient, Duration waitTime) {
        this(new SqsQueueTransport(sqsClient),
                new SnsTopicTransport(snsClient),
                new MessageCodec(),
                waitTime,
                MessageDispatcher.MAX_BATCH_SIZE,
                Math.max(DEFAULT_MIN_DISPATCH_THREADS, Runtime.getRuntime().availableProcessors()),
                new GuavaSubscriptionCache(),
                false,
                null);
    }

    /**
     * Creates a MessageQueue with full configuration options.
     *
     * @param queueTransport  queue operations
     * @param topicTransport  topic operations
     * @param codec           payload and envelope codec
     * @param waitTime        long-poll wait for standard queue receives (0 to 20 seconds)
     * @param maxMessages     messages requested per receive (1 to 10)
     * @param dispatchThreads threads handlers run on
     * @param cache           subscription cache, cleared on close
     * @param cacheMultiKey   whether multi-key subscriptions are cached like single-key ones
     * @param metrics         optional metrics collector (may be null)
     * @throws NullPointerException     if a transport, the codec, the wait time or the cache is null
     * @throws IllegalArgumentException if a numeric parameter is out of range
     */
    public MessageQueue(
            QueueTransport queueTransport,
            TopicTransport topicTransport,
            MessageCodec codec,
            Duration waitTime,
            int maxMessages,
            int dispatchThreads,
            SubscriptionCache cache,
            boolean cacheMultiKey,
            MessageQueueMetrics metrics) {

        this.queueTransport = Objects.requireNonNull(queueTransport, "queueTransport cannot be null");
        this.topicTransport = Objects.requireNonNull(topicTransport, "topicTransport cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.waitTime = Objects.requireNonNull(waitTime, "waitTime cannot be null");
        this.subscriptionCache = Objects.requireNonNull(cache, "cache cannot be null");

        if (waitTime.isNegative() || waitTime.compareTo(MAX_WAIT_TIME) > 0) {
            throw new IllegalArgumentException("waitTime must be between 0 and " + MAX_WAIT_TIME.getSeconds() + " seconds");
        }
        if (dispatchThreads <= 0) {
            throw new IllegalArgumentException("dispatchThreads must be positive");
        }
        if (maxMessages < 1 || maxMessages > MessageDispatcher.MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("maxMessages must be between 1 and " + MessageDispatcher.MAX_BATCH_SIZE);
        }

        this.metrics = metrics;
        this.dispatchScheduler = Schedulers.newBoundedElastic(dispatchThreads,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "message-queue-dispatch");
        this.topicProvisioner = new TopicProvisioner(topicTransport);
        this.queueProvisioner = new QueueProvisioner(queueTransport, topicProvisioner, codec, metrics);
        this.subscriptionReconciler = new SubscriptionReconciler(topicProvisioner, queueProvisioner,
                queueTransport, topicTransport, codec, cache, cacheMultiKey);
        this.dispatcher = new MessageDispatcher(queueTransport, codec, dispatchScheduler, maxMessages, metrics);
    }

    // ==========================================================================
    // Sending
    // ==========================================================================

    @Override
    public Mono<Boolean> broadcast(String topicName, String routingKey, Object payload,
                                   Map<String, String> customAttributes, String metaKey) {
        return publish(topicName, routingKey, metaKey, customAttributes, () -> codec.encodeTyped(payload));
    }

    @Override
    public Mono<Boolean> broadcastString(String topicName, String routingKey, String text,
                                         Map<String, String> customAttributes, String metaKey) {
        return publish(topicName, routingKey, metaKey, customAttributes, () -> codec.encodeRaw(text));
    }

    @Override
    public Mono<Boolean> enqueue(String queueName, Object payload, Map<String, String> customAttributes) {
        return send(queueName, false, null, null, customAttributes, () -> codec.encodeTyped(payload));
    }

    @Override
    public Mono<Boolean> enqueueString(String queueName, String text, Map<String, String> customAttributes) {
        return send(queueName, false, null, null, customAttributes, () -> codec.encodeRaw(text));
    }

    @Override
    public boolean enqueueFifo(String queueName, String groupId, String deduplicationId, Object payload,
                               Map<String, String> customAttributes) {
        return Boolean.TRUE.equals(send(queueName, true, groupId, deduplicationId, customAttributes,
                () -> codec.encodeTyped(payload)).block());
    }

    @Override
    public boolean enqueueStringFifo(String queueName, String groupId, String deduplicationId, String text,
                                     Map<String, String> customAttributes) {
        return Boolean.TRUE.equals(send(queueName, true, groupId, deduplicationId, customAttributes,
                () -> codec.encodeRaw(text)).block());
    }

    private Mono<Boolean> publish(String topicName, String routingKey, String metaKey,
                                  Map<String, String> customAttributes, BodyEncoder encoder) {
        return Mono.defer(() -> {
                    Objects.requireNonNull(topicName, "topicName cannot be null");
                    Objects.requireNonNull(routingKey, "routingKey cannot be null");
                    String body = encoder.encode();
                    Map<String, String> attributes = routingAttributes(routingKey, metaKey, customAttributes);
                    return topicProvisioner.getOrCreateTopicArn(topicName)
                            .flatMap(topicArn -> topicTransport.publish(OutboundMessage.standard(topicArn, body, attributes)));
                })
                .map(messageId -> !messageId.isBlank())
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Failed to broadcast to topic '{}': {}", sanitizeForLog(topicName),
                            sanitizeForLog(e.getMessage()));
                    return Mono.just(false);
                })
                .doOnNext(sent -> recordSent(topicName, sent));
    }

    private Mono<Boolean> send(String queueName, boolean ordered, String groupId, String deduplicationId,
                               Map<String, String> customAttributes, BodyEncoder encoder) {
        return Mono.defer(() -> {
                    Objects.requireNonNull(queueName, "queueName cannot be null");
                    if (ordered) {
                        Objects.requireNonNull(groupId, "groupId cannot be null");
                    }
                    String body = encoder.encode();
                    Map<String, String> attributes = AttributeSanitizer.sanitizeAll(customAttributes);
                    return queueProvisioner.getOrCreateQueueUrl(queueName, ordered)
                            .flatMap(queueUrl -> queueTransport.sendMessage(
                                    new OutboundMessage(queueUrl, body, attributes, groupId, deduplicationId)));
                })
                .map(messageId -> !messageId.isBlank())
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Failed to enqueue to queue '{}': {}", sanitizeForLog(queueName),
                            sanitizeForLog(e.getMessage()));
                    return Mono.just(false);
                })
                .doOnNext(sent -> recordSent(queueName, sent));
    }

    private static Map<String, String> routingAttributes(String routingKey, String metaKey,
                                                         Map<String, String> customAttributes) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(QueueNames.ROUTING_KEY_NAME, routingKey);
        if (metaKey != null && !metaKey.isBlank()) {
            attributes.put(QueueNames.META_KEY_NAME, metaKey);
        }
        attributes.putAll(AttributeSanitizer.sanitizeAll(customAttributes));
        return attributes;
    }

    private void recordSent(String destination, boolean sent) {
        if (metrics != null) {
            metrics.recordSent(destination, sent);
        }
    }

    // ==========================================================================
    // Receiving
    // ==========================================================================

    @Override
    public <T> Mono<String> dequeue(String queueName, TopicRoute route, Class<T> type,
                                    MessageHandler.SingleKey<T> handler) {
        return dequeueFromTopic(queueName, route, PayloadReader.typed(codec, type), handler);
    }

    @Override
    public <T> Mono<String> dequeue(String queueName, TopicRoute route, Class<T> type,
                                    MessageHandler.SingleKeyWithOriginTopic<T> handler) {
        return dequeueFromTopic(queueName, route, PayloadReader.typed(codec, type), handler);
    }

    @Override
    public <T> Mono<String> dequeue(String queueName, TopicMultiRoute route, Class<T> type,
                                    MessageHandler.MultiKey<T> handler) {
        return dequeueFromTopic(queueName, route, PayloadReader.typed(codec, type), handler);
    }

    @Override
    public <T> Mono<String> dequeue(String queueName, TopicMultiRoute route, Class<T> type,
                                    MessageHandler.MultiKeyWithOriginTopic<T> handler) {
        return dequeueFromTopic(queueName, route, PayloadReader.typed(codec, type), handler);
    }

    @Override
    public Mono<String> dequeueString(String queueName, TopicRoute route, MessageHandler.SingleKey<String> handler) {
        return dequeueFromTopic(queueName, route, PayloadReader.raw(codec), handler);
    }

    @Override
    public Mono<String> dequeueString(String queueName, TopicRoute route,
                                      MessageHandler.SingleKeyWithOriginTopic<String> handler) {
        return dequeueFromTopic(queueName, route, PayloadReader.raw(codec), handler);
    }

    @Override
    public Mono<String> dequeueString(String queueName, TopicMultiRoute route,
                                      MessageHandler.MultiKey<String> handler) {
        return dequeueFromTopic(queueName, route, PayloadReader.raw(codec), handler);
    }

    @Override
    public Mono<String> dequeueString(String queueName, TopicMultiRoute route,
                                      MessageHandler.MultiKeyWithOriginTopic<String> handler) {
        return dequeueFromTopic(queueName, route, PayloadReader.raw(codec), handler);
    }

    @Override
    public <T> Mono<String> dequeue(String queueName, Class<T> type, MessageHandler.SingleKey<T> handler) {
        return dequeueDirect(queueName, PayloadReader.typed(codec, type), handler);
    }

    @Override
    public Mono<String> dequeueString(String queueName, MessageHandler.SingleKey<String> handler) {
        return dequeueDirect(queueName, PayloadReader.raw(codec), handler);
    }

    @Override
    public <T> String dequeueFifo(String queueName, Class<T> type, MessageHandler.SingleKey<T> handler) {
        return dequeueOrdered(queueName, PayloadReader.typed(codec, type), handler);
    }

    @Override
    public String dequeueStringFifo(String queueName, MessageHandler.SingleKey<String> handler) {
        return dequeueOrdered(queueName, PayloadReader.raw(codec), handler);
    }

    private <T> Mono<String> dequeueFromTopic(String queueName, TopicRoute route, PayloadReader<T> reader,
                                              MessageHandler<T> handler) {
        Objects.requireNonNull(queueName, "queueName cannot be null");
        Objects.requireNonNull(route, "route cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        return subscriptionReconciler.ensureSubscribed(route, queueName)
                .then(resolveQueueUrl(queueName, false))
                .flatMap(queueUrl -> dispatcher.dispatch(queueUrl, waitTime, reader, handler,
                        DeliveryContext.of(route), true));
    }

    private <T> Mono<String> dequeueFromTopic(String queueName, TopicMultiRoute route, PayloadReader<T> reader,
                                              MessageHandler<T> handler) {
        Objects.requireNonNull(queueName, "queueName cannot be null");
        Objects.requireNonNull(route, "route cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        return subscriptionReconciler.ensureSubscribed(route, queueName)
                .then(resolveQueueUrl(queueName, false))
                .flatMap(queueUrl -> dispatcher.dispatch(queueUrl, waitTime, reader, handler,
                        DeliveryContext.of(route), true));
    }

    private <T> Mono<String> dequeueDirect(String queueName, PayloadReader<T> reader,
                                           MessageHandler<T> handler) {
        Objects.requireNonNull(queueName, "queueName cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        return resolveQueueUrl(queueName, false)
                .flatMap(queueUrl -> dispatcher.dispatch(queueUrl, waitTime, reader, handler,
                        DeliveryContext.direct(), false));
    }

    // ordered queues are received without a long-poll wait and handled on the caller's thread
    private <T> String dequeueOrdered(String queueName, PayloadReader<T> reader, MessageHandler<T> handler) {
        Objects.requireNonNull(queueName, "queueName cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        String queueUrl = resolveQueueUrl(queueName, true).block();
        return dispatcher.dispatchOnCaller(queueUrl, reader, handler, DeliveryContext.direct());
    }

    private Mono<String> resolveQueueUrl(String queueName, boolean ordered) {
        return Mono.defer(() -> queueProvisioner.getOrCreateQueueUrl(queueName, ordered))
                .switchIfEmpty(Mono.error(() -> new QueueProvisioningException(
                        "Cannot find or create queue " + QueueNames.physicalName(queueName, ordered))));
    }

    // ==========================================================================
    // Administration
    // ==========================================================================

    @Override
    public Mono<String> createQueueWithDeadLetter(String queueName, boolean ordered) {
        return queueProvisioner.createQueueWithDeadLetter(queueName, ordered);
    }

    @Override
    public Mono<Boolean> deleteQueueWithDeadLetter(String queueName, String topicName, boolean ordered) {
        return queueProvisioner.deleteQueueWithDeadLetter(queueName, topicName, ordered);
    }

    @Override
    public Mono<Boolean> ensureQueueIsSubscribedToTopic(String topicName, String queueName, String routingKey,
                                                        String metaKey) {
        return Mono.defer(() -> subscriptionReconciler.ensureSubscribed(
                        new TopicRoute(topicName, routingKey, metaKey), queueName))
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.warn("Failed to subscribe queue '{}' to topic '{}': {}", sanitizeForLog(queueName),
                            sanitizeForLog(topicName), sanitizeForLog(e.getMessage()));
                    if (metrics != null) {
                        metrics.recordProvisioningFailure(topicName);
                    }
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<Boolean> deleteTopic(String topicName) {
        return Mono.defer(() -> topicProvisioner.deleteTopic(Objects.requireNonNull(topicName, "topicName cannot be null")))
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.warn("Failed to delete topic '{}': {}", sanitizeForLog(topicName),
                            sanitizeForLog(e.getMessage()));
                    return Mono.just(false);
                });
    }

    // ==========================================================================
    // Lifecycle
    // ==========================================================================

    /**
     * Disposes the dispatch scheduler, clears the subscription cache and closes the transports.
     */
    @Override
    public void close() {
        dispatchScheduler.dispose();
        subscriptionCache.clear();
        queueTransport.close();
        topicTransport.close();
        log.info("MessageQueue closed");
    }

    /**
     * Closes this MessageQueue when the Spring context is destroyed.
     */
    @Override
    public void destroy() {
        close();
    }

    @FunctionalInterface
    private interface BodyEncoder {
        String encode();
    }
}
