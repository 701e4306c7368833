package io.clype.sqsrelay.dispatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.sqsrelay.codec.MessageCodec;
import io.clype.sqsrelay.codec.PayloadReader;
import io.clype.sqsrelay.handler.MessageHandler;
import io.clype.sqsrelay.metrics.MessageQueueMetrics;
import io.clype.sqsrelay.model.DecodedEnvelope;
import io.clype.sqsrelay.model.DeliveryContext;
import io.clype.sqsrelay.model.MessageDispatchException;
import io.clype.sqsrelay.model.ReceivedMessage;
import io.clype.sqsrelay.transport.QueueTransport;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Runs one receive-process-acknowledge cycle against a queue.
 *
 * <p>Each call issues a single batched receive and processes the returned messages one at a time,
 * in receive order, on the dispatch scheduler so that handlers never run on transport I/O threads.
 * For every message the body is decoded, the payload is read, the handler is invoked and its
 * verdict is applied by the {@link AckController} before the next message is touched.</p>
 *
 * <p><b>Failure:</b> When decoding or the handler throws, the message is abandoned (left for
 * redelivery) and the returned Mono errors with {@link MessageDispatchException}. The rest of the
 * batch is not processed; those messages redeliver after the visibility timeout.</p>
 *
 * <p>Ordered queues go through {@link #dispatchOnCaller}, which runs handlers on the calling thread
 * instead of the dispatch scheduler.</p>
 *
 * <p>There is no polling loop here. Callers wanting continuous consumption dispatch repeatedly.</p>
 */
public class MessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    /** Maximum messages a single receive may return (transport limit). */
    public static final int MAX_BATCH_SIZE = 10;

    private final QueueTransport queueTransport;
    private final MessageCodec codec;
    private final AckController ackController;
    private final Scheduler scheduler;
    private final int maxMessages;
    private final MessageQueueMetrics metrics;

    /**
     * @param queueTransport queue operations
     * @param codec          decodes message bodies
     * @param scheduler      scheduler handlers run on
     * @param maxMessages    messages requested per receive, 1 to {@value #MAX_BATCH_SIZE}
     * @param metrics        optional metrics collector (may be null)
     */
    public MessageDispatcher(QueueTransport queueTransport, MessageCodec codec, Scheduler scheduler,
                             int maxMessages, MessageQueueMetrics metrics) {
        this.queueTransport = Objects.requireNonNull(queueTransport, "queueTransport cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        if (maxMessages < 1 || maxMessages > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("maxMessages must be between 1 and " + MAX_BATCH_SIZE);
        }
        this.maxMessages = maxMessages;
        this.metrics = metrics;
        this.ackController = new AckController(queueTransport, metrics);
    }

    /**
     * Receives one batch from {@code queueUrl} and dispatches it to {@code handler}.
     *
     * @param queueUrl      the queue to receive from
     * @param waitTime      long-poll wait, or {@code null} to receive without one (ordered queues)
     * @param reader        turns the decoded payload text into the handler's payload
     * @param handler       the caller's handler
     * @param context       origin topic and routing keys the handler is given
     * @param topicDelivery whether bodies are topic notifications that need unwrapping
     * @return the comma-joined ids of the processed messages, empty when nothing was received
     */
    public <T> Mono<String> dispatch(String queueUrl, Duration waitTime, PayloadReader<T> reader,
                                     MessageHandler<T> handler, DeliveryContext context, boolean topicDelivery) {
        Objects.requireNonNull(queueUrl, "queueUrl cannot be null");
        Objects.requireNonNull(reader, "reader cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        Objects.requireNonNull(context, "context cannot be null");

        return queueTransport.receiveMessages(queueUrl, maxMessages, waitTime)
                .doOnNext(messages -> recordReceived(queueUrl, messages))
                .flatMapMany(Flux::fromIterable)
                .publishOn(scheduler)
                .concatMap(message -> process(queueUrl, message, reader, handler, context, topicDelivery))
                .collectList()
                .map(ids -> String.join(",", ids));
    }

    /**
     * Receives one batch from an ordered queue without a long-poll wait and dispatches it on the
     * calling thread, blocking until every message has been acknowledged or abandoned.
     *
     * @return the comma-joined ids of the processed messages, empty when nothing was received
     * @throws MessageDispatchException if decoding or the handler failed
     */
    public <T> String dispatchOnCaller(String queueUrl, PayloadReader<T> reader, MessageHandler<T> handler,
                                       DeliveryContext context) {
        Objects.requireNonNull(queueUrl, "queueUrl cannot be null");
        Objects.requireNonNull(reader, "reader cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        Objects.requireNonNull(context, "context cannot be null");

        List<ReceivedMessage> messages = queueTransport.receiveMessages(queueUrl, maxMessages, null).block();
        if (messages == null || messages.isEmpty()) {
            return "";
        }
        recordReceived(queueUrl, messages);

        List<String> ids = new ArrayList<>(messages.size());
        for (ReceivedMessage message : messages) {
            ids.add(process(queueUrl, message, reader, handler, context, false).block());
        }
        return String.join(",", ids);
    }

    private void recordReceived(String queueUrl, List<ReceivedMessage> messages) {
        log.debug("Received {} message(s) from {}", messages.size(), queueUrl);
        if (metrics != null && !messages.isEmpty()) {
            metrics.recordReceived(queueUrl, messages.size());
        }
    }

    // invokes the handler synchronously; only the acknowledgement is deferred to the returned Mono
    private <T> Mono<String> process(String queueUrl, ReceivedMessage message, PayloadReader<T> reader,
                                     MessageHandler<T> handler, DeliveryContext context, boolean topicDelivery) {
        AckOutcome outcome;
        try {
            DecodedEnvelope envelope = codec.decodeEnvelope(message.body(), topicDelivery);
            T payload = reader.read(envelope.payload());
            DeliveryContext delivery = context.withAttributes(
                    topicDelivery ? envelope.attributes() : merge(message.attributes(), envelope.attributes()));

            long start = System.nanoTime();
            boolean handled = handler.dispatch(payload, delivery);
            if (metrics != null) {
                metrics.recordHandlerLatency(queueUrl, System.nanoTime() - start);
            }
            outcome = AckOutcome.of(handled);
        } catch (RuntimeException e) {
            log.error("Failed to process message {} from {}: {}", message.messageId(), queueUrl, e.getMessage());
            if (metrics != null) {
                metrics.recordHandlerFailure(queueUrl);
            }
            return ackController.resolve(queueUrl, message, AckOutcome.ABANDON)
                    .then(Mono.error(new MessageDispatchException(message.messageId(), e)));
        }
        return ackController.resolve(queueUrl, message, outcome).thenReturn(message.messageId());
    }

    private static Map<String, String> merge(Map<String, String> transportAttributes,
                                             Map<String, String> bodyAttributes) {
        if (bodyAttributes.isEmpty()) {
            return transportAttributes;
        }
        Map<String, String> merged = new LinkedHashMap<>(transportAttributes);
        merged.putAll(bodyAttributes);
        return merged;
    }
}
