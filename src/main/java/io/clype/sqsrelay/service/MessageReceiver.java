package io.clype.sqsrelay.service;

import io.clype.sqsrelay.handler.MessageHandler;
import io.clype.sqsrelay.model.TopicMultiRoute;
import io.clype.sqsrelay.model.TopicRoute;

import reactor.core.publisher.Mono;

/**
 * Receives one batch from a queue and hands each message to a handler.
 *
 * <p>Every operation returns the comma-joined ids of the messages it processed, or an empty
 * string when the receive returned nothing. A handler returning {@code true} acknowledges its
 * message; returning {@code false} leaves it for redelivery. Failures propagate: a decode or
 * handler failure errors with {@link io.clype.sqsrelay.model.MessageDispatchException} after the
 * message has been left unacknowledged.</p>
 *
 * <p>Topic operations first make sure the queue is subscribed to the route's topic. The handler
 * kind a caller passes selects the overload; handlers that also take the origin topic suit
 * dead-letter processing.</p>
 */
public interface MessageReceiver extends AutoCloseable {

    <T> Mono<String> dequeue(String queueName, TopicRoute route, Class<T> type,
                             MessageHandler.SingleKey<T> handler);

    <T> Mono<String> dequeue(String queueName, TopicRoute route, Class<T> type,
                             MessageHandler.SingleKeyWithOriginTopic<T> handler);

    <T> Mono<String> dequeue(String queueName, TopicMultiRoute route, Class<T> type,
                             MessageHandler.MultiKey<T> handler);

    <T> Mono<String> dequeue(String queueName, TopicMultiRoute route, Class<T> type,
                             MessageHandler.MultiKeyWithOriginTopic<T> handler);

    Mono<String> dequeueString(String queueName, TopicRoute route, MessageHandler.SingleKey<String> handler);

    Mono<String> dequeueString(String queueName, TopicRoute route,
                               MessageHandler.SingleKeyWithOriginTopic<String> handler);

    Mono<String> dequeueString(String queueName, TopicMultiRoute route, MessageHandler.MultiKey<String> handler);

    Mono<String> dequeueString(String queueName, TopicMultiRoute route,
                               MessageHandler.MultiKeyWithOriginTopic<String> handler);

    /**
     * Receives messages sent directly to a standard queue. The handler's routing key is {@code null}.
     */
    <T> Mono<String> dequeue(String queueName, Class<T> type, MessageHandler.SingleKey<T> handler);

    Mono<String> dequeueString(String queueName, MessageHandler.SingleKey<String> handler);

    /**
     * Receives from an ordered queue, without a long-poll wait, and blocks until the batch is done.
     * Must not be called from a non-blocking thread.
     */
    <T> String dequeueFifo(String queueName, Class<T> type, MessageHandler.SingleKey<T> handler);

    String dequeueStringFifo(String queueName, MessageHandler.SingleKey<String> handler);

    @Override
    void close();
}
