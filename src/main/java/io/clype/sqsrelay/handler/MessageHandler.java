package io.clype.sqsrelay.handler;

import java.util.List;
import java.util.Map;

import io.clype.sqsrelay.model.DeliveryContext;

/**
 * Caller-supplied processing for a received message.
 *
 * <p>A handler returns {@code true} when it has processed the message, which acknowledges
 * (deletes) it. Returning {@code false} leaves the message on the queue; it becomes visible
 * again once the visibility timeout elapses and is dead-lettered after the maximum receive
 * count. A handler that throws is treated like one that returned {@code false}, and the
 * failure is then raised to the caller.</p>
 *
 * <p>The set of handler kinds is closed. The dequeue operation a caller picks determines which
 * kind it accepts:</p>
 * <ul>
 *   <li>{@link SingleKey}: payload, the routing key used, attributes</li>
 *   <li>{@link MultiKey}: payload, the routing keys used, attributes</li>
 *   <li>{@link SingleKeyWithOriginTopic}: as {@link SingleKey}, plus the topic the message came
 *       through; suited to draining dead-letter queues back to their origin</li>
 *   <li>{@link MultiKeyWithOriginTopic}: as {@link MultiKey}, plus the origin topic</li>
 * </ul>
 *
 * @param <T> the payload type
 */
public sealed interface MessageHandler<T> permits
        MessageHandler.SingleKey,
        MessageHandler.MultiKey,
        MessageHandler.SingleKeyWithOriginTopic,
        MessageHandler.MultiKeyWithOriginTopic {

    /**
     * Invokes this handler with the arguments its kind takes from {@code context}.
     *
     * @return whether the message should be acknowledged
     */
    boolean dispatch(T payload, DeliveryContext context);

    @FunctionalInterface
    non-sealed interface SingleKey<T> extends MessageHandler<T> {

        boolean handle(T payload, String routingKey, Map<String, String> attributes);

        @Override
        default boolean dispatch(T payload, DeliveryContext context) {
            return handle(payload, context.routingKey(), context.attributes());
        }
    }

    @FunctionalInterface
    non-sealed interface MultiKey<T> extends MessageHandler<T> {

        boolean handle(T payload, List<String> routingKeys, Map<String, String> attributes);

        @Override
        default boolean dispatch(T payload, DeliveryContext context) {
            return handle(payload, context.routingKeys(), context.attributes());
        }
    }

    @FunctionalInterface
    non-sealed interface SingleKeyWithOriginTopic<T> extends MessageHandler<T> {

        boolean handle(T payload, String originTopic, String routingKey, Map<String, String> attributes);

        @Override
        default boolean dispatch(T payload, DeliveryContext context) {
            return handle(payload, context.originTopic(), context.routingKey(), context.attributes());
        }
    }

    @FunctionalInterface
    non-sealed interface MultiKeyWithOriginTopic<T> extends MessageHandler<T> {

        boolean handle(T payload, String originTopic, List<String> routingKeys, Map<String, String> attributes);

        @Override
        default boolean dispatch(T payload, DeliveryContext context) {
            return handle(payload, context.originTopic(), context.routingKeys(), context.attributes());
        }
    }
}
