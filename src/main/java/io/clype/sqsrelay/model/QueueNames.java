package io.clype.sqsrelay.model;

import java.util.Objects;

/**
 * Naming rules shared by every queue this library provisions.
 *
 * <p>Every non-dead-letter queue has a paired dead-letter queue named by appending
 * {@link #DEAD_LETTER_SUFFIX}. Ordered (FIFO) queues additionally carry {@link #FIFO_SUFFIX},
 * which is always the outermost suffix:</p>
 * <pre>{@code
 * orders          -> orders-dl
 * orders (fifo)   -> orders.fifo, orders-dl.fifo
 * }</pre>
 */
public final class QueueNames {

    /** Literal appended to a base name to form its dead-letter queue. */
    public static final String DEAD_LETTER_SUFFIX = "-dl";

    /** Literal the transport requires on every FIFO queue name. */
    public static final String FIFO_SUFFIX = ".fifo";

    /** Message attribute carrying the routing key matched by subscription filter policies. */
    public static final String ROUTING_KEY_NAME = "routingKey";

    /** Optional secondary message attribute matched by subscription filter policies. */
    public static final String META_KEY_NAME = "metaKey";

    private QueueNames() {
    }

    /**
     * Returns the transport-level name of a queue.
     *
     * @param baseName the logical queue name
     * @param ordered  whether the queue is FIFO
     * @return {@code baseName}, with {@link #FIFO_SUFFIX} appended when ordered
     */
    public static String physicalName(String baseName, boolean ordered) {
        Objects.requireNonNull(baseName, "baseName cannot be null");
        return ordered ? baseName + FIFO_SUFFIX : baseName;
    }

    /**
     * Returns the transport-level name of the dead-letter queue paired with {@code baseName}.
     */
    public static String deadLetterName(String baseName, boolean ordered) {
        Objects.requireNonNull(baseName, "baseName cannot be null");
        return physicalName(baseName + DEAD_LETTER_SUFFIX, ordered);
    }

    /**
     * Whether the logical name already denotes a dead-letter queue. Such queues are never
     * given a further dead-letter pairing.
     */
    public static boolean isDeadLetter(String baseName) {
        return baseName != null && baseName.endsWith(DEAD_LETTER_SUFFIX);
    }
}
