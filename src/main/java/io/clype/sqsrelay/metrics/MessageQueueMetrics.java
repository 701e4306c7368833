package io.clype.sqsrelay.metrics;

import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Collects and exposes metrics for send, receive and acknowledge operations.
 *
 * <p><b>Available Metrics:</b></p>
 * <ul>
 *   <li>{@code message.queue.sent} - Counter of send/publish attempts, tagged {@code outcome=success|failure}</li>
 *   <li>{@code message.queue.received} - Counter of received messages</li>
 *   <li>{@code message.queue.acknowledged} - Counter of messages deleted after a successful handler</li>
 *   <li>{@code message.queue.abandoned} - Counter of messages left for redelivery</li>
 *   <li>{@code message.queue.handler.failures} - Counter of handler or decode failures</li>
 *   <li>{@code message.queue.provisioning.failures} - Counter of failed queue/topic provisioning</li>
 *   <li>{@code message.queue.handler.latency} - Timer measuring handler execution (p50, p95, p99)</li>
 * </ul>
 *
 * <p>All metrics are tagged with the queue or topic name ({@code destination}).</p>
 */
public class MessageQueueMetrics {

    private static final String METRIC_PREFIX = "message.queue";
    private static final double[] HANDLER_LATENCY_PERCENTILES = {0.5, 0.95, 0.99};

    private final MeterRegistry registry;

    /**
     * Creates a new MessageQueueMetrics instance.
     *
     * @param registry the Micrometer registry to register metrics with
     */
    public MessageQueueMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the outcome of a send or publish.
     *
     * @param destination queue URL, topic ARN or plain name
     * @param success     whether the transport accepted the message
     */
    public void recordSent(String destination, boolean success) {
        counter(".sent", "Messages sent to queues or published to topics",
                tags(destination).and("outcome", success ? "success" : "failure")).increment();
    }

    public void recordReceived(String queue, int count) {
        counter(".received", "Messages received from queues", tags(queue)).increment(count);
    }

    public void recordAcknowledged(String queue) {
        counter(".acknowledged", "Messages deleted after successful processing", tags(queue)).increment();
    }

    public void recordAbandoned(String queue) {
        counter(".abandoned", "Messages left on the queue for redelivery", tags(queue)).increment();
    }

    public void recordHandlerFailure(String queue) {
        counter(".handler.failures", "Messages whose decoding or handler failed", tags(queue)).increment();
    }

    public void recordProvisioningFailure(String name) {
        counter(".provisioning.failures", "Failed queue or topic provisioning", tags(name)).increment();
    }

    /**
     * Records how long a handler took.
     *
     * @param queue        the queue the message came from
     * @param latencyNanos handler execution time in nanoseconds
     */
    public void recordHandlerLatency(String queue, long latencyNanos) {
        Timer.builder(METRIC_PREFIX + ".handler.latency")
                .description("Time taken by message handlers")
                .tags(tags(queue))
                .publishPercentiles(HANDLER_LATENCY_PERCENTILES)
                .register(registry)
                .record(latencyNanos, TimeUnit.NANOSECONDS);
    }

    private Counter counter(String suffix, String description, Tags tags) {
        return Counter.builder(METRIC_PREFIX + suffix)
                .description(description)
                .tags(tags)
                .register(registry);
    }

    private static Tags tags(String destination) {
        return Tags.of("destination", extractName(destination));
    }

    /**
     * Extracts the trailing name from a queue URL or topic ARN.
     *
     * @param destination e.g. {@code https://sqs.us-east-1.amazonaws.com/123456789012/orders}
     *                    or {@code arn:aws:sns:us-east-1:123456789012:orders}
     * @return e.g. {@code orders}
     */
    static String extractName(String destination) {
        if (destination == null || destination.isEmpty()) {
            return "unknown";
        }
        int separator = Math.max(destination.lastIndexOf('/'), destination.lastIndexOf(':'));
        if (separator >= 0 && separator < destination.length() - 1) {
            return destination.substring(separator + 1);
        }
        return destination;
    }
}
