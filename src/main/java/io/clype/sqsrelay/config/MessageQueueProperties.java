package io.clype.sqsrelay.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the message queue.
 *
 * <p>These properties are bound to the {@code message-queue} prefix in your
 * application configuration.</p>
 *
 * <p><b>Example Configuration (application.yml):</b></p>
 * <pre>{@code
 * message-queue:
 *   enabled: true
 *   region: eu-central-1
 *   endpoint: http://localhost:4566   # Optional, e.g. LocalStack
 *   wait-time: 10s
 *   max-messages: 10
 *   max-connections: 100
 *   dispatch-threads: 8
 *   subscriptions:
 *     cache-multi-key: false
 *   metrics:
 *     enabled: true
 * }</pre>
 *
 * @see MessageQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "message-queue")
public class MessageQueueProperties {

    public static final Duration DEFAULT_WAIT_TIME = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_MESSAGES = 10;
    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    public static final int DEFAULT_MIN_DISPATCH_THREADS = 8;

    private boolean enabled;
    private String region;
    private String endpoint;
    private Duration waitTime = DEFAULT_WAIT_TIME;
    private int maxMessages = DEFAULT_MAX_MESSAGES;
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;
    private int dispatchThreads = Math.max(DEFAULT_MIN_DISPATCH_THREADS, Runtime.getRuntime().availableProcessors());
    private SubscriptionsConfig subscriptions = new SubscriptionsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

    public Duration getWaitTime() { return waitTime; }
    public void setWaitTime(Duration waitTime) { this.waitTime = waitTime; }

    public int getMaxMessages() { return maxMessages; }
    public void setMaxMessages(int maxMessages) { this.maxMessages = maxMessages; }

    public int getMaxConnections() { return maxConnections; }
    public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }

    public int getDispatchThreads() { return dispatchThreads; }
    public void setDispatchThreads(int dispatchThreads) { this.dispatchThreads = dispatchThreads; }

    public SubscriptionsConfig getSubscriptions() { return subscriptions; }
    public void setSubscriptions(SubscriptionsConfig subscriptions) { this.subscriptions = subscriptions; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Subscription cache configuration.
     *
     * <p>Single-key subscriptions are always cached once confirmed. Multi-key subscriptions are
     * re-checked against the topic on every dequeue unless {@code cache-multi-key} is set.</p>
     */
    public static class SubscriptionsConfig {
        private boolean cacheMultiKey = false;

        public boolean isCacheMultiKey() { return cacheMultiKey; }
        public void setCacheMultiKey(boolean cacheMultiKey) { this.cacheMultiKey = cacheMultiKey; }
    }

    /** Metrics configuration. */
    public static class MetricsConfig {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
