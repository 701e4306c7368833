package io.clype.sqsrelay.config;

import java.net.URI;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import io.clype.sqsrelay.codec.MessageCodec;
import io.clype.sqsrelay.metrics.MessageQueueMetrics;
import io.clype.sqsrelay.service.MessageQueue;
import io.clype.sqsrelay.subscription.GuavaSubscriptionCache;
import io.clype.sqsrelay.subscription.SubscriptionCache;
import io.clype.sqsrelay.transport.SnsTopicTransport;
import io.clype.sqsrelay.transport.SqsQueueTransport;

import software.amazon.awssdk.http.async.SdkAsyncHttpClient;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sns.SnsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

/**
 * Spring Boot auto-configuration for the message queue.
 *
 * <p>This configuration is enabled when {@code message-queue.enabled} is {@code true}.</p>
 *
 * <p><b>Configuration Example (application.yml):</b></p>
 * <pre>{@code
 * message-queue:
 *   enabled: true
 *   region: eu-central-1     # Optional, uses default provider chain if not set
 *   wait-time: 10s           # Optional, default: 10s
 *   max-connections: 100     # Optional, default: 100
 * }</pre>
 *
 * <p><b>Bean Customization:</b> All beans created by this configuration use
 * {@code @ConditionalOnMissingBean}, allowing you to provide your own implementations
 * by defining beans of the same type in your application configuration.</p>
 *
 * <p><b>AWS Credentials:</b> The SQS and SNS clients use the default AWS credential provider chain.
 * Configure credentials via environment variables, system properties, or IAM roles.</p>
 *
 * <p><b>HTTP Client:</b> Both clients share one Netty NIO async HTTP client.</p>
 *
 * @see MessageQueueProperties
 * @see MessageQueue
 */
@AutoConfiguration
@EnableConfigurationProperties(MessageQueueProperties.class)
@ConditionalOnProperty(prefix = "message-queue", name = "enabled", havingValue = "true")
public class MessageQueueAutoConfiguration {

    private final MessageQueueProperties properties;

    /**
     * Creates the auto-configuration with the given properties.
     *
     * @param properties the message queue configuration properties
     */
    public MessageQueueAutoConfiguration(MessageQueueProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates the Netty-based async HTTP client shared by the SQS and SNS clients.
     *
     * <p>The read timeout is kept above the longest long-poll wait so that receives are not cut off.</p>
     *
     * @return the configured async HTTP client
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SdkAsyncHttpClient messageQueueHttpClient() {
        return NettyNioAsyncHttpClient.builder()
                .maxConcurrency(properties.getMaxConnections())
                .connectionTimeout(Duration.ofSeconds(10))
                .readTimeout(MessageQueue.MAX_WAIT_TIME.plusSeconds(10))
                .connectionMaxIdleTime(Duration.ofSeconds(60))
                .build();
    }

    /**
     * Creates the AWS SQS async client.
     *
     * <p>If a region is specified in properties, it will be used. Otherwise, the client
     * uses the default AWS region provider chain (environment, system properties, profile).</p>
     *
     * @param httpClient the async HTTP client to use for API calls
     * @return the configured SQS async client
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SqsAsyncClient sqsAsyncClient(SdkAsyncHttpClient httpClient) {
        var builder = SqsAsyncClient.builder()
                .httpClient(httpClient);

        if (properties.getRegion() != null && !properties.getRegion().isEmpty()) {
            builder.region(Region.of(properties.getRegion()));
        }
        if (properties.getEndpoint() != null && !properties.getEndpoint().isEmpty()) {
            builder.endpointOverride(URI.create(properties.getEndpoint()));
        }

        return builder.build();
    }

    /**
     * Creates the AWS SNS async client, configured like the SQS client.
     *
     * @param httpClient the async HTTP client to use for API calls
     * @return the configured SNS async client
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SnsAsyncClient snsAsyncClient(SdkAsyncHttpClient httpClient) {
        var builder = SnsAsyncClient.builder()
                .httpClient(httpClient);

        if (properties.getRegion() != null && !properties.getRegion().isEmpty()) {
            builder.region(Region.of(properties.getRegion()));
        }
        if (properties.getEndpoint() != null && !properties.getEndpoint().isEmpty()) {
            builder.endpointOverride(URI.create(properties.getEndpoint()));
        }

        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageCodec messageCodec() {
        return new MessageCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionCache subscriptionCache() {
        return new GuavaSubscriptionCache();
    }

    /**
     * Creates the message queue bean.
     *
     * @param sqsClient the SQS async client
     * @param snsClient the SNS async client
     * @param codec     the payload codec
     * @param cache     the subscription cache
     * @param metrics   optional metrics collector (may be null if metrics are disabled)
     * @return the configured message queue
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({SqsAsyncClient.class, SnsAsyncClient.class})
    public MessageQueue messageQueue(
            SqsAsyncClient sqsClient,
            SnsAsyncClient snsClient,
            MessageCodec codec,
            SubscriptionCache cache,
            @Autowired(required = false) MessageQueueMetrics metrics) {
        return new MessageQueue(
                new SqsQueueTransport(sqsClient),
                new SnsTopicTransport(snsClient),
                codec,
                properties.getWaitTime(),
                properties.getMaxMessages(),
                properties.getDispatchThreads(),
                cache,
                properties.getSubscriptions().isCacheMultiKey(),
                metrics);
    }
}
