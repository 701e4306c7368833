package io.clype.sqsrelay.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import io.clype.sqsrelay.metrics.MessageQueueMetrics;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Auto-configuration for message queue metrics.
 *
 * <p>This configuration is automatically enabled when:</p>
 * <ul>
 *   <li>Micrometer is on the classpath</li>
 *   <li>A {@link MeterRegistry} bean exists</li>
 *   <li>The {@code message-queue.metrics.enabled} property is true (default)</li>
 * </ul>
 *
 * <p>When Spring Boot Actuator is present this runs after its composite meter registry
 * auto-configuration, so registries created by Actuator are visible to the
 * {@code @ConditionalOnBean} check. Without Actuator only user-defined registries are seen.</p>
 *
 * @see MessageQueueMetrics
 */
@AutoConfiguration(before = MessageQueueAutoConfiguration.class,
        afterName = MessageQueueMetricsAutoConfiguration.METER_REGISTRY_AUTO_CONFIGURATION)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "message-queue.metrics", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class MessageQueueMetricsAutoConfiguration {

    static final String METER_REGISTRY_AUTO_CONFIGURATION =
            "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration";

    @Bean
    @ConditionalOnMissingBean
    public MessageQueueMetrics messageQueueMetrics(MeterRegistry registry) {
        return new MessageQueueMetrics(registry);
    }
}
