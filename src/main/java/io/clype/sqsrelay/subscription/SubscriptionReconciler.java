package io.clype.sqsrelay.subscription;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.sqsrelay.codec.MessageCodec;
import io.clype.sqsrelay.model.FilterPolicy;
import io.clype.sqsrelay.model.QueueProvisioningException;
import io.clype.sqsrelay.model.TopicMultiRoute;
import io.clype.sqsrelay.model.TopicRoute;
import io.clype.sqsrelay.provision.QueueProvisioner;
import io.clype.sqsrelay.provision.TopicProvisioner;
import io.clype.sqsrelay.transport.QueueTransport;
import io.clype.sqsrelay.transport.TopicTransport;

import reactor.core.publisher.Mono;

import static io.clype.sqsrelay.codec.LogSanitizer.sanitizeForLog;

/**
 * Makes sure a standard queue is subscribed to a topic with the filter policy of a route.
 *
 * <p>Reconciliation resolves (creating where missing) the topic and the queue, lists the topic's
 * subscriptions and subscribes the queue only when no {@code sqs} subscription already targets
 * it. A new subscription gets the queue access grant for the topic and the route's filter policy.
 * An existing subscription is left untouched, filter policy included.</p>
 *
 * <p><b>Caching:</b> Single-key reconciliation records the pair in the {@link SubscriptionCache}
 * and short-circuits on later calls. Multi-key reconciliation consults the cache only when
 * {@code cacheMultiKey} is enabled; otherwise every call re-checks the transport.</p>
 *
 * <p><b>Error Handling:</b> Errors propagate. A topic or queue that can be neither found nor
 * created fails with {@link QueueProvisioningException}; blank routing keys fail with
 * {@link IllegalArgumentException} before any transport call.</p>
 */
public class SubscriptionReconciler {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionReconciler.class);

    private final TopicProvisioner topicProvisioner;
    private final QueueProvisioner queueProvisioner;
    private final QueueTransport queueTransport;
    private final TopicTransport topicTransport;
    private final QueueAccessPolicy accessPolicy;
    private final MessageCodec codec;
    private final SubscriptionCache cache;
    private final boolean cacheMultiKey;

    public SubscriptionReconciler(
            TopicProvisioner topicProvisioner,
            QueueProvisioner queueProvisioner,
            QueueTransport queueTransport,
            TopicTransport topicTransport,
            MessageCodec codec,
            SubscriptionCache cache,
            boolean cacheMultiKey) {
        this.topicProvisioner = Objects.requireNonNull(topicProvisioner, "topicProvisioner cannot be null");
        this.queueProvisioner = Objects.requireNonNull(queueProvisioner, "queueProvisioner cannot be null");
        this.queueTransport = Objects.requireNonNull(queueTransport, "queueTransport cannot be null");
        this.topicTransport = Objects.requireNonNull(topicTransport, "topicTransport cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.accessPolicy = new QueueAccessPolicy(codec);
        this.cacheMultiKey = cacheMultiKey;
    }

    /**
     * Ensures {@code queueName} is subscribed to the route's topic, filtered on its routing key
     * and optional meta key. Cached per (topic, queue).
     */
    public Mono<Void> ensureSubscribed(TopicRoute route, String queueName) {
        Objects.requireNonNull(route, "route cannot be null");
        Objects.requireNonNull(queueName, "queueName cannot be null");
        return Mono.defer(() -> {
            if (cache.isSubscribed(route.topicName(), queueName)) {
                return Mono.empty();
            }
            return reconcile(route.topicName(), queueName, route.filterPolicy())
                    .doOnSuccess(v -> cache.markSubscribed(route.topicName(), queueName));
        });
    }

    /**
     * Ensures {@code queueName} is subscribed to the route's topic, accepting any of its routing
     * keys. Cached only when multi-key caching is enabled.
     */
    public Mono<Void> ensureSubscribed(TopicMultiRoute route, String queueName) {
        Objects.requireNonNull(route, "route cannot be null");
        Objects.requireNonNull(queueName, "queueName cannot be null");
        return Mono.defer(() -> {
            if (cacheMultiKey && cache.isSubscribed(route.topicName(), queueName)) {
                return Mono.empty();
            }
            Mono<Void> reconciled = reconcile(route.topicName(), queueName, route.filterPolicy());
            return cacheMultiKey
                    ? reconciled.doOnSuccess(v -> cache.markSubscribed(route.topicName(), queueName))
                    : reconciled;
        });
    }

    private Mono<Void> reconcile(String topicName, String queueName, FilterPolicy filterPolicy) {
        Mono<String> topicArn = topicProvisioner.getOrCreateTopicArn(topicName)
                .filter(arn -> !arn.isBlank())
                .switchIfEmpty(Mono.error(() -> new QueueProvisioningException(
                        "Cannot find or create topic " + topicName)));
        Mono<String> queueUrl = queueProvisioner.getOrCreateQueueUrl(queueName, false)
                .filter(url -> !url.isBlank())
                .switchIfEmpty(Mono.error(() -> new QueueProvisioningException(
                        "Cannot find or create queue " + queueName)));

        return topicArn.zipWith(queueUrl)
                .flatMap(resolved -> queueProvisioner.getQueueArn(resolved.getT2())
                        .flatMap(queueArn -> topicProvisioner.findSubscription(resolved.getT1(), queueArn)
                                .hasElement()
                                .flatMap(subscribed -> subscribed
                                        ? Mono.<Void>empty()
                                        : subscribe(resolved.getT1(), resolved.getT2(), queueArn, filterPolicy)
                                                .doOnSuccess(v -> log.info(
                                                        "Subscribed queue '{}' to topic '{}' with filter {}",
                                                        sanitizeForLog(queueName), sanitizeForLog(topicName),
                                                        sanitizeForLog(codec.toJson(filterPolicy)))))));
    }

    private Mono<Void> subscribe(String topicArn, String queueUrl, String queueArn, FilterPolicy filterPolicy) {
        String filterPolicyJson = codec.toJson(filterPolicy);
        return grantTopicAccess(topicArn, queueUrl, queueArn)
                .then(topicTransport.subscribeQueue(topicArn, queueArn))
                .flatMap(subscriptionArn -> topicTransport.setSubscriptionAttribute(
                        subscriptionArn, TopicTransport.FILTER_POLICY_ATTRIBUTE, filterPolicyJson));
    }

    private Mono<Void> grantTopicAccess(String topicArn, String queueUrl, String queueArn) {
        return queueTransport.getQueueAttributes(queueUrl, List.of(QueueTransport.POLICY_ATTRIBUTE))
                .flatMap(attributes -> {
                    String merged = accessPolicy.grantTopicAccess(
                            attributes.get(QueueTransport.POLICY_ATTRIBUTE), queueArn, topicArn);
                    if (merged == null) {
                        return Mono.empty();
                    }
                    return queueTransport.setQueueAttributes(queueUrl, Map.of(QueueTransport.POLICY_ATTRIBUTE, merged));
                });
    }
}
