package io.clype.sqsrelay.subscription;

/**
 * Remembers which (topic, queue) pairs are known to be subscribed, so that reconciliation can
 * skip the transport round trips once a pair has been confirmed.
 *
 * <p>Implementations must be safe for concurrent use. Two callers reconciling the same pair for
 * the first time may both miss the cache and both reconcile; the transport's subscription listing
 * keeps that from producing a second subscription in the common case, and a repeated filter
 * policy update is harmless.</p>
 *
 * <p>Pairs are compared component by component. Names may contain hyphens, so a joined
 * {@code topic-queue} string cannot identify a pair.</p>
 */
public interface SubscriptionCache {

    boolean isSubscribed(String topicName, String queueName);

    void markSubscribed(String topicName, String queueName);

    /**
     * Forgets every pair.
     */
    void clear();
}
