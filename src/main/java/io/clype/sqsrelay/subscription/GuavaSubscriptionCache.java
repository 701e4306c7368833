package io.clype.sqsrelay.subscription;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

/**
 * {@link SubscriptionCache} backed by a bounded Guava cache. Entries never expire; they live as
 * long as the owning {@link io.clype.sqsrelay.service.MessageQueue}.
 */
public class GuavaSubscriptionCache implements SubscriptionCache {

    private static final int MAX_ENTRIES = 10_000;

    private final Cache<Pair, Boolean> subscriptions;

    public GuavaSubscriptionCache() {
        this(MAX_ENTRIES);
    }

    public GuavaSubscriptionCache(int maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.subscriptions = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public boolean isSubscribed(String topicName, String queueName) {
        return Boolean.TRUE.equals(subscriptions.getIfPresent(new Pair(topicName, queueName)));
    }

    @Override
    public void markSubscribed(String topicName, String queueName) {
        subscriptions.put(new Pair(topicName, queueName), Boolean.TRUE);
    }

    @Override
    public void clear() {
        subscriptions.invalidateAll();
    }

    long size() {
        return subscriptions.size();
    }

    private record Pair(String topicName, String queueName) {}
}
