package io.clype.sqsrelay.service;

import reactor.core.publisher.Mono;

/**
 * Topic administration.
 */
public interface TopicManager {

    /**
     * Deletes the topic. A topic that does not exist counts as deleted.
     *
     * @return whether the topic is gone; {@code false} on failure
     */
    Mono<Boolean> deleteTopic(String topicName);
}
