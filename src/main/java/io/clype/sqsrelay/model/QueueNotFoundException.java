package io.clype.sqsrelay.model;

/**
 * Signals that a queue lookup found no queue of that name.
 *
 * <p>This is a lookup outcome rather than a failure: get-or-create paths react to it by
 * provisioning the queue.</p>
 */
public class QueueNotFoundException extends RuntimeException {

    private final String queueName;

    public QueueNotFoundException(String queueName, Throwable cause) {
        super("Queue does not exist: " + queueName, cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
