package io.clype.sqsrelay.model;

/**
 * Thrown on receive paths when a queue or topic could neither be found nor created.
 */
public class QueueProvisioningException extends RuntimeException {

    public QueueProvisioningException(String message) {
        super(message);
    }
}
