package io.clype.sqsrelay.dispatch;

/**
 * What happens to a received message once its handler has run.
 */
public enum AckOutcome {

    /** Delete the message; it is never delivered again. */
    ACKNOWLEDGE,

    /**
     * Leave the message on the queue. It becomes visible again after the visibility timeout and
     * moves to the dead-letter queue once the maximum receive count is reached.
     */
    ABANDON;

    public static AckOutcome of(boolean handled) {
        return handled ? ACKNOWLEDGE : ABANDON;
    }
}
