package io.clype.sqsrelay.model;

/**
 * Thrown when a provider response carries a client or server error status.
 */
public class TransportException extends RuntimeException {

    private final int statusCode;

    public TransportException(String operation, int statusCode) {
        super("Invalid status code received from " + operation + ": " + statusCode);
        this.statusCode = statusCode;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * Returns the HTTP status code, or -1 when the failure did not come from a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
