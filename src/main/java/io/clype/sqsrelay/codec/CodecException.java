package io.clype.sqsrelay.codec;

/**
 * Thrown when a payload or envelope cannot be serialized or parsed.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
