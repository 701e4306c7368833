package io.clype.sqsrelay.codec;

import java.util.Objects;

/**
 * Turns decoded payload text into the value handed to a message handler.
 *
 * @param <T> the handler's payload type
 */
@FunctionalInterface
public interface PayloadReader<T> {

    T read(String payloadText);

    /**
     * Reads JSON payloads as {@code type}.
     */
    static <T> PayloadReader<T> typed(MessageCodec codec, Class<T> type) {
        Objects.requireNonNull(codec, "codec cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        return text -> codec.decodeTyped(text, type);
    }

    /**
     * Reads Base64 encoded text payloads.
     */
    static PayloadReader<String> raw(MessageCodec codec) {
        Objects.requireNonNull(codec, "codec cannot be null");
        return codec::decodeRaw;
    }
}
