package io.clype.sqsrelay.codec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.clype.sqsrelay.model.DecodedEnvelope;
import io.clype.sqsrelay.model.MessageAttributesWrapper;
import io.clype.sqsrelay.model.TopicNotification;

/**
 * Encodes and decodes message payloads and envelopes.
 *
 * <p>Two payload encodings are supported:</p>
 * <ul>
 *   <li><b>Typed:</b> objects are serialized to JSON with Jackson.</li>
 *   <li><b>Raw:</b> strings are Base64 encoded (UTF-8) so arbitrary text survives the transport
 *       as an opaque string.</li>
 * </ul>
 *
 * <p>Inbound bodies are decoded by {@link #decodeEnvelope(String, boolean)}, which optionally
 * unwraps the topic notification envelope and extracts the attributes map.</p>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe once constructed.</p>
 */
public class MessageCodec {

    private static final Logger log = LoggerFactory.getLogger(MessageCodec.class);

    private static final Pattern BASE64_PATTERN = Pattern.compile("^[a-zA-Z0-9+/]*={0,3}$");

    private final ObjectMapper objectMapper;

    /**
     * Creates a codec with a default {@link ObjectMapper} that ignores unknown properties.
     */
    public MessageCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    /**
     * Creates a codec on top of the given mapper.
     *
     * @param objectMapper the mapper used for typed payloads and envelopes
     */
    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    /**
     * Serializes a typed payload to JSON.
     *
     * @throws CodecException if the object cannot be serialized
     */
    public String encodeTyped(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CodecException("Cannot serialize payload of type "
                    + (payload == null ? "null" : payload.getClass().getName()), e);
        }
    }

    /**
     * Deserializes a JSON payload.
     *
     * @throws CodecException if the text is not valid JSON for {@code type}
     */
    public <T> T decodeTyped(String json, Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CodecException("Cannot deserialize payload as " + type.getName(), e);
        }
    }

    /**
     * Base64 encodes the UTF-8 bytes of {@code text}.
     */
    public String encodeRaw(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Reverses {@link #encodeRaw(String)}.
     *
     * <p>Input that is not syntactically Base64 (length not a multiple of four, characters outside
     * the alphabet, bad padding) is returned unchanged, as it was never encoded.</p>
     */
    public String decodeRaw(String text) {
        if (!isBase64(text)) {
            return text;
        }
        try {
            return new String(Base64.getDecoder().decode(text.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Payload looked like Base64 but did not decode, passing it through: {}", e.getMessage());
            return text;
        }
    }

    /**
     * Whether {@code text} is syntactically valid Base64.
     */
    public static boolean isBase64(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.trim();
        return trimmed.length() % 4 == 0 && BASE64_PATTERN.matcher(trimmed).matches();
    }

    /**
     * Decodes an inbound message body.
     *
     * <p>When {@code unwrapTopicEnvelope} is true the body must be a topic notification and its
     * inner message becomes the payload. The attributes are always read by treating the body as
     * an attributes wrapper; a body that is not a JSON object carries no attributes.</p>
     *
     * @param body                the raw message body
     * @param unwrapTopicEnvelope whether the message arrived through a topic subscription
     * @return the payload text and the attributes map
     * @throws CodecException if a topic envelope was expected but the body is not one
     */
    public DecodedEnvelope decodeEnvelope(String body, boolean unwrapTopicEnvelope) {
        String payload = body;
        if (unwrapTopicEnvelope) {
            TopicNotification notification = readNotification(body);
            payload = notification.message();
        }
        return new DecodedEnvelope(payload, readAttributes(body).toStringMap());
    }

    /**
     * Serializes a policy or other value object with the shared mapper.
     */
    public String toJson(Object value) {
        return encodeTyped(value);
    }

    /**
     * Parses JSON text into a tree, for callers that need to merge documents.
     */
    public JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CodecException("Cannot parse JSON document", e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private TopicNotification readNotification(String body) {
        TopicNotification notification;
        try {
            notification = objectMapper.readValue(body, TopicNotification.class);
        } catch (JsonProcessingException e) {
            throw new CodecException("Message body is not a topic notification", e);
        }
        if (notification == null || notification.message() == null) {
            throw new CodecException("Topic notification has no Message field", null);
        }
        return notification;
    }

    private MessageAttributesWrapper readAttributes(String body) {
        if (body == null || !body.trim().startsWith("{")) {
            return MessageAttributesWrapper.empty();
        }
        try {
            MessageAttributesWrapper wrapper = objectMapper.readValue(body, MessageAttributesWrapper.class);
            return wrapper == null ? MessageAttributesWrapper.empty() : wrapper;
        } catch (JsonProcessingException e) {
            log.debug("Message body has no readable attributes section: {}", e.getOriginalMessage());
            return MessageAttributesWrapper.empty();
        }
    }
}
