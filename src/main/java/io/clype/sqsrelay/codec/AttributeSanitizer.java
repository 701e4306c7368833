package io.clype.sqsrelay.codec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.sqsrelay.model.QueueNames;

/**
 * Restricts outbound custom attributes to what every transport accepts.
 *
 * <p>Keys and values are reduced to ASCII letters. An attribute whose key or value is blank,
 * or becomes empty once sanitized, is dropped. Attributes that would collide with the reserved
 * routing attributes are dropped as well, and duplicate keys keep their first value.</p>
 */
public final class AttributeSanitizer {

    private static final Logger log = LoggerFactory.getLogger(AttributeSanitizer.class);

    private static final Pattern NON_ALPHABETIC = Pattern.compile("[^a-zA-Z]");

    private AttributeSanitizer() {
    }

    /**
     * Strips every character outside {@code [a-zA-Z]}.
     */
    public static String sanitize(String input) {
        if (input == null) {
            return "";
        }
        return NON_ALPHABETIC.matcher(input).replaceAll("");
    }

    /**
     * Sanitizes a map of caller-supplied attributes.
     *
     * @param customAttributes attributes to send, may be null
     * @return sanitized attributes in caller order, never null
     */
    public static Map<String, String> sanitizeAll(Map<String, String> customAttributes) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        if (customAttributes == null || customAttributes.isEmpty()) {
            return sanitized;
        }
        customAttributes.forEach((key, value) -> {
            if (key == null || key.isBlank() || value == null || value.isBlank()) {
                return;
            }
            String cleanKey = sanitize(key);
            String cleanValue = sanitize(value);
            if (cleanKey.isEmpty() || cleanValue.isEmpty()) {
                log.debug("Dropping attribute '{}': nothing left after sanitizing", cleanKey);
                return;
            }
            if (QueueNames.ROUTING_KEY_NAME.equals(cleanKey) || QueueNames.META_KEY_NAME.equals(cleanKey)) {
                log.warn("Dropping custom attribute '{}': the name is reserved for routing", cleanKey);
                return;
            }
            if (sanitized.putIfAbsent(cleanKey, cleanValue) != null) {
                log.warn("Dropping duplicate attribute '{}' produced by sanitizing", cleanKey);
            }
        });
        return sanitized;
    }
}
