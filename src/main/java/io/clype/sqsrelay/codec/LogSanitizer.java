package io.clype.sqsrelay.codec;

import java.util.regex.Pattern;

/**
 * Makes caller-supplied text safe to write to logs.
 */
public final class LogSanitizer {

    /** Matches all control characters, including ANSI escape introducers. */
    private static final Pattern LOG_SANITIZE_PATTERN = Pattern.compile("[\\p{Cntrl}\\p{Cc}]");

    private LogSanitizer() {
    }

    /**
     * Replaces control characters with underscores. Prevents log injection.
     */
    public static String sanitizeForLog(String input) {
        if (input == null) {
            return "null";
        }
        return LOG_SANITIZE_PATTERN.matcher(input).replaceAll("_");
    }
}
