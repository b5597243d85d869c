// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core;

import java.util.regex.Pattern;

/**
 * Removes sensitive values from debug log payloads.
 *
 * <p>
 * Redacts private keys and raw signed transactions in JSON payloads and in
 * {@code eth_sendRawTransaction} parameter lists, then truncates the result
 * to {@value #MAX_LOG_LENGTH} characters.
 */
public final class LogSanitizer {

    static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern PRIVATE_KEY_PATTERN =
            Pattern.compile("\"privateKey\"\\s*:\\s*\"(0x)?[^\"]+\"");
    private static final String PRIVATE_KEY_REPLACEMENT = "\"privateKey\":\"0x***[REDACTED]***\"";

    private static final Pattern RAW_PATTERN = Pattern.compile("\"raw\"\\s*:\\s*\"0x[^\"]+\"");
    private static final String RAW_REPLACEMENT = "\"raw\":\"0x***[REDACTED]***\"";

    private static final Pattern SEND_RAW_PATTERN =
            Pattern.compile("(\"method\"\\s*:\\s*\"eth_sendRawTransaction\"\\s*,\\s*\"params\"\\s*:\\s*\\[\\s*\")0x[0-9a-fA-F]+");
    private static final String SEND_RAW_REPLACEMENT = "$10x***[REDACTED]***";

    private LogSanitizer() {
    }

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;
        if (sanitized.contains("\"privateKey\"")) {
            sanitized = PRIVATE_KEY_PATTERN.matcher(sanitized).replaceAll(PRIVATE_KEY_REPLACEMENT);
        }
        if (sanitized.contains("\"raw\"")) {
            sanitized = RAW_PATTERN.matcher(sanitized).replaceAll(RAW_REPLACEMENT);
        }
        if (sanitized.contains("eth_sendRawTransaction")) {
            sanitized = SEND_RAW_PATTERN.matcher(sanitized).replaceAll(SEND_RAW_REPLACEMENT);
        }
        if (sanitized.length() > MAX_LOG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length()) + TRUNCATION_SUFFIX;
        }
        return sanitized;
    }
}
