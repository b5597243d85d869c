// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void redactsPrivateKeysAndRawTransactions() {
        String input = "{\"privateKey\":\"0xabcdef\",\"raw\":\"0xf86c0102\"}";

        String sanitized = LogSanitizer.sanitize(input);

        assertEquals("{\"privateKey\":\"0x***[REDACTED]***\",\"raw\":\"0x***[REDACTED]***\"}", sanitized);
    }

    @Test
    void redactsSendRawTransactionParams() {
        String input = "{\"jsonrpc\":\"2.0\",\"method\":\"eth_sendRawTransaction\",\"params\":[\"0xf86c098504\"],\"id\":1}";

        String sanitized = LogSanitizer.sanitize(input);

        assertFalse(sanitized.contains("f86c098504"));
        assertTrue(sanitized.contains("\"params\":[\"0x***[REDACTED]***\"]"));
    }

    @Test
    void truncatesLongMessages() {
        String sanitized = LogSanitizer.sanitize("x".repeat(5000));

        assertEquals(LogSanitizer.MAX_LOG_LENGTH, sanitized.length());
        assertTrue(sanitized.endsWith("...(truncated)"));
    }

    @Test
    void handlesNull() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }
}
