// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debug logger for RPC and transaction tracing, gated by {@link JasmineDebug}.
 *
 * <p>
 * Messages go to the {@code sh.jasmine.debug} SLF4J logger at INFO level and
 * are always passed through {@link LogSanitizer} first.
 */
public final class DebugLogger {

    /** Name of the SLF4J logger that receives debug output. */
    public static final String LOGGER_NAME = "sh.jasmine.debug";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (JasmineDebug.isRpcLoggingEnabled()) {
            logDirect(message, args);
        }
    }

    public static void logTx(final String message, final Object... args) {
        if (JasmineDebug.isTxLoggingEnabled()) {
            logDirect(message, args);
        }
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
