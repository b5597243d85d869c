// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core;

/**
 * Global toggles for verbose lifecycle logging.
 *
 * <p>
 * Both toggles start enabled when the JVM is launched with
 * {@code -Djasmine.debug=true}. The fields are volatile; the compound check
 * in {@link #isEnabled()} is best-effort.
 */
public final class JasmineDebug {

    /** System property that switches on all debug logging at startup. */
    public static final String DEBUG_PROPERTY = "jasmine.debug";

    private static volatile boolean rpcLogging = Boolean.getBoolean(DEBUG_PROPERTY);
    private static volatile boolean txLogging = Boolean.getBoolean(DEBUG_PROPERTY);

    private JasmineDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || txLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        txLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }
}
