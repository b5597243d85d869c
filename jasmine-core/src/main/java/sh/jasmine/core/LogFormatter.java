// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core;

import static sh.jasmine.core.AnsiColors.AMBER;
import static sh.jasmine.core.AnsiColors.CORAL;
import static sh.jasmine.core.AnsiColors.INDIGO;
import static sh.jasmine.core.AnsiColors.LAVENDER;
import static sh.jasmine.core.AnsiColors.RESET;
import static sh.jasmine.core.AnsiColors.SLATE;
import static sh.jasmine.core.AnsiColors.TEAL;

import java.util.Locale;

/**
 * One-line messages for the RPC and transaction lifecycle debug log.
 *
 * <p>
 * Each message starts with a bracketed tag ({@code [RPC]}, {@code [TX-SEND]},
 * ...) so it can be grepped. Hashes and calldata are shortened to
 * {@code 0x1234...abcd}.
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;
    private static final int HASH_SUFFIX_LENGTH = 4;
    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    public static String formatRpc(final String method, final long durationMicros) {
        return String.format(Locale.ROOT, "%s[RPC]%s method=%s %s", INDIGO, RESET, method, duration(durationMicros));
    }

    public static String formatRpcError(
            final String method, final Object code, final String message, final long durationMicros) {
        return String.format(Locale.ROOT,
                "%s[RPC-ERROR]%s method=%s code=%s message=%s %s",
                CORAL, RESET, method, code, message, duration(durationMicros));
    }

    public static String formatEstimateGas(final String from, final String to, final String data) {
        return String.format(Locale.ROOT,
                "%s[ESTIMATE-GAS]%s from=%s to=%s data=%s",
                AMBER, RESET, shortenHash(from), to != null ? shortenHash(to) : "create", shortenHash(data));
    }

    public static String formatTxSend(
            final String from, final String to, final Object nonce, final Object gasLimit, final Object value) {
        return String.format(Locale.ROOT,
                "%s[TX-SEND]%s from=%s to=%s nonce=%s gasLimit=%s value=%s",
                LAVENDER, RESET,
                shortenHash(from),
                to != null ? shortenHash(to) : "create",
                nonce, gasLimit, value);
    }

    public static String formatTxHash(final String hash, final long durationMicros) {
        return String.format(Locale.ROOT,
                "%s[TX-HASH]%s hash=%s %s", LAVENDER, RESET, shortenHash(hash), duration(durationMicros));
    }

    public static String formatTxWait(final String hash, final long pollMillis, final Long timeoutMillis) {
        return String.format(Locale.ROOT,
                "%s[TX-WAIT]%s hash=%s poll=%dms timeout=%s",
                SLATE, RESET, shortenHash(hash), pollMillis, timeoutMillis == null ? "none" : timeoutMillis + "ms");
    }

    public static String formatTxReceipt(final String hash, final long block, final boolean status) {
        final String color = status ? TEAL : CORAL;
        return String.format(Locale.ROOT,
                "%s[TX-RECEIPT]%s hash=%s block=%d status=%s",
                color, RESET, shortenHash(hash), block, status ? "SUCCESS" : "FAILED");
    }

    public static String formatTxFailure(final String stage, final String message) {
        return String.format(Locale.ROOT, "%s[TX-FAILED]%s stage=%s message=%s", CORAL, RESET, stage, message);
    }

    static String shortenHash(final String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }

    private static String duration(final long micros) {
        final double ms = micros / 1000.0;
        final String formatted = ms < 1000
                ? String.format(Locale.ROOT, "%.2fms", ms)
                : String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
        return SLATE + "duration=" + formatted + RESET;
    }
}
