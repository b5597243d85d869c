// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for fixed-length, {@code 0x}-prefixed hex strings.
 *
 * @since 0.1.0
 */
final class HexValidator {
    private HexValidator() {}

    /**
     * Returns a pattern matching exactly {@code byteLength * 2} hex characters after {@code 0x}.
     *
     * @param byteLength the byte length the hex string must represent
     * @return the compiled pattern
     */
    static Pattern fixedLength(int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }
}
