// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

/**
 * Thrown when ABI-encoded output cannot be decoded.
 */
public final class AbiDecodingException extends JasmineException {

    public AbiDecodingException(final String message) {
        super(message);
    }

    public AbiDecodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
