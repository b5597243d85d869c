// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

/**
 * Thrown when ABI inputs cannot be encoded.
 */
public final class AbiEncodingException extends JasmineException {

    public AbiEncodingException(final String message) {
        super(message);
    }

    public AbiEncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
