// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

/**
 * Thrown when nonce lookup failed.
 */
public final class NonceException extends TxnException {

    public NonceException(final String message, final Throwable cause) {
        super(TransactionStage.NONCE, message, null, cause);
    }
}
