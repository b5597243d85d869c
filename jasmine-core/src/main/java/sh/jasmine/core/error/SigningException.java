// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

/**
 * Thrown when signing failed.
 */
public final class SigningException extends TxnException {

    public SigningException(final String message, final Throwable cause) {
        super(TransactionStage.SIGNING, message, null, cause);
    }
}
