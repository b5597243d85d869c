// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

/**
 * Thrown when gas estimation failed.
 */
public final class EstimationException extends TxnException {

    public EstimationException(final String message, final Throwable cause) {
        super(TransactionStage.ESTIMATION, message, null, cause);
    }
}
