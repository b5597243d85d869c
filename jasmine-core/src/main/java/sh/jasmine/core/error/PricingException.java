// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

/**
 * Thrown when gas price lookup failed.
 */
public final class PricingException extends TxnException {

    public PricingException(final String message, final Throwable cause) {
        super(TransactionStage.PRICING, message, null, cause);
    }
}
