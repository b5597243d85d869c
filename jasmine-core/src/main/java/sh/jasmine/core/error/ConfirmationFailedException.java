// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

import java.util.Objects;
import java.util.Optional;

import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Hash;

/**
 * Thrown when a broadcast transaction does not confirm successfully.
 *
 * <p>
 * Either the transaction was mined and reverted, in which case the receipt
 * is attached, or no receipt arrived before the configured deadline.
 */
public final class ConfirmationFailedException extends TxnException {

    private final TransactionReceipt receipt;

    public ConfirmationFailedException(
            final String message, final Hash transactionHash, final TransactionReceipt receipt, final Throwable cause) {
        super(TransactionStage.CONFIRMATION, message, Objects.requireNonNull(transactionHash, "transactionHash"), cause);
        this.receipt = receipt;
    }

    public static ConfirmationFailedException reverted(final TransactionReceipt receipt) {
        return new ConfirmationFailedException(
                "transaction " + receipt.transactionHash() + " reverted in block " + receipt.blockNumber(),
                receipt.transactionHash(),
                receipt,
                null);
    }

    public static ConfirmationFailedException timedOut(final Hash transactionHash, final long timeoutMillis) {
        return new ConfirmationFailedException(
                "no receipt for " + transactionHash + " after " + timeoutMillis + " ms", transactionHash, null, null);
    }

    public Optional<TransactionReceipt> receipt() {
        return Optional.ofNullable(receipt);
    }

    public boolean isReverted() {
        return receipt != null;
    }
}
