// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

import java.util.Objects;
import java.util.Optional;

import sh.jasmine.core.types.Hash;

/**
 * Base class for failures of the transaction lifecycle.
 *
 * <p>
 * Each subtype corresponds to one {@link TransactionStage}. The originating
 * cause, usually a {@link TransportException} or {@link RpcException}, is
 * available through {@link #getCause()}. A transaction hash is present once
 * the transaction has been signed and handed to the node.
 */
public abstract sealed class TxnException extends JasmineException
        permits EstimationException,
        PricingException,
        NonceException,
        SigningException,
        SubmissionRejectedException,
        SubmissionFailedException,
        ConfirmationFailedException {

    private final TransactionStage stage;
    private final Hash transactionHash;

    protected TxnException(
            final TransactionStage stage, final String message, final Hash transactionHash, final Throwable cause) {
        super(message, cause);
        this.stage = Objects.requireNonNull(stage, "stage");
        this.transactionHash = transactionHash;
    }

    public TransactionStage stage() {
        return stage;
    }

    public Optional<Hash> transactionHash() {
        return Optional.ofNullable(transactionHash);
    }
}
