// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

import java.util.Objects;

import sh.jasmine.core.types.Hash;

/**
 * Thrown when a signed transaction could not be handed to the node and the
 * node did not answer with a rejection.
 *
 * <p>
 * The transaction may still have reached the node, for example when the
 * connection dropped after the request was sent. {@link #transactionHash()}
 * is always present so the caller can look the transaction up before sending
 * it again.
 */
public final class SubmissionFailedException extends TxnException {

    public SubmissionFailedException(final String message, final Hash transactionHash, final Throwable cause) {
        super(TransactionStage.SUBMISSION, message, Objects.requireNonNull(transactionHash, "transactionHash"), cause);
    }
}
