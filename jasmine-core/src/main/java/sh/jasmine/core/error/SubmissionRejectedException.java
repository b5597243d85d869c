// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

import java.util.Objects;

import sh.jasmine.core.types.Hash;

/**
 * Thrown when the node refuses a signed transaction at submission.
 *
 * <p>
 * {@link #nodeReason()} is the message the node returned; {@link #reason()}
 * classifies it where the message is recognised.
 */
public final class SubmissionRejectedException extends TxnException {

    private final RejectionReason reason;
    private final String nodeReason;

    public SubmissionRejectedException(final String nodeReason, final Throwable cause) {
        this(nodeReason, null, cause);
    }

    /**
     * @param nodeReason      the node's message
     * @param transactionHash hash of the refused transaction, {@code null} if unknown
     * @param cause           the node error
     */
    public SubmissionRejectedException(final String nodeReason, final Hash transactionHash, final Throwable cause) {
        super(TransactionStage.SUBMISSION, "transaction rejected by node: " + nodeReason, transactionHash, cause);
        this.nodeReason = Objects.requireNonNullElse(nodeReason, "");
        this.reason = RejectionReason.classify(nodeReason);
    }

    public RejectionReason reason() {
        return reason;
    }

    public String nodeReason() {
        return nodeReason;
    }
}
