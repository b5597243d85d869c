// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;

class SubmissionRejectedExceptionTest {

    private static final Hash HASH = new Hash("0x" + "ab".repeat(32));

    @Test
    void classifiesNodeMessages() {
        assertEquals(RejectionReason.INSUFFICIENT_FUNDS,
                RejectionReason.classify("insufficient funds for gas * price + value"));
        assertEquals(RejectionReason.NONCE_TOO_LOW, RejectionReason.classify("Nonce too low"));
        assertEquals(RejectionReason.UNDERPRICED, RejectionReason.classify("replacement transaction underpriced"));
        assertEquals(RejectionReason.ALREADY_KNOWN, RejectionReason.classify("already known"));
        assertEquals(RejectionReason.INTRINSIC_GAS_TOO_LOW, RejectionReason.classify("intrinsic gas too low"));
        assertEquals(RejectionReason.OTHER, RejectionReason.classify("something odd"));
        assertEquals(RejectionReason.OTHER, RejectionReason.classify(null));
    }

    @Test
    void carriesStageReasonAndCause() {
        RpcException cause = new RpcException(-32000, "nonce too low", null, 7L);

        SubmissionRejectedException e = new SubmissionRejectedException(cause.getMessage(), cause);

        assertEquals(TransactionStage.SUBMISSION, e.stage());
        assertEquals(RejectionReason.NONCE_TOO_LOW, e.reason());
        assertSame(cause, e.getCause());
        assertTrue(e.transactionHash().isEmpty());
        assertEquals("[requestId=7] nonce too low", cause.getMessage());
    }

    @Test
    void submissionFailuresKeepTheLocalHash() {
        TransportException down = new TransportException("read timed out", null);

        SubmissionRejectedException rejected = new SubmissionRejectedException("already known", HASH, null);
        SubmissionFailedException failed = new SubmissionFailedException("broadcast failed", HASH, down);

        assertEquals(HASH, rejected.transactionHash().orElseThrow());
        assertEquals(RejectionReason.ALREADY_KNOWN, rejected.reason());
        assertEquals(TransactionStage.SUBMISSION, failed.stage());
        assertEquals(HASH, failed.transactionHash().orElseThrow());
        assertSame(down, failed.getCause());
        assertThrows(NullPointerException.class, () -> new SubmissionFailedException("x", null, down));
    }

    @Test
    void confirmationFailuresExposeHashAndReceipt() {
        TransactionReceipt receipt = new TransactionReceipt(
                HASH, new Hash("0x" + "cd".repeat(32)), 5, Address.ZERO, null, null,
                false, 21_000, 21_000, null, List.of());

        ConfirmationFailedException reverted = ConfirmationFailedException.reverted(receipt);
        ConfirmationFailedException timedOut = ConfirmationFailedException.timedOut(HASH, 1000);

        assertEquals(TransactionStage.CONFIRMATION, reverted.stage());
        assertEquals(HASH, reverted.transactionHash().orElseThrow());
        assertSame(receipt, reverted.receipt().orElseThrow());
        assertTrue(reverted.isReverted());
        assertEquals(HASH, timedOut.transactionHash().orElseThrow());
        assertTrue(timedOut.receipt().isEmpty());
    }
}
