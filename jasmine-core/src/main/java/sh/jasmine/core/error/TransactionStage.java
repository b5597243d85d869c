// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

/**
 * The lifecycle stage at which a transaction failed.
 */
public enum TransactionStage {
    ESTIMATION,
    PRICING,
    NONCE,
    SIGNING,
    SUBMISSION,
    CONFIRMATION
}
