// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

import java.util.Locale;

/**
 * Recognised reasons a node refuses a raw transaction.
 */
public enum RejectionReason {
    INSUFFICIENT_FUNDS("insufficient funds"),
    NONCE_TOO_LOW("nonce too low"),
    UNDERPRICED("underpriced"),
    ALREADY_KNOWN("already known", "known transaction"),
    INTRINSIC_GAS_TOO_LOW("intrinsic gas too low"),
    OTHER();

    private final String[] markers;

    RejectionReason(final String... markers) {
        this.markers = markers;
    }

    /**
     * Classifies a node-reported error message.
     *
     * @param nodeMessage the message returned by the node, may be null
     * @return the matching reason, or {@link #OTHER}
     */
    public static RejectionReason classify(final String nodeMessage) {
        if (nodeMessage == null) {
            return OTHER;
        }
        final String msg = nodeMessage.toLowerCase(Locale.ROOT);
        for (RejectionReason reason : values()) {
            for (String marker : reason.markers) {
                if (msg.contains(marker)) {
                    return reason;
                }
            }
        }
        return OTHER;
    }
}
