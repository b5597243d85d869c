// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogFormatterTest {

    private static final String HASH = "0x88df016429689c079f3b2f6ad39fa052532c56795b733da78a91ebe6a713944b";

    @Test
    void shortensLongHashes() {
        assertEquals("0x88df...944b", LogFormatter.shortenHash(HASH));
        assertEquals("0x1234", LogFormatter.shortenHash("0x1234"));
    }

    @Test
    void tagsLifecycleMessages() {
        assertTrue(LogFormatter.formatRpc("eth_chainId", 1500).contains("[RPC]"));
        assertTrue(LogFormatter.formatTxHash(HASH, 10).contains("hash=0x88df...944b"));
        assertTrue(LogFormatter.formatTxSend("0xaaaa", null, 3L, 21000L, "0x0").contains("to=create"));
        assertTrue(LogFormatter.formatTxWait(HASH, 500, null).contains("timeout=none"));
        assertTrue(LogFormatter.formatTxReceipt(HASH, 12, false).contains("status=FAILED"));
        assertTrue(LogFormatter.formatEstimateGas("0xaaaa", "0xbbbb", "0x").contains("[ESTIMATE-GAS]"));
    }
}
