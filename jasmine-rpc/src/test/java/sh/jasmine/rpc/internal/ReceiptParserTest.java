// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sh.jasmine.core.model.LogEntry;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;
import sh.jasmine.core.types.Wei;

class ReceiptParserTest {

    private static Map<String, Object> creationReceipt(final String status) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("transactionHash", "0x" + "a".repeat(64));
        map.put("blockHash", "0x" + "b".repeat(64));
        map.put("blockNumber", "0x1b4");
        map.put("from", "0x" + "1".repeat(40));
        map.put("to", null);
        map.put("contractAddress", "0x" + "c".repeat(40));
        map.put("status", status);
        map.put("gasUsed", "0x2dc6c0");
        map.put("cumulativeGasUsed", "0x2dc6c0");
        map.put("effectiveGasPrice", "0x3b9aca00");
        map.put("logs", List.of(Map.of(
                "address", "0x" + "c".repeat(40),
                "data", "0x01",
                "topics", List.of("0x" + "d".repeat(64)),
                "transactionHash", "0x" + "a".repeat(64),
                "logIndex", "0x0")));
        return map;
    }

    @Test
    void parsesContractCreation() {
        TransactionReceipt receipt = ReceiptParser.parseReceipt(creationReceipt("0x1"));

        assertTrue(receipt.status());
        assertEquals(436L, receipt.blockNumber());
        assertNull(receipt.to());
        assertEquals(new Address("0x" + "c".repeat(40)), receipt.contractAddressOpt().orElseThrow());
        assertEquals(3_000_000L, receipt.gasUsed());
        assertEquals(Wei.gwei(1), receipt.effectiveGasPrice());

        LogEntry log = receipt.logs().get(0);
        assertEquals(List.of(new Hash("0x" + "d".repeat(64))), log.topics());
        assertEquals(1, log.data().byteLength());
    }

    @Test
    void zeroStatusIsFailure() {
        assertFalse(ReceiptParser.parseReceipt(creationReceipt("0x0")).status());
    }

    @Test
    void missingHashIsRejected() {
        Map<String, Object> map = creationReceipt("0x1");
        map.remove("transactionHash");

        assertThrows(NullPointerException.class, () -> ReceiptParser.parseReceipt(map));
    }
}
