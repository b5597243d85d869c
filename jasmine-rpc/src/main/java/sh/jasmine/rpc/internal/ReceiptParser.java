// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc.internal;

import static sh.jasmine.rpc.internal.RpcUtils.MAPPER;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;

import org.jspecify.annotations.Nullable;

import sh.jasmine.core.model.LogEntry;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;
import sh.jasmine.core.types.HexData;
import sh.jasmine.core.types.Wei;

/**
 * Converts {@code eth_getTransactionReceipt} result objects into
 * {@link TransactionReceipt}s.
 *
 * <p>
 * {@code status} is treated as success unless it is {@code 0x0}. Missing
 * optional quantities decode as zero; a missing hash or address throws.
 */
public final class ReceiptParser {

    private ReceiptParser() {
    }

    /**
     * Parses a receipt object.
     *
     * @param map the raw result
     * @return the receipt
     * @throws IllegalArgumentException if a value is malformed
     * @throws NullPointerException     if a required field is missing
     */
    public static TransactionReceipt parseReceipt(final Map<String, Object> map) {
        final String statusHex = RpcUtils.stringValue(map.get("status"));
        final boolean status = statusHex != null && !statusHex.isBlank() && !statusHex.equalsIgnoreCase("0x0");
        final String to = RpcUtils.stringValue(map.get("to"));
        final String contractAddress = RpcUtils.stringValue(map.get("contractAddress"));
        final String effectiveGasPrice = RpcUtils.stringValue(map.get("effectiveGasPrice"));

        return new TransactionReceipt(
                hash(map.get("transactionHash")),
                hash(map.get("blockHash")),
                quantity(map.get("blockNumber")),
                new Address(String.valueOf(required(map.get("from"), "from"))),
                to != null ? new Address(to) : null,
                contractAddress != null ? new Address(contractAddress) : null,
                status,
                quantity(map.get("gasUsed")),
                quantity(map.get("cumulativeGasUsed")),
                effectiveGasPrice != null ? Wei.of(RpcUtils.decodeHexBigInteger(effectiveGasPrice)) : null,
                parseLogs(map.get("logs")));
    }

    public static List<LogEntry> parseLogs(final @Nullable Object value) {
        if (value == null) {
            return List.of();
        }
        final List<Map<String, Object>> rawLogs =
                MAPPER.convertValue(value, new TypeReference<List<Map<String, Object>>>() {});
        final List<LogEntry> logs = new ArrayList<>(rawLogs.size());
        for (Map<String, Object> raw : rawLogs) {
            logs.add(parseLog(raw));
        }
        return List.copyOf(logs);
    }

    static LogEntry parseLog(final Map<String, Object> map) {
        final String data = RpcUtils.stringValue(map.get("data"));
        final List<String> topicsHex = MAPPER.convertValue(map.get("topics"), new TypeReference<List<String>>() {});
        final List<Hash> topics = topicsHex != null ? topicsHex.stream().map(Hash::new).toList() : List.of();
        return new LogEntry(
                new Address(String.valueOf(required(map.get("address"), "log address"))),
                data != null ? new HexData(data) : HexData.EMPTY,
                topics,
                hash(map.get("transactionHash")),
                quantity(map.get("logIndex")));
    }

    private static Hash hash(final Object value) {
        return new Hash(String.valueOf(required(value, "hash")));
    }

    private static long quantity(final Object value) {
        final Long decoded = RpcUtils.decodeHexLong(value);
        return decoded != null ? decoded : 0L;
    }

    private static Object required(final Object value, final String field) {
        if (value == null) {
            throw new NullPointerException(field + " missing from receipt");
        }
        return value;
    }
}
