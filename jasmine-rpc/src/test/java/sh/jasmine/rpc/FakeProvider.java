// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import sh.jasmine.core.crypto.Keccak256;
import sh.jasmine.core.error.TransportException;
import sh.jasmine.core.types.Hash;
import sh.jasmine.primitives.Hex;

/**
 * Provider scripted per JSON-RPC method. Unscripted methods fail with a
 * {@link TransportException}.
 */
final class FakeProvider implements JasmineProvider {

    private final Map<String, Function<List<?>, Object>> handlers = new ConcurrentHashMap<>();
    private final List<String> methods = new CopyOnWriteArrayList<>();
    private final Map<String, List<?>> lastParams = new ConcurrentHashMap<>();
    private volatile boolean closed;

    FakeProvider respond(final String method, final Object result) {
        handlers.put(method, params -> result);
        return this;
    }

    FakeProvider respondWith(final String method, final Function<List<?>, Object> handler) {
        handlers.put(method, handler);
        return this;
    }

    FakeProvider fail(final String method, final RuntimeException error) {
        handlers.put(method, params -> {
            throw error;
        });
        return this;
    }

    /** Scripts a local dev chain that accepts and immediately mines every transaction. */
    FakeProvider minesEverything(final String chainIdHex, final String status) {
        return respond("eth_chainId", chainIdHex)
                .respond("eth_estimateGas", "0x5208")
                .respond("eth_gasPrice", "0x3b9aca00")
                .respond("eth_getTransactionCount", "0x7")
                .respondWith("eth_sendRawTransaction", params -> hashOfRaw((String) params.get(0)))
                .respondWith("eth_getTransactionReceipt", params -> receipt((String) params.get(0), status));
    }

    @Override
    public CompletableFuture<JsonRpcResponse> sendAsync(final String method, final List<?> params) {
        methods.add(method);
        lastParams.put(method, params == null ? List.of() : params);
        final Function<List<?>, Object> handler = handlers.get(method);
        if (handler == null) {
            return CompletableFuture.failedFuture(new TransportException("No response scripted for " + method, null));
        }
        try {
            return CompletableFuture.completedFuture(new JsonRpcResponse("2.0", handler.apply(params), null, "1"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }

    List<String> methods() {
        return new ArrayList<>(methods);
    }

    long count(final String method) {
        return methods.stream().filter(method::equals).count();
    }

    List<?> lastParams(final String method) {
        return lastParams.get(method);
    }

    static String hashOfRaw(final String rawHex) {
        return Hash.fromBytes(Keccak256.hash(Hex.decode(rawHex))).value();
    }

    static Map<String, Object> receipt(final String txHash, final String status) {
        final Map<String, Object> receipt = new LinkedHashMap<>();
        receipt.put("transactionHash", txHash);
        receipt.put("blockHash", "0x" + "b".repeat(64));
        receipt.put("blockNumber", "0x10");
        receipt.put("from", "0x" + "1".repeat(40));
        receipt.put("to", "0x" + "2".repeat(40));
        receipt.put("contractAddress", null);
        receipt.put("status", status);
        receipt.put("gasUsed", "0x5208");
        receipt.put("cumulativeGasUsed", "0xa410");
        receipt.put("effectiveGasPrice", "0x3b9aca00");
        receipt.put("logs", List.of());
        return receipt;
    }
}
