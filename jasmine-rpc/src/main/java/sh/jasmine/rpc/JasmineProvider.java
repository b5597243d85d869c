// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import sh.jasmine.core.error.RpcException;
import sh.jasmine.core.error.TransportException;
import sh.jasmine.rpc.internal.RpcUtils;

/**
 * Sends JSON-RPC requests to an Ethereum node.
 *
 * <p>
 * Implementations own the transport (HTTP, WebSocket) and must be safe for
 * concurrent use. A returned future completes with the response when the node
 * answered with a result. It completes exceptionally with
 * {@link RpcException} when the node answered with an error object, and with
 * {@link TransportException} when no usable answer arrived.
 *
 * <p>
 * Built-in implementations:
 * <ul>
 * <li>{@link HttpJasmineProvider} for {@code http://} and {@code https://}</li>
 * <li>{@link WebSocketJasmineProvider} for {@code ws://} and {@code wss://}</li>
 * </ul>
 */
public interface JasmineProvider extends AutoCloseable {

    /**
     * Sends a request without blocking.
     *
     * @param method the JSON-RPC method name
     * @param params positional parameters; {@code null} means none
     * @return the pending response
     */
    CompletableFuture<JsonRpcResponse> sendAsync(String method, List<?> params);

    /**
     * Sends a request and waits for the response.
     *
     * @param method the JSON-RPC method name
     * @param params positional parameters
     * @return the response
     * @throws RpcException       if the node returned an error
     * @throws TransportException if the exchange failed
     */
    default JsonRpcResponse send(final String method, final List<?> params) {
        return RpcUtils.await(sendAsync(method, params), "JSON-RPC call " + method);
    }

    static JasmineProvider http(final String url) {
        return HttpJasmineProvider.builder(url).build();
    }

    @Override
    default void close() {
        // nothing to release
    }
}
