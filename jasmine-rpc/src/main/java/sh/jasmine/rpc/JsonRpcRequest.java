// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.util.List;

/**
 * A JSON-RPC 2.0 request as written on the wire.
 *
 * @param jsonrpc protocol version, always {@code "2.0"}
 * @param method  method name, e.g. {@code eth_chainId}
 * @param params  positional parameters
 * @param id      request id
 */
public record JsonRpcRequest(String jsonrpc, String method, List<?> params, long id) {
}
