// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import static sh.jasmine.rpc.internal.RpcUtils.MAPPER;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;

import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response from an Ethereum node.
 *
 * <p>
 * Holds either a result or an error; check {@link #hasError()} first.
 *
 * @param jsonrpc the protocol version
 * @param result  the result, or {@code null} on error or for a null result
 * @param error   the error, or {@code null} on success
 * @param id      the id of the request this answers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        @Nullable String id) {

    public boolean hasError() {
        return error != null;
    }

    /**
     * Returns the result as a string, as for hex quantities and data.
     *
     * @return the result's string form, or {@code null}
     */
    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }

    /**
     * Returns an object result, such as a receipt, as a map.
     *
     * @return the result as a map, or {@code null}
     * @throws IllegalArgumentException if the result is not an object
     */
    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> resultAsMap() {
        if (result == null) {
            return null;
        }
        if (result instanceof Map<?, ?>) {
            return (Map<String, Object>) result;
        }
        return MAPPER.convertValue(result, new TypeReference<Map<String, Object>>() {});
    }

    public <T> @Nullable T resultAs(final Class<T> type) {
        if (result == null) {
            return null;
        }
        return MAPPER.convertValue(result, type);
    }
}
