// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

import java.util.Locale;

/**
 * Thrown when the node answers a JSON-RPC request with an error object.
 *
 * <p>
 * <strong>Common codes:</strong>
 * <ul>
 * <li><strong>-32600</strong>: invalid request</li>
 * <li><strong>-32601</strong>: method not found</li>
 * <li><strong>-32602</strong>: invalid params</li>
 * <li><strong>-32000</strong>: server error such as "insufficient funds" or
 * "nonce too low"</li>
 * <li><strong>3</strong>: execution reverted, with revert data in {@link #data()}</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends TransportException {

    public RpcException(
            final int code,
            final String message,
            final String data,
            final Long requestId,
            final Throwable cause) {
        super(code, message, data, requestId, cause);
    }

    public RpcException(final int code, final String message, final String data, final Long requestId) {
        this(code, message, data, requestId, null);
    }

    /**
     * Returns {@code true} if the node reported an EVM revert.
     *
     * @return whether the message or code indicates a revert
     */
    public boolean isExecutionReverted() {
        final String msg = getMessage();
        return code() == 3 || (msg != null && msg.toLowerCase(Locale.ROOT).contains("execution reverted"));
    }
}
