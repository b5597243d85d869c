// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.error;

/**
 * Thrown when a JSON-RPC exchange with the node fails before a usable result
 * is obtained: the connection failed, the HTTP status was not 2xx, or the
 * response could not be parsed.
 *
 * <p>
 * Conventional codes used for locally detected failures:
 * <ul>
 * <li><strong>-32700</strong>: response body is not valid JSON</li>
 * <li><strong>-32001</strong>: non-2xx HTTP status</li>
 * <li><strong>-32000</strong>: connection or I/O failure</li>
 * </ul>
 * The node's own error objects are reported as {@link RpcException}.
 */
public sealed class TransportException extends JasmineException permits RpcException {

    private final int code;
    private final String rawMessage;
    private final String data;
    private final Long requestId;

    public TransportException(
            final int code,
            final String message,
            final String data,
            final Long requestId,
            final Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.rawMessage = message;
        this.data = data;
        this.requestId = requestId;
    }

    public TransportException(final String message, final Throwable cause) {
        this(-32000, message, null, null, cause);
    }

    public int code() {
        return code;
    }

    /**
     * Returns the message without the request id prefix, as the node or
     * transport reported it.
     *
     * @return the unprefixed message
     */
    public String rawMessage() {
        return rawMessage;
    }

    public String data() {
        return data;
    }

    public Long requestId() {
        return requestId;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + ", data=" + data
                + ", requestId=" + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[requestId=" + requestId + "] " + message;
    }
}
