// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings shared by the HTTP and WebSocket providers.
 *
 * @param url            endpoint URL
 * @param connectTimeout connect timeout, default 10 s
 * @param readTimeout    per-request timeout, default 30 s
 * @param headers        extra request headers (HTTP and the WebSocket handshake)
 */
public record RpcConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    public RpcConfig {
        Objects.requireNonNull(url, "url");
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static RpcConfig withDefaults(final String url) {
        return new RpcConfig(url, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT, Map.of());
    }
}
