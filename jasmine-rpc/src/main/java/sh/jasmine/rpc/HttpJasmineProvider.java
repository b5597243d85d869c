// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;

import sh.jasmine.core.DebugLogger;
import sh.jasmine.core.LogFormatter;
import sh.jasmine.core.error.ConfigurationException;
import sh.jasmine.core.error.RpcException;
import sh.jasmine.core.error.TransportException;
import sh.jasmine.rpc.internal.RpcUtils;

/**
 * JSON-RPC over HTTP(S) with {@link HttpClient#sendAsync}.
 *
 * <p>
 * Failure mapping: connection and I/O errors use code -32000, a non-2xx
 * status uses -32001 with the body as data, and an unparseable body uses
 * -32700. An error object from the node becomes an {@link RpcException}
 * with the node's code and message.
 */
public final class HttpJasmineProvider implements JasmineProvider {

    private final RpcConfig config;
    private final URI uri;
    private final HttpClient httpClient;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpJasmineProvider(final RpcConfig config) {
        this.config = config;
        try {
            this.uri = URI.create(config.url());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid HTTP endpoint: " + config.url(), e);
        }
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public RpcConfig config() {
        return config;
    }

    @Override
    public CompletableFuture<JsonRpcResponse> sendAsync(final String method, final List<?> params) {
        final List<?> safeParams = params == null ? List.of() : params;
        final long requestId = ids.getAndIncrement();
        final String payload;
        try {
            payload = RpcUtils.MAPPER.writeValueAsString(new JsonRpcRequest("2.0", method, safeParams, requestId));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new TransportException(
                    -32700, "Unable to serialize JSON-RPC request for " + method, null, requestId, e));
        }

        final long start = System.nanoTime();
        return httpClient.sendAsync(buildRequest(payload), HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    final long durationMicros = (System.nanoTime() - start) / 1_000L;
                    if (error != null) {
                        DebugLogger.logRpc(LogFormatter.formatRpcError(
                                method, -32000, RpcUtils.unwrap(error).toString(), durationMicros));
                        throw new CompletionException(new TransportException(
                                -32000, "Network error during JSON-RPC call " + method, null, requestId,
                                RpcUtils.unwrap(error)));
                    }
                    return toResponse(method, response, requestId, durationMicros);
                });
    }

    private JsonRpcResponse toResponse(
            final String method,
            final HttpResponse<String> response,
            final long requestId,
            final long durationMicros) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(
                    method, response.statusCode(), "HTTP " + response.statusCode(), durationMicros));
            throw new CompletionException(new TransportException(
                    -32001,
                    "HTTP error for method " + method + ": " + response.statusCode(),
                    response.body(),
                    requestId,
                    null));
        }

        final JsonRpcResponse rpcResponse;
        try {
            rpcResponse = RpcUtils.MAPPER.readValue(response.body(), JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new CompletionException(new TransportException(
                    -32700, "Unable to parse JSON-RPC response for method " + method, response.body(), requestId, e));
        }
        if (rpcResponse.hasError()) {
            final JsonRpcError err = rpcResponse.error();
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, err.code(), err.message(), durationMicros));
            throw new CompletionException(
                    new RpcException(err.code(), err.message(), RpcUtils.extractErrorData(err.data()), requestId));
        }

        DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
        return rpcResponse;
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = RpcConfig.DEFAULT_CONNECT_TIMEOUT;
        private Duration readTimeout = RpcConfig.DEFAULT_READ_TIMEOUT;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public Builder headers(final Map<String, String> values) {
            if (values != null) {
                headers.putAll(values);
            }
            return this;
        }

        public HttpJasmineProvider build() {
            return new HttpJasmineProvider(new RpcConfig(url, connectTimeout, readTimeout, headers));
        }
    }
}
