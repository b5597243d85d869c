// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ChannelPromise;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.EventExecutor;

import sh.jasmine.core.DebugLogger;
import sh.jasmine.core.LogFormatter;
import sh.jasmine.core.error.ConfigurationException;
import sh.jasmine.core.error.RpcException;
import sh.jasmine.core.error.TransportException;
import sh.jasmine.rpc.internal.RpcUtils;

/**
 * JSON-RPC over a single WebSocket connection, built on Netty.
 *
 * <p>
 * Requests are written as text frames and matched to responses by id. Each
 * request is failed with a {@link TransportException} if no response arrives
 * within {@link RpcConfig#readTimeout()}. When the connection drops, all
 * pending requests fail and later requests fail immediately; the provider
 * does not reconnect.
 *
 * <p>
 * The connection and handshake happen in {@link #connect(RpcConfig)}, which
 * blocks until the handshake completes or {@link RpcConfig#connectTimeout()}
 * elapses.
 */
public final class WebSocketJasmineProvider implements JasmineProvider {

    private static final Logger log = LoggerFactory.getLogger(WebSocketJasmineProvider.class);

    private static final int MAX_FRAME_AGGREGATE = 10 * 1024 * 1024;

    private final RpcConfig config;
    private final URI uri;
    private final EventLoopGroup group;
    private final ConcurrentHashMap<Long, CompletableFuture<JsonRpcResponse>> pending = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong(1L);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Channel channel;

    private WebSocketJasmineProvider(final RpcConfig config, final URI uri) {
        this.config = config;
        this.uri = uri;
        this.group = new NioEventLoopGroup(1, r -> {
            final Thread t = new Thread(r, "jasmine-netty-io");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Opens a connection and completes the WebSocket handshake.
     *
     * @param config connection settings; the URL must use {@code ws} or {@code wss}
     * @return a connected provider
     * @throws ConfigurationException if the URL is not a WebSocket URL
     * @throws TransportException     if the connection or handshake fails
     */
    public static WebSocketJasmineProvider connect(final RpcConfig config) {
        final URI uri;
        try {
            uri = URI.create(config.url());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid WebSocket endpoint: " + config.url(), e);
        }
        final String scheme = uri.getScheme();
        if (uri.getHost() == null || (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme))) {
            throw new ConfigurationException("invalid WebSocket endpoint: " + config.url());
        }
        final WebSocketJasmineProvider provider = new WebSocketJasmineProvider(config, uri);
        try {
            provider.open();
        } catch (RuntimeException e) {
            provider.close();
            throw e;
        }
        return provider;
    }

    public static WebSocketJasmineProvider connect(final String url) {
        return connect(RpcConfig.withDefaults(url));
    }

    private void open() {
        final boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        final SslContext sslContext;
        try {
            sslContext = secure ? SslContextBuilder.forClient().build() : null;
        } catch (Exception e) {
            throw new TransportException("Unable to initialise TLS for " + uri, e);
        }
        final int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);

        final HttpHeaders headers = new DefaultHttpHeaders();
        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            headers.add(entry.getKey(), entry.getValue());
        }
        final ClientHandler handler = new ClientHandler(WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, false, headers, MAX_FRAME_AGGREGATE));

        final Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), uri.getHost(), port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_FRAME_AGGREGATE));
                        p.addLast(handler);
                    }
                });

        try {
            this.channel = b.connect(uri.getHost(), port).sync().channel();
            if (!handler.handshakeFuture().await(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TransportException("WebSocket handshake with " + uri + " timed out", null);
            }
            if (!handler.handshakeFuture().isSuccess()) {
                throw new TransportException(
                        "WebSocket handshake with " + uri + " failed", handler.handshakeFuture().cause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while connecting to " + uri, e);
        } catch (TransportException e) {
            throw e;
        } catch (Exception e) {
            throw new TransportException("Unable to connect to " + uri, e);
        }
        log.debug("Connected to {}", uri);
    }

    @Override
    public CompletableFuture<JsonRpcResponse> sendAsync(final String method, final List<?> params) {
        final long id = ids.getAndIncrement();
        final Channel ch = this.channel;
        if (closed.get() || ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(
                    new TransportException(-32000, "WebSocket connection is closed", null, id, null));
        }

        final String payload;
        try {
            payload = RpcUtils.MAPPER.writeValueAsString(
                    new JsonRpcRequest("2.0", method, params == null ? List.of() : params, id));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new TransportException(
                    -32700, "Unable to serialize JSON-RPC request for " + method, null, id, e));
        }

        final long start = System.nanoTime();
        final CompletableFuture<JsonRpcResponse> raw = new CompletableFuture<>();
        if (!track(id, raw, method, ch.eventLoop())) {
            return raw;
        }

        ch.writeAndFlush(new TextWebSocketFrame(payload)).addListener((ChannelFuture f) -> {
            if (!f.isSuccess() && pending.remove(id, raw)) {
                raw.completeExceptionally(
                        new TransportException(-32000, "Failed to write request " + method, null, id, f.cause()));
            }
        });

        return raw.thenApply(response -> {
            final long durationMicros = (System.nanoTime() - start) / 1_000L;
            if (response.hasError()) {
                final JsonRpcError err = response.error();
                DebugLogger.logRpc(LogFormatter.formatRpcError(method, err.code(), err.message(), durationMicros));
                throw new RpcException(err.code(), err.message(), RpcUtils.extractErrorData(err.data()), id);
            }
            DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
            return response;
        });
    }

    /**
     * Registers {@code raw} as pending and arms its read timeout on {@code loop}. Returns false, with {@code raw}
     * already failed and nothing left pending, when the loop no longer accepts tasks.
     */
    boolean track(final long id, final CompletableFuture<JsonRpcResponse> raw, final String method,
            final EventExecutor loop) {
        pending.put(id, raw);
        final long timeoutMillis = config.readTimeout().toMillis();
        try {
            loop.schedule(() -> {
                if (pending.remove(id, raw)) {
                    raw.completeExceptionally(new TransportException(
                            -32000, "Request timed out after " + timeoutMillis + "ms (method: " + method + ")",
                            null, id, null));
                }
            }, timeoutMillis, TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            // event loop already shutting down
            pending.remove(id, raw);
            raw.completeExceptionally(new TransportException(-32000, "WebSocket connection is closed", null, id, e));
            return false;
        }
    }

    /** Number of requests still waiting for a response. */
    int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        failAllPending(new TransportException("WebSocket provider is shutting down", null));
        final Channel ch = this.channel;
        if (ch != null) {
            try {
                ch.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while closing channel", e);
            } catch (Exception e) {
                log.warn("Error closing channel", e);
            }
        }
        try {
            group.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down event loop", e);
        }
    }

    private void failAllPending(final TransportException e) {
        for (Long id : pending.keySet()) {
            final CompletableFuture<JsonRpcResponse> f = pending.remove(id);
            if (f != null) {
                f.completeExceptionally(e);
            }
        }
    }

    private final class ClientHandler extends SimpleChannelInboundHandler<Object> {
        private final WebSocketClientHandshaker handshaker;
        private ChannelPromise handshakeFuture;

        ClientHandler(final WebSocketClientHandshaker handshaker) {
            this.handshaker = handshaker;
        }

        ChannelFuture handshakeFuture() {
            return handshakeFuture;
        }

        @Override
        public void handlerAdded(final ChannelHandlerContext ctx) {
            handshakeFuture = ctx.newPromise();
        }

        @Override
        public void channelActive(final ChannelHandlerContext ctx) {
            handshaker.handshake(ctx.channel());
        }

        @Override
        public void channelInactive(final ChannelHandlerContext ctx) {
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(new WebSocketHandshakeException("connection closed during handshake"));
            }
            if (!closed.get()) {
                log.warn("WebSocket connection to {} lost", uri);
            }
            failAllPending(new TransportException("WebSocket connection lost", null));
        }

        @Override
        protected void channelRead0(final ChannelHandlerContext ctx, final Object msg) throws Exception {
            final Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                try {
                    handshaker.finishHandshake(ch, (FullHttpResponse) msg);
                    handshakeFuture.setSuccess();
                } catch (WebSocketHandshakeException e) {
                    handshakeFuture.setFailure(e);
                }
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                throw new IllegalStateException("Unexpected FullHttpResponse (status=" + response.status() + ")");
            }

            if (msg instanceof WebSocketFrame frame) {
                if (frame instanceof TextWebSocketFrame textFrame) {
                    final String text = textFrame.text();
                    try {
                        processResponseNode(RpcUtils.MAPPER.readTree(text));
                    } catch (JsonProcessingException e) {
                        log.warn("Ignoring unparseable WebSocket frame: {}", e.getOriginalMessage());
                    }
                } else if (frame instanceof CloseWebSocketFrame) {
                    ch.close();
                }
            }
        }

        private void processResponseNode(final JsonNode node) {
            final JsonNode idNode = node.get("id");
            if (idNode == null || idNode.isNull()) {
                return;
            }
            final long id;
            if (idNode.isNumber()) {
                id = idNode.asLong();
            } else {
                try {
                    id = Long.parseLong(idNode.asText());
                } catch (NumberFormatException e) {
                    log.warn("Could not parse response id '{}'", idNode.asText());
                    return;
                }
            }
            final CompletableFuture<JsonRpcResponse> future = pending.remove(id);
            if (future == null) {
                return;
            }
            final JsonRpcResponse response;
            try {
                response = decodeResponse(node, id);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                future.completeExceptionally(new TransportException(
                        -32700, "Malformed JSON-RPC response: " + e.getMessage(), null, id, e));
                return;
            }
            future.complete(response);
        }

        private JsonRpcResponse decodeResponse(final JsonNode node, final long id) throws JsonProcessingException {
            final JsonNode errorNode = node.get("error");
            JsonRpcError error = null;
            if (errorNode != null && !errorNode.isNull()) {
                error = RpcUtils.MAPPER.treeToValue(errorNode, JsonRpcError.class);
            }
            Object result = null;
            if (node.has("result")) {
                result = RpcUtils.MAPPER.treeToValue(node.get("result"), Object.class);
            }
            return new JsonRpcResponse("2.0", result, error, String.valueOf(id));
        }

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            log.error("WebSocket channel error", cause);
            if (!handshakeFuture.isDone()) {
                handshakeFuture.setFailure(cause);
            }
            failAllPending(new TransportException("WebSocket channel error", cause));
            ctx.close();
        }
    }
}
