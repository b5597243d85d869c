// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.jasmine.core.DebugLogger;
import sh.jasmine.core.LogFormatter;
import sh.jasmine.core.error.ConfirmationFailedException;
import sh.jasmine.core.error.TransportException;
import sh.jasmine.core.model.SignedTransaction;
import sh.jasmine.core.model.TransactionIntent;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;
import sh.jasmine.core.types.HexData;
import sh.jasmine.core.types.Wei;
import sh.jasmine.rpc.internal.ReceiptParser;
import sh.jasmine.rpc.internal.RpcUtils;

/**
 * {@link ChainClient} over a {@link JasmineProvider}.
 *
 * <p>
 * Receipt polling runs on a {@link ScheduledExecutorService}: each poll is an
 * asynchronous request, and the next poll is scheduled only after the
 * previous one answered, so no thread waits between polls. Malformed results
 * fail with a {@link TransportException} using code -32700.
 *
 * <p>
 * Closing the client closes the provider and, when the client created it,
 * the polling scheduler.
 */
public final class DefaultChainClient implements ChainClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultChainClient.class);

    /** Default interval between receipt polls. */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    private final JasmineProvider provider;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Duration pollInterval;
    private final @Nullable Duration confirmationTimeout;

    private DefaultChainClient(final Builder builder) {
        this.provider = builder.provider;
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler ? JasmineExecutors.newReceiptPoller() : builder.scheduler;
        this.pollInterval = builder.pollInterval;
        this.confirmationTimeout = builder.confirmationTimeout;
    }

    public static Builder builder(final JasmineProvider provider) {
        return new Builder(provider);
    }

    public static DefaultChainClient create(final JasmineProvider provider) {
        return builder(provider).build();
    }

    public JasmineProvider provider() {
        return provider;
    }

    @Override
    public CompletableFuture<Long> estimateGas(final TransactionIntent intent) {
        final Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("from", intent.from().value());
        intent.toOpt().ifPresent(to -> tx.put("to", to.value()));
        tx.put("value", RpcUtils.toQuantityHex(intent.value().value()));
        tx.put("data", intent.data().value());
        DebugLogger.logTx(LogFormatter.formatEstimateGas(
                intent.from().value(), intent.toOpt().map(Address::value).orElse(null), intent.data().value()));
        return request("eth_estimateGas", List.of(tx), response -> quantity("eth_estimateGas", response));
    }

    @Override
    public CompletableFuture<Wei> suggestGasPrice() {
        return request("eth_gasPrice", List.of(),
                response -> Wei.of(RpcUtils.decodeHexBigInteger(requireString("eth_gasPrice", response))));
    }

    @Override
    public CompletableFuture<Long> getTransactionCount(final Address address) {
        return request("eth_getTransactionCount", List.of(address.value(), "pending"),
                response -> quantity("eth_getTransactionCount", response));
    }

    @Override
    public CompletableFuture<Hash> sendRawTransaction(final SignedTransaction transaction) {
        final long start = System.nanoTime();
        return request("eth_sendRawTransaction", List.of(transaction.raw().value()), response -> {
            final Hash hash = new Hash(requireString("eth_sendRawTransaction", response));
            if (!hash.equals(transaction.hash())) {
                log.warn("Node returned hash {} for locally computed {}", hash, transaction.hash());
            }
            DebugLogger.logTx(LogFormatter.formatTxHash(hash.value(), (System.nanoTime() - start) / 1_000L));
            return hash;
        });
    }

    @Override
    public CompletableFuture<Optional<TransactionReceipt>> getTransactionReceipt(final Hash hash) {
        return request("eth_getTransactionReceipt", List.of(hash.value()), response -> {
            final Map<String, Object> map = response.resultAsMap();
            if (map == null) {
                return Optional.<TransactionReceipt>empty();
            }
            try {
                return Optional.of(ReceiptParser.parseReceipt(map));
            } catch (RuntimeException e) {
                throw new TransportException(-32700, "Malformed receipt for " + hash, String.valueOf(map), null, e);
            }
        });
    }

    @Override
    public CompletableFuture<TransactionReceipt> waitForReceipt(final Hash hash) {
        final Long timeoutMillis = confirmationTimeout == null ? null : confirmationTimeout.toMillis();
        DebugLogger.logTx(LogFormatter.formatTxWait(hash.value(), pollInterval.toMillis(), timeoutMillis));
        final long deadline = timeoutMillis == null ? Long.MAX_VALUE : System.nanoTime() + confirmationTimeout.toNanos();
        final CompletableFuture<TransactionReceipt> result = new CompletableFuture<>();
        poll(hash, result, deadline, timeoutMillis);
        return result;
    }

    private void poll(
            final Hash hash,
            final CompletableFuture<TransactionReceipt> result,
            final long deadline,
            final Long timeoutMillis) {
        if (result.isDone()) {
            return;
        }
        getTransactionReceipt(hash).whenComplete((receipt, error) -> {
            if (error != null) {
                result.completeExceptionally(RpcUtils.unwrap(error));
                return;
            }
            if (receipt.isPresent()) {
                final TransactionReceipt r = receipt.get();
                DebugLogger.logTx(LogFormatter.formatTxReceipt(r.transactionHash().value(), r.blockNumber(), r.status()));
                result.complete(r);
                return;
            }
            if (timeoutMillis != null && System.nanoTime() - deadline >= 0) {
                result.completeExceptionally(ConfirmationFailedException.timedOut(hash, timeoutMillis));
                return;
            }
            try {
                scheduler.schedule(
                        () -> poll(hash, result, deadline, timeoutMillis),
                        pollInterval.toMillis(),
                        TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                result.completeExceptionally(new TransportException("Receipt polling stopped: client closed", e));
            }
        });
    }

    @Override
    public CompletableFuture<HexData> call(final Address to, final HexData data) {
        final Map<String, Object> callObject = new LinkedHashMap<>();
        callObject.put("to", to.value());
        callObject.put("data", data.value());
        return request("eth_call", List.of(callObject, "latest"),
                response -> new HexData(requireString("eth_call", response)));
    }

    @Override
    public CompletableFuture<Wei> getBalance(final Address address) {
        return request("eth_getBalance", List.of(address.value(), "latest"),
                response -> Wei.of(RpcUtils.decodeHexBigInteger(requireString("eth_getBalance", response))));
    }

    @Override
    public CompletableFuture<Long> chainId() {
        return request("eth_chainId", List.of(), response -> quantity("eth_chainId", response));
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        provider.close();
    }

    private <T> CompletableFuture<T> request(
            final String method, final List<?> params, final Function<JsonRpcResponse, T> decoder) {
        final CompletableFuture<JsonRpcResponse> response;
        try {
            response = provider.sendAsync(method, params);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return response.thenApply(r -> {
            try {
                return decoder.apply(r);
            } catch (TransportException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new CompletionException(new TransportException(
                        -32700, "Malformed result for " + method + ": " + r.result(), null, null, e));
            }
        });
    }

    private static String requireString(final String method, final JsonRpcResponse response) {
        final String value = response.resultAsString();
        if (value == null) {
            throw new TransportException(-32700, "Missing result for " + method, null, null, null);
        }
        return value;
    }

    private static long quantity(final String method, final JsonRpcResponse response) {
        return RpcUtils.decodeHexLong(requireString(method, response));
    }

    public static final class Builder {
        private final JasmineProvider provider;
        private ScheduledExecutorService scheduler;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration confirmationTimeout;

        private Builder(final JasmineProvider provider) {
            this.provider = Objects.requireNonNull(provider, "provider");
        }

        /**
         * Uses an external scheduler for receipt polling. The client does not
         * shut it down.
         */
        public Builder scheduler(final ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder pollInterval(final Duration pollInterval) {
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * Sets how long {@link DefaultChainClient#waitForReceipt(Hash)} polls before failing.
         * {@code null} (the default) waits indefinitely.
         */
        public Builder confirmationTimeout(final Duration confirmationTimeout) {
            if (confirmationTimeout != null && (confirmationTimeout.isNegative() || confirmationTimeout.isZero())) {
                throw new IllegalArgumentException("confirmationTimeout must be positive");
            }
            this.confirmationTimeout = confirmationTimeout;
            return this;
        }

        public DefaultChainClient build() {
            return new DefaultChainClient(this);
        }
    }
}
