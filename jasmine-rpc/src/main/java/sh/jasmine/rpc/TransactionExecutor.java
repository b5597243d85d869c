// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import sh.jasmine.core.DebugLogger;
import sh.jasmine.core.LogFormatter;
import sh.jasmine.core.crypto.TransactionSigner;
import sh.jasmine.core.error.ConfigurationException;
import sh.jasmine.core.error.ConfirmationFailedException;
import sh.jasmine.core.error.EstimationException;
import sh.jasmine.core.error.NonceException;
import sh.jasmine.core.error.PricingException;
import sh.jasmine.core.error.RpcException;
import sh.jasmine.core.error.SigningException;
import sh.jasmine.core.error.SubmissionFailedException;
import sh.jasmine.core.error.SubmissionRejectedException;
import sh.jasmine.core.error.TransportException;
import sh.jasmine.core.error.TxnException;
import sh.jasmine.core.model.SignedTransaction;
import sh.jasmine.core.model.TransactionIntent;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Hash;
import sh.jasmine.rpc.internal.RpcUtils;

/**
 * Drives a transaction from intent to confirmed receipt.
 *
 * <p>
 * {@link #submit(TransactionIntent, TransactionSigner)} runs these stages in
 * order, each one starting when the previous one completed:
 * <ol>
 * <li>checks that the signer's address is the intent's sender</li>
 * <li>estimates the gas limit if the intent has none</li>
 * <li>resolves the gas price with the {@link GasPriceStrategy} if absent</li>
 * <li>fetches the pending transaction count as nonce if absent</li>
 * <li>signs the populated intent for the node's chain id</li>
 * <li>broadcasts the signed transaction</li>
 * <li>polls for the receipt and checks its status</li>
 * </ol>
 * Values already present in the intent are used as given.
 *
 * <p>
 * <strong>Failures:</strong> the returned future fails with exactly one
 * typed exception: {@link ConfigurationException} for a signer/sender or
 * chain id mismatch, {@link EstimationException}, {@link PricingException},
 * {@link NonceException}, {@link SigningException},
 * {@link SubmissionRejectedException} when the node refuses the transaction,
 * {@link SubmissionFailedException} when the broadcast could not complete, and
 * {@link ConfirmationFailedException} when the transaction reverted or no
 * receipt arrived in time. Nothing is retried.
 *
 * <p>
 * <strong>Concurrency:</strong> submissions are independent. The nonce is
 * read from the node on every call, so two concurrent submissions from one
 * sender can receive the same nonce and one of them will be rejected. Callers
 * that send in parallel from one account must sequence the submissions or set
 * nonces themselves. The chain id is the only value cached across calls.
 *
 * <p>
 * Cancelling the returned future before broadcast stops the remaining
 * stages. After broadcast the transaction cannot be recalled; cancelling only
 * detaches the caller.
 */
public final class TransactionExecutor {

    private final ChainClient client;
    private final GasPriceStrategy gasPriceStrategy;
    private final @Nullable Long expectedChainId;
    private final AtomicReference<Long> cachedChainId = new AtomicReference<>();

    private TransactionExecutor(final Builder builder) {
        this.client = builder.client;
        this.gasPriceStrategy = builder.gasPriceStrategy;
        this.expectedChainId = builder.expectedChainId;
    }

    public static Builder builder(final ChainClient client) {
        return new Builder(client);
    }

    public static TransactionExecutor create(final ChainClient client) {
        return builder(client).build();
    }

    public ChainClient client() {
        return client;
    }

    /**
     * Completes, signs, broadcasts and confirms a transaction.
     *
     * @param intent the transaction to send; never modified
     * @param signer the key for {@code intent.from()}
     * @return a future that completes once with the successful receipt or the
     *         failure of the first stage that failed
     */
    public CompletableFuture<TransactionReceipt> submit(final TransactionIntent intent, final TransactionSigner signer) {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(signer, "signer");
        if (!signer.address().equals(intent.from())) {
            return CompletableFuture.failedFuture(new ConfigurationException(
                    "signer address " + signer.address() + " does not match sender " + intent.from()));
        }

        final CompletableFuture<TransactionReceipt> handle = new CompletableFuture<>();
        completeGas(intent)
                .thenCompose(withGas -> active(handle, () -> completeGasPrice(withGas)))
                .thenCompose(withPrice -> active(handle, () -> completeNonce(withPrice)))
                .thenCompose(populated -> active(handle, () -> sign(populated, signer)))
                .thenCompose(signed -> active(handle, () -> broadcast(signed)))
                .thenCompose(this::confirm)
                .whenComplete((receipt, error) -> {
                    if (error == null) {
                        handle.complete(receipt);
                        return;
                    }
                    final Throwable cause = RpcUtils.unwrap(error);
                    if (!(cause instanceof CancellationException)) {
                        DebugLogger.logTx(LogFormatter.formatTxFailure(stageName(cause), cause.getMessage()));
                    }
                    handle.completeExceptionally(cause);
                });
        return handle;
    }

    private CompletableFuture<TransactionIntent> completeGas(final TransactionIntent intent) {
        if (intent.gasOpt().isPresent()) {
            return CompletableFuture.completedFuture(intent);
        }
        return stage(() -> client.estimateGas(intent),
                e -> new EstimationException("gas estimation failed: " + e.getMessage(), e))
                .thenApply(intent::withGas);
    }

    private CompletableFuture<TransactionIntent> completeGasPrice(final TransactionIntent intent) {
        if (intent.gasPriceOpt().isPresent()) {
            return CompletableFuture.completedFuture(intent);
        }
        return stage(() -> gasPriceStrategy.gasPrice(client),
                e -> new PricingException("gas price lookup failed: " + e.getMessage(), e))
                .thenApply(intent::withGasPrice);
    }

    private CompletableFuture<TransactionIntent> completeNonce(final TransactionIntent intent) {
        if (intent.nonceOpt().isPresent()) {
            return CompletableFuture.completedFuture(intent);
        }
        return stage(() -> client.getTransactionCount(intent.from()),
                e -> new NonceException("nonce lookup failed for " + intent.from() + ": " + e.getMessage(), e))
                .thenApply(intent::withNonce);
    }

    private CompletableFuture<SignedTransaction> sign(final TransactionIntent intent, final TransactionSigner signer) {
        return chainId().thenApply(chainId -> {
            final SignedTransaction signed;
            try {
                signed = signer.sign(intent, chainId);
            } catch (RuntimeException e) {
                throw new CompletionException(new SigningException("signing failed: " + e.getMessage(), e));
            }
            DebugLogger.logTx(LogFormatter.formatTxSend(
                    intent.from().value(),
                    intent.toOpt().map(a -> a.value()).orElse(null),
                    intent.nonce(),
                    intent.gas(),
                    intent.value().value()));
            return signed;
        });
    }

    /**
     * Returns the node's chain id, fetched once and then cached. A failure to
     * fetch it is a signing failure; a mismatch with the expected chain id is
     * a configuration error.
     */
    private CompletableFuture<Long> chainId() {
        final Long cached = cachedChainId.get();
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return stage(client::chainId,
                e -> new SigningException("unable to determine chain id: " + e.getMessage(), e))
                .thenApply(actual -> {
                    if (expectedChainId != null && !expectedChainId.equals(actual)) {
                        throw new CompletionException(new ConfigurationException(
                                "chain id mismatch: expected " + expectedChainId + " but node reports " + actual));
                    }
                    cachedChainId.compareAndSet(null, actual);
                    return actual;
                });
    }

    private CompletableFuture<Hash> broadcast(final SignedTransaction signed) {
        return stage(() -> client.sendRawTransaction(signed), e -> {
            if (e instanceof RpcException rpc) {
                return new SubmissionRejectedException(rpc.rawMessage(), signed.hash(), rpc);
            }
            if (e instanceof TxnException txn) {
                return txn;
            }
            // the node may have received it; keep the hash so the caller can look it up
            return new SubmissionFailedException(
                    "broadcast of " + signed.hash() + " failed: " + e.getMessage(), signed.hash(), e);
        });
    }

    private CompletableFuture<TransactionReceipt> confirm(final Hash hash) {
        return stage(() -> client.waitForReceipt(hash), e -> {
            if (e instanceof ConfirmationFailedException cfe) {
                return cfe;
            }
            return new ConfirmationFailedException(
                    "confirmation of " + hash + " failed: " + e.getMessage(), hash, null, e);
        }).thenApply(receipt -> {
            if (!receipt.status()) {
                throw new CompletionException(ConfirmationFailedException.reverted(receipt));
            }
            return receipt;
        });
    }

    private static <T> CompletableFuture<T> active(
            final CompletableFuture<?> handle, final Supplier<CompletableFuture<T>> next) {
        if (handle.isDone()) {
            return CompletableFuture.failedFuture(new CancellationException("transaction handle already completed"));
        }
        return next.get();
    }

    private static <T> CompletableFuture<T> stage(
            final Supplier<CompletableFuture<T>> call, final Function<Throwable, RuntimeException> onFailure) {
        final CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(onFailure.apply(e));
        }
        return future.handle((value, error) -> {
            if (error == null) {
                return value;
            }
            throw new CompletionException(onFailure.apply(RpcUtils.unwrap(error)));
        });
    }

    private static String stageName(final Throwable failure) {
        if (failure instanceof TxnException txn) {
            return txn.stage().name();
        }
        if (failure instanceof ConfigurationException) {
            return "CONFIGURATION";
        }
        if (failure instanceof TransportException) {
            return "TRANSPORT";
        }
        return failure.getClass().getSimpleName();
    }

    public static final class Builder {
        private final ChainClient client;
        private GasPriceStrategy gasPriceStrategy = GasPriceStrategy.rpc();
        private Long expectedChainId;

        private Builder(final ChainClient client) {
            this.client = Objects.requireNonNull(client, "client");
        }

        public Builder gasPriceStrategy(final GasPriceStrategy gasPriceStrategy) {
            this.gasPriceStrategy = Objects.requireNonNull(gasPriceStrategy, "gasPriceStrategy");
            return this;
        }

        /**
         * Fails submissions with {@link ConfigurationException} when the node
         * reports a different chain id. {@code null} accepts any chain.
         */
        public Builder expectedChainId(final Long expectedChainId) {
            this.expectedChainId = expectedChainId;
            return this;
        }

        public TransactionExecutor build() {
            return new TransactionExecutor(this);
        }
    }
}
