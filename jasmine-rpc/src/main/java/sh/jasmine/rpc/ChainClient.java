// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import sh.jasmine.core.error.ConfirmationFailedException;
import sh.jasmine.core.model.SignedTransaction;
import sh.jasmine.core.model.TransactionIntent;
import sh.jasmine.core.model.TransactionReceipt;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Hash;
import sh.jasmine.core.types.HexData;
import sh.jasmine.core.types.Wei;

/**
 * The chain primitives used by the transaction executor and the contract
 * bindings.
 *
 * <p>
 * Every method is non-blocking. Futures fail with the
 * {@link sh.jasmine.core.error.TransportException} or
 * {@link sh.jasmine.core.error.RpcException} raised by the provider; the
 * executor maps them to lifecycle stages.
 *
 * @see DefaultChainClient
 */
public interface ChainClient extends AutoCloseable {

    /**
     * Estimates the gas limit for an intent ({@code eth_estimateGas}).
     *
     * @param intent the intent; gas, gas price and nonce are not sent
     * @return the estimate
     */
    CompletableFuture<Long> estimateGas(TransactionIntent intent);

    /** Returns the node's suggested gas price ({@code eth_gasPrice}). */
    CompletableFuture<Wei> suggestGasPrice();

    /**
     * Returns the next nonce for an address, counting pending transactions.
     *
     * @param address the sender
     * @return the transaction count at the {@code pending} tag
     */
    CompletableFuture<Long> getTransactionCount(Address address);

    /**
     * Broadcasts a signed transaction. Completes once the node accepts it,
     * without waiting for mining.
     *
     * @param transaction the signed envelope
     * @return the hash reported by the node
     */
    CompletableFuture<Hash> sendRawTransaction(SignedTransaction transaction);

    /**
     * Polls for the receipt of a transaction until one is available.
     *
     * <p>
     * The receipt is returned whatever its status. If a confirmation timeout
     * is configured and elapses first, the future fails with
     * {@link ConfirmationFailedException}.
     *
     * @param hash the transaction hash
     * @return the receipt
     */
    CompletableFuture<TransactionReceipt> waitForReceipt(Hash hash);

    /**
     * Fetches a receipt once.
     *
     * @param hash the transaction hash
     * @return the receipt, or empty while the transaction is not mined
     */
    CompletableFuture<Optional<TransactionReceipt>> getTransactionReceipt(Hash hash);

    /**
     * Executes a read-only call at the latest block ({@code eth_call}).
     *
     * @param to   the contract
     * @param data the ABI-encoded call
     * @return the returned bytes
     */
    CompletableFuture<HexData> call(Address to, HexData data);

    /** Returns the balance of an address at the latest block. */
    CompletableFuture<Wei> getBalance(Address address);

    /** Returns the chain id reported by the node ({@code eth_chainId}). */
    CompletableFuture<Long> chainId();

    @Override
    default void close() {
        // nothing to release
    }
}
