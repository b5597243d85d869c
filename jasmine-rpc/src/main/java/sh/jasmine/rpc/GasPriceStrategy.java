// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.rpc;

import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import sh.jasmine.core.types.Wei;

/**
 * Chooses the gas price for intents that do not carry one.
 *
 * <p>
 * The strategy is handed to the {@link TransactionExecutor} when it is built;
 * there is no process-wide default to mutate.
 */
@FunctionalInterface
public interface GasPriceStrategy {

    /**
     * Resolves the gas price to use.
     *
     * @param client the chain client of the executor
     * @return the price
     */
    CompletableFuture<Wei> gasPrice(ChainClient client);

    /** The node's suggested price from {@code eth_gasPrice}. */
    static GasPriceStrategy rpc() {
        return ChainClient::suggestGasPrice;
    }

    /** A constant price; never queries the node. */
    static GasPriceStrategy fixed(final Wei price) {
        Objects.requireNonNull(price, "price");
        return client -> CompletableFuture.completedFuture(price);
    }

    /**
     * The suggested price multiplied by {@code numerator / denominator},
     * rounded down. {@code scaled(120, 100)} bids 20% above the suggestion.
     *
     * @throws IllegalArgumentException if either factor is not positive
     */
    static GasPriceStrategy scaled(final long numerator, final long denominator) {
        if (numerator <= 0 || denominator <= 0) {
            throw new IllegalArgumentException("numerator and denominator must be positive");
        }
        final BigInteger num = BigInteger.valueOf(numerator);
        final BigInteger den = BigInteger.valueOf(denominator);
        return client -> client.suggestGasPrice()
                .thenApply(price -> Wei.of(price.value().multiply(num).divide(den)));
    }
}
