// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.model;

import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.jasmine.core.tx.LegacyTransaction;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.HexData;
import sh.jasmine.core.types.Wei;

/**
 * An unsigned description of a transaction to send.
 *
 * <p>
 * Only {@code from} is required. {@code gas}, {@code gasPrice} and
 * {@code nonce} may be left empty and are completed just before signing.
 * An absent {@code to} means contract creation, with {@code data} holding
 * the init code. Instances are immutable: the {@code with*} methods return
 * copies.
 *
 * <pre>{@code
 * TransactionIntent intent = TransactionIntent.builder(sender)
 *         .to(recipient)
 *         .value(Wei.fromEther(new BigDecimal("0.5")))
 *         .build();
 * }</pre>
 *
 * @param from     the sender
 * @param to       the recipient, or {@code null} for contract creation
 * @param value    wei transferred, zero when not set
 * @param data     calldata or init code, empty when not set
 * @param gas      gas limit, or {@code null} to estimate
 * @param gasPrice gas price, or {@code null} to look up
 * @param nonce    sender nonce, or {@code null} to query
 */
public record TransactionIntent(
        Address from,
        @Nullable Address to,
        Wei value,
        HexData data,
        @Nullable Long gas,
        @Nullable Wei gasPrice,
        @Nullable Long nonce) {

    public TransactionIntent {
        Objects.requireNonNull(from, "from cannot be null");
        value = value != null ? value : Wei.ZERO;
        data = data != null ? data : HexData.EMPTY;
        if (gas != null && gas <= 0) {
            throw new IllegalArgumentException("gas must be positive");
        }
        if (nonce != null && nonce < 0) {
            throw new IllegalArgumentException("nonce cannot be negative");
        }
    }

    public static Builder builder(final Address from) {
        return new Builder(from);
    }

    public Optional<Address> toOpt() {
        return Optional.ofNullable(to);
    }

    public Optional<Long> gasOpt() {
        return Optional.ofNullable(gas);
    }

    public Optional<Wei> gasPriceOpt() {
        return Optional.ofNullable(gasPrice);
    }

    public Optional<Long> nonceOpt() {
        return Optional.ofNullable(nonce);
    }

    public boolean isContractCreation() {
        return to == null;
    }

    public TransactionIntent withGas(final long gas) {
        return new TransactionIntent(from, to, value, data, gas, gasPrice, nonce);
    }

    public TransactionIntent withGasPrice(final Wei gasPrice) {
        return new TransactionIntent(from, to, value, data, gas, Objects.requireNonNull(gasPrice, "gasPrice"), nonce);
    }

    public TransactionIntent withNonce(final long nonce) {
        return new TransactionIntent(from, to, value, data, gas, gasPrice, nonce);
    }

    /**
     * Converts a fully populated intent into the legacy transaction to sign.
     *
     * @return the legacy transaction
     * @throws IllegalStateException if gas, gas price or nonce is missing
     */
    public LegacyTransaction toLegacyTransaction() {
        if (gas == null) {
            throw new IllegalStateException("gas must be set");
        }
        if (gasPrice == null) {
            throw new IllegalStateException("gasPrice must be set");
        }
        if (nonce == null) {
            throw new IllegalStateException("nonce must be set");
        }
        return new LegacyTransaction(nonce, gasPrice, gas, to, value, data);
    }

    /**
     * Builder for {@link TransactionIntent}.
     */
    public static final class Builder {
        private final Address from;
        private Address to;
        private Wei value;
        private HexData data;
        private Long gas;
        private Wei gasPrice;
        private Long nonce;

        private Builder(final Address from) {
            this.from = Objects.requireNonNull(from, "from cannot be null");
        }

        public Builder to(final Address to) {
            this.to = to;
            return this;
        }

        public Builder value(final Wei value) {
            this.value = value;
            return this;
        }

        public Builder data(final HexData data) {
            this.data = data;
            return this;
        }

        public Builder gas(final long gas) {
            this.gas = gas;
            return this;
        }

        public Builder gasPrice(final Wei gasPrice) {
            this.gasPrice = gasPrice;
            return this;
        }

        public Builder nonce(final long nonce) {
            this.nonce = nonce;
            return this;
        }

        public TransactionIntent build() {
            return new TransactionIntent(from, to, value, data, gas, gasPrice, nonce);
        }
    }
}
