// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.jasmine.core.crypto.Signature;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.HexData;
import sh.jasmine.core.types.Wei;
import sh.jasmine.primitives.rlp.Rlp;
import sh.jasmine.primitives.rlp.RlpItem;
import sh.jasmine.primitives.rlp.RlpString;

/**
 * Pre-EIP-2718 transaction with EIP-155 replay protection.
 *
 * <p>
 * The signing payload is {@code rlp([nonce, gasPrice, gas, to, value, data, chainId, 0, 0])};
 * the broadcast envelope replaces the last three items with {@code v, r, s}.
 *
 * @param nonce    sender nonce
 * @param gasPrice price per unit of gas
 * @param gasLimit gas limit, positive
 * @param to       recipient, or {@code null} for contract creation
 * @param value    amount transferred
 * @param data     calldata or init code
 */
public record LegacyTransaction(
        long nonce,
        Wei gasPrice,
        long gasLimit,
        Address to,
        Wei value,
        HexData data) {

    public LegacyTransaction {
        if (nonce < 0) {
            throw new IllegalArgumentException("Nonce cannot be negative");
        }
        Objects.requireNonNull(gasPrice, "gasPrice cannot be null");
        if (gasLimit <= 0) {
            throw new IllegalArgumentException("gasLimit must be positive");
        }
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
    }

    public byte[] encodeForSigning(final long chainId) {
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive");
        }
        final List<RlpItem> items = payload();
        items.add(RlpString.of(chainId));
        items.add(RlpString.of(0L));
        items.add(RlpString.of(0L));
        return Rlp.encodeList(items);
    }

    public byte[] encodeAsEnvelope(final Signature signature) {
        Objects.requireNonNull(signature, "signature is required");
        if (signature.v() < 35) {
            throw new IllegalArgumentException(
                    "Legacy transaction signature v must be EIP-155 encoded (>= 35), got: " + signature.v());
        }
        final List<RlpItem> items = payload();
        items.add(RlpString.of(signature.v()));
        items.add(RlpString.of(signature.rAsBigInteger()));
        items.add(RlpString.of(signature.sAsBigInteger()));
        return Rlp.encodeList(items);
    }

    private List<RlpItem> payload() {
        final List<RlpItem> items = new ArrayList<>(9);
        items.add(RlpString.of(nonce));
        items.add(RlpString.of(gasPrice.value()));
        items.add(RlpString.of(gasLimit));
        items.add(new RlpString(to != null ? to.toBytes() : new byte[0]));
        items.add(RlpString.of(value.value()));
        items.add(new RlpString(data.toBytes()));
        return items;
    }
}
