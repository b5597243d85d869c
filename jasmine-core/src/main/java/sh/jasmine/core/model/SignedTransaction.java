// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.model;

import java.util.Arrays;
import java.util.Objects;

import sh.jasmine.core.types.Hash;
import sh.jasmine.core.types.HexData;

/**
 * A signed EIP-155 envelope ready for {@code eth_sendRawTransaction}.
 *
 * @param rawBytes the RLP-encoded envelope, copied
 * @param hash     Keccak-256 of the envelope
 */
public record SignedTransaction(byte[] rawBytes, Hash hash) {

    public SignedTransaction {
        Objects.requireNonNull(rawBytes, "rawBytes");
        Objects.requireNonNull(hash, "hash");
        rawBytes = rawBytes.clone();
    }

    @Override
    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    public HexData raw() {
        return HexData.fromBytes(rawBytes);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SignedTransaction other)) {
            return false;
        }
        return hash.equals(other.hash) && Arrays.equals(rawBytes, other.rawBytes);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "SignedTransaction[hash=" + hash + ", bytes=" + rawBytes.length + "]";
    }
}
