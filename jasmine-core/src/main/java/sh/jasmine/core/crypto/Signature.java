// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * ECDSA signature over secp256k1.
 *
 * <p>
 * {@code v} is either the raw recovery id (0 or 1) or, for EIP-155 legacy
 * transactions, {@code chainId * 2 + 35 + recoveryId}. The byte arrays are
 * copied on the way in and out.
 *
 * @param r 32-byte r component
 * @param s 32-byte s component
 * @param v recovery id or EIP-155 encoded v
 */
public record Signature(byte[] r, byte[] s, long v) {

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");
        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    public BigInteger rAsBigInteger() {
        return new BigInteger(1, r);
    }

    public BigInteger sAsBigInteger() {
        return new BigInteger(1, s);
    }

    /**
     * Returns the recovery id (0 or 1) regardless of how {@code v} is encoded.
     *
     * @return the y-parity of the signature's R point
     */
    public int recoveryId() {
        if (v == 0 || v == 1) {
            return (int) v;
        }
        if (v == 27 || v == 28) {
            return (int) (v - 27);
        }
        return (int) ((v - 35) & 1);
    }

    /**
     * Returns a copy of this signature with {@code v} encoded for EIP-155.
     *
     * @param chainId the chain the signature is bound to
     * @return the re-encoded signature
     */
    public Signature withEip155(final long chainId) {
        return new Signature(r, s, chainId * 2 + 35 + recoveryId());
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Signature other)) {
            return false;
        }
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=32 bytes, s=32 bytes, v=" + v + "]";
    }
}
