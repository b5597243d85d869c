// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.primitives.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.jasmine.primitives.Hex;

/**
 * RLP byte string.
 *
 * <p>
 * Numeric values are stored in their minimal big-endian form, so zero is the
 * empty string.
 */
public final class RlpString implements RlpItem {

    private static final byte[] EMPTY = new byte[0];

    private final byte[] bytes;

    /**
     * Wraps the given bytes without copying. The caller hands over ownership.
     *
     * @param bytes the raw value
     */
    public RlpString(final byte[] bytes) {
        this.bytes = Objects.requireNonNull(bytes, "bytes cannot be null");
    }

    public static RlpString of(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return new RlpString(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * Creates a string holding the minimal big-endian form of {@code value}.
     *
     * @param value a non-negative number
     * @return the encoded string item
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        if (value == 0) {
            return new RlpString(EMPTY);
        }
        final int size = (64 - Long.numberOfLeadingZeros(value) + 7) >>> 3;
        final byte[] raw = new byte[size];
        long tmp = value;
        for (int i = size - 1; i >= 0; i--) {
            raw[i] = (byte) tmp;
            tmp >>>= 8;
        }
        return new RlpString(raw);
    }

    /**
     * Creates a string holding the minimal big-endian form of {@code value}.
     *
     * @param value a non-negative number
     * @return the encoded string item
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public static RlpString of(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        if (value.signum() == 0) {
            return new RlpString(EMPTY);
        }
        final byte[] raw = value.toByteArray();
        if (raw[0] == 0) {
            return new RlpString(Arrays.copyOfRange(raw, 1, raw.length));
        }
        return new RlpString(raw);
    }

    /**
     * Returns a copy of the raw value.
     *
     * @return the bytes of this string
     */
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Interprets the bytes as an unsigned big-endian integer.
     *
     * @return the numeric value, zero for the empty string
     */
    public BigInteger asBigInteger() {
        return bytes.length == 0 ? BigInteger.ZERO : new BigInteger(1, bytes);
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeString(bytes);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RlpString other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RlpString[" + Hex.encode(bytes) + "]";
    }
}
