// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.abi;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Unsigned integer of 8 to 256 bits.
 *
 * @param width bit width, a multiple of 8
 * @param value non-negative value that fits in {@code width} bits
 */
public record UInt(int width, BigInteger value) implements AbiType {
    public UInt {
        if (width % 8 != 0 || width < 8 || width > 256) {
            throw new IllegalArgumentException("Invalid uint width: " + width);
        }
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint cannot be negative");
        }
        if (value.bitLength() > width) {
            throw new IllegalArgumentException("value " + value + " too large for uint" + width);
        }
    }

    public static UInt uint256(final BigInteger value) {
        return new UInt(256, value);
    }

    @Override
    public String typeName() {
        return "uint" + width;
    }

    @Override
    public boolean isDynamic() {
        return false;
    }

    @Override
    public byte[] encode() {
        return AbiEncoder.word(value);
    }
}
