// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.abi;

import java.math.BigInteger;
import java.util.Objects;

import sh.jasmine.core.types.HexData;

/**
 * ABI {@code bytes} (dynamic) or {@code bytesN} (static, 1 to 32 bytes).
 *
 * @param value     the raw content
 * @param isDynamic whether this is the dynamic {@code bytes} type
 */
public record Bytes(HexData value, boolean isDynamic) implements AbiType {
    public Bytes {
        Objects.requireNonNull(value, "value cannot be null");
        if (!isDynamic && (value.byteLength() < 1 || value.byteLength() > 32)) {
            throw new IllegalArgumentException("bytesN must hold 1 to 32 bytes, got " + value.byteLength());
        }
    }

    public static Bytes of(final byte[] data) {
        return new Bytes(HexData.fromBytes(data), true);
    }

    public static Bytes ofStatic(final byte[] data) {
        return new Bytes(HexData.fromBytes(data), false);
    }

    @Override
    public String typeName() {
        return isDynamic ? "bytes" : "bytes" + value.byteLength();
    }

    @Override
    public byte[] encode() {
        final byte[] data = value.toBytes();
        if (!isDynamic) {
            return AbiEncoder.padRight(data);
        }
        return AbiEncoder.concat(AbiEncoder.word(BigInteger.valueOf(data.length)), AbiEncoder.padRight(data));
    }
}
