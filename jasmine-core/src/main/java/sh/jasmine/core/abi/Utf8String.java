// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.abi;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * ABI {@code string}, encoded as UTF-8 bytes.
 */
public record Utf8String(String value) implements AbiType {
    public Utf8String {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public boolean isDynamic() {
        return true;
    }

    @Override
    public byte[] encode() {
        final byte[] data = value.getBytes(StandardCharsets.UTF_8);
        return AbiEncoder.concat(AbiEncoder.word(BigInteger.valueOf(data.length)), AbiEncoder.padRight(data));
    }
}
