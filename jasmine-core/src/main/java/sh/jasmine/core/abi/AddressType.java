// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.abi;

import java.util.Objects;

import sh.jasmine.core.types.Address;

/**
 * ABI {@code address}, left-padded to 32 bytes.
 */
public record AddressType(Address value) implements AbiType {
    public AddressType {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public String typeName() {
        return "address";
    }

    @Override
    public boolean isDynamic() {
        return false;
    }

    @Override
    public byte[] encode() {
        final byte[] result = new byte[32];
        System.arraycopy(value.toBytes(), 0, result, 12, 20);
        return result;
    }
}
