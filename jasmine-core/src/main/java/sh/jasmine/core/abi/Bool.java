// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.abi;

/**
 * ABI {@code bool}.
 */
public record Bool(boolean value) implements AbiType {

    @Override
    public String typeName() {
        return "bool";
    }

    @Override
    public boolean isDynamic() {
        return false;
    }

    @Override
    public byte[] encode() {
        final byte[] result = new byte[32];
        if (value) {
            result[31] = 1;
        }
        return result;
    }
}
