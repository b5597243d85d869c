// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.abi;

/**
 * A typed value in the Solidity contract ABI.
 *
 * <p>
 * Static types occupy one 32-byte head slot. Dynamic types ({@code bytes},
 * {@code string}) put an offset in the head and their length-prefixed
 * content in the tail.
 */
public sealed interface AbiType permits UInt, AddressType, Bool, Bytes, Utf8String {

    /**
     * Returns the canonical Solidity type name, e.g. {@code uint256}.
     *
     * @return the type name used in function signatures
     */
    String typeName();

    boolean isDynamic();

    /**
     * Encodes this value: the 32-byte word for static types, or length word
     * plus right-padded content for dynamic ones.
     *
     * @return the encoded bytes
     */
    byte[] encode();
}
