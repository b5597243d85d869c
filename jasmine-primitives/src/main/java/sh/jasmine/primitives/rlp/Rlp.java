// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.primitives.rlp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive Length Prefix encoding and decoding.
 *
 * @see <a href=
 *      "https://ethereum.org/en/developers/docs/data-structures-and-encoding/rlp/">Ethereum
 *      RLP Specification</a>
 */
public final class Rlp {

    private static final int SHORT_LIMIT = 55;

    private Rlp() {
        // Utility class
    }

    /**
     * Encodes a raw byte string.
     *
     * @param bytes the payload
     * @return encoded bytes
     */
    public static byte[] encodeString(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");

        final int length = bytes.length;
        if (length == 1 && (bytes[0] & 0xFF) <= 0x7F) {
            return new byte[] { bytes[0] };
        }
        return withHeader(0x80, 0xB7, bytes, length);
    }

    /**
     * Encodes a list of items.
     *
     * @param items the items to encode
     * @return encoded bytes
     */
    public static byte[] encodeList(final List<RlpItem> items) {
        Objects.requireNonNull(items, "items cannot be null");

        final byte[][] encodedItems = new byte[items.size()][];
        int payloadSize = 0;
        for (int i = 0; i < encodedItems.length; i++) {
            final RlpItem item = Objects.requireNonNull(items.get(i), "items cannot contain null values");
            encodedItems[i] = item.encode();
            payloadSize += encodedItems[i].length;
        }

        final byte[] payload = new byte[payloadSize];
        int offset = 0;
        for (final byte[] encoded : encodedItems) {
            System.arraycopy(encoded, 0, payload, offset, encoded.length);
            offset += encoded.length;
        }
        return withHeader(0xC0, 0xF7, payload, payloadSize);
    }

    /**
     * Decodes a single root item; trailing bytes are rejected.
     *
     * @param encoded the encoded bytes
     * @return decoded item
     * @throws IllegalArgumentException if the input is not well-formed RLP
     */
    public static RlpItem decode(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        final DecodeResult result = decode(encoded, 0);
        if (result.consumed != encoded.length) {
            throw new IllegalArgumentException("RLP data has trailing bytes");
        }
        return result.item;
    }

    /**
     * Decodes bytes whose root is expected to be a list.
     *
     * @param encoded the encoded bytes
     * @return the list elements
     * @throws IllegalArgumentException if the root is not a list
     */
    public static List<RlpItem> decodeList(final byte[] encoded) {
        final RlpItem item = decode(encoded);
        if (item instanceof RlpList list) {
            return list.items();
        }
        throw new IllegalArgumentException("RLP data is not a list");
    }

    private static byte[] withHeader(final int shortBase, final int longBase, final byte[] payload, final int length) {
        if (length <= SHORT_LIMIT) {
            final byte[] result = new byte[1 + length];
            result[0] = (byte) (shortBase + length);
            System.arraycopy(payload, 0, result, 1, length);
            return result;
        }
        final int lengthSize = lengthSize(length);
        final byte[] result = new byte[1 + lengthSize + length];
        result[0] = (byte) (longBase + lengthSize);
        for (int i = 0; i < lengthSize; i++) {
            result[1 + i] = (byte) (length >>> (8 * (lengthSize - 1 - i)));
        }
        System.arraycopy(payload, 0, result, 1 + lengthSize, length);
        return result;
    }

    private static DecodeResult decode(final byte[] data, final int offset) {
        if (offset >= data.length) {
            throw new IllegalArgumentException("Invalid RLP data: offset beyond end");
        }

        final int prefix = data[offset] & 0xFF;
        if (prefix <= 0x7F) {
            return new DecodeResult(new RlpString(new byte[] { (byte) prefix }), 1);
        }
        if (prefix <= 0xB7) {
            return decodeString(data, offset, prefix - 0x80, 1);
        }
        if (prefix <= 0xBF) {
            final int lengthOfLength = prefix - 0xB7;
            final int length = readLength(data, offset + 1, lengthOfLength);
            return decodeString(data, offset, length, 1 + lengthOfLength);
        }
        if (prefix <= 0xF7) {
            return decodeList(data, offset, prefix - 0xC0, 1);
        }
        final int lengthOfLength = prefix - 0xF7;
        final int length = readLength(data, offset + 1, lengthOfLength);
        return decodeList(data, offset, length, 1 + lengthOfLength);
    }

    private static DecodeResult decodeString(
            final byte[] data, final int offset, final int length, final int headerSize) {
        final int start = offset + headerSize;
        if (start + length > data.length) {
            throw new IllegalArgumentException("Invalid RLP string length");
        }
        final byte[] value = new byte[length];
        System.arraycopy(data, start, value, 0, length);
        return new DecodeResult(new RlpString(value), headerSize + length);
    }

    private static DecodeResult decodeList(
            final byte[] data, final int offset, final int length, final int headerSize) {
        final int start = offset + headerSize;
        final int end = start + length;
        if (end > data.length) {
            throw new IllegalArgumentException("Invalid RLP list length");
        }

        final List<RlpItem> items = new ArrayList<>();
        int current = start;
        while (current < end) {
            final DecodeResult child = decode(data, current);
            items.add(child.item);
            current += child.consumed;
        }
        if (current != end) {
            throw new IllegalArgumentException("RLP list length mismatch");
        }
        return new DecodeResult(new RlpList(items), headerSize + length);
    }

    private static int readLength(final byte[] data, final int start, final int lengthOfLength) {
        if (lengthOfLength < 1 || lengthOfLength > 4 || start + lengthOfLength > data.length) {
            throw new IllegalArgumentException("Invalid length-of-length: " + lengthOfLength);
        }
        if ((data[start] & 0xFF) == 0) {
            throw new IllegalArgumentException("Length has leading zeros");
        }
        int length = 0;
        for (int i = 0; i < lengthOfLength; i++) {
            length = (length << 8) | (data[start + i] & 0xFF);
        }
        if (length <= SHORT_LIMIT || length < 0) {
            throw new IllegalArgumentException("Non-minimal length encoding: " + length);
        }
        return length;
    }

    private static int lengthSize(final int value) {
        if (value < 0x100) {
            return 1;
        }
        if (value < 0x10000) {
            return 2;
        }
        if (value < 0x1000000) {
            return 3;
        }
        return 4;
    }

    private record DecodeResult(RlpItem item, int consumed) {
    }
}
