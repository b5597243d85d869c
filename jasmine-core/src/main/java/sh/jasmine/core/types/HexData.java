// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.types;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.jasmine.primitives.Hex;

/**
 * Arbitrary-length byte data rendered as {@code 0x}-prefixed hex.
 *
 * <p>
 * Used for calldata, contract init bytecode and {@code eth_call} results.
 * Instances created with {@link #fromBytes(byte[])} keep the raw bytes and
 * render the hex string lazily.
 *
 * <pre>{@code
 * HexData data = new HexData("0x1234abcd");
 * HexData same = HexData.fromBytes(data.toBytes());
 * }</pre>
 *
 * @since 0.1.0
 */
public final class HexData {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    /** Zero-length data ({@code 0x}). */
    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] raw;
    private volatile String value;

    /**
     * Creates a HexData from a hex string.
     *
     * @param value the hex-encoded string with "0x" prefix and an even number of digits
     * @throws IllegalArgumentException if the string is malformed
     */
    public HexData(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.raw = Hex.decode(value);
    }

    private HexData(final byte[] raw) {
        this.raw = raw;
    }

    /**
     * Creates HexData from raw bytes, copying them.
     *
     * @param bytes the byte array, or null/empty for {@link #EMPTY}
     * @return the wrapped data
     */
    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    /**
     * Returns the lowercase hex string with "0x" prefix.
     *
     * @return the hex string
     */
    @com.fasterxml.jackson.annotation.JsonValue
    public String value() {
        String v = value;
        if (v == null) {
            v = Hex.encode(raw);
            value = v;
        }
        return v;
    }

    public int byteLength() {
        return raw.length;
    }

    public boolean isEmpty() {
        return raw.length == 0;
    }

    /**
     * Returns a copy of the underlying bytes.
     *
     * @return the decoded byte array
     */
    public byte[] toBytes() {
        return raw.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HexData other)) {
            return false;
        }
        return Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "HexData[value=" + value() + ']';
    }
}
