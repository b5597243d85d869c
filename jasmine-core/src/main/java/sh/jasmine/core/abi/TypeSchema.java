// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.abi;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import sh.jasmine.core.error.AbiEncodingException;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.HexData;
import sh.jasmine.core.types.Wei;

/**
 * The shape of an ABI parameter, without a value.
 *
 * <p>
 * Schemas drive decoding of call results and turn plain Java arguments into
 * {@link AbiType} values via {@link #wrap(Object)}.
 */
public sealed interface TypeSchema permits
        TypeSchema.UIntSchema,
        TypeSchema.AddressSchema,
        TypeSchema.BoolSchema,
        TypeSchema.BytesSchema,
        TypeSchema.StringSchema {

    boolean isDynamic();

    String typeName();

    /**
     * Converts a Java argument into the matching ABI value.
     *
     * @param value the argument
     * @return the typed ABI value
     * @throws AbiEncodingException if the value cannot represent this type
     */
    AbiType wrap(Object value);

    /**
     * Parses a canonical Solidity type name. Only the types used by the SDK's
     * contracts are supported.
     *
     * @param typeName e.g. {@code uint256}, {@code address}, {@code bytes}
     * @return the schema
     * @throws AbiEncodingException for unsupported or malformed names
     */
    static TypeSchema parse(final String typeName) {
        if (typeName == null) {
            throw new AbiEncodingException("ABI type name cannot be null");
        }
        final String t = "uint".equals(typeName) ? "uint256" : typeName;
        try {
            if (t.startsWith("uint")) {
                return new UIntSchema(Integer.parseInt(t.substring(4)));
            }
            if ("address".equals(t)) {
                return new AddressSchema();
            }
            if ("bool".equals(t)) {
                return new BoolSchema();
            }
            if ("string".equals(t)) {
                return new StringSchema();
            }
            if ("bytes".equals(t)) {
                return new BytesSchema(BytesSchema.DYNAMIC);
            }
            if (t.startsWith("bytes")) {
                return new BytesSchema(Integer.parseInt(t.substring(5)));
            }
        } catch (IllegalArgumentException e) {
            throw new AbiEncodingException("Invalid ABI type: " + typeName, e);
        }
        throw new AbiEncodingException("Unsupported ABI type: " + typeName);
    }

    record UIntSchema(int width) implements TypeSchema {
        public UIntSchema {
            if (width % 8 != 0 || width < 8 || width > 256) {
                throw new IllegalArgumentException("Invalid uint width: " + width);
            }
        }

        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public String typeName() {
            return "uint" + width;
        }

        @Override
        public AbiType wrap(final Object value) {
            final BigInteger number;
            if (value instanceof BigInteger b) {
                number = b;
            } else if (value instanceof Long || value instanceof Integer
                    || value instanceof Short || value instanceof Byte) {
                number = BigInteger.valueOf(((Number) value).longValue());
            } else if (value instanceof Wei w) {
                number = w.value();
            } else {
                throw mismatch(this, value);
            }
            try {
                return new UInt(width, number);
            } catch (IllegalArgumentException e) {
                throw new AbiEncodingException(e.getMessage(), e);
            }
        }
    }

    record AddressSchema() implements TypeSchema {
        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public String typeName() {
            return "address";
        }

        @Override
        public AbiType wrap(final Object value) {
            if (value instanceof Address a) {
                return new AddressType(a);
            }
            throw mismatch(this, value);
        }
    }

    record BoolSchema() implements TypeSchema {
        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public String typeName() {
            return "bool";
        }

        @Override
        public AbiType wrap(final Object value) {
            if (value instanceof Boolean b) {
                return new Bool(b);
            }
            throw mismatch(this, value);
        }
    }

    record BytesSchema(int size) implements TypeSchema {
        public static final int DYNAMIC = -1;

        public BytesSchema {
            if (size != DYNAMIC && (size < 1 || size > 32)) {
                throw new IllegalArgumentException("bytesN size must be 1-32 or DYNAMIC (-1), got: " + size);
            }
        }

        @Override
        public boolean isDynamic() {
            return size == DYNAMIC;
        }

        @Override
        public String typeName() {
            return size == DYNAMIC ? "bytes" : "bytes" + size;
        }

        @Override
        public AbiType wrap(final Object value) {
            final byte[] data;
            if (value instanceof byte[] raw) {
                data = raw;
            } else if (value instanceof HexData hex) {
                data = hex.toBytes();
            } else {
                throw mismatch(this, value);
            }
            if (size == DYNAMIC) {
                return Bytes.of(data);
            }
            if (data.length != size) {
                throw new AbiEncodingException("bytes" + size + " requires " + size + " bytes, got " + data.length);
            }
            return Bytes.ofStatic(data);
        }
    }

    record StringSchema() implements TypeSchema {
        @Override
        public boolean isDynamic() {
            return true;
        }

        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public AbiType wrap(final Object value) {
            if (value instanceof String s) {
                return new Utf8String(s);
            }
            if (value instanceof byte[] raw) {
                return new Utf8String(new String(raw, StandardCharsets.UTF_8));
            }
            throw mismatch(this, value);
        }
    }

    private static AbiEncodingException mismatch(final TypeSchema schema, final Object value) {
        final String actual = value == null ? "null" : value.getClass().getSimpleName();
        return new AbiEncodingException("Cannot encode " + actual + " as " + schema.typeName());
    }
}
