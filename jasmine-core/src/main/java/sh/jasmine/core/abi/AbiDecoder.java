// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.abi;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.jasmine.core.error.AbiDecodingException;
import sh.jasmine.core.types.Address;

/**
 * Decodes ABI-encoded tuples, typically {@code eth_call} return data.
 */
public final class AbiDecoder {

    private static final int WORD = 32;

    private AbiDecoder() {
    }

    /**
     * Decodes {@code data} as a tuple of the given schemas.
     *
     * @param data    the encoded bytes, without a selector
     * @param schemas the expected output types, in order
     * @return one value per schema
     * @throws AbiDecodingException if the data is truncated or malformed
     */
    public static List<AbiType> decode(final byte[] data, final List<TypeSchema> schemas) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(schemas, "schemas");
        if (data.length < schemas.size() * WORD) {
            throw new AbiDecodingException("Data too short for " + schemas.size()
                    + " output(s): " + data.length + " bytes");
        }

        final List<AbiType> results = new ArrayList<>(schemas.size());
        int head = 0;
        for (TypeSchema schema : schemas) {
            if (schema.isDynamic()) {
                final int tailOffset = toInt(readWord(data, head), "dynamic offset");
                results.add(decodeDynamic(data, tailOffset, schema));
            } else {
                results.add(decodeStatic(data, head, schema));
            }
            head += WORD;
        }
        return results;
    }

    /**
     * Decodes a single output value.
     *
     * @param data   the encoded bytes
     * @param schema the expected type
     * @return the decoded value
     */
    public static AbiType decodeSingle(final byte[] data, final TypeSchema schema) {
        return decode(data, List.of(schema)).get(0);
    }

    private static AbiType decodeStatic(final byte[] data, final int offset, final TypeSchema schema) {
        final byte[] word = Arrays.copyOfRange(data, offset, offset + WORD);
        if (schema instanceof TypeSchema.UIntSchema s) {
            final BigInteger value = new BigInteger(1, word);
            if (value.bitLength() > s.width()) {
                throw new AbiDecodingException("value does not fit in " + s.typeName());
            }
            return new UInt(s.width(), value);
        }
        if (schema instanceof TypeSchema.AddressSchema) {
            return new AddressType(Address.fromBytes(Arrays.copyOfRange(word, 12, WORD)));
        }
        if (schema instanceof TypeSchema.BoolSchema) {
            final BigInteger value = new BigInteger(1, word);
            if (value.compareTo(BigInteger.ONE) > 0) {
                throw new AbiDecodingException("invalid bool word: " + value);
            }
            return new Bool(value.signum() == 1);
        }
        if (schema instanceof TypeSchema.BytesSchema s) {
            return Bytes.ofStatic(Arrays.copyOf(word, s.size()));
        }
        throw new AbiDecodingException("Unsupported static type: " + schema.typeName());
    }

    private static AbiType decodeDynamic(final byte[] data, final int offset, final TypeSchema schema) {
        final int length = toInt(readWord(data, offset), "length");
        final int start = offset + WORD;
        if (start + (long) length > data.length) {
            throw new AbiDecodingException("Declared length " + length + " exceeds available data");
        }
        final byte[] content = Arrays.copyOfRange(data, start, start + length);
        if (schema instanceof TypeSchema.StringSchema) {
            return new Utf8String(new String(content, StandardCharsets.UTF_8));
        }
        if (schema instanceof TypeSchema.BytesSchema) {
            return Bytes.of(content);
        }
        throw new AbiDecodingException("Unsupported dynamic type: " + schema.typeName());
    }

    private static BigInteger readWord(final byte[] data, final int offset) {
        if (offset < 0 || offset + WORD > data.length) {
            throw new AbiDecodingException("Offset " + offset + " out of bounds for " + data.length + " bytes");
        }
        return new BigInteger(1, Arrays.copyOfRange(data, offset, offset + WORD));
    }

    private static int toInt(final BigInteger value, final String what) {
        if (value.bitLength() > 31) {
            throw new AbiDecodingException(what + " too large: " + value);
        }
        return value.intValue();
    }
}
