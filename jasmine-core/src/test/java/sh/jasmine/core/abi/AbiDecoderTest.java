// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.abi;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.jasmine.core.error.AbiDecodingException;
import sh.jasmine.core.error.AbiEncodingException;
import sh.jasmine.core.types.Address;
import sh.jasmine.core.types.Wei;
import sh.jasmine.primitives.Hex;

class AbiDecoderTest {

    @Test
    void decodesMixedOutputs() {
        Address holder = new Address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");
        byte[] encoded = AbiEncoder.encode(List.of(
                new AddressType(holder),
                new Utf8String("TFC Token"),
                new UInt(8, BigInteger.valueOf(18)),
                Bytes.of(new byte[] {1, 2, 3}),
                new Bool(false)));

        List<AbiType> decoded = AbiDecoder.decode(encoded, List.of(
                TypeSchema.parse("address"),
                TypeSchema.parse("string"),
                TypeSchema.parse("uint8"),
                TypeSchema.parse("bytes"),
                TypeSchema.parse("bool")));

        assertEquals(new AddressType(holder), decoded.get(0));
        assertEquals(new Utf8String("TFC Token"), decoded.get(1));
        assertEquals(new UInt(8, BigInteger.valueOf(18)), decoded.get(2));
        assertArrayEquals(new byte[] {1, 2, 3}, ((Bytes) decoded.get(3)).value().toBytes());
        assertEquals(new Bool(false), decoded.get(4));
    }

    @Test
    void rejectsTruncatedOrMalformedData() {
        assertThrows(AbiDecodingException.class,
                () -> AbiDecoder.decodeSingle(new byte[31], TypeSchema.parse("uint256")));
        byte[] badOffset = Hex.decode("0x" + "0".repeat(62) + "ff");
        assertThrows(AbiDecodingException.class,
                () -> AbiDecoder.decodeSingle(badOffset, TypeSchema.parse("string")));
        byte[] badBool = Hex.decode("0x" + "0".repeat(63) + "2");
        assertThrows(AbiDecodingException.class,
                () -> AbiDecoder.decodeSingle(badBool, TypeSchema.parse("bool")));
        assertThrows(AbiDecodingException.class,
                () -> AbiDecoder.decodeSingle(Hex.decode("0x" + "ff".repeat(32)), TypeSchema.parse("uint8")));
    }

    @Test
    void schemasParseAndWrapJavaValues() {
        assertEquals("uint256", TypeSchema.parse("uint").typeName());
        assertEquals(UInt.uint256(BigInteger.valueOf(5)), TypeSchema.parse("uint256").wrap(5L));
        assertEquals(UInt.uint256(BigInteger.TEN), TypeSchema.parse("uint256").wrap(Wei.of(10)));
        assertEquals(new Bool(true), TypeSchema.parse("bool").wrap(Boolean.TRUE));
        assertEquals("bytes32", TypeSchema.parse("bytes32").wrap(new byte[32]).typeName());

        assertThrows(AbiEncodingException.class, () -> TypeSchema.parse("int256"));
        assertThrows(AbiEncodingException.class, () -> TypeSchema.parse("uint7"));
        assertThrows(AbiEncodingException.class, () -> TypeSchema.parse("address").wrap("0x1234"));
        assertThrows(AbiEncodingException.class, () -> TypeSchema.parse("uint8").wrap(300L));
        assertThrows(AbiEncodingException.class, () -> TypeSchema.parse("bytes4").wrap(new byte[3]));
    }
}
