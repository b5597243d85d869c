// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.primitives.rlp;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.jasmine.primitives.Hex;

class RlpTest {

    @Test
    void encodesSingleByteAsItself() {
        assertEquals("0x7f", Hex.encode(Rlp.encodeString(new byte[] {0x7f})));
        assertEquals("0x8180", Hex.encode(Rlp.encodeString(new byte[] {(byte) 0x80})));
    }

    @Test
    void encodesShortString() {
        byte[] dog = "dog".getBytes(StandardCharsets.US_ASCII);
        assertEquals("0x83646f67", Hex.encode(Rlp.encodeString(dog)));
        assertEquals("0x80", Hex.encode(Rlp.encodeString(new byte[0])));
    }

    @Test
    void encodesLongString() {
        byte[] text = "Lorem ipsum dolor sit amet, consectetur adipisicing elit"
                .getBytes(StandardCharsets.US_ASCII);
        byte[] encoded = Rlp.encodeString(text);
        assertEquals((byte) 0xb8, encoded[0]);
        assertEquals(56, encoded[1]);
        assertEquals(58, encoded.length);
    }

    @Test
    void encodesNestedLists() {
        RlpList catDog = RlpList.of(
                RlpString.of("cat".getBytes(StandardCharsets.US_ASCII)),
                RlpString.of("dog".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("0xc88363617483646f67", Hex.encode(catDog.encode()));
        assertEquals("0xc0", Hex.encode(new RlpList(List.of()).encode()));

        // set-theoretic representation of three
        RlpList empty = new RlpList(List.of());
        RlpList three = RlpList.of(empty, RlpList.of(empty), RlpList.of(empty, RlpList.of(empty)));
        assertEquals("0xc7c0c1c0c3c0c1c0", Hex.encode(three.encode()));
    }

    @Test
    void encodesNumbersMinimally() {
        assertEquals("0x80", Hex.encode(RlpString.of(0L).encode()));
        assertEquals("0x0f", Hex.encode(RlpString.of(15L).encode()));
        assertEquals("0x820400", Hex.encode(RlpString.of(1024L).encode()));
        assertEquals("0x820400", Hex.encode(RlpString.of(BigInteger.valueOf(1024)).encode()));
        assertEquals(
                "0x880de0b6b3a7640000",
                Hex.encode(RlpString.of(new BigInteger("1000000000000000000")).encode()));
        assertThrows(IllegalArgumentException.class, () -> RlpString.of(-1L));
        assertThrows(IllegalArgumentException.class, () -> RlpString.of(BigInteger.ONE.negate()));
    }

    @Test
    void decodesWhatItEncodes() {
        RlpList original = RlpList.of(
                RlpString.of(9L),
                RlpString.of(new BigInteger("20000000000")),
                RlpString.of(new byte[20]),
                RlpList.of(RlpString.of(new byte[70])));

        List<RlpItem> decoded = Rlp.decodeList(original.encode());

        assertEquals(original.items(), decoded);
        assertEquals(BigInteger.valueOf(9), ((RlpString) decoded.get(0)).asBigInteger());
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(Hex.decode("0x83646f")));
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(Hex.decode("0x8080")));
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(Hex.decode("0xb80100")));
        assertThrows(IllegalArgumentException.class, () -> Rlp.decodeList(Hex.decode("0x80")));
    }
}
