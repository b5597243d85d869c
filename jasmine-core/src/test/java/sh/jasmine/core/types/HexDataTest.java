// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.types;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HexDataTest {

    @Test
    void equalityIgnoresCaseAndOrigin() {
        HexData fromString = new HexData("0xABCD");
        HexData fromBytes = HexData.fromBytes(new byte[] {(byte) 0xab, (byte) 0xcd});

        assertEquals(fromString, fromBytes);
        assertEquals(fromString.hashCode(), fromBytes.hashCode());
        assertEquals("0xabcd", fromString.value());
        assertEquals(2, fromString.byteLength());
    }

    @Test
    void emptyInputsCollapseToEmpty() {
        assertSame(HexData.EMPTY, HexData.fromBytes(null));
        assertSame(HexData.EMPTY, HexData.fromBytes(new byte[0]));
        assertTrue(new HexData("0x").isEmpty());
    }

    @Test
    void bytesAreCopied() {
        byte[] source = {1, 2};
        HexData data = HexData.fromBytes(source);
        source[0] = 9;

        byte[] out = data.toBytes();
        out[1] = 9;

        assertArrayEquals(new byte[] {1, 2}, data.toBytes());
    }

    @Test
    void rejectsMalformedHex() {
        assertThrows(IllegalArgumentException.class, () -> new HexData("0x123"));
        assertThrows(IllegalArgumentException.class, () -> new HexData("1234"));
        assertThrows(IllegalArgumentException.class, () -> new HexData("0xgg"));
    }
}
