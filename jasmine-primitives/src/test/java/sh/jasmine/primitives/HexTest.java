// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {
    @Test
    @DisplayName("Encoding empty and single bytes")
    void testEncodeBasic() {
        assertEquals("0x", Hex.encode(new byte[] {}));
        assertEquals("0x00", Hex.encode(new byte[] {0x00}));
        assertEquals("0xff", Hex.encode(new byte[] {(byte) 0xFF}));
        assertEquals("ab12", Hex.encodeNoPrefix(new byte[] {(byte) 0xAB, 0x12}));
    }

    @Test
    void testDecodeAcceptsMixedCaseAndOptionalPrefix() {
        byte[] expected = new byte[] {(byte) 0xAB, (byte) 0xC1, 0x23};
        assertArrayEquals(expected, Hex.decode("0xabc123"));
        assertArrayEquals(expected, Hex.decode("ABC123"));
        assertArrayEquals(expected, Hex.decode("0XaBc123"));
        assertArrayEquals(new byte[0], Hex.decode(""));
    }

    @Test
    void testDecodeInvalidInputs() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xabc"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xzz"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xéé"));
        assertThrows(IllegalArgumentException.class, () -> Hex.encode(null));
    }

    @Test
    void testIsValid() {
        assertTrue(Hex.isValid("0x"));
        assertTrue(Hex.isValid("deadBEEF"));
        assertFalse(Hex.isValid("0x1"));
        assertFalse(Hex.isValid("0xg0"));
        assertFalse(Hex.isValid(null));
    }

    @Test
    void testPrefixHelpers() {
        assertEquals("1234", Hex.cleanPrefix("0x1234"));
        assertEquals("1234", Hex.cleanPrefix("1234"));
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix("0"));
        assertFalse(Hex.hasPrefix(null));
    }
}
