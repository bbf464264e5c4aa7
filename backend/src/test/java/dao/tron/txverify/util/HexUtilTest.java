package dao.tron.txverify.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HexUtilTest {

    @Test
    @DisplayName("Decodes with or without prefix, in either case")
    void testFromHex() {
        byte[] expected = {(byte) 0xab, 0x01, (byte) 0xff};

        assertArrayEquals(expected, HexUtil.fromHex("0xAB01ff"));
        assertArrayEquals(expected, HexUtil.fromHex("ab01FF"));
        assertArrayEquals(expected, HexUtil.fromHex(" 0Xab01ff "));
        assertEquals(0, HexUtil.fromHex("0x").length);
    }

    @Test
    @DisplayName("Odd length and non-hex characters are rejected")
    void testFromHexStrict() {
        assertThrows(IllegalArgumentException.class, () -> HexUtil.fromHex("0xabc"));
        assertThrows(IllegalArgumentException.class, () -> HexUtil.fromHex("zz"));
        assertThrows(IllegalArgumentException.class, () -> HexUtil.fromHex("0x12 4"));
    }

    @Test
    @DisplayName("Encodes lowercase with a 0x prefix")
    void testToHex() {
        assertEquals("0xab01ff", HexUtil.toHex0x(new byte[]{(byte) 0xAB, 0x01, (byte) 0xFF}));
        assertEquals("", HexUtil.toHexNoPrefix(new byte[0]));
    }
}
