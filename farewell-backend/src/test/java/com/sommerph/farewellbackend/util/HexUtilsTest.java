package com.sommerph.farewellbackend.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HexUtilsTest {

    @Test
    void decodeAcceptsOptionalPrefix() {
        assertArrayEquals(new byte[]{(byte) 0xde, (byte) 0xad}, HexUtils.decode("0xdead"));
        assertArrayEquals(new byte[]{(byte) 0xde, (byte) 0xad}, HexUtils.decode("DEAD"));
        assertArrayEquals(new byte[0], HexUtils.decode("0x"));
    }

    @Test
    void decodeRejectsOddLengthAndNonHex() {
        assertThrows(IllegalArgumentException.class, () -> HexUtils.decode("0xabc"));
        assertThrows(IllegalArgumentException.class, () -> HexUtils.decode("zz"));
        assertThrows(IllegalArgumentException.class, () -> HexUtils.decode(null));
    }

    @Test
    void isHexRequiresAtLeastOneDigit() {
        assertTrue(HexUtils.isHex("0xdead"));
        assertTrue(HexUtils.isHex("abc"));
        assertFalse(HexUtils.isHex("0x"));
        assertFalse(HexUtils.isHex("0xnothex"));
        assertFalse(HexUtils.isHex(null));
    }

    @Test
    void toPrefixedHexIsLowerCase() {
        assertEquals("0x00ff", HexUtils.toPrefixedHex(new byte[]{0, (byte) 0xff}));
    }

}
