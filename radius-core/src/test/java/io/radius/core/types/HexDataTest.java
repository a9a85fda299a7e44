// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class HexDataTest {

    @Test
    void parsesAndRendersHex() {
        final HexData data = HexData.of("0xDEADbeef");
        assertEquals("0xdeadbeef", data.value());
        assertEquals(4, data.byteLength());
        assertArrayEquals(new byte[] {(byte) 0xDE, (byte) 0xAD, (byte) 0xBE, (byte) 0xEF}, data.toBytes());
    }

    @Test
    void emptyForms() {
        assertSame(HexData.EMPTY, HexData.fromBytes(new byte[0]));
        assertSame(HexData.EMPTY, HexData.fromBytes(null));
        assertEquals(HexData.EMPTY, HexData.of("0x"));
        assertTrue(HexData.EMPTY.isEmpty());
        assertEquals("0x", HexData.EMPTY.value());
    }

    @Test
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> HexData.of("deadbeef"));
        assertThrows(IllegalArgumentException.class, () -> HexData.of("0xabc"));
        assertThrows(IllegalArgumentException.class, () -> HexData.of("0xzz"));
    }

    @Test
    void isImmutable() {
        final byte[] source = {1, 2, 3};
        final HexData data = HexData.fromBytes(source);
        source[0] = 9;
        data.toBytes()[1] = 9;
        assertEquals("0x010203", data.value());
    }

    @Test
    void concatJoinsPayloads() {
        final HexData code = HexData.of("0x6080");
        final HexData args = HexData.of("0x0001");
        assertEquals(HexData.of("0x60800001"), code.concat(args));
        assertSame(code, code.concat(HexData.EMPTY));
        assertSame(args, HexData.EMPTY.concat(args));
    }

    @Test
    void jsonRoundTrip() throws Exception {
        final ObjectMapper mapper = new ObjectMapper();
        assertEquals("\"0x0102\"", mapper.writeValueAsString(HexData.of("0x0102")));
        assertEquals(HexData.of("0x0102"), mapper.readValue("\"0x0102\"", HexData.class));
    }
}
