// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.primitives.rlp;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.radius.primitives.Hex;

class RlpTest {

    private static RlpString ascii(final String s) {
        return RlpString.of(s.getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("String vectors from the Ethereum RLP documentation")
    void stringVectors() {
        assertEquals("80", Hex.encodeNoPrefix(RlpString.of(new byte[] {}).encode()));
        assertEquals("83646f67", Hex.encodeNoPrefix(ascii("dog").encode()));
        assertEquals("00", Hex.encodeNoPrefix(RlpString.of(new byte[] {0x00}).encode()));
        assertEquals("0f", Hex.encodeNoPrefix(RlpString.of(15L).encode()));
        assertEquals("820400", Hex.encodeNoPrefix(RlpString.of(1024L).encode()));
        assertEquals("80", Hex.encodeNoPrefix(RlpString.of(BigInteger.ZERO).encode()));
    }

    @Test
    @DisplayName("List vectors from the Ethereum RLP documentation")
    void listVectors() {
        assertEquals("c0", Hex.encodeNoPrefix(RlpList.of().encode()));
        assertEquals("c88363617483646f67", Hex.encodeNoPrefix(RlpList.of(ascii("cat"), ascii("dog")).encode()));
        assertEquals(
                "c7c0c1c0c3c0c1c0",
                Hex.encodeNoPrefix(RlpList.of(
                        RlpList.of(),
                        RlpList.of(RlpList.of()),
                        RlpList.of(RlpList.of(), RlpList.of(RlpList.of()))).encode()));
    }

    @Test
    void longStringUsesLengthOfLengthHeader() {
        final String text = "Lorem ipsum dolor sit amet, consectetur adipisicing elit";
        final byte[] encoded = ascii(text).encode();
        assertEquals(0xB8, encoded[0] & 0xFF);
        assertEquals(56, encoded[1] & 0xFF);
        assertEquals(ascii(text), Rlp.decode(encoded));
    }

    @Test
    void decodesNestedStructure() {
        final RlpList original = RlpList.of(
                RlpString.of(9L),
                RlpList.of(ascii("hello"), RlpString.of(BigInteger.TWO.pow(200))),
                RlpString.of(new byte[70]));
        final RlpList decoded = Rlp.decodeList(original.encode());

        assertEquals(original, decoded);
        assertEquals(9L, ((RlpString) decoded.get(0)).asLong());
        assertEquals(BigInteger.TWO.pow(200), ((RlpString) ((RlpList) decoded.get(1)).get(1)).asBigInteger());
    }

    @Test
    void rejectsMalformedEncodings() {
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(new byte[] {(byte) 0x83, 0x01}));
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(new byte[] {0x01, 0x02}));
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(new byte[] {(byte) 0x81, 0x05}));
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(new byte[] {(byte) 0xB8, 0x02, 0x01, 0x02}));
        assertThrows(IllegalArgumentException.class, () -> Rlp.decodeList(new byte[] {0x05}));
        assertThrows(IllegalArgumentException.class, () -> RlpString.of(-1L));
    }

    @Test
    void bytesAccessorReturnsCopy() {
        final byte[] source = {1, 2, 3};
        final RlpString item = RlpString.of(source);
        source[0] = 9;
        final byte[] exposed = item.bytes();
        exposed[1] = 9;
        assertTrue(Arrays.equals(new byte[] {1, 2, 3}, item.bytes()));
    }
}
