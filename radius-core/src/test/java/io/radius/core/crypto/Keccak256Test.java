// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import io.radius.primitives.Hex;

class Keccak256Test {

    @Test
    void emptyInputVector() {
        assertEquals(
                "0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.encode(Keccak256.hash(new byte[0])));
    }

    @Test
    void multiPartHashEqualsConcatenation() {
        final byte[] whole = Keccak256.hash("hello world".getBytes(StandardCharsets.UTF_8));
        final byte[] parts = Keccak256.hash(
                "hello ".getBytes(StandardCharsets.UTF_8), "world".getBytes(StandardCharsets.UTF_8));
        assertArrayEquals(whole, parts);
        assertArrayEquals(whole, Keccak256.hashUtf8("hello world"));
    }
}
