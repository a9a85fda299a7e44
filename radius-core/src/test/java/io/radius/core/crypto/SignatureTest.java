// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class SignatureTest {

    @Test
    void wireFormRoundTrip() {
        final byte[] r = new byte[32];
        final byte[] s = new byte[32];
        Arrays.fill(r, (byte) 0x11);
        Arrays.fill(s, (byte) 0x22);
        final Signature sig = new Signature(r, s, 28);
        final byte[] wire = sig.toBytes();
        assertEquals(65, wire.length);
        assertEquals(28, wire[64]);
        assertEquals(sig, Signature.fromBytes(wire));
    }

    @Test
    void rejectsWrongSizes() {
        assertThrows(IllegalArgumentException.class, () -> new Signature(new byte[31], new byte[32], 27));
        assertThrows(IllegalArgumentException.class, () -> Signature.fromBytes(new byte[64]));
    }

    @Test
    void parityFromEveryConvention() {
        final byte[] zero = new byte[32];
        assertEquals(1, new Signature(zero, zero, 1).yParity());
        assertEquals(0, new Signature(zero, zero, 27).yParity());
        assertEquals(1, new Signature(zero, zero, 28).yParity());
        assertEquals(0, new Signature(zero, zero, 37).yParity());
        assertEquals(1, new Signature(zero, zero, 38).yParity());
        assertThrows(IllegalArgumentException.class, () -> new Signature(zero, zero, 5).yParity());
    }

    @Test
    void componentsAreCopied() {
        final byte[] r = new byte[32];
        final Signature sig = new Signature(r, new byte[32], 27);
        r[0] = 1;
        sig.r()[1] = 1;
        assertArrayEquals(new byte[32], sig.r());
    }
}
