// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.Test;

class WeiTest {

    @Test
    void unitConversions() {
        assertEquals(BigInteger.valueOf(1_000_000_000L), Wei.gwei(1).value());
        assertEquals(new BigInteger("1500000000000000000"), Wei.fromEther(new BigDecimal("1.5")).value());
        assertEquals(0, new BigDecimal("1.5").compareTo(Wei.fromEther(new BigDecimal("1.5")).toEther()));
    }

    @Test
    void rejectsNegativeAndSubWeiAmounts() {
        assertThrows(IllegalArgumentException.class, () -> Wei.of(-1));
        assertThrows(ArithmeticException.class, () -> Wei.fromEther(new BigDecimal("0.0000000000000000001")));
    }

    @Test
    void hexForm() {
        assertEquals("0x0", Wei.ZERO.toHexString());
        assertEquals("0x3b9aca00", Wei.gwei(1).toHexString());
        assertTrue(Wei.ZERO.isZero());
        assertTrue(Wei.of(2).compareTo(Wei.of(1)) > 0);
    }
}
