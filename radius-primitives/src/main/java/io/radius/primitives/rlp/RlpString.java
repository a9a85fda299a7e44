// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.primitives.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import io.radius.primitives.Hex;

/**
 * RLP byte string. Numeric factories use the minimal big-endian form, so zero
 * encodes as the empty string ({@code 0x80}).
 */
public final class RlpString implements RlpItem {

    private final byte[] bytes;

    private RlpString(final byte[] bytes) {
        this.bytes = bytes;
    }

    public static RlpString of(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return new RlpString(bytes.clone());
    }

    public static RlpString of(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        return of(BigInteger.valueOf(value));
    }

    public static RlpString of(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative");
        }
        if (value.signum() == 0) {
            return new RlpString(new byte[0]);
        }
        final byte[] raw = value.toByteArray();
        return new RlpString(raw[0] == 0 ? Arrays.copyOfRange(raw, 1, raw.length) : raw);
    }

    static RlpString wrap(final byte[] owned) {
        return new RlpString(owned);
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * Interprets the payload as an unsigned big-endian integer.
     */
    public BigInteger asBigInteger() {
        return bytes.length == 0 ? BigInteger.ZERO : new BigInteger(1, bytes);
    }

    public long asLong() {
        return asBigInteger().longValueExact();
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeString(bytes);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RlpString other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RlpString[" + Hex.encode(bytes) + "]";
    }
}
