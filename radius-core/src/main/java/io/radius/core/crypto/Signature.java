// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import io.radius.primitives.Hex;

/**
 * An ECDSA signature over secp256k1.
 *
 * <p>{@code v} is stored as produced by its source: a bare y-parity (0/1) from
 * {@link PrivateKey#sign}, 27/28 for personal messages, or the EIP-155 form
 * {@code chainId * 2 + 35 + yParity} inside transaction envelopes.
 *
 * @param r 32-byte r component
 * @param s 32-byte s component
 * @param v recovery value
 */
public record Signature(byte[] r, byte[] s, int v) {

    public static final int WIRE_LENGTH = 65;

    public Signature {
        Objects.requireNonNull(r, "r");
        Objects.requireNonNull(s, "s");
        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        r = r.clone();
        s = s.clone();
    }

    /**
     * Parses the 65-byte {@code r || s || v} wire form.
     */
    public static Signature fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != WIRE_LENGTH) {
            throw new IllegalArgumentException(
                    "Signature must be " + WIRE_LENGTH + " bytes, got " + (bytes == null ? "null" : bytes.length));
        }
        return new Signature(
                Arrays.copyOfRange(bytes, 0, 32),
                Arrays.copyOfRange(bytes, 32, 64),
                bytes[64] & 0xFF);
    }

    /**
     * Returns {@code r || s || v} with {@code v} truncated to one byte.
     */
    public byte[] toBytes() {
        final byte[] out = new byte[WIRE_LENGTH];
        System.arraycopy(r, 0, out, 0, 32);
        System.arraycopy(s, 0, out, 32, 32);
        out[64] = (byte) v;
        return out;
    }

    @Override
    public byte[] r() {
        return r.clone();
    }

    @Override
    public byte[] s() {
        return s.clone();
    }

    public BigInteger rAsBigInteger() {
        return new BigInteger(1, r);
    }

    public BigInteger sAsBigInteger() {
        return new BigInteger(1, s);
    }

    /**
     * Extracts the y-parity from any of the three {@code v} conventions.
     */
    public int yParity() {
        if (v == 0 || v == 1) {
            return v;
        }
        if (v == 27 || v == 28) {
            return v - 27;
        }
        if (v >= 35) {
            return (v - 35) & 1;
        }
        throw new IllegalArgumentException("Unrecognised signature v: " + v);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Signature)) {
            return false;
        }
        final Signature other = (Signature) o;
        return v == other.v && Arrays.equals(r, other.r) && Arrays.equals(s, other.s);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(r) + Arrays.hashCode(s)) + v;
    }

    @Override
    public String toString() {
        return "Signature[r=" + Hex.encode(r) + ", s=" + Hex.encode(s) + ", v=" + v + "]";
    }
}
