// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.math.ec.ECPoint;

import io.radius.core.error.ConfigurationException;
import io.radius.core.types.Address;
import io.radius.primitives.Hex;

/**
 * A secp256k1 private key.
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x4c08...");
 * Signature sig = key.sign(Keccak256.hash(payload));
 * Address signer = PrivateKey.recoverAddress(Keccak256.hash(payload), sig);
 * }</pre>
 *
 * <p>{@link #destroy()} drops the key reference and makes later use fail with
 * {@link IllegalStateException}. {@code BigInteger} is immutable, so the
 * scalar itself cannot be wiped. {@link #toString()} shows only the address.
 */
public final class PrivateKey implements Destroyable {

    private static final int KEY_LENGTH = 32;

    private BigInteger scalar;
    private final Address address;
    private volatile boolean destroyed;

    private PrivateKey(final byte[] keyBytes) {
        try {
            if (keyBytes.length != KEY_LENGTH) {
                throw new ConfigurationException(
                        "Private key must be " + KEY_LENGTH + " bytes, got " + keyBytes.length);
            }
            final BigInteger value = new BigInteger(1, keyBytes);
            if (value.signum() == 0 || value.compareTo(Secp256k1.CURVE.getN()) >= 0) {
                throw new ConfigurationException("Private key is outside the secp256k1 range");
            }
            this.scalar = value;
            this.address = Secp256k1.toAddress(Secp256k1.publicPoint(value));
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Loads a key from 64 hex digits, with or without {@code 0x}.
     *
     * @throws ConfigurationException if the string is not a valid key
     */
    public static PrivateKey fromHex(final String hex) {
        Objects.requireNonNull(hex, "hex");
        final byte[] bytes;
        try {
            bytes = Hex.decode(hex.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Private key is not valid hex", e);
        }
        return new PrivateKey(bytes);
    }

    /**
     * Loads a key from 32 raw bytes. The array is zeroed afterwards.
     *
     * @throws ConfigurationException if the bytes are not a valid key
     */
    public static PrivateKey fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new PrivateKey(bytes);
    }

    public Address toAddress() {
        checkNotDestroyed();
        return address;
    }

    /**
     * Signs a 32-byte digest deterministically.
     *
     * @return a signature with {@code v} equal to the y-parity (0 or 1)
     */
    public Signature sign(final byte[] digest) {
        Objects.requireNonNull(digest, "digest");
        if (digest.length != 32) {
            throw new IllegalArgumentException("Digest must be 32 bytes, got " + digest.length);
        }
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = scalar;
        }
        return Secp256k1.sign(digest, key);
    }

    /**
     * Recovers the signing address. Accepts {@code v} as a bare parity, 27/28
     * or EIP-155 encoded.
     *
     * @throws IllegalArgumentException if no valid public key matches
     */
    public static Address recoverAddress(final byte[] digest, final Signature signature) {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(signature, "signature");
        if (digest.length != 32) {
            throw new IllegalArgumentException("Digest must be 32 bytes, got " + digest.length);
        }
        final ECPoint point = Secp256k1.recover(
                digest, signature.rAsBigInteger(), signature.sAsBigInteger(), signature.yParity());
        if (point == null || point.isInfinity()) {
            throw new IllegalArgumentException("Cannot recover a public key from signature");
        }
        return Secp256k1.toAddress(point);
    }

    @Override
    public synchronized void destroy() {
        destroyed = true;
        scalar = null;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    @Override
    public String toString() {
        return destroyed ? "PrivateKey[destroyed]" : "PrivateKey[address=" + address + "]";
    }
}
