// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.types;

import java.util.Arrays;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import io.radius.primitives.Hex;

/**
 * An immutable byte payload of arbitrary length: calldata, bytecode, raw
 * signed envelopes, log data.
 *
 * <p>Instances hold the bytes; the hex form is rendered on demand and cached.
 */
public final class HexData {

    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] bytes;
    private volatile String hex;

    private HexData(final byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Parses {@code 0x}-prefixed hex with an even number of digits.
     *
     * @throws IllegalArgumentException if the string is not valid hex data
     */
    @JsonCreator
    public static HexData of(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!Hex.hasPrefix(value)) {
            throw new IllegalArgumentException("Hex data must start with 0x: " + value);
        }
        return fromBytes(Hex.decode(value));
    }

    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    @JsonValue
    public String value() {
        String cached = hex;
        if (cached == null) {
            cached = Hex.encode(bytes);
            hex = cached;
        }
        return cached;
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public int byteLength() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    /**
     * Returns this payload followed by {@code other}.
     */
    public HexData concat(final HexData other) {
        Objects.requireNonNull(other, "other");
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        final byte[] joined = Arrays.copyOf(bytes, bytes.length + other.bytes.length);
        System.arraycopy(other.bytes, 0, joined, bytes.length, other.bytes.length);
        return new HexData(joined);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HexData)) {
            return false;
        }
        return Arrays.equals(bytes, ((HexData) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "HexData[" + value() + "]";
    }
}
