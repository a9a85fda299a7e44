// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import io.radius.primitives.Hex;

/**
 * A 32-byte identifier for transactions, blocks and log topics.
 */
public record Hash(@JsonValue String value) {

    public static final int BYTE_LENGTH = 32;
    private static final Pattern FORMAT = HexValidator.ofBytes(BYTE_LENGTH);

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException(
                    "Hash must be exactly " + BYTE_LENGTH + " bytes, got "
                            + (bytes == null ? "null" : bytes.length));
        }
        return new Hash(Hex.encode(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
