// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import io.radius.primitives.Hex;

/**
 * A 20-byte account identifier, held as a lowercase {@code 0x}-prefixed string.
 *
 * <p>Mixed-case (checksummed) input is accepted and normalised, so two
 * addresses are equal exactly when their raw bytes are equal.
 */
public record Address(@JsonValue String value) {

    public static final int BYTE_LENGTH = 20;
    private static final Pattern FORMAT = HexValidator.ofBytes(BYTE_LENGTH);

    /** The all-zero address. */
    public static final Address ZERO = new Address("0x" + "00".repeat(BYTE_LENGTH));

    public Address {
        Objects.requireNonNull(value, "address");
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException(
                    "Address must be exactly " + BYTE_LENGTH + " bytes, got "
                            + (bytes == null ? "null" : bytes.length));
        }
        return new Address(Hex.encode(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    @Override
    public String toString() {
        return value;
    }
}
