// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.primitives.rlp;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Recursive Length Prefix encoding as used by Ethereum transaction envelopes.
 *
 * <p>Strings of a single byte below {@code 0x80} encode as themselves. Other
 * strings take a {@code 0x80 + len} header up to 55 bytes and a
 * {@code 0xb7 + lenOfLen} header beyond. Lists use {@code 0xc0}/{@code 0xf7}
 * in the same way. Decoding rejects non-canonical length prefixes.
 *
 * @see <a href="https://ethereum.org/en/developers/docs/data-structures-and-encoding/rlp/">RLP</a>
 */
public final class Rlp {

    private static final int SHORT_LIMIT = 55;
    private static final int STRING_OFFSET = 0x80;
    private static final int LONG_STRING_OFFSET = 0xB7;
    private static final int LIST_OFFSET = 0xC0;
    private static final int LONG_LIST_OFFSET = 0xF7;

    private Rlp() {
    }

    public static byte[] encode(final RlpItem item) {
        Objects.requireNonNull(item, "item cannot be null");
        return item.encode();
    }

    public static byte[] encodeString(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length == 1 && (bytes[0] & 0xFF) < STRING_OFFSET) {
            return new byte[] {bytes[0]};
        }
        return withHeader(bytes, STRING_OFFSET, LONG_STRING_OFFSET);
    }

    public static byte[] encodeList(final List<RlpItem> items) {
        Objects.requireNonNull(items, "items cannot be null");
        final ByteArrayOutputStream payload = new ByteArrayOutputStream();
        for (RlpItem item : items) {
            Objects.requireNonNull(item, "items cannot contain null values");
            payload.writeBytes(item.encode());
        }
        return withHeader(payload.toByteArray(), LIST_OFFSET, LONG_LIST_OFFSET);
    }

    /**
     * Decodes a single RLP item that must span the whole input.
     *
     * @throws IllegalArgumentException on truncated, non-canonical or trailing data
     */
    public static RlpItem decode(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        final Cursor cursor = new Cursor(encoded, 0, encoded.length);
        final RlpItem item = cursor.next();
        if (cursor.position != encoded.length) {
            throw new IllegalArgumentException("RLP data has trailing bytes");
        }
        return item;
    }

    /**
     * Decodes input whose root must be a list.
     */
    public static RlpList decodeList(final byte[] encoded) {
        final RlpItem item = decode(encoded);
        if (item instanceof RlpList list) {
            return list;
        }
        throw new IllegalArgumentException("RLP data is not a list");
    }

    private static byte[] withHeader(final byte[] payload, final int shortOffset, final int longOffset) {
        final int length = payload.length;
        if (length <= SHORT_LIMIT) {
            final byte[] out = new byte[1 + length];
            out[0] = (byte) (shortOffset + length);
            System.arraycopy(payload, 0, out, 1, length);
            return out;
        }
        final byte[] lengthBytes = bigEndian(length);
        final byte[] out = new byte[1 + lengthBytes.length + length];
        out[0] = (byte) (longOffset + lengthBytes.length);
        System.arraycopy(lengthBytes, 0, out, 1, lengthBytes.length);
        System.arraycopy(payload, 0, out, 1 + lengthBytes.length, length);
        return out;
    }

    private static byte[] bigEndian(final int value) {
        final int size = (32 - Integer.numberOfLeadingZeros(value) + 7) / 8;
        final byte[] out = new byte[size];
        for (int i = 0; i < size; i++) {
            out[size - 1 - i] = (byte) (value >>> (8 * i));
        }
        return out;
    }

    private static final class Cursor {
        private final byte[] data;
        private final int end;
        private int position;

        Cursor(final byte[] data, final int start, final int end) {
            this.data = data;
            this.position = start;
            this.end = end;
        }

        RlpItem next() {
            if (position >= end) {
                throw new IllegalArgumentException("Invalid RLP data: offset beyond end");
            }
            final int prefix = data[position] & 0xFF;
            if (prefix < STRING_OFFSET) {
                return RlpString.wrap(new byte[] {data[position++]});
            }
            if (prefix < LIST_OFFSET) {
                final boolean isLong = prefix > LONG_STRING_OFFSET;
                final int length = readLength(prefix, STRING_OFFSET, LONG_STRING_OFFSET, isLong);
                final byte[] value = take(length);
                if (!isLong && length == 1 && (value[0] & 0xFF) < STRING_OFFSET) {
                    throw new IllegalArgumentException("Non-canonical single byte encoding");
                }
                return RlpString.wrap(value);
            }
            final boolean isLong = prefix > LONG_LIST_OFFSET;
            final int length = readLength(prefix, LIST_OFFSET, LONG_LIST_OFFSET, isLong);
            if (position + length > end) {
                throw new IllegalArgumentException("Invalid RLP list length");
            }
            final Cursor inner = new Cursor(data, position, position + length);
            final List<RlpItem> items = new ArrayList<>();
            while (inner.position < inner.end) {
                items.add(inner.next());
            }
            position += length;
            return new RlpList(items);
        }

        private int readLength(final int prefix, final int shortOffset, final int longOffset, final boolean isLong) {
            position++;
            if (!isLong) {
                return prefix - shortOffset;
            }
            final int lengthOfLength = prefix - longOffset;
            if (lengthOfLength > 4) {
                throw new IllegalArgumentException("Invalid length-of-length: " + lengthOfLength);
            }
            final byte[] raw = take(lengthOfLength);
            if (raw[0] == 0) {
                throw new IllegalArgumentException("Length has leading zeros");
            }
            int length = 0;
            for (byte b : raw) {
                length = (length << 8) | (b & 0xFF);
            }
            if (length <= SHORT_LIMIT || length < 0) {
                throw new IllegalArgumentException("Non-minimal length encoding");
            }
            return length;
        }

        private byte[] take(final int length) {
            if (position + length > end) {
                throw new IllegalArgumentException("Invalid RLP string length");
            }
            final byte[] out = Arrays.copyOfRange(data, position, position + length);
            position += length;
            return out;
        }
    }
}
