// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.primitives;

import java.util.Arrays;

/**
 * Hex encoding and decoding with optional {@code 0x} prefixes.
 *
 * <p>Encoding always produces lowercase digits. Decoding accepts either case and
 * an optional {@code 0x}/{@code 0X} prefix.
 */
public final class Hex {
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLES = new int[128];

    static {
        Arrays.fill(NIBBLES, -1);
        for (int i = 0; i < 10; i++) {
            NIBBLES['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLES['a' + i] = 10 + i;
            NIBBLES['A' + i] = 10 + i;
        }
    }

    private Hex() {
    }

    /**
     * Decodes a hex string, with or without {@code 0x}, into bytes.
     *
     * @param hex the string to decode
     * @return decoded bytes, empty for {@code "0x"} or {@code ""}
     * @throws IllegalArgumentException if the input is null, odd-length or not hex
     */
    public static byte[] decode(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hasPrefix(hex) ? 2 : 0;
        final int digits = hex.length() - start;
        if ((digits & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hex);
        }
        final byte[] out = new byte[digits / 2];
        for (int i = 0; i < out.length; i++) {
            final int hi = nibble(hex.charAt(start + 2 * i), hex);
            final int lo = nibble(hex.charAt(start + 2 * i + 1), hex);
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    /**
     * Encodes bytes as a lowercase hex string with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return {@code 0x}-prefixed hex
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes bytes as a lowercase hex string without a prefix.
     *
     * @param bytes the bytes to encode
     * @return bare hex digits
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[2 * i] = DIGITS[v >>> 4];
            chars[2 * i + 1] = DIGITS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Strips a leading {@code 0x} if present.
     */
    public static String cleanPrefix(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(hex) ? hex.substring(2) : hex;
    }

    public static boolean hasPrefix(final String hex) {
        return hex != null
                && hex.length() >= 2
                && hex.charAt(0) == '0'
                && (hex.charAt(1) == 'x' || hex.charAt(1) == 'X');
    }

    private static int nibble(final char c, final String input) {
        if (c >= NIBBLES.length || NIBBLES[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + input);
        }
        return NIBBLES[c];
    }
}
