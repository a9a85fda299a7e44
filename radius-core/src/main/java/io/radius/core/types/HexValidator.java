// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for {@code 0x}-prefixed hex strings of a fixed byte width.
 */
final class HexValidator {

    private HexValidator() {
    }

    static Pattern ofBytes(final int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }
}
