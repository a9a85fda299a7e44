// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core;

import java.util.regex.Pattern;

/**
 * Scrubs debug payloads before they reach a log sink: redacts
 * {@code "privateKey"} and {@code "raw"} JSON values and truncates long lines.
 */
public final class LogSanitizer {

    static final int MAX_LOG_LENGTH = 2000;
    static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern PRIVATE_KEY = Pattern.compile("\"privateKey\"\\s*:\\s*\"[^\"]*\"");
    private static final Pattern RAW = Pattern.compile("\"raw\"\\s*:\\s*\"[^\"]*\"");

    private LogSanitizer() {
    }

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }
        String out = input;
        if (out.contains("\"privateKey\"")) {
            out = PRIVATE_KEY.matcher(out).replaceAll("\"privateKey\":\"***[REDACTED]***\"");
        }
        if (out.contains("\"raw\"")) {
            out = RAW.matcher(out).replaceAll("\"raw\":\"***[REDACTED]***\"");
        }
        if (out.length() > MAX_LOG_LENGTH) {
            out = out.substring(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length()) + TRUNCATION_SUFFIX;
        }
        return out;
    }
}
