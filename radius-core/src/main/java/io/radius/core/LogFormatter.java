// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core;

import java.util.Locale;

/**
 * Builds the one-line bracketed records written by {@link DebugLogger}, e.g.
 * {@code [TX-HASH] hash=0x1234...abcd duration=0.93ms}. Long hex values are
 * shortened to their first six and last four characters.
 */
public final class LogFormatter {

    private static final int PREFIX = 6;
    private static final int SUFFIX = 4;

    private LogFormatter() {
    }

    public static String formatRpc(final String method, final long durationMicros) {
        return "[RPC] method=" + method + " " + duration(durationMicros);
    }

    public static String formatRpcError(
            final String method, final int code, final String message, final long durationMicros) {
        return "[RPC-ERROR] method=" + method + " code=" + code + " message=" + message + " "
                + duration(durationMicros);
    }

    public static String formatTxSend(
            final String from, final String to, final long nonce, final long gasLimit, final String value) {
        return "[TX-SEND] from=" + shortenHash(from) + " to=" + (to == null ? "(create)" : shortenHash(to))
                + " nonce=" + nonce + " gasLimit=" + gasLimit + " value=" + value;
    }

    public static String formatTxHash(final String hash, final long durationMicros) {
        return "[TX-HASH] hash=" + shortenHash(hash) + " " + duration(durationMicros);
    }

    public static String formatTxWait(final String hash, final long timeoutMillis) {
        final String timeout = timeoutMillis < 1000
                ? timeoutMillis + "ms"
                : String.format(Locale.ROOT, "%.1fs", timeoutMillis / 1000.0);
        return "[TX-WAIT] hash=" + shortenHash(hash) + " timeout=" + timeout;
    }

    public static String formatTxReceipt(final String hash, final long block, final boolean status) {
        return "[TX-RECEIPT] hash=" + shortenHash(hash) + " block=" + block + " status="
                + (status ? "SUCCESS" : "FAILED");
    }

    static String shortenHash(final String value) {
        if (value == null || value.length() <= PREFIX + SUFFIX + 3) {
            return value;
        }
        return value.substring(0, PREFIX) + "..." + value.substring(value.length() - SUFFIX);
    }

    private static String duration(final long micros) {
        final double ms = micros / 1000.0;
        return ms < 1000
                ? String.format(Locale.ROOT, "duration=%.2fms", ms)
                : String.format(Locale.ROOT, "duration=%.2fs", ms / 1000.0);
    }
}
