// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core;

/**
 * Process-wide switches for verbose RPC and transaction logging.
 *
 * <p>Flags are volatile; {@link #isEnabled()} reads both without locking,
 * which is acceptable for best-effort logging.
 */
public final class RadiusDebug {

    private static volatile boolean rpcLogging;
    private static volatile boolean txLogging;

    private RadiusDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || txLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        txLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }
}
