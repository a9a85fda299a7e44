// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes {@link RadiusDebug}-gated lines to the {@code io.radius.debug} logger.
 * Every line passes through {@link LogSanitizer} first.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.radius.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String line) {
        if (RadiusDebug.isRpcLoggingEnabled()) {
            emit(line);
        }
    }

    public static void logTx(final String line) {
        if (RadiusDebug.isTxLoggingEnabled()) {
            emit(line);
        }
    }

    private static void emit(final String line) {
        if (LOG.isInfoEnabled()) {
            LOG.info(LogSanitizer.sanitize(line));
        }
    }
}
