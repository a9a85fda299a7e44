// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import java.time.Duration;
import java.util.Objects;

import io.radius.core.error.ConfigurationException;

/**
 * How {@link RadiusClient#waitForTransaction} polls for a receipt.
 *
 * @param pollInterval delay between receipt queries
 * @param timeout      total time to wait before giving up
 */
public record ConfirmationPolicy(Duration pollInterval, Duration timeout) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public ConfirmationPolicy {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(timeout, "timeout");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new ConfigurationException("pollInterval must be positive: " + pollInterval);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new ConfigurationException("timeout must be positive: " + timeout);
        }
    }

    public static ConfirmationPolicy defaults() {
        return new ConfirmationPolicy(DEFAULT_POLL_INTERVAL, DEFAULT_TIMEOUT);
    }
}
