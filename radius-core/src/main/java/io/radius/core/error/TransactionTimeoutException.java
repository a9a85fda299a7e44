// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

import java.time.Duration;

import io.radius.core.types.Hash;

/**
 * Thrown when no receipt appeared within the confirmation window.
 *
 * <p>This outcome is inconclusive: the transaction was broadcast and may still
 * be mined later. Callers should query the receipt again rather than resend.
 */
public final class TransactionTimeoutException extends TxnException {

    private final Hash transactionHash;
    private final Duration timeout;

    public TransactionTimeoutException(final Hash transactionHash, final Duration timeout) {
        super("No receipt for " + transactionHash.value() + " after " + timeout.toMillis()
                + " ms; the transaction may still be mined");
        this.transactionHash = transactionHash;
        this.timeout = timeout;
    }

    public Hash transactionHash() {
        return transactionHash;
    }

    public Duration timeout() {
        return timeout;
    }
}
