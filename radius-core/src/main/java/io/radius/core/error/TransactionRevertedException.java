// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

import io.radius.core.model.Receipt;

/**
 * Thrown when a transaction was mined but its execution reverted
 * ({@code status = 0}). The receipt is kept for diagnostics.
 */
public final class TransactionRevertedException extends TxnException {

    private final Receipt receipt;

    public TransactionRevertedException(final Receipt receipt) {
        super("Transaction " + receipt.transactionHash().value() + " reverted in block " + receipt.blockNumber());
        this.receipt = receipt;
    }

    public Receipt receipt() {
        return receipt;
    }
}
