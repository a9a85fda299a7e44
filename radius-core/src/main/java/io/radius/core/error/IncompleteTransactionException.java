// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

/**
 * Thrown when a transaction is handed to a signer without a field it requires.
 */
public final class IncompleteTransactionException extends TxnException {

    private final String field;

    public IncompleteTransactionException(final String field) {
        super("Transaction must have a " + field + " before signing");
        this.field = field;
    }

    public String field() {
        return field;
    }
}
