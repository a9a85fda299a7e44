// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

/**
 * Base class for failures in the transaction lifecycle: completion, signing,
 * confirmation and deployment.
 */
public sealed class TxnException extends RadiusException
        permits IncompleteTransactionException,
        TransactionRevertedException,
        TransactionTimeoutException,
        DeploymentFailedException {

    public TxnException(final String message) {
        super(message);
    }

    public TxnException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
