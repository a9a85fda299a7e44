// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

import io.radius.core.model.Receipt;

/**
 * Thrown when a deployment transaction succeeded but its receipt names no
 * created contract address.
 */
public final class DeploymentFailedException extends TxnException {

    private final Receipt receipt;

    public DeploymentFailedException(final Receipt receipt) {
        super("Deployment " + receipt.transactionHash().value() + " succeeded without a contract address");
        this.receipt = receipt;
    }

    public Receipt receipt() {
        return receipt;
    }
}
