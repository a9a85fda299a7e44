// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import io.radius.core.types.Address;
import io.radius.core.types.Hash;

/**
 * The outcome of a mined transaction.
 *
 * @param transactionHash   hash of the transaction
 * @param blockHash         containing block
 * @param blockNumber       containing block height
 * @param from              sender
 * @param to                recipient, {@code null} for contract creation
 * @param contractAddress   created contract, {@code null} unless this was a creation
 * @param gasUsed           gas consumed by this transaction
 * @param cumulativeGasUsed gas consumed in the block up to and including this transaction
 * @param status            {@code true} if execution succeeded
 * @param events            logs in emission order
 */
public record Receipt(
        Hash transactionHash,
        Hash blockHash,
        long blockNumber,
        Address from,
        @Nullable Address to,
        @Nullable Address contractAddress,
        long gasUsed,
        long cumulativeGasUsed,
        boolean status,
        List<Event> events) {

    public Receipt {
        Objects.requireNonNull(transactionHash, "transactionHash");
        Objects.requireNonNull(blockHash, "blockHash");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(events, "events");
        events = List.copyOf(events);
    }

    public Optional<Address> deployedAddress() {
        return Optional.ofNullable(contractAddress);
    }
}
