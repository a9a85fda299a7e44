// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;

/**
 * A log record emitted by a contract during execution.
 *
 * <p>{@code topics[0]} is the event signature hash for non-anonymous events;
 * the remaining topics hold indexed parameters. Block fields may be absent on
 * pending logs.
 */
public record Event(
        Address address,
        List<Hash> topics,
        HexData data,
        @Nullable Hash blockHash,
        long blockNumber,
        Hash transactionHash,
        long transactionIndex,
        long logIndex,
        boolean removed) {

    public Event {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(topics, "topics");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(transactionHash, "transactionHash");
        topics = List.copyOf(topics);
    }

    public Optional<Hash> signatureTopic() {
        return topics.isEmpty() ? Optional.empty() : Optional.of(topics.get(0));
    }
}
