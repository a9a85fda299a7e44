// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.tx;

import java.util.Objects;

import io.radius.core.types.Hash;
import io.radius.core.types.HexData;

/**
 * A signed envelope ready for {@code eth_sendRawTransaction}.
 *
 * @param hash        keccak-256 of {@code raw}
 * @param raw         the RLP envelope
 * @param transaction the transaction that was signed
 */
public record SignedTransaction(Hash hash, HexData raw, LegacyTransaction transaction) {

    public SignedTransaction {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(transaction, "transaction");
    }
}
