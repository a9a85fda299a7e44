// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import io.radius.core.tx.LegacyTransaction;
import io.radius.core.tx.SignedTransaction;
import io.radius.core.tx.Transaction;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.Wei;

/**
 * Produces signatures for one address on one chain.
 *
 * <p>Implementations bind their chain id once when built and never fetch it
 * again. {@link #address()} must not perform I/O. Implementations are safe for
 * concurrent use.
 */
public interface Signer {

    Address address();

    long chainId();

    /**
     * The EIP-155 signing hash of {@code tx} for {@link #chainId()}.
     */
    default Hash hash(final LegacyTransaction tx) {
        return Hash.fromBytes(Keccak256.hash(tx.encodeForSigning(chainId())));
    }

    SignedTransaction signTransaction(LegacyTransaction tx);

    /**
     * Signs a partially specified transaction. Nonce and gas limit must be set;
     * a missing gas price is replaced by {@link #fallbackGasPrice()} when this
     * signer has one.
     *
     * @throws io.radius.core.error.IncompleteTransactionException if a required field is absent
     */
    default SignedTransaction signTransaction(final Transaction tx) {
        return signTransaction(tx.toLegacy(fallbackGasPrice().orElse(null)));
    }

    /**
     * Gas price used for transactions that arrive without one.
     */
    default Optional<Wei> fallbackGasPrice() {
        return Optional.empty();
    }

    /**
     * Signs {@code message} as an EIP-191 personal message. The result has
     * {@code v} of 27 or 28.
     */
    Signature signMessage(byte[] message);

    /**
     * Keccak-256 of the EIP-191 version 0x45 prefix, the decimal length and the message.
     */
    static byte[] personalMessageHash(final byte[] message) {
        final byte[] prefix = ("\u0019Ethereum Signed Message:\n" + message.length)
                .getBytes(StandardCharsets.UTF_8);
        return Keccak256.hash(prefix, message);
    }
}
