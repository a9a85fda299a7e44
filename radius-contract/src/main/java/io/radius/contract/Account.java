// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.contract;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

import io.radius.core.crypto.PrivateKeySigner;
import io.radius.core.crypto.Signature;
import io.radius.core.crypto.Signer;
import io.radius.core.error.ConfigurationException;
import io.radius.core.model.Receipt;
import io.radius.core.tx.SignedTransaction;
import io.radius.core.tx.Transaction;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.Wei;
import io.radius.rpc.RadiusClient;

/**
 * An address bound to a {@link Signer}. The client is passed to each call, so
 * one account can be used against several nodes.
 *
 * <pre>{@code
 * Account account = Account.builder().privateKey(hex, chainId).build();
 * Receipt receipt = account.send(client, recipient, Wei.fromEther(new BigDecimal("0.1"))).join();
 * }</pre>
 */
public final class Account {

    private final Signer signer;

    private Account(final Signer signer) {
        this.signer = signer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Address address() {
        return signer.address();
    }

    public Signer signer() {
        return signer;
    }

    public CompletableFuture<Wei> balance(final RadiusClient client) {
        return client.balanceAt(address());
    }

    /**
     * The pending nonce, so transactions still in the pool are counted.
     */
    public CompletableFuture<Long> nonce(final RadiusClient client) {
        return client.pendingNonceAt(address());
    }

    /**
     * Transfers {@code amount} to {@code recipient} and waits for the receipt.
     */
    public CompletableFuture<Receipt> send(final RadiusClient client, final Address recipient, final Wei amount) {
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(amount, "amount");
        return sendTransaction(client, Transaction.builder().to(recipient).value(amount).build());
    }

    public CompletableFuture<Receipt> sendTransaction(final RadiusClient client, final Transaction tx) {
        return new TransactionOrchestrator(client).execute(signer, tx);
    }

    /**
     * Sends {@code tx} and returns its hash as soon as the node accepts it.
     */
    public CompletableFuture<Hash> submit(final RadiusClient client, final Transaction tx) {
        return new TransactionOrchestrator(client).send(signer, tx);
    }

    /**
     * Signs locally. Missing fields are not filled in here.
     *
     * @throws io.radius.core.error.IncompleteTransactionException if nonce, gas limit or
     *         (without a signer fallback) gas price is missing
     */
    public SignedTransaction signTransaction(final Transaction tx) {
        return signer.signTransaction(tx);
    }

    public Signature signMessage(final byte[] message) {
        return signer.signMessage(message);
    }

    @Override
    public String toString() {
        return "Account[" + address() + "]";
    }

    public static final class Builder {
        private @Nullable Signer signer;

        private Builder() {
        }

        public Builder signer(final Signer signer) {
            this.signer = Objects.requireNonNull(signer, "signer");
            return this;
        }

        /**
         * Shorthand for a {@link PrivateKeySigner}.
         *
         * @throws ConfigurationException if the key is invalid
         */
        public Builder privateKey(final String hex, final long chainId) {
            this.signer = PrivateKeySigner.builder().privateKey(hex).chainId(chainId).build();
            return this;
        }

        public Account build() {
            if (signer == null) {
                throw new ConfigurationException("signer is required");
            }
            return new Account(signer);
        }
    }
}
