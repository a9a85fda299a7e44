// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jspecify.annotations.Nullable;

import io.radius.core.error.ConfigurationException;
import io.radius.core.model.BlockTag;
import io.radius.core.model.Receipt;
import io.radius.core.tx.Transaction;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;
import io.radius.core.types.Wei;

/**
 * Asynchronous access to a Radius node.
 *
 * <p>Every operation issues one JSON-RPC call on the client executor and
 * returns a {@link CompletableFuture}. Failures complete the future
 * exceptionally; {@code join()} surfaces them as the direct cause of a
 * {@link java.util.concurrent.CompletionException}.
 *
 * <pre>{@code
 * try (RadiusClient client = RadiusClient.builder("http://localhost:8545").build()) {
 *     long chainId = client.chainId().join();
 *     Wei balance = client.balanceAt(address).join();
 * }
 * }</pre>
 */
public interface RadiusClient extends AutoCloseable {

    static Builder builder(final String url) {
        return new Builder(Objects.requireNonNull(url, "url"), null);
    }

    static Builder builder(final RpcTransport transport) {
        return new Builder(null, Objects.requireNonNull(transport, "transport"));
    }

    CompletableFuture<Long> chainId();

    CompletableFuture<Wei> gasPrice();

    CompletableFuture<Long> blockNumber();

    default CompletableFuture<Wei> balanceAt(final Address address) {
        return balanceAt(address, BlockTag.LATEST);
    }

    CompletableFuture<Wei> balanceAt(Address address, BlockTag block);

    /**
     * The next nonce including pending transactions.
     */
    default CompletableFuture<Long> pendingNonceAt(final Address address) {
        return nonceAt(address, BlockTag.PENDING);
    }

    CompletableFuture<Long> nonceAt(Address address, BlockTag block);

    default CompletableFuture<HexData> codeAt(final Address address) {
        return codeAt(address, BlockTag.LATEST);
    }

    CompletableFuture<HexData> codeAt(Address address, BlockTag block);

    default CompletableFuture<HexData> call(final Transaction tx, final BlockTag block) {
        return call(null, tx, block);
    }

    /**
     * Executes {@code tx} against state at {@code block} without broadcasting.
     *
     * @param from caller address, or {@code null} if unknown
     */
    CompletableFuture<HexData> call(@Nullable Address from, Transaction tx, BlockTag block);

    default CompletableFuture<Long> estimateGas(final Transaction tx) {
        return estimateGas(null, tx);
    }

    CompletableFuture<Long> estimateGas(@Nullable Address from, Transaction tx);

    CompletableFuture<Hash> sendRawTransaction(HexData raw);

    /**
     * Empty while the transaction is unknown or not yet mined.
     */
    CompletableFuture<Optional<Receipt>> transactionReceipt(Hash hash);

    /**
     * Polls with the client's {@link ConfirmationPolicy}.
     *
     * @see ConfirmationPoller
     */
    CompletableFuture<Receipt> waitForTransaction(Hash hash);

    CompletableFuture<Receipt> waitForTransaction(Hash hash, Duration timeout, Duration pollInterval);

    ConfirmationPolicy confirmationPolicy();

    /**
     * The executor async work runs on; callers may schedule CPU work such as
     * signing here too.
     */
    Executor executor();

    /**
     * Closes the transport and shuts down an executor the client created.
     */
    @Override
    void close();

    final class Builder {
        private final @Nullable String url;
        private @Nullable RpcTransport transport;
        private @Nullable Executor executor;
        private ConfirmationPolicy confirmation = ConfirmationPolicy.defaults();

        private Builder(final @Nullable String url, final @Nullable RpcTransport transport) {
            this.url = url;
            this.transport = transport;
        }

        /**
         * Replaces the HTTP transport the url would otherwise create.
         */
        public Builder transport(final RpcTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        /**
         * Runs calls on {@code executor}. The client does not shut it down.
         */
        public Builder executor(final Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public Builder confirmation(final ConfirmationPolicy confirmation) {
            this.confirmation = Objects.requireNonNull(confirmation, "confirmation");
            return this;
        }

        /**
         * @throws ConfigurationException if the url is blank or malformed
         */
        public RadiusClient build() {
            final RpcTransport resolved = transport != null ? transport : RpcTransport.http(requireUrl());
            if (executor != null) {
                return new DefaultRadiusClient(resolved, executor, false, confirmation);
            }
            return new DefaultRadiusClient(resolved, RadiusExecutors.newIoExecutor(), true, confirmation);
        }

        private String requireUrl() {
            if (url == null || url.isBlank()) {
                throw new ConfigurationException("RPC url must not be blank");
            }
            return url;
        }
    }
}
