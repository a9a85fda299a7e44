// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.contract;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.radius.core.DebugLogger;
import io.radius.core.LogFormatter;
import io.radius.core.crypto.Signer;
import io.radius.core.error.RpcException;
import io.radius.core.model.Receipt;
import io.radius.core.tx.LegacyTransaction;
import io.radius.core.tx.SignedTransaction;
import io.radius.core.tx.Transaction;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.Wei;
import io.radius.rpc.RadiusClient;

/**
 * Drives a transaction from a partial description to a confirmed receipt.
 *
 * <p>The lifecycle is:
 * <ol>
 * <li>fill the nonce from {@code eth_getTransactionCount(from, "pending")}</li>
 * <li>estimate gas and add a 20% margin, capped at {@link #MAX_GAS}</li>
 * <li>fill the gas price from {@code eth_gasPrice}, falling back to
 * {@link #DEFAULT_GAS_PRICE} when the node cannot answer</li>
 * <li>sign on the client executor</li>
 * <li>broadcast via {@code eth_sendRawTransaction}</li>
 * <li>optionally poll for the receipt</li>
 * </ol>
 * Fields already present on the transaction are kept as given.
 *
 * <p><strong>Nonces:</strong> sends are not serialised per address. Two
 * concurrent sends from the same account can read the same pending nonce;
 * callers that need ordering must serialise their own sends.
 */
public final class TransactionOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionOrchestrator.class);

    /** Gas price used when {@code eth_gasPrice} fails. */
    public static final Wei DEFAULT_GAS_PRICE = Wei.gwei(1);

    /** Estimates are raised by {@code estimate / GAS_MARGIN_DIVISOR}. */
    public static final long GAS_MARGIN_DIVISOR = 5;

    public static final long MAX_GAS = 1_319_413_953_330L;

    private final RadiusClient client;

    public TransactionOrchestrator(final RadiusClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public RadiusClient client() {
        return client;
    }

    /**
     * Fills nonce, gas limit and gas price, in that order. The gas estimate is
     * taken on the nonce-filled transaction.
     */
    public CompletableFuture<LegacyTransaction> complete(final Address from, final Transaction tx) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(tx, "tx");
        return fillNonce(from, tx)
                .thenCompose(withNonce -> fillGasLimit(from, withNonce))
                .thenCompose(this::fillGasPrice)
                .thenApply(filled -> filled.toLegacy(null));
    }

    /**
     * Completes, signs and broadcasts {@code tx} without waiting for it to be
     * mined.
     */
    public CompletableFuture<Hash> send(final Signer signer, final Transaction tx) {
        Objects.requireNonNull(signer, "signer");
        final Address from = signer.address();
        return complete(from, tx)
                .thenApplyAsync(legacy -> {
                    DebugLogger.logTx(LogFormatter.formatTxSend(
                            from.value(),
                            legacy.to() != null ? legacy.to().value() : null,
                            legacy.nonce(),
                            legacy.gasLimit(),
                            legacy.value().value().toString()));
                    return signer.signTransaction(legacy);
                }, client.executor())
                .thenCompose(this::broadcast);
    }

    /**
     * {@link #send} followed by {@link RadiusClient#waitForTransaction(Hash)}.
     * A reverted or unconfirmed transaction fails the future.
     */
    public CompletableFuture<Receipt> execute(final Signer signer, final Transaction tx) {
        return send(signer, tx).thenCompose(client::waitForTransaction);
    }

    /**
     * Broadcasts an already signed transaction and waits for its receipt.
     */
    public CompletableFuture<Receipt> transact(final SignedTransaction signed) {
        return broadcast(signed).thenCompose(client::waitForTransaction);
    }

    /**
     * Broadcasts an already signed transaction.
     */
    public CompletableFuture<Hash> broadcast(final SignedTransaction signed) {
        Objects.requireNonNull(signed, "signed");
        return client.sendRawTransaction(signed.raw());
    }

    static long withMargin(final long estimate) {
        if (estimate >= MAX_GAS) {
            return MAX_GAS;
        }
        return Math.min(estimate + estimate / GAS_MARGIN_DIVISOR, MAX_GAS);
    }

    private CompletableFuture<Transaction> fillNonce(final Address from, final Transaction tx) {
        if (tx.nonce().isPresent()) {
            return CompletableFuture.completedFuture(tx);
        }
        return client.pendingNonceAt(from).thenApply(tx::withNonce);
    }

    private CompletableFuture<Transaction> fillGasLimit(final Address from, final Transaction tx) {
        if (tx.gasLimit().isPresent()) {
            return CompletableFuture.completedFuture(tx);
        }
        return client.estimateGas(from, tx).thenApply(estimate -> {
            if (estimate <= 0) {
                throw RpcException.malformedResult("eth_estimateGas",
                        new IllegalArgumentException("gas estimate must be positive, got " + estimate));
            }
            return tx.withGasLimit(withMargin(estimate));
        });
    }

    private CompletableFuture<Transaction> fillGasPrice(final Transaction tx) {
        if (tx.gasPrice().isPresent()) {
            return CompletableFuture.completedFuture(tx);
        }
        return client.gasPrice().handle((price, error) -> {
            if (error != null) {
                LOG.warn("eth_gasPrice failed, using default of {} wei: {}",
                        DEFAULT_GAS_PRICE.value(), rootMessage(error));
                return tx.withGasPrice(DEFAULT_GAS_PRICE);
            }
            return tx.withGasPrice(price);
        });
    }

    private static String rootMessage(final Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
