// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.radius.core.DebugLogger;
import io.radius.core.LogFormatter;
import io.radius.core.error.TransactionRevertedException;
import io.radius.core.error.TransactionTimeoutException;
import io.radius.core.model.Receipt;
import io.radius.core.types.Hash;

/**
 * Polls for a receipt until it appears, reverts, or the policy timeout passes.
 *
 * <p>Each attempt is scheduled on {@link CompletableFuture#delayedExecutor};
 * no thread sleeps between attempts. The deadline is measured on a monotonic
 * clock and a timeout is only raised by an attempt that starts after it.
 * Cancelling the returned future stops further attempts.
 */
public final class ConfirmationPoller {

    private static final Logger LOG = LoggerFactory.getLogger(ConfirmationPoller.class);

    private final Function<Hash, CompletableFuture<Optional<Receipt>>> fetcher;
    private final Executor executor;
    private final LongSupplier nanoTime;

    public ConfirmationPoller(
            final Function<Hash, CompletableFuture<Optional<Receipt>>> fetcher, final Executor executor) {
        this(fetcher, executor, System::nanoTime);
    }

    ConfirmationPoller(
            final Function<Hash, CompletableFuture<Optional<Receipt>>> fetcher,
            final Executor executor,
            final LongSupplier nanoTime) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
    }

    /**
     * Completes with a successful receipt, or exceptionally with
     * {@link TransactionRevertedException}, {@link TransactionTimeoutException}
     * or the RPC failure of a receipt query.
     */
    public CompletableFuture<Receipt> await(final Hash hash, final ConfirmationPolicy policy) {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(policy, "policy");
        final CompletableFuture<Receipt> result = new CompletableFuture<>();
        final long deadline = nanoTime.getAsLong() + policy.timeout().toNanos();
        DebugLogger.logTx(LogFormatter.formatTxWait(hash.value(), policy.timeout().toMillis()));
        attempt(hash, policy, deadline, 1, result);
        return result;
    }

    private void attempt(
            final Hash hash,
            final ConfirmationPolicy policy,
            final long deadline,
            final int attempt,
            final CompletableFuture<Receipt> result) {
        if (result.isDone()) {
            return;
        }
        final CompletableFuture<Optional<Receipt>> query;
        try {
            query = fetcher.apply(hash);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        query.whenComplete((receipt, error) -> {
            if (result.isDone()) {
                return;
            }
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            if (receipt.isPresent()) {
                final Receipt found = receipt.get();
                DebugLogger.logTx(LogFormatter.formatTxReceipt(hash.value(), found.blockNumber(), found.status()));
                if (found.status()) {
                    result.complete(found);
                } else {
                    result.completeExceptionally(new TransactionRevertedException(found));
                }
                return;
            }
            if (nanoTime.getAsLong() - deadline >= 0) {
                result.completeExceptionally(new TransactionTimeoutException(hash, policy.timeout()));
                return;
            }
            LOG.debug("No receipt for {} after attempt {}; retrying in {}", hash, attempt, policy.pollInterval());
            final Executor delayed = CompletableFuture.delayedExecutor(
                    policy.pollInterval().toNanos(), TimeUnit.NANOSECONDS, executor);
            try {
                delayed.execute(() -> attempt(hash, policy, deadline, attempt + 1, result));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
    }

    private static Throwable unwrap(final Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
