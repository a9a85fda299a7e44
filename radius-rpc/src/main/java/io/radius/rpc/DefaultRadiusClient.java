// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.radius.core.DebugLogger;
import io.radius.core.LogFormatter;
import io.radius.core.error.RpcException;
import io.radius.core.model.BlockTag;
import io.radius.core.model.Receipt;
import io.radius.core.tx.Transaction;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;
import io.radius.core.types.Wei;
import io.radius.rpc.internal.ReceiptParser;
import io.radius.rpc.internal.RpcUtils;

final class DefaultRadiusClient implements RadiusClient {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultRadiusClient.class);

    private final RpcTransport transport;
    private final Executor executor;
    private final boolean ownsExecutor;
    private final ConfirmationPolicy confirmation;
    private final ConfirmationPoller poller;
    private final AtomicBoolean closed = new AtomicBoolean();

    DefaultRadiusClient(
            final RpcTransport transport,
            final Executor executor,
            final boolean ownsExecutor,
            final ConfirmationPolicy confirmation) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
        this.confirmation = Objects.requireNonNull(confirmation, "confirmation");
        this.poller = new ConfirmationPoller(this::transactionReceipt, executor);
    }

    @Override
    public CompletableFuture<Long> chainId() {
        return async(() -> RpcUtils.decodeLong(requireResult("eth_chainId", List.of())), "eth_chainId");
    }

    @Override
    public CompletableFuture<Wei> gasPrice() {
        return async(() -> Wei.of(RpcUtils.decodeQuantity(requireResult("eth_gasPrice", List.of()))),
                "eth_gasPrice");
    }

    @Override
    public CompletableFuture<Long> blockNumber() {
        return async(() -> RpcUtils.decodeLong(requireResult("eth_blockNumber", List.of())), "eth_blockNumber");
    }

    @Override
    public CompletableFuture<Wei> balanceAt(final Address address, final BlockTag block) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(block, "block");
        return async(() -> Wei.of(RpcUtils.decodeQuantity(
                requireResult("eth_getBalance", List.of(address.value(), block.toRpcValue())))),
                "eth_getBalance");
    }

    @Override
    public CompletableFuture<Long> nonceAt(final Address address, final BlockTag block) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(block, "block");
        return async(() -> RpcUtils.decodeLong(
                requireResult("eth_getTransactionCount", List.of(address.value(), block.toRpcValue()))),
                "eth_getTransactionCount");
    }

    @Override
    public CompletableFuture<HexData> codeAt(final Address address, final BlockTag block) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(block, "block");
        return async(() -> HexData.of(
                requireResult("eth_getCode", List.of(address.value(), block.toRpcValue())).toString()),
                "eth_getCode");
    }

    @Override
    public CompletableFuture<HexData> call(final @Nullable Address from, final Transaction tx, final BlockTag block) {
        Objects.requireNonNull(tx, "tx");
        Objects.requireNonNull(block, "block");
        final Map<String, Object> callObject = RpcUtils.toCallObject(from, tx);
        return async(() -> HexData.of(
                requireResult("eth_call", List.of(callObject, block.toRpcValue())).toString()),
                "eth_call");
    }

    @Override
    public CompletableFuture<Long> estimateGas(final @Nullable Address from, final Transaction tx) {
        Objects.requireNonNull(tx, "tx");
        final Map<String, Object> callObject = RpcUtils.toCallObject(from, tx);
        return async(() -> RpcUtils.decodeLong(requireResult("eth_estimateGas", List.of(callObject))),
                "eth_estimateGas");
    }

    @Override
    public CompletableFuture<Hash> sendRawTransaction(final HexData raw) {
        Objects.requireNonNull(raw, "raw");
        return async(() -> {
            final long start = System.nanoTime();
            final Hash hash = new Hash(requireResult("eth_sendRawTransaction", List.of(raw.value())).toString());
            DebugLogger.logTx(LogFormatter.formatTxHash(hash.value(), (System.nanoTime() - start) / 1_000L));
            return hash;
        }, "eth_sendRawTransaction");
    }

    @Override
    public CompletableFuture<Optional<Receipt>> transactionReceipt(final Hash hash) {
        Objects.requireNonNull(hash, "hash");
        return async(() -> {
            final JsonRpcResponse response = transport.send("eth_getTransactionReceipt", List.of(hash.value()));
            final Map<String, Object> map = response.resultAsMap();
            return map == null ? Optional.<Receipt>empty() : Optional.of(ReceiptParser.parseReceipt(map));
        }, "eth_getTransactionReceipt");
    }

    @Override
    public CompletableFuture<Receipt> waitForTransaction(final Hash hash) {
        return poller.await(hash, confirmation);
    }

    @Override
    public CompletableFuture<Receipt> waitForTransaction(
            final Hash hash, final Duration timeout, final Duration pollInterval) {
        return poller.await(hash, new ConfirmationPolicy(pollInterval, timeout));
    }

    @Override
    public ConfirmationPolicy confirmationPolicy() {
        return confirmation;
    }

    @Override
    public Executor executor() {
        return executor;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            transport.close();
        } catch (Exception e) {
            LOG.warn("Failed to close RPC transport", e);
        }
        if (ownsExecutor && executor instanceof ExecutorService) {
            ((ExecutorService) executor).shutdown();
        }
    }

    private Object requireResult(final String method, final List<?> params) {
        final Object result = transport.send(method, params).result();
        if (result == null) {
            throw RpcException.nullResult(method);
        }
        return result;
    }

    /**
     * Runs {@code call} on the executor. Anything other than a
     * {@link RpcException} escaping the call means the node answered with a
     * value we could not interpret.
     */
    private <T> CompletableFuture<T> async(final Supplier<T> call, final String method) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("RadiusClient has been closed"));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.get();
            } catch (RpcException e) {
                throw e;
            } catch (IllegalArgumentException | ArithmeticException | ClassCastException e) {
                throw RpcException.malformedResult(method, e);
            }
        }, executor);
    }
}
