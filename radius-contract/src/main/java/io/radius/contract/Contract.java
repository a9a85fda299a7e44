// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.contract;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import io.radius.core.abi.Abi;
import io.radius.core.crypto.Signer;
import io.radius.core.error.AbiDecodingException;
import io.radius.core.error.ConfigurationException;
import io.radius.core.error.DeploymentFailedException;
import io.radius.core.model.BlockTag;
import io.radius.core.model.Event;
import io.radius.core.model.Receipt;
import io.radius.core.tx.Transaction;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;
import io.radius.rpc.RadiusClient;

/**
 * A deployed contract: its address and ABI. Stateless apart from those two,
 * so one instance can be shared across clients and threads.
 *
 * <pre>{@code
 * Contract token = new Contract(tokenAddress, Abi.fromJson(abiJson));
 * BigInteger balance = (BigInteger) token.call(client, "balanceOf", holder).join().get(0);
 * Receipt receipt = token.execute(client, signer, "transfer", recipient, amount).join();
 * }</pre>
 */
public final class Contract {

    private final Address address;
    private final Abi abi;

    /**
     * @throws ConfigurationException if the address is zero or the ABI is null
     */
    public Contract(final Address address, final Abi abi) {
        if (address == null || address.isZero()) {
            throw new ConfigurationException("Contract address must be non-zero");
        }
        if (abi == null) {
            throw new ConfigurationException("Contract ABI is required");
        }
        this.address = address;
        this.abi = abi;
    }

    /**
     * Deploys {@code bytecode} with ABI-encoded constructor arguments appended
     * and waits for the receipt.
     *
     * <p>The returned future fails with {@link DeploymentFailedException} if
     * the receipt is successful but carries no contract address.
     */
    public static CompletableFuture<Contract> deploy(
            final RadiusClient client,
            final Signer signer,
            final HexData bytecode,
            final Abi abi,
            final Object... args) {
        Objects.requireNonNull(bytecode, "bytecode");
        if (abi == null) {
            throw new ConfigurationException("Contract ABI is required");
        }
        final Transaction tx = Transaction.builder()
                .data(bytecode.concat(abi.encodeConstructor(args)))
                .build();
        return new TransactionOrchestrator(client).execute(signer, tx)
                .thenApply(receipt -> new Contract(
                        receipt.deployedAddress().orElseThrow(() -> new DeploymentFailedException(receipt)),
                        abi));
    }

    public Address address() {
        return address;
    }

    public Abi abi() {
        return abi;
    }

    public CompletableFuture<List<Object>> call(
            final RadiusClient client, final String method, final Object... args) {
        return call(client, BlockTag.LATEST, method, args);
    }

    /**
     * Read-only call via {@code eth_call} at {@code block}; nothing is signed
     * or broadcast.
     */
    public CompletableFuture<List<Object>> call(
            final RadiusClient client, final BlockTag block, final String method, final Object... args) {
        final HexData data = abi.encodeFunction(method, args);
        final Transaction tx = Transaction.builder().to(address).data(data).build();
        return client.call(tx, block).thenApply(result -> abi.decodeFunctionResult(method, result));
    }

    /**
     * Sends a state-changing call through {@link TransactionOrchestrator#execute}.
     */
    public CompletableFuture<Receipt> execute(
            final RadiusClient client, final Signer signer, final String method, final Object... args) {
        return new TransactionOrchestrator(client).execute(signer, invocation(method, args));
    }

    /**
     * Like {@link #execute} but returns once the node has accepted the
     * transaction.
     */
    public CompletableFuture<Hash> submit(
            final RadiusClient client, final Signer signer, final String method, final Object... args) {
        return new TransactionOrchestrator(client).send(signer, invocation(method, args));
    }

    /**
     * Decodes every event in {@code receipt} emitted by this contract whose
     * topic 0 matches {@code eventName}. Parameters are in declaration order.
     *
     * @throws AbiDecodingException if the ABI has no such event
     */
    public List<List<Object>> decodeEvents(final Receipt receipt, final String eventName) {
        Objects.requireNonNull(receipt, "receipt");
        final Hash topic = abi.eventTopicOf(eventName).orElseThrow(
                () -> new AbiDecodingException("Unknown event: " + eventName));
        final List<List<Object>> decoded = new ArrayList<>();
        for (Event event : receipt.events()) {
            if (address.equals(event.address()) && event.signatureTopic().filter(topic::equals).isPresent()) {
                decoded.add(abi.decodeEvent(eventName, event));
            }
        }
        return decoded;
    }

    private Transaction invocation(final String method, final Object... args) {
        return Transaction.builder().to(address).data(abi.encodeFunction(method, args)).build();
    }

    @Override
    public String toString() {
        return "Contract[" + address + "]";
    }
}
