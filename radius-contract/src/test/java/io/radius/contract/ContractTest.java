// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.contract;

import static io.radius.contract.TransactionOrchestratorTest.BLOCK_HASH;
import static io.radius.contract.TransactionOrchestratorTest.DIRECT;
import static io.radius.contract.TransactionOrchestratorTest.KEY;
import static io.radius.contract.TransactionOrchestratorTest.SENDER;
import static io.radius.contract.TransactionOrchestratorTest.TX_HASH;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.radius.core.abi.Abi;
import io.radius.core.crypto.PrivateKeySigner;
import io.radius.core.crypto.Signer;
import io.radius.core.error.AbiDecodingException;
import io.radius.core.error.ConfigurationException;
import io.radius.core.error.DeploymentFailedException;
import io.radius.core.error.MissingConstructorException;
import io.radius.core.model.BlockTag;
import io.radius.core.model.Event;
import io.radius.core.model.Receipt;
import io.radius.core.tx.Transaction;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;
import io.radius.core.types.Wei;
import io.radius.rpc.RadiusClient;

@ExtendWith(MockitoExtension.class)
class ContractTest {

    private static final String TOKEN_ABI = """
            [
              {"type":"constructor","inputs":[{"name":"supply","type":"uint256"}]},
              {"type":"function","name":"balanceOf","stateMutability":"view",
               "inputs":[{"name":"owner","type":"address"}],"outputs":[{"name":"","type":"uint256"}]},
              {"type":"function","name":"transfer","stateMutability":"nonpayable",
               "inputs":[{"name":"to","type":"address"},{"name":"amount","type":"uint256"}],
               "outputs":[{"name":"","type":"bool"}]},
              {"type":"event","name":"Transfer","anonymous":false,"inputs":[
                {"name":"from","type":"address","indexed":true},
                {"name":"to","type":"address","indexed":true},
                {"name":"value","type":"uint256","indexed":false}]}
            ]
            """;
    private static final Address TOKEN = new Address("0x" + "c".repeat(40));
    private static final Address HOLDER = new Address("0x" + "d".repeat(40));

    @Mock
    private RadiusClient client;

    private Abi abi;
    private Signer signer;

    @BeforeEach
    void setUp() {
        abi = Abi.fromJson(TOKEN_ABI);
        signer = PrivateKeySigner.builder().privateKey(KEY).chainId(1).build();
    }

    private static String word(final String hex) {
        return "0".repeat(64 - hex.length()) + hex;
    }

    private static Hash topicOf(final Address address) {
        return new Hash("0x" + word(address.value().substring(2)));
    }

    private static Receipt receipt(final Address to, final Address contractAddress, final List<Event> events) {
        return new Receipt(TX_HASH, BLOCK_HASH, 7, SENDER, to, contractAddress, 50_000, 50_000, true, events);
    }

    private static Event transferLog(final Address emitter, final long value) {
        return new Event(emitter,
                List.of(Abi.eventTopic("Transfer(address,address,uint256)"), topicOf(SENDER), topicOf(HOLDER)),
                HexData.of("0x" + word(Long.toHexString(value))),
                BLOCK_HASH, 7, TX_HASH, 0, 0, false);
    }

    @Test
    void rejectsZeroAddressAndMissingAbi() {
        assertThrows(ConfigurationException.class, () -> new Contract(Address.ZERO, abi));
        assertThrows(ConfigurationException.class, () -> new Contract(null, abi));
        assertThrows(ConfigurationException.class, () -> new Contract(TOKEN, null));
    }

    @Test
    void callEncodesAndDecodesWithoutSigning() {
        when(client.call(any(), eq(BlockTag.LATEST)))
                .thenReturn(CompletableFuture.completedFuture(HexData.of("0x" + word("3e8"))));

        final List<Object> result = new Contract(TOKEN, abi).call(client, "balanceOf", HOLDER).join();

        assertEquals(List.of(BigInteger.valueOf(1000)), result);
        final ArgumentCaptor<Transaction> sent = ArgumentCaptor.forClass(Transaction.class);
        verify(client).call(sent.capture(), eq(BlockTag.LATEST));
        assertEquals(TOKEN, sent.getValue().to().orElseThrow());
        assertEquals(abi.encodeFunction("balanceOf", HOLDER), sent.getValue().data());
        verify(client, never()).sendRawTransaction(any());
        verify(client, never()).pendingNonceAt(any());
    }

    @Test
    void callHonoursBlockTag() {
        final BlockTag block = BlockTag.of(42);
        when(client.call(any(), eq(block))).thenReturn(CompletableFuture.completedFuture(HexData.EMPTY));

        assertEquals(List.of(), new Contract(TOKEN, abi).call(client, block, "balanceOf", HOLDER).join());
    }

    @Test
    void executeRunsTheFullLifecycle() {
        final Receipt mined = receipt(TOKEN, null, List.of());
        when(client.executor()).thenReturn(DIRECT);
        when(client.pendingNonceAt(SENDER)).thenReturn(CompletableFuture.completedFuture(1L));
        when(client.estimateGas(eq(SENDER), any())).thenReturn(CompletableFuture.completedFuture(40_000L));
        when(client.gasPrice()).thenReturn(CompletableFuture.completedFuture(Wei.gwei(2)));
        when(client.sendRawTransaction(any())).thenReturn(CompletableFuture.completedFuture(TX_HASH));
        when(client.waitForTransaction(TX_HASH)).thenReturn(CompletableFuture.completedFuture(mined));

        final Receipt receipt = new Contract(TOKEN, abi)
                .execute(client, signer, "transfer", HOLDER, BigInteger.TEN).join();

        assertSame(mined, receipt);
        final ArgumentCaptor<Transaction> estimated = ArgumentCaptor.forClass(Transaction.class);
        verify(client).estimateGas(eq(SENDER), estimated.capture());
        assertEquals(abi.encodeFunction("transfer", HOLDER, BigInteger.TEN), estimated.getValue().data());
    }

    @Test
    void deployAppendsConstructorArguments() {
        final Address deployed = new Address("0x" + "e".repeat(40));
        when(client.executor()).thenReturn(DIRECT);
        when(client.pendingNonceAt(SENDER)).thenReturn(CompletableFuture.completedFuture(0L));
        when(client.estimateGas(eq(SENDER), any())).thenReturn(CompletableFuture.completedFuture(100_000L));
        when(client.gasPrice()).thenReturn(CompletableFuture.completedFuture(Wei.gwei(1)));
        when(client.sendRawTransaction(any())).thenReturn(CompletableFuture.completedFuture(TX_HASH));
        when(client.waitForTransaction(TX_HASH))
                .thenReturn(CompletableFuture.completedFuture(receipt(null, deployed, List.of())));

        final Contract contract = Contract.deploy(
                client, signer, HexData.of("0x6080"), abi, BigInteger.valueOf(1000)).join();

        assertEquals(deployed, contract.address());
        final ArgumentCaptor<Transaction> estimated = ArgumentCaptor.forClass(Transaction.class);
        verify(client).estimateGas(eq(SENDER), estimated.capture());
        assertTrue(estimated.getValue().isContractCreation());
        assertEquals("0x6080" + word("3e8"), estimated.getValue().data().value());
    }

    @Test
    void deployWithoutContractAddressFails() {
        final Receipt noAddress = receipt(null, null, List.of());
        when(client.executor()).thenReturn(DIRECT);
        when(client.pendingNonceAt(SENDER)).thenReturn(CompletableFuture.completedFuture(0L));
        when(client.estimateGas(eq(SENDER), any())).thenReturn(CompletableFuture.completedFuture(100_000L));
        when(client.gasPrice()).thenReturn(CompletableFuture.completedFuture(Wei.gwei(1)));
        when(client.sendRawTransaction(any())).thenReturn(CompletableFuture.completedFuture(TX_HASH));
        when(client.waitForTransaction(TX_HASH)).thenReturn(CompletableFuture.completedFuture(noAddress));

        final CompletableFuture<Contract> future =
                Contract.deploy(client, signer, HexData.of("0x6080"), Abi.fromJson("[]"));

        final CompletionException ex = assertThrows(CompletionException.class, future::join);
        final DeploymentFailedException failure = assertInstanceOf(DeploymentFailedException.class, ex.getCause());
        assertSame(noAddress, failure.receipt());
    }

    @Test
    void deployArgumentsNeedAConstructor() {
        assertThrows(MissingConstructorException.class, () -> Contract.deploy(
                client, signer, HexData.of("0x6080"), Abi.fromJson("[]"), BigInteger.ONE));
    }

    @Test
    void decodesOnlyMatchingEventsFromThisContract() {
        final Receipt receipt = receipt(TOKEN, null, List.of(
                transferLog(TOKEN, 5),
                transferLog(HOLDER, 6),
                new Event(TOKEN, List.of(Abi.eventTopic("Approval(address,address,uint256)")),
                        HexData.EMPTY, BLOCK_HASH, 7, TX_HASH, 0, 1, false),
                transferLog(TOKEN, 7)));

        final List<List<Object>> decoded = new Contract(TOKEN, abi).decodeEvents(receipt, "Transfer");

        assertEquals(List.of(
                List.of(SENDER, HOLDER, BigInteger.valueOf(5)),
                List.of(SENDER, HOLDER, BigInteger.valueOf(7))), decoded);
        assertThrows(AbiDecodingException.class, () -> new Contract(TOKEN, abi).decodeEvents(receipt, "Approval"));
    }
}
