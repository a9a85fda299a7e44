// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc.clef;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import io.radius.core.crypto.Keccak256;
import io.radius.core.crypto.Signature;
import io.radius.core.error.ConfigurationException;
import io.radius.core.error.IncompleteTransactionException;
import io.radius.core.error.RpcException;
import io.radius.core.tx.LegacyTransaction;
import io.radius.core.tx.SignedTransaction;
import io.radius.core.tx.Transaction;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;
import io.radius.core.types.Wei;

class ClefSignerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Address SIGNER = new Address("0x9d8a62f656a8d1615c1294fd71e9cfb3e4855a4f");
    private static final Address TO = new Address("0x3535353535353535353535353535353535353535");
    private static final String RAW = "0xf86c098504a817c800825208943535353535353535353535353535353535353535"
            + "880de0b6b3a76400008025a028ef61340bd939bc2195fe537567866003e1a15d3c71ff63e1590620aa636276"
            + "a067cbe9d8997f761aecb703304b3800ccf555c9f3dc64214b297fb1966a3b6d83";

    private HttpServer server;
    private String url;
    private final Map<String, String> results = new ConcurrentHashMap<>();
    private final List<JsonNode> requests = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        url = "http://127.0.0.1:" + server.getAddress().getPort();
        results.put("account_list", "[\"" + SIGNER.value() + "\"]");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(final HttpExchange exchange) throws IOException {
        final JsonNode request = MAPPER.readTree(exchange.getRequestBody());
        requests.add(request);
        final String result = results.get(request.get("method").asText());
        final String body = result == null
                ? "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32601,\"message\":\"not found\"}}"
                : "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + result + "}";
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private ClefSigner signer() {
        return ClefSigner.builder(url).address(SIGNER).chainId(1).build();
    }

    private List<JsonNode> requests(final String method) {
        return requests.stream().filter(r -> method.equals(r.get("method").asText())).toList();
    }

    @Test
    void buildProbesAccountList() {
        final ClefSigner signer = signer();
        assertEquals(SIGNER, signer.address());
        assertEquals(1, requests("account_list").size());
        assertTrue(signer.fallbackGasPrice().isEmpty());
    }

    @Test
    void unreachableClefIsAConfigurationError() throws IOException {
        final int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        assertThrows(ConfigurationException.class, () -> ClefSigner.builder("http://127.0.0.1:" + closedPort)
                .address(SIGNER).chainId(1).build());
    }

    @Test
    void unlistedAddressStillBuilds() {
        results.put("account_list", "[]");
        assertEquals(SIGNER, signer().address());
    }

    @Test
    void chainIdSourceIsEvaluatedOnce() {
        final AtomicInteger calls = new AtomicInteger();
        final ClefSigner signer = ClefSigner.builder(url).address(SIGNER)
                .chainIdSource(() -> {
                    calls.incrementAndGet();
                    return 1223953L;
                })
                .build();
        assertEquals(1223953L, signer.chainId());
        assertEquals(1223953L, signer.chainId());
        assertEquals(1, calls.get());
        assertThrows(ConfigurationException.class, () -> ClefSigner.builder(url).address(SIGNER).build());
    }

    @Test
    void signsTransactionThroughClef() {
        final String hash = "0x" + "ab".repeat(32);
        results.put("account_signTransaction", "{\"raw\":\"" + RAW + "\",\"tx\":{\"hash\":\"" + hash + "\"}}");
        final LegacyTransaction tx = new LegacyTransaction(
                9, Wei.gwei(20), 21_000, TO, Wei.of(1), HexData.EMPTY);

        final SignedTransaction signed = signer().signTransaction(tx);

        assertEquals(new Hash(hash), signed.hash());
        assertEquals(RAW, signed.raw().value());
        final JsonNode sent = requests("account_signTransaction").get(0).get("params").get(0);
        assertEquals(SIGNER.value(), sent.get("from").asText());
        assertEquals(TO.value(), sent.get("to").asText());
        assertEquals("0x9", sent.get("nonce").asText());
        assertEquals("0x5208", sent.get("gas").asText());
        assertEquals("0x4a817c800", sent.get("gasPrice").asText());
        assertEquals("0x1", sent.get("chainId").asText());
    }

    @Test
    void missingHashIsComputedFromRaw() {
        results.put("account_signTransaction", "{\"raw\":\"" + RAW + "\",\"tx\":{}}");
        final SignedTransaction signed = signer().signTransaction(
                new LegacyTransaction(9, Wei.gwei(20), 21_000, TO, Wei.ZERO, HexData.EMPTY));
        assertEquals(Hash.fromBytes(Keccak256.hash(HexData.of(RAW).toBytes())), signed.hash());
    }

    @Test
    void partialTransactionNeedsGasPriceBeforeAnyRequest() {
        final ClefSigner signer = signer();
        final Transaction partial = Transaction.builder().to(TO).nonce(0).gasLimit(21_000).build();
        final IncompleteTransactionException ex =
                assertThrows(IncompleteTransactionException.class, () -> signer.signTransaction(partial));
        assertEquals("gasPrice", ex.field());
        assertTrue(requests("account_signTransaction").isEmpty());
    }

    @Test
    void signsMessageAsTextPlain() {
        final String sig = "0x" + "11".repeat(32) + "22".repeat(32) + "1c";
        results.put("account_signData", "\"" + sig + "\"");

        final Signature signature = signer().signMessage("hello".getBytes(StandardCharsets.UTF_8));

        assertEquals(28, signature.v());
        final JsonNode params = requests("account_signData").get(0).get("params");
        assertEquals("text/plain", params.get(0).asText());
        assertEquals(SIGNER.value(), params.get(1).asText());
        assertEquals("0x68656c6c6f", params.get(2).asText());
    }

    @Test
    void shortSignatureIsAnRpcError() {
        results.put("account_signData", "\"0x1234\"");
        final ClefSigner signer = signer();
        assertThrows(RpcException.class, () -> signer.signMessage(new byte[] {1}));
    }

    @Test
    void clefRejectionPropagates() {
        final ClefSigner signer = signer();
        final RpcException ex = assertThrows(RpcException.class, () -> signer.signMessage(new byte[] {1}));
        assertEquals(-32601, ex.code());
    }
}
