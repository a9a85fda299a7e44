// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import static io.radius.rpc.internal.RpcUtils.MAPPER;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import io.radius.core.DebugLogger;
import io.radius.core.LogFormatter;
import io.radius.core.error.ConfigurationException;
import io.radius.core.error.RpcException;
import io.radius.rpc.internal.RpcUtils;

/**
 * JSON-RPC over HTTP using the JDK {@link HttpClient}.
 *
 * <pre>{@code
 * RpcTransport transport = HttpRpcTransport.builder("http://localhost:8545")
 *         .readTimeout(Duration.ofSeconds(5))
 *         .header("Authorization", "Bearer ...")
 *         .build();
 * }</pre>
 *
 * <p>Thread-safe; one instance may be shared by many clients.
 */
public final class HttpRpcTransport implements RpcTransport {

    private final RpcConfig config;
    private final URI uri;
    private final HttpClient httpClient;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpRpcTransport(final RpcConfig config) {
        this.config = config;
        try {
            this.uri = URI.create(config.url());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid RPC url: " + config.url(), e);
        }
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public RpcConfig config() {
        return config;
    }

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) throws RpcException {
        final long requestId = ids.getAndIncrement();
        final JsonRpcRequest request = new JsonRpcRequest(method, params, requestId);
        final String payload = serialize(request);

        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(method, buildRequest(payload), requestId);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(
                    method, response.statusCode(), "HTTP " + response.statusCode(), durationMicros));
            throw new RpcException(
                    -32001,
                    "HTTP error for method " + method + ": " + response.statusCode(),
                    response.body(),
                    requestId);
        }

        final JsonRpcResponse rpcResponse = parseResponse(method, response.body(), requestId);
        if (rpcResponse.hasError()) {
            final JsonRpcError err = rpcResponse.error();
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, err.code(), err.message(), durationMicros));
            throw new RpcException(err.code(), err.message(), RpcUtils.extractErrorData(err.data()), requestId);
        }
        DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
        return rpcResponse;
    }

    private String serialize(final JsonRpcRequest request) {
        try {
            return MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    -32700, "Unable to serialize JSON-RPC request for " + request.method(), null, request.id(), e);
        }
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    private HttpResponse<String> execute(final String method, final HttpRequest request, final long requestId) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(-32000, "Interrupted during JSON-RPC call " + method, null, requestId, e);
        } catch (IOException e) {
            throw new RpcException(-32000, "Network error during JSON-RPC call " + method, null, requestId, e);
        }
    }

    /**
     * Parses the body, telling a {@code null} result apart from a missing one.
     */
    private static JsonRpcResponse parseResponse(final String method, final String body, final long requestId) {
        final JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    -32700, "Unable to parse JSON-RPC response for method " + method, body, requestId, e);
        }
        if (root == null || !root.isObject()) {
            throw new RpcException(
                    -32700, "JSON-RPC response for method " + method + " is not an object", body, requestId);
        }
        if (!root.has("result") && !root.has("error")) {
            throw new RpcException(
                    -32603, "JSON-RPC response for method " + method + " has neither result nor error", body,
                    requestId);
        }
        try {
            return MAPPER.treeToValue(root, JsonRpcResponse.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RpcException(
                    -32700, "Malformed JSON-RPC response for method " + method, body, requestId, e);
        }
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = RpcConfig.DEFAULT_CONNECT_TIMEOUT;
        private Duration readTimeout = RpcConfig.DEFAULT_READ_TIMEOUT;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        /**
         * @throws ConfigurationException if the url is blank or malformed
         */
        public HttpRpcTransport build() {
            return new HttpRpcTransport(new RpcConfig(url, connectTimeout, readTimeout, headers));
        }
    }
}
