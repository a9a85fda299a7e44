// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import static io.radius.rpc.internal.RpcUtils.MAPPER;

import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;

/**
 * A JSON-RPC 2.0 response.
 *
 * <p>Exactly one of {@code result} and {@code error} is meaningful; a
 * {@code null} result is a legal answer (for example an unmined receipt).
 *
 * @param jsonrpc protocol version
 * @param result  decoded result, possibly {@code null}
 * @param error   error object, or {@code null} on success
 * @param id      request id echoed by the server
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        @Nullable String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        @Nullable String id) {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    public static JsonRpcResponse success(final @Nullable Object result) {
        return new JsonRpcResponse("2.0", result, null, null);
    }

    public boolean hasError() {
        return error != null;
    }

    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }

    /**
     * @throws IllegalArgumentException if the result is not a JSON object
     */
    public @Nullable Map<String, Object> resultAsMap() {
        return convertResult(Map.class, MAP_TYPE);
    }

    /**
     * @throws IllegalArgumentException if the result is not a JSON array
     */
    public @Nullable List<Object> resultAsList() {
        return convertResult(List.class, LIST_TYPE);
    }

    @SuppressWarnings("unchecked")
    private <T> @Nullable T convertResult(final Class<?> shape, final TypeReference<T> type) {
        if (result == null || shape.isInstance(result)) {
            return (T) result;
        }
        return MAPPER.convertValue(result, type);
    }
}
