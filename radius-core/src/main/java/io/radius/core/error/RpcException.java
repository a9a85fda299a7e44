// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a JSON-RPC call fails: the node returned an error envelope, the
 * body could not be decoded, or the transport itself failed.
 *
 * <p>Standard codes used locally:
 * <ul>
 * <li><strong>-32700</strong>: unparsable request or response body</li>
 * <li><strong>-32603</strong>: response carried neither {@code result} nor {@code error}</li>
 * <li><strong>-32001</strong>: non-2xx HTTP status</li>
 * <li><strong>-32000</strong>: network failure or generic node error</li>
 * </ul>
 * Node-reported errors keep the remote code and message verbatim.
 */
public final class RpcException extends RadiusException {

    private final int code;
    private final @Nullable String data;
    private final @Nullable Long requestId;

    public RpcException(
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Long requestId,
            final @Nullable Throwable cause) {
        super(withRequestId(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final @Nullable String data, final @Nullable Long requestId) {
        this(code, message, data, requestId, null);
    }

    /**
     * Wraps a local failure that happened while interpreting an RPC result.
     */
    public static RpcException malformedResult(final String method, final Throwable cause) {
        return new RpcException(-32700, "Malformed result for " + method + ": " + cause.getMessage(), null, null, cause);
    }

    public static RpcException nullResult(final String method) {
        return new RpcException(-32000, "Node returned null result for " + method, null, null, null);
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    @Override
    public String toString() {
        return "RpcException{code=" + code + ", message=" + getMessage() + ", data=" + data + ", requestId="
                + requestId + "}";
    }

    private static String withRequestId(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[requestId=" + requestId + "] " + message;
    }
}
