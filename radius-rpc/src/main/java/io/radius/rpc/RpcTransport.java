// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import java.util.List;

import io.radius.core.error.RpcException;

/**
 * Sends JSON-RPC requests to a node or signer daemon.
 *
 * <p>Implementations must be thread-safe. A node-reported error is raised as
 * {@link RpcException} rather than returned, so a returned response always
 * carries a result (which may be JSON {@code null}).
 *
 * @see HttpRpcTransport
 */
public interface RpcTransport extends AutoCloseable {

    /**
     * Sends one request and waits for its response.
     *
     * @param method the JSON-RPC method name
     * @param params positional parameters
     * @return the successful response
     * @throws RpcException if the call fails at any layer
     */
    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    static RpcTransport http(final String url) {
        return HttpRpcTransport.builder(url).build();
    }

    @Override
    default void close() {
    }
}
