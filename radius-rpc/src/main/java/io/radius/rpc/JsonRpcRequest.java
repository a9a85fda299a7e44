// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import java.util.List;

/**
 * A JSON-RPC 2.0 request envelope.
 */
public record JsonRpcRequest(String jsonrpc, String method, List<?> params, long id) {

    public JsonRpcRequest(final String method, final List<?> params, final long id) {
        this("2.0", method, params == null ? List.of() : params, id);
    }
}
