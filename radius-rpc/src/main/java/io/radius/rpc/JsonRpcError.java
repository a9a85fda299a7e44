// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(int code, String message, @Nullable Object data) {
}
