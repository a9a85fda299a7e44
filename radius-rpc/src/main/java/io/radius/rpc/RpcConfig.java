// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import io.radius.core.error.ConfigurationException;

/**
 * HTTP endpoint settings for {@link HttpRpcTransport}.
 *
 * @param url            JSON-RPC endpoint
 * @param connectTimeout TCP connect timeout
 * @param readTimeout    per-request timeout
 * @param headers        extra headers sent with every request
 */
public record RpcConfig(String url, Duration connectTimeout, Duration readTimeout, Map<String, String> headers) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    public RpcConfig {
        Objects.requireNonNull(url, "url");
        if (url.isBlank()) {
            throw new ConfigurationException("RPC url must not be blank");
        }
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout;
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new ConfigurationException("connectTimeout must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new ConfigurationException("readTimeout must be positive");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static RpcConfig withDefaults(final String url) {
        return new RpcConfig(url, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT, Map.of());
    }
}
