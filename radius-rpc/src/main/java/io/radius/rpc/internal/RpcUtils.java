// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc.internal;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.radius.core.tx.Transaction;
import io.radius.core.types.Address;
import io.radius.primitives.Hex;

/**
 * Shared helpers for the RPC layer: quantity decoding, call-object building
 * and error-data extraction.
 *
 * <p><strong>Internal use only.</strong>
 */
public final class RpcUtils {

    /**
     * Shared mapper; thread-safe once configured.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
    }

    /**
     * Decodes a quantity that a node may send either as a {@code 0x} hex string
     * or as a native JSON number. Unprefixed strings are read as decimal.
     *
     * @throws IllegalArgumentException if the value is not a non-negative integer
     */
    public static BigInteger decodeQuantity(final Object value) {
        if (value == null) {
            throw new IllegalArgumentException("quantity is null");
        }
        final BigInteger result;
        if (value instanceof BigInteger) {
            result = (BigInteger) value;
        } else if (value instanceof BigDecimal) {
            result = ((BigDecimal) value).toBigIntegerExact();
        } else if (value instanceof Double || value instanceof Float) {
            result = BigDecimal.valueOf(((Number) value).doubleValue()).toBigIntegerExact();
        } else if (value instanceof Number) {
            result = BigInteger.valueOf(((Number) value).longValue());
        } else if (value instanceof String) {
            final String text = ((String) value).trim();
            if (Hex.hasPrefix(text)) {
                final String digits = text.substring(2);
                result = digits.isEmpty() ? BigInteger.ZERO : new BigInteger(digits, 16);
            } else {
                result = new BigInteger(text);
            }
        } else {
            throw new IllegalArgumentException("Unsupported quantity type: " + value.getClass().getSimpleName());
        }
        if (result.signum() < 0) {
            throw new IllegalArgumentException("quantity is negative: " + value);
        }
        return result;
    }

    /**
     * @throws ArithmeticException if the quantity does not fit in a long
     */
    public static long decodeLong(final Object value) {
        return decodeQuantity(value).longValueExact();
    }

    public static String toQuantityHex(final BigInteger value) {
        return "0x" + value.toString(16);
    }

    public static String toQuantityHex(final long value) {
        return "0x" + Long.toHexString(value);
    }

    public static @Nullable String stringValue(final @Nullable Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Builds the object passed to {@code eth_call} and {@code eth_estimateGas}.
     * {@code to} is omitted when absent, {@code data} when empty and
     * {@code value} unless positive.
     */
    public static Map<String, Object> toCallObject(final @Nullable Address from, final Transaction tx) {
        final Map<String, Object> out = new LinkedHashMap<>();
        if (from != null) {
            out.put("from", from.value());
        }
        tx.to().ifPresent(to -> out.put("to", to.value()));
        tx.gasLimit().ifPresent(gas -> out.put("gas", toQuantityHex(gas)));
        tx.gasPrice().ifPresent(price -> out.put("gasPrice", price.toHexString()));
        if (tx.value().value().signum() > 0) {
            out.put("value", tx.value().toHexString());
        }
        if (!tx.data().isEmpty()) {
            out.put("data", tx.data().value());
        }
        return out;
    }

    /**
     * Flattens nested error data: {@code {data: {data: "0x.."}}} becomes
     * {@code "0x.."}. Falls back to {@code toString()} when nothing nested is
     * found.
     */
    public static @Nullable String extractErrorData(final @Nullable Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String) {
            return (String) dataValue;
        }
        if (dataValue instanceof Map<?, ?>) {
            return extractFromIterable(((Map<?, ?>) dataValue).values(), dataValue);
        }
        if (dataValue instanceof Iterable<?>) {
            return extractFromIterable((Iterable<?>) dataValue, dataValue);
        }
        if (dataValue.getClass().isArray()) {
            final int length = Array.getLength(dataValue);
            for (int i = 0; i < length; i++) {
                final String nested = extractErrorData(Array.get(dataValue, i));
                if (nested != null) {
                    return nested;
                }
            }
            return dataValue.toString();
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (Object item : iterable) {
            final String nested = extractErrorData(item);
            if (nested != null) {
                return nested;
            }
        }
        return fallback.toString();
    }
}
