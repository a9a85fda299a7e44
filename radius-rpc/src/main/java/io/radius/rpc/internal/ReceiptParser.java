// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc.internal;

import static io.radius.rpc.internal.RpcUtils.MAPPER;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.core.type.TypeReference;

import io.radius.core.model.Event;
import io.radius.core.model.Receipt;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;

/**
 * Maps {@code eth_getTransactionReceipt} results and their logs onto
 * {@link Receipt} and {@link Event}.
 *
 * <p>Quantities go through {@link RpcUtils#decodeQuantity(Object)}, so hex
 * strings and JSON numbers are both accepted. Missing required fields raise
 * {@link IllegalArgumentException}; callers wrap it as a malformed result.
 */
public final class ReceiptParser {

    private ReceiptParser() {
    }

    public static Receipt parseReceipt(final Map<String, Object> map) {
        final List<Event> events = parseEvents(map.get("logs"));
        final @Nullable String to = RpcUtils.stringValue(map.get("to"));
        final @Nullable String contractAddress = RpcUtils.stringValue(map.get("contractAddress"));
        return new Receipt(
                new Hash(required(map, "transactionHash")),
                new Hash(required(map, "blockHash")),
                RpcUtils.decodeLong(requiredValue(map, "blockNumber")),
                new Address(required(map, "from")),
                to != null ? new Address(to) : null,
                contractAddress != null ? new Address(contractAddress) : null,
                optionalLong(map.get("gasUsed")),
                optionalLong(map.get("cumulativeGasUsed")),
                parseStatus(map.get("status")),
                events);
    }

    public static List<Event> parseEvents(final @Nullable Object value) {
        if (value == null) {
            return List.of();
        }
        final List<Map<String, Object>> rawLogs =
                MAPPER.convertValue(value, new TypeReference<List<Map<String, Object>>>() {});
        final List<Event> events = new ArrayList<>(rawLogs.size());
        for (Map<String, Object> log : rawLogs) {
            events.add(parseEvent(log));
        }
        return List.copyOf(events);
    }

    public static Event parseEvent(final Map<String, Object> map) {
        final @Nullable String data = RpcUtils.stringValue(map.get("data"));
        final @Nullable String blockHash = RpcUtils.stringValue(map.get("blockHash"));
        final @Nullable List<String> topicsHex =
                MAPPER.convertValue(map.get("topics"), new TypeReference<List<String>>() {});
        final List<Hash> topics = topicsHex != null
                ? topicsHex.stream().map(Hash::new).toList()
                : List.of();
        return new Event(
                new Address(required(map, "address")),
                topics,
                data != null ? HexData.of(data) : HexData.EMPTY,
                blockHash != null ? new Hash(blockHash) : null,
                optionalLong(map.get("blockNumber")),
                new Hash(required(map, "transactionHash")),
                optionalLong(map.get("transactionIndex")),
                optionalLong(map.get("logIndex")),
                Boolean.TRUE.equals(map.get("removed")));
    }

    /**
     * Pre-Byzantium receipts carry no status; they are treated as successful.
     */
    private static boolean parseStatus(final @Nullable Object status) {
        if (status == null) {
            return true;
        }
        if (status instanceof Boolean) {
            return (Boolean) status;
        }
        return RpcUtils.decodeQuantity(status).signum() != 0;
    }

    private static long optionalLong(final @Nullable Object value) {
        return value == null ? 0L : RpcUtils.decodeLong(value);
    }

    private static Object requiredValue(final Map<String, Object> map, final String field) {
        final Object value = map.get(field);
        if (value == null) {
            throw new IllegalArgumentException("Missing '" + field + "'");
        }
        return value;
    }

    private static String required(final Map<String, Object> map, final String field) {
        return requiredValue(map, field).toString();
    }
}
