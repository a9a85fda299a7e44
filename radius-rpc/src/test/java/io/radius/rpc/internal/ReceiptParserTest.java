// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc.internal;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.radius.core.model.Event;
import io.radius.core.model.Receipt;

class ReceiptParserTest {

    private static Map<String, Object> receipt() {
        final Map<String, Object> map = new HashMap<>();
        map.put("transactionHash", "0x" + "11".repeat(32));
        map.put("blockHash", "0x" + "22".repeat(32));
        map.put("blockNumber", "0x3");
        map.put("from", "0x00000000000000000000000000000000000000AA");
        map.put("to", null);
        return map;
    }

    @Test
    void statusForms() {
        final Map<String, Object> map = receipt();
        map.put("status", "0x0");
        assertFalse(ReceiptParser.parseReceipt(map).status());
        map.put("status", 1);
        assertTrue(ReceiptParser.parseReceipt(map).status());
        map.put("status", false);
        assertFalse(ReceiptParser.parseReceipt(map).status());
        map.remove("status");
        assertTrue(ReceiptParser.parseReceipt(map).status());
    }

    @Test
    void optionalFieldsDefault() {
        final Receipt parsed = ReceiptParser.parseReceipt(receipt());
        assertNull(parsed.to());
        assertTrue(parsed.deployedAddress().isEmpty());
        assertEquals(0, parsed.gasUsed());
        assertTrue(parsed.events().isEmpty());
        assertEquals("0x00000000000000000000000000000000000000aa", parsed.from().value());
    }

    @Test
    void missingRequiredFieldIsRejected() {
        final Map<String, Object> map = receipt();
        map.remove("blockHash");
        assertThrows(IllegalArgumentException.class, () -> ReceiptParser.parseReceipt(map));
    }

    @Test
    void parsesEventFields() {
        final List<Event> events = ReceiptParser.parseEvents(List.of(Map.of(
                "address", "0x00000000000000000000000000000000000000bb",
                "topics", List.of("0x" + "33".repeat(32), "0x" + "44".repeat(32)),
                "data", "0x01",
                "blockNumber", "0x3",
                "transactionHash", "0x" + "11".repeat(32),
                "transactionIndex", "0x1",
                "logIndex", 4,
                "removed", true)));
        final Event event = events.get(0);
        assertEquals(2, event.topics().size());
        assertEquals("0x" + "33".repeat(32), event.signatureTopic().orElseThrow().value());
        assertEquals(3, event.blockNumber());
        assertEquals(1, event.transactionIndex());
        assertEquals(4, event.logIndex());
        assertTrue(event.removed());
        assertNull(event.blockHash());
    }
}
