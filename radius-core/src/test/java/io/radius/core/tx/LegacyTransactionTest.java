// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.tx;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.radius.core.crypto.Signature;
import io.radius.core.types.Address;
import io.radius.core.types.HexData;
import io.radius.core.types.Wei;
import io.radius.primitives.Hex;

class LegacyTransactionTest {

    private static final Address TO = new Address("0x3535353535353535353535353535353535353535");
    private static final LegacyTransaction TX = new LegacyTransaction(
            9, Wei.gwei(20), 21_000, TO, Wei.of(new BigInteger("1000000000000000000")), HexData.EMPTY);

    @Test
    void eip155SigningPreimage() {
        assertEquals(
                "0xec098504a817c800825208943535353535353535353535353535353535353535880de0b6b3a764000080018080",
                Hex.encode(TX.encodeForSigning(1)));
    }

    @Test
    void preimageWithoutChainIdHasSixFields() {
        assertEquals(
                "0xe9098504a817c800825208943535353535353535353535353535353535353535880de0b6b3a764000080",
                Hex.encode(TX.encodeForSigning(0)));
    }

    @Test
    void envelopeRequiresReplayProtectedV() {
        final Signature parity = new Signature(new byte[32], new byte[32], 1);
        assertThrows(IllegalArgumentException.class, () -> TX.encodeAsEnvelope(parity));
    }

    @Test
    void rpcObjectUsesHexQuantities() {
        final Address from = new Address("0x9d8a62f656a8d1615c1294fd71e9cfb3e4855a4f");
        final Map<String, Object> json = TX.toRpcObject(from, 1223953L);
        assertEquals(from.value(), json.get("from"));
        assertEquals(TO.value(), json.get("to"));
        assertEquals("0x9", json.get("nonce"));
        assertEquals("0x5208", json.get("gas"));
        assertEquals("0x4a817c800", json.get("gasPrice"));
        assertEquals("0xde0b6b3a7640000", json.get("value"));
        assertEquals("0x", json.get("data"));
        assertEquals("0x12ad11", json.get("chainId"));
    }

    @Test
    void creationOmitsRecipient() {
        final LegacyTransaction create =
                new LegacyTransaction(0, Wei.ZERO, 100_000, null, Wei.ZERO, HexData.of("0x6000"));
        assertTrue(create.isContractCreation());
        assertFalse(create.toRpcObject(Address.ZERO, 1).containsKey("to"));
    }

    @Test
    void rejectsInvalidFields() {
        assertThrows(IllegalArgumentException.class,
                () -> new LegacyTransaction(-1, Wei.ZERO, 21_000, TO, Wei.ZERO, HexData.EMPTY));
        assertThrows(IllegalArgumentException.class,
                () -> new LegacyTransaction(0, Wei.ZERO, 0, TO, Wei.ZERO, HexData.EMPTY));
    }
}
