// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.abi;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.radius.core.error.AbiEncodingException;
import io.radius.core.types.Address;
import io.radius.primitives.Hex;

class AbiEncoderTest {

    private static final TypeSchema UINT256 = new TypeSchema.UIntSchema(256);

    private static String word(final String hex) {
        return "0".repeat(64 - hex.length()) + hex;
    }

    @Test
    void encodesSolidityDocumentationExample() {
        // f(uint256,uint32[],bytes10,bytes)
        final List<TypeSchema> schemas = List.of(
                UINT256,
                new TypeSchema.ArraySchema(new TypeSchema.UIntSchema(32), TypeSchema.ArraySchema.DYNAMIC),
                new TypeSchema.BytesSchema(10),
                new TypeSchema.BytesSchema(TypeSchema.BytesSchema.DYNAMIC));
        final byte[] encoded = AbiEncoder.encodeFunction(
                "f(uint256,uint32[],bytes10,bytes)",
                schemas,
                List.of(
                        BigInteger.valueOf(0x123),
                        List.of(0x456, 0x789),
                        "1234567890".getBytes(StandardCharsets.US_ASCII),
                        "Hello, world!".getBytes(StandardCharsets.US_ASCII)));

        final String expected = "0x8be65246"
                + word("123")
                + word("80")
                + "3132333435363738393000000000000000000000000000000000000000000000"
                + word("e0")
                + word("2")
                + word("456")
                + word("789")
                + word("d")
                + "48656c6c6f2c20776f726c642100000000000000000000000000000000000000";
        assertEquals(expected, Hex.encode(encoded));
    }

    @Test
    void encodesTransferCall() {
        final byte[] encoded = AbiEncoder.encodeFunction(
                "transfer(address,uint256)",
                List.of(new TypeSchema.AddressSchema(), UINT256),
                List.of(new Address("0x00000000000000000000000000000000000000aa"), 1000L));
        assertEquals("0xa9059cbb" + word("aa") + word("3e8"), Hex.encode(encoded));
    }

    @Test
    void negativeIntegersAreTwosComplement() {
        final byte[] encoded = AbiEncoder.encode(List.of(new TypeSchema.IntSchema(256)), List.of(-1));
        assertEquals("0x" + "f".repeat(64), Hex.encode(encoded));
    }

    @Test
    void staticTupleIsInlinedInTheHead() {
        final TypeSchema pair = new TypeSchema.TupleSchema(List.of(UINT256, new TypeSchema.BoolSchema()));
        final byte[] encoded = AbiEncoder.encode(
                List.of(pair, new TypeSchema.StringSchema()),
                List.of(List.of(7, true), "a"));
        // head: two inline words plus one offset word
        assertEquals(
                "0x" + word("7") + word("1") + word("60") + word("1")
                        + "6100000000000000000000000000000000000000000000000000000000000000",
                Hex.encode(encoded));
    }

    @Test
    void acceptsHexAndDecimalStringsForIntegers() {
        assertArrayEquals(
                AbiEncoder.encode(List.of(UINT256), List.of(BigInteger.valueOf(255))),
                AbiEncoder.encode(List.of(UINT256), List.of("0xff")));
        assertArrayEquals(
                AbiEncoder.encode(List.of(UINT256), List.of(BigInteger.valueOf(255))),
                AbiEncoder.encode(List.of(UINT256), List.of("255")));
    }

    @Test
    void rejectsOutOfRangeAndMismatchedValues() {
        assertThrows(AbiEncodingException.class,
                () -> AbiEncoder.encode(List.of(new TypeSchema.UIntSchema(8)), List.of(256)));
        assertThrows(AbiEncodingException.class, () -> AbiEncoder.encode(List.of(UINT256), List.of(-1)));
        assertThrows(AbiEncodingException.class,
                () -> AbiEncoder.encode(List.of(new TypeSchema.IntSchema(8)), List.of(128)));
        assertThrows(AbiEncodingException.class,
                () -> AbiEncoder.encode(List.of(new TypeSchema.BoolSchema()), List.of("true")));
        assertThrows(AbiEncodingException.class,
                () -> AbiEncoder.encode(List.of(new TypeSchema.BytesSchema(2)), List.of(new byte[3])));
        assertThrows(AbiEncodingException.class,
                () -> AbiEncoder.encode(List.of(new TypeSchema.AddressSchema()), List.of("0x1234")));
        assertThrows(AbiEncodingException.class, () -> AbiEncoder.encode(List.of(UINT256), List.of()));
        assertThrows(AbiEncodingException.class,
                () -> AbiEncoder.encode(List.of(new TypeSchema.ArraySchema(UINT256, 2)), List.of(List.of(1))));
    }

    @Test
    void emptyFixedBytesStillTakesAFullWord() {
        final List<TypeSchema> schemas = List.of(new TypeSchema.BytesSchema(32), UINT256);
        final byte[] encoded = AbiEncoder.encode(schemas, List.of(new byte[0], 7));

        assertEquals(64, encoded.length);
        assertEquals("0x" + word("0") + word("7"), Hex.encode(encoded));
        assertEquals(BigInteger.valueOf(7), AbiDecoder.decode(encoded, schemas).get(1));
    }
}
