// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.abi;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.radius.core.error.AbiEncodingException;
import io.radius.core.types.Address;
import io.radius.core.types.HexData;
import io.radius.primitives.Hex;

/**
 * Encodes plain Java values against a {@link TypeSchema} using the standard
 * head/tail layout.
 *
 * <p>Accepted values:
 * <ul>
 * <li>integers: {@link BigInteger}, any {@link Number}, decimal or {@code 0x} strings</li>
 * <li>address: {@link Address} or a hex string</li>
 * <li>bool: {@link Boolean}</li>
 * <li>bytes and bytesN: {@code byte[]}, {@link HexData} or a hex string</li>
 * <li>string: {@link String}</li>
 * <li>arrays and tuples: {@link List} or any Java array</li>
 * </ul>
 * A {@code bytesN} value shorter than N is right-padded with zeros.
 *
 * @see AbiDecoder
 */
public final class AbiEncoder {

    private static final int WORD = 32;

    private AbiEncoder() {
    }

    /**
     * Encodes {@code values} as a tuple of {@code schemas}, without a selector.
     *
     * @throws AbiEncodingException on an arity, type or range mismatch
     */
    public static byte[] encode(final List<TypeSchema> schemas, final List<?> values) {
        Objects.requireNonNull(schemas, "schemas");
        Objects.requireNonNull(values, "values");
        return encodeTuple(schemas, values, "arguments");
    }

    /**
     * Encodes a call: the 4-byte selector of {@code signature} followed by the
     * encoded arguments.
     */
    public static byte[] encodeFunction(final String signature, final List<TypeSchema> schemas, final List<?> values) {
        final byte[] selector = Abi.functionSelector(signature).toBytes();
        final byte[] body = encode(schemas, values);
        final byte[] out = Arrays.copyOf(selector, selector.length + body.length);
        System.arraycopy(body, 0, out, selector.length, body.length);
        return out;
    }

    private static byte[] encodeTuple(final List<TypeSchema> schemas, final List<?> values, final String context) {
        if (schemas.size() != values.size()) {
            throw new AbiEncodingException(
                    context + ": expected " + schemas.size() + " values, got " + values.size());
        }
        int headLength = 0;
        for (TypeSchema schema : schemas) {
            headLength += schema.headSize();
        }
        final ByteArrayOutputStream head = new ByteArrayOutputStream(headLength);
        final ByteArrayOutputStream tail = new ByteArrayOutputStream();
        for (int i = 0; i < schemas.size(); i++) {
            final TypeSchema schema = schemas.get(i);
            final byte[] encoded = encodeValue(schema, values.get(i), context + "[" + i + "]");
            if (schema.isDynamic()) {
                head.writeBytes(word(BigInteger.valueOf((long) headLength + tail.size())));
                tail.writeBytes(encoded);
            } else {
                head.writeBytes(encoded);
            }
        }
        head.writeBytes(tail.toByteArray());
        return head.toByteArray();
    }

    private static byte[] encodeValue(final TypeSchema schema, final Object value, final String context) {
        if (value == null) {
            throw new AbiEncodingException(context + ": null value for " + schema.typeName());
        }
        if (schema instanceof TypeSchema.UIntSchema) {
            final int width = ((TypeSchema.UIntSchema) schema).width();
            final BigInteger n = toBigInteger(value, context);
            if (n.signum() < 0 || n.bitLength() > width) {
                throw new AbiEncodingException(context + ": " + n + " out of range for uint" + width);
            }
            return word(n);
        }
        if (schema instanceof TypeSchema.IntSchema) {
            final int width = ((TypeSchema.IntSchema) schema).width();
            final BigInteger n = toBigInteger(value, context);
            if (n.bitLength() > width - 1) {
                throw new AbiEncodingException(context + ": " + n + " out of range for int" + width);
            }
            return signedWord(n);
        }
        if (schema instanceof TypeSchema.AddressSchema) {
            return leftPad(toAddress(value, context).toBytes());
        }
        if (schema instanceof TypeSchema.BoolSchema) {
            if (!(value instanceof Boolean)) {
                throw mismatch(context, "Boolean", value);
            }
            return word((Boolean) value ? BigInteger.ONE : BigInteger.ZERO);
        }
        if (schema instanceof TypeSchema.BytesSchema) {
            final int size = ((TypeSchema.BytesSchema) schema).size();
            final byte[] bytes = toBytes(value, context);
            if (size == TypeSchema.BytesSchema.DYNAMIC) {
                return lengthPrefixed(bytes);
            }
            if (bytes.length > size) {
                throw new AbiEncodingException(context + ": " + bytes.length + " bytes do not fit bytes" + size);
            }
            return Arrays.copyOf(bytes, WORD);
        }
        if (schema instanceof TypeSchema.StringSchema) {
            if (!(value instanceof String)) {
                throw mismatch(context, "String", value);
            }
            return lengthPrefixed(((String) value).getBytes(StandardCharsets.UTF_8));
        }
        if (schema instanceof TypeSchema.ArraySchema) {
            final TypeSchema.ArraySchema array = (TypeSchema.ArraySchema) schema;
            final List<?> items = asList(value, context);
            if (array.fixedLength() != TypeSchema.ArraySchema.DYNAMIC && items.size() != array.fixedLength()) {
                throw new AbiEncodingException(
                        context + ": expected " + array.fixedLength() + " elements, got " + items.size());
            }
            final byte[] body = encodeTuple(Collections.nCopies(items.size(), array.element()), items, context);
            if (array.fixedLength() != TypeSchema.ArraySchema.DYNAMIC) {
                return body;
            }
            final byte[] out = Arrays.copyOf(word(BigInteger.valueOf(items.size())), WORD + body.length);
            System.arraycopy(body, 0, out, WORD, body.length);
            return out;
        }
        final TypeSchema.TupleSchema tuple = (TypeSchema.TupleSchema) schema;
        return encodeTuple(tuple.components(), asList(value, context), context);
    }

    private static BigInteger toBigInteger(final Object value, final String context) {
        try {
            if (value instanceof BigInteger) {
                return (BigInteger) value;
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).toBigIntegerExact();
            }
            if (value instanceof Double || value instanceof Float) {
                return BigDecimal.valueOf(((Number) value).doubleValue()).toBigIntegerExact();
            }
            if (value instanceof Number) {
                return BigInteger.valueOf(((Number) value).longValue());
            }
            if (value instanceof String) {
                final String text = ((String) value).trim();
                if (Hex.hasPrefix(text)) {
                    return new BigInteger(text.substring(2), 16);
                }
                return new BigInteger(text);
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new AbiEncodingException(context + ": not an integer: " + value, e);
        }
        throw mismatch(context, "integer", value);
    }

    private static Address toAddress(final Object value, final String context) {
        if (value instanceof Address) {
            return (Address) value;
        }
        if (value instanceof String) {
            try {
                return new Address((String) value);
            } catch (IllegalArgumentException e) {
                throw new AbiEncodingException(context + ": " + e.getMessage(), e);
            }
        }
        throw mismatch(context, "Address", value);
    }

    private static byte[] toBytes(final Object value, final String context) {
        if (value instanceof byte[]) {
            return (byte[]) value;
        }
        if (value instanceof HexData) {
            return ((HexData) value).toBytes();
        }
        if (value instanceof String) {
            try {
                return Hex.decode((String) value);
            } catch (IllegalArgumentException e) {
                throw new AbiEncodingException(context + ": " + e.getMessage(), e);
            }
        }
        throw mismatch(context, "byte[] or HexData", value);
    }

    private static List<?> asList(final Object value, final String context) {
        if (value instanceof List) {
            return (List<?>) value;
        }
        if (value.getClass().isArray()) {
            final int length = java.lang.reflect.Array.getLength(value);
            final List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(java.lang.reflect.Array.get(value, i));
            }
            return list;
        }
        throw mismatch(context, "List or array", value);
    }

    private static AbiEncodingException mismatch(final String context, final String expected, final Object value) {
        return new AbiEncodingException(
                context + ": expected " + expected + " but got " + value.getClass().getSimpleName());
    }

    private static byte[] lengthPrefixed(final byte[] bytes) {
        final byte[] padded = rightPad(bytes);
        final byte[] out = Arrays.copyOf(word(BigInteger.valueOf(bytes.length)), WORD + padded.length);
        System.arraycopy(padded, 0, out, WORD, padded.length);
        return out;
    }

    static byte[] word(final BigInteger unsigned) {
        return leftPad(toMinimalBytes(unsigned));
    }

    private static byte[] signedWord(final BigInteger value) {
        if (value.signum() >= 0) {
            return word(value);
        }
        final byte[] raw = value.toByteArray();
        final byte[] out = new byte[WORD];
        Arrays.fill(out, (byte) 0xFF);
        System.arraycopy(raw, 0, out, WORD - raw.length, raw.length);
        return out;
    }

    private static byte[] toMinimalBytes(final BigInteger value) {
        final byte[] raw = value.toByteArray();
        if (raw.length > 1 && raw[0] == 0) {
            return Arrays.copyOfRange(raw, 1, raw.length);
        }
        return raw;
    }

    private static byte[] leftPad(final byte[] bytes) {
        final byte[] out = new byte[WORD];
        System.arraycopy(bytes, 0, out, WORD - bytes.length, bytes.length);
        return out;
    }

    private static byte[] rightPad(final byte[] bytes) {
        final int padded = (bytes.length + WORD - 1) / WORD * WORD;
        return Arrays.copyOf(bytes, padded);
    }
}
