// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.abi;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.radius.core.error.AbiDecodingException;
import io.radius.core.types.Address;
import io.radius.core.types.HexData;

/**
 * Decodes ABI data into plain Java values according to a {@link TypeSchema}.
 *
 * <p>Results use {@link BigInteger} for integers, {@link Address},
 * {@link Boolean}, {@link String}, {@link HexData} for both {@code bytes} and
 * {@code bytesN}, and an unmodifiable {@code List<Object>} for arrays and
 * tuples. Dynamic offsets are relative to the start of their enclosing tuple,
 * and every offset and length is bounds-checked.
 *
 * @see AbiEncoder
 */
public final class AbiDecoder {

    private static final int WORD = 32;

    private AbiDecoder() {
    }

    /**
     * Decodes {@code data} as a tuple of {@code schemas}.
     *
     * @throws AbiDecodingException if the data is truncated or malformed
     */
    public static List<Object> decode(final byte[] data, final List<TypeSchema> schemas) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(schemas, "schemas");
        try {
            return decodeTuple(data, 0, schemas);
        } catch (AbiDecodingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AbiDecodingException("Malformed ABI data: " + e.getMessage(), e);
        }
    }

    private static List<Object> decodeTuple(final byte[] data, final int offset, final List<TypeSchema> schemas) {
        long headLength = 0;
        for (TypeSchema schema : schemas) {
            headLength += schema.headSize();
        }
        require(data, offset, headLength, "tuple head");

        final List<Object> results = new ArrayList<>(schemas.size());
        int head = offset;
        for (TypeSchema schema : schemas) {
            if (schema.isDynamic()) {
                final int relative = toIntExact(readUnsigned(data, head), "dynamic offset");
                final int target = offset + relative;
                validateOffset(data, target, schema.typeName());
                results.add(decodeDynamic(data, target, schema));
                head += WORD;
            } else {
                results.add(decodeStatic(data, head, schema));
                head += schema.headSize();
            }
        }
        return Collections.unmodifiableList(results);
    }

    private static Object decodeStatic(final byte[] data, final int offset, final TypeSchema schema) {
        if (schema instanceof TypeSchema.UIntSchema) {
            final int width = ((TypeSchema.UIntSchema) schema).width();
            final BigInteger value = readUnsigned(data, offset);
            if (value.bitLength() > width) {
                throw new AbiDecodingException("Value exceeds uint" + width + " at offset " + offset);
            }
            return value;
        }
        if (schema instanceof TypeSchema.IntSchema) {
            final int width = ((TypeSchema.IntSchema) schema).width();
            final BigInteger value = new BigInteger(Arrays.copyOfRange(data, offset, offset + WORD));
            if (value.bitLength() > width - 1) {
                throw new AbiDecodingException("Value exceeds int" + width + " at offset " + offset);
            }
            return value;
        }
        if (schema instanceof TypeSchema.AddressSchema) {
            return Address.fromBytes(Arrays.copyOfRange(data, offset + 12, offset + WORD));
        }
        if (schema instanceof TypeSchema.BoolSchema) {
            final BigInteger value = readUnsigned(data, offset);
            if (value.bitLength() > 1) {
                throw new AbiDecodingException("Invalid bool value " + value + " at offset " + offset);
            }
            return value.signum() == 1;
        }
        if (schema instanceof TypeSchema.BytesSchema) {
            final int size = ((TypeSchema.BytesSchema) schema).size();
            return HexData.fromBytes(Arrays.copyOfRange(data, offset, offset + size));
        }
        if (schema instanceof TypeSchema.ArraySchema) {
            final TypeSchema.ArraySchema array = (TypeSchema.ArraySchema) schema;
            return decodeTuple(data, offset, Collections.nCopies(array.fixedLength(), array.element()));
        }
        if (schema instanceof TypeSchema.TupleSchema) {
            return decodeTuple(data, offset, ((TypeSchema.TupleSchema) schema).components());
        }
        throw new AbiDecodingException("Unexpected static schema: " + schema.typeName());
    }

    private static Object decodeDynamic(final byte[] data, final int offset, final TypeSchema schema) {
        if (schema instanceof TypeSchema.BytesSchema) {
            return HexData.fromBytes(readLengthPrefixed(data, offset, "bytes"));
        }
        if (schema instanceof TypeSchema.StringSchema) {
            return new String(readLengthPrefixed(data, offset, "string"), StandardCharsets.UTF_8);
        }
        if (schema instanceof TypeSchema.ArraySchema) {
            final TypeSchema.ArraySchema array = (TypeSchema.ArraySchema) schema;
            final int length;
            final int start;
            if (array.fixedLength() == TypeSchema.ArraySchema.DYNAMIC) {
                length = toIntExact(readUnsigned(data, offset), "array length");
                start = offset + WORD;
            } else {
                length = array.fixedLength();
                start = offset;
            }
            require(data, start, (long) length * array.element().headSize(), "array elements");
            return decodeTuple(data, start, Collections.nCopies(length, array.element()));
        }
        if (schema instanceof TypeSchema.TupleSchema) {
            return decodeTuple(data, offset, ((TypeSchema.TupleSchema) schema).components());
        }
        throw new AbiDecodingException("Unexpected dynamic schema: " + schema.typeName());
    }

    private static byte[] readLengthPrefixed(final byte[] data, final int offset, final String context) {
        final int length = toIntExact(readUnsigned(data, offset), context + " length");
        require(data, offset + WORD, length, context + " data");
        return Arrays.copyOfRange(data, offset + WORD, offset + WORD + length);
    }

    private static BigInteger readUnsigned(final byte[] data, final int offset) {
        require(data, offset, WORD, "word");
        return new BigInteger(1, Arrays.copyOfRange(data, offset, offset + WORD));
    }

    private static int toIntExact(final BigInteger value, final String context) {
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new AbiDecodingException(context + " too large: " + value, e);
        }
    }

    private static void validateOffset(final byte[] data, final int offset, final String context) {
        if (offset < 0 || offset >= data.length) {
            throw new AbiDecodingException(
                    context + " offset out of bounds: " + offset + " (data length: " + data.length + ")");
        }
    }

    private static void require(final byte[] data, final long start, final long length, final String context) {
        if (start < 0 || length < 0 || start + length > data.length) {
            throw new AbiDecodingException(
                    "Data too short for " + context + ": need " + (start + length) + " bytes, have " + data.length);
        }
    }
}
