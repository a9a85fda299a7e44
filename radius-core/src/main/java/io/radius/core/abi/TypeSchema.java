// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.abi;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The shape of an ABI value, shared by {@link AbiEncoder} and {@link AbiDecoder}.
 *
 * <pre>{@code
 * // (uint256, string[])
 * TypeSchema schema = new TypeSchema.TupleSchema(List.of(
 *     new TypeSchema.UIntSchema(256),
 *     new TypeSchema.ArraySchema(new TypeSchema.StringSchema(), TypeSchema.ArraySchema.DYNAMIC)));
 * }</pre>
 */
public sealed interface TypeSchema permits
        TypeSchema.UIntSchema,
        TypeSchema.IntSchema,
        TypeSchema.AddressSchema,
        TypeSchema.BoolSchema,
        TypeSchema.BytesSchema,
        TypeSchema.StringSchema,
        TypeSchema.ArraySchema,
        TypeSchema.TupleSchema {

    boolean isDynamic();

    /**
     * Canonical type name as used in signatures, e.g. {@code (address,uint256)[]}.
     */
    String typeName();

    /**
     * Bytes this value occupies in the head of an enclosing tuple: 32 for
     * dynamic values (the offset word), the full inline size otherwise.
     */
    default int headSize() {
        return 32;
    }

    record UIntSchema(int width) implements TypeSchema {
        public UIntSchema {
            checkWidth(width, "uint");
        }

        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public String typeName() {
            return "uint" + width;
        }
    }

    record IntSchema(int width) implements TypeSchema {
        public IntSchema {
            checkWidth(width, "int");
        }

        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public String typeName() {
            return "int" + width;
        }
    }

    record AddressSchema() implements TypeSchema {
        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public String typeName() {
            return "address";
        }
    }

    record BoolSchema() implements TypeSchema {
        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public String typeName() {
            return "bool";
        }
    }

    /**
     * {@code bytesN} for {@code size} 1..32, or {@code bytes} when {@code size} is {@link #DYNAMIC}.
     */
    record BytesSchema(int size) implements TypeSchema {
        public static final int DYNAMIC = -1;

        public BytesSchema {
            if (size != DYNAMIC && (size < 1 || size > 32)) {
                throw new IllegalArgumentException("bytesN size must be 1-32, got " + size);
            }
        }

        @Override
        public boolean isDynamic() {
            return size == DYNAMIC;
        }

        @Override
        public String typeName() {
            return size == DYNAMIC ? "bytes" : "bytes" + size;
        }
    }

    record StringSchema() implements TypeSchema {
        @Override
        public boolean isDynamic() {
            return true;
        }

        @Override
        public String typeName() {
            return "string";
        }
    }

    /**
     * {@code T[k]} for {@code fixedLength >= 0}, or {@code T[]} when it is {@link #DYNAMIC}.
     */
    record ArraySchema(TypeSchema element, int fixedLength) implements TypeSchema {
        public static final int DYNAMIC = -1;

        public ArraySchema {
            Objects.requireNonNull(element, "element");
            if (fixedLength < DYNAMIC) {
                throw new IllegalArgumentException("Invalid array length: " + fixedLength);
            }
        }

        @Override
        public boolean isDynamic() {
            return fixedLength == DYNAMIC || element.isDynamic();
        }

        @Override
        public int headSize() {
            return isDynamic() ? 32 : fixedLength * element.headSize();
        }

        @Override
        public String typeName() {
            return element.typeName() + (fixedLength == DYNAMIC ? "[]" : "[" + fixedLength + "]");
        }
    }

    record TupleSchema(List<TypeSchema> components) implements TypeSchema {
        public TupleSchema {
            components = List.copyOf(Objects.requireNonNull(components, "components"));
        }

        @Override
        public boolean isDynamic() {
            return components.stream().anyMatch(TypeSchema::isDynamic);
        }

        @Override
        public int headSize() {
            return isDynamic() ? 32 : components.stream().mapToInt(TypeSchema::headSize).sum();
        }

        @Override
        public String typeName() {
            return components.stream().map(TypeSchema::typeName).collect(Collectors.joining(",", "(", ")"));
        }
    }

    private static void checkWidth(final int width, final String kind) {
        if (width % 8 != 0 || width < 8 || width > 256) {
            throw new IllegalArgumentException("Invalid " + kind + " width: " + width);
        }
    }
}
