// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.model;

/**
 * A block selector for state queries: a named tag or a block height.
 */
public sealed interface BlockTag permits BlockTag.Named, BlockTag.Number {

    BlockTag LATEST = new Named("latest");
    BlockTag PENDING = new Named("pending");
    BlockTag EARLIEST = new Named("earliest");
    BlockTag SAFE = new Named("safe");
    BlockTag FINALIZED = new Named("finalized");

    static BlockTag of(final long blockNumber) {
        return new Number(blockNumber);
    }

    /**
     * The JSON-RPC form: the tag name, or the height as {@code 0x} hex.
     */
    String toRpcValue();

    record Named(String name) implements BlockTag {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Block tag name cannot be blank");
            }
        }

        @Override
        public String toRpcValue() {
            return name;
        }
    }

    record Number(long blockNumber) implements BlockTag {
        public Number {
            if (blockNumber < 0) {
                throw new IllegalArgumentException("Block number cannot be negative: " + blockNumber);
            }
        }

        @Override
        public String toRpcValue() {
            return "0x" + Long.toHexString(blockNumber);
        }
    }
}
