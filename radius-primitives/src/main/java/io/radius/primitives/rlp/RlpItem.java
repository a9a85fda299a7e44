// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.primitives.rlp;

/**
 * A node in an RLP tree: either a byte string or a list of items.
 */
public sealed interface RlpItem permits RlpString, RlpList {

    /**
     * Returns the RLP encoding of this item, header included.
     */
    byte[] encode();
}
