// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.tx;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.radius.core.crypto.Signature;
import io.radius.core.types.Address;
import io.radius.core.types.HexData;
import io.radius.core.types.Wei;
import io.radius.primitives.rlp.Rlp;
import io.radius.primitives.rlp.RlpItem;
import io.radius.primitives.rlp.RlpString;

/**
 * A fully specified EIP-155 legacy transaction, the only shape a
 * {@link io.radius.core.crypto.Signer} accepts.
 *
 * <p>Signing preimage:
 * {@code RLP([nonce, gasPrice, gasLimit, to, value, data, chainId, 0, 0])},
 * or the six-field form when {@code chainId == 0}. Signed envelope:
 * {@code RLP([nonce, gasPrice, gasLimit, to, value, data, v, r, s])}.
 *
 * @param nonce    sender nonce
 * @param gasPrice price per gas unit
 * @param gasLimit maximum gas the transaction may consume
 * @param to       recipient, or {@code null} for contract creation
 * @param value    native value transferred
 * @param data     calldata or creation bytecode
 */
public record LegacyTransaction(
        long nonce,
        Wei gasPrice,
        long gasLimit,
        @Nullable Address to,
        Wei value,
        HexData data) {

    public LegacyTransaction {
        if (nonce < 0) {
            throw new IllegalArgumentException("nonce cannot be negative");
        }
        Objects.requireNonNull(gasPrice, "gasPrice");
        if (gasLimit <= 0) {
            throw new IllegalArgumentException("gasLimit must be positive");
        }
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(data, "data");
    }

    public boolean isContractCreation() {
        return to == null;
    }

    public byte[] encodeForSigning(final long chainId) {
        if (chainId < 0) {
            throw new IllegalArgumentException("chainId cannot be negative");
        }
        final List<RlpItem> items = fields();
        if (chainId != 0) {
            items.add(RlpString.of(chainId));
            items.add(RlpString.of(0L));
            items.add(RlpString.of(0L));
        }
        return Rlp.encodeList(items);
    }

    /**
     * Encodes the network envelope. {@code signature.v()} must already carry the
     * replay-protected value ({@code chainId * 2 + 35 + yParity}, or
     * {@code 27 + yParity} without a chain id).
     */
    public byte[] encodeAsEnvelope(final Signature signature) {
        Objects.requireNonNull(signature, "signature");
        if (signature.v() < 27) {
            throw new IllegalArgumentException("Legacy signature v must be 27, 28 or >= 35, got " + signature.v());
        }
        final List<RlpItem> items = fields();
        items.add(RlpString.of(signature.v()));
        items.add(RlpString.of(signature.rAsBigInteger()));
        items.add(RlpString.of(signature.sAsBigInteger()));
        return Rlp.encodeList(items);
    }

    /**
     * Renders the JSON-RPC transaction object used by remote signers, with
     * quantities as {@code 0x} hex and {@code to} omitted for creations.
     */
    public Map<String, Object> toRpcObject(final Address from, final long chainId) {
        Objects.requireNonNull(from, "from");
        final Map<String, Object> out = new LinkedHashMap<>();
        out.put("from", from.value());
        if (to != null) {
            out.put("to", to.value());
        }
        out.put("nonce", quantity(nonce));
        out.put("gas", quantity(gasLimit));
        out.put("gasPrice", gasPrice.toHexString());
        out.put("value", value.toHexString());
        out.put("data", data.value());
        out.put("chainId", quantity(chainId));
        return out;
    }

    private List<RlpItem> fields() {
        final List<RlpItem> items = new ArrayList<>(9);
        items.add(RlpString.of(nonce));
        items.add(RlpString.of(gasPrice.value()));
        items.add(RlpString.of(gasLimit));
        items.add(RlpString.of(to != null ? to.toBytes() : new byte[0]));
        items.add(RlpString.of(value.value()));
        items.add(RlpString.of(data.toBytes()));
        return items;
    }

    private static String quantity(final long value) {
        return "0x" + Long.toHexString(value);
    }
}
