// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.crypto;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

import org.jspecify.annotations.Nullable;

import io.radius.core.error.ConfigurationException;
import io.radius.core.tx.LegacyTransaction;
import io.radius.core.tx.SignedTransaction;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;
import io.radius.core.types.Wei;

/**
 * Signs locally with an in-memory {@link PrivateKey}.
 *
 * <pre>{@code
 * Signer signer = PrivateKeySigner.builder()
 *         .privateKey("0x4c08...")
 *         .chainId(1223953L)
 *         .build();
 * }</pre>
 *
 * <p>A transaction with no gas price is signed at zero.
 */
public final class PrivateKeySigner implements Signer {

    private final PrivateKey key;
    private final Address address;
    private final long chainId;

    private PrivateKeySigner(final PrivateKey key, final long chainId) {
        this.key = key;
        this.address = key.toAddress();
        this.chainId = chainId;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public long chainId() {
        return chainId;
    }

    @Override
    public Optional<Wei> fallbackGasPrice() {
        return Optional.of(Wei.ZERO);
    }

    @Override
    public SignedTransaction signTransaction(final LegacyTransaction tx) {
        Objects.requireNonNull(tx, "tx");
        final Signature parity = key.sign(hash(tx).toBytes());
        final int v = chainId == 0
                ? 27 + parity.v()
                : Math.toIntExact(chainId * 2 + 35 + parity.v());
        final byte[] envelope = tx.encodeAsEnvelope(new Signature(parity.r(), parity.s(), v));
        return new SignedTransaction(Hash.fromBytes(Keccak256.hash(envelope)), HexData.fromBytes(envelope), tx);
    }

    @Override
    public Signature signMessage(final byte[] message) {
        Objects.requireNonNull(message, "message");
        final Signature parity = key.sign(Signer.personalMessageHash(message));
        return new Signature(parity.r(), parity.s(), 27 + parity.v());
    }

    @Override
    public String toString() {
        return "PrivateKeySigner[address=" + address + ", chainId=" + chainId + "]";
    }

    public static final class Builder {
        private @Nullable PrivateKey key;
        private @Nullable Long chainId;
        private @Nullable LongSupplier chainIdSource;

        private Builder() {
        }

        public Builder privateKey(final String hex) {
            this.key = PrivateKey.fromHex(hex);
            return this;
        }

        public Builder privateKey(final PrivateKey key) {
            this.key = Objects.requireNonNull(key, "key");
            return this;
        }

        public Builder chainId(final long chainId) {
            if (chainId < 0) {
                throw new ConfigurationException("chainId cannot be negative: " + chainId);
            }
            this.chainId = chainId;
            return this;
        }

        /**
         * Supplies the chain id lazily, typically from a node. Evaluated exactly
         * once, in {@link #build()}.
         */
        public Builder chainIdSource(final LongSupplier source) {
            this.chainIdSource = Objects.requireNonNull(source, "source");
            return this;
        }

        /**
         * @throws ConfigurationException if the key is missing or the chain id is
         *         not set exactly once
         */
        public PrivateKeySigner build() {
            if (key == null) {
                throw new ConfigurationException("privateKey is required");
            }
            if ((chainId == null) == (chainIdSource == null)) {
                throw new ConfigurationException("Exactly one of chainId or chainIdSource must be set");
            }
            final long resolved = chainId != null ? chainId : chainIdSource.getAsLong();
            if (resolved < 0) {
                throw new ConfigurationException("chainId cannot be negative: " + resolved);
            }
            return new PrivateKeySigner(key, resolved);
        }
    }
}
