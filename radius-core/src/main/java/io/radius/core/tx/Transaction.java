// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.tx;

import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import io.radius.core.error.IncompleteTransactionException;
import io.radius.core.types.Address;
import io.radius.core.types.HexData;
import io.radius.core.types.Wei;

/**
 * A transaction as the caller describes it, before nonce, gas limit and gas
 * price are known.
 *
 * <p>Instances are immutable. The {@code with*} methods return filled copies,
 * and {@link #toLegacy(Wei)} produces the complete form once every field is
 * present.
 *
 * <pre>{@code
 * Transaction tx = Transaction.builder()
 *         .to(recipient)
 *         .value(Wei.gwei(5))
 *         .build();
 * }</pre>
 */
public final class Transaction {

    private final @Nullable Address to;
    private final HexData data;
    private final Wei value;
    private final @Nullable Long nonce;
    private final @Nullable Wei gasPrice;
    private final @Nullable Long gasLimit;

    private Transaction(
            final @Nullable Address to,
            final HexData data,
            final Wei value,
            final @Nullable Long nonce,
            final @Nullable Wei gasPrice,
            final @Nullable Long gasLimit) {
        this.to = to;
        this.data = data;
        this.value = value;
        this.nonce = nonce;
        this.gasPrice = gasPrice;
        this.gasLimit = gasLimit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Address> to() {
        return Optional.ofNullable(to);
    }

    public HexData data() {
        return data;
    }

    public Wei value() {
        return value;
    }

    public Optional<Long> nonce() {
        return Optional.ofNullable(nonce);
    }

    public Optional<Wei> gasPrice() {
        return Optional.ofNullable(gasPrice);
    }

    public Optional<Long> gasLimit() {
        return Optional.ofNullable(gasLimit);
    }

    public boolean isContractCreation() {
        return to == null;
    }

    public Transaction withNonce(final long nonce) {
        return new Transaction(to, data, value, nonce, gasPrice, gasLimit);
    }

    public Transaction withGasLimit(final long gasLimit) {
        return new Transaction(to, data, value, nonce, gasPrice, gasLimit);
    }

    public Transaction withGasPrice(final Wei gasPrice) {
        Objects.requireNonNull(gasPrice, "gasPrice");
        return new Transaction(to, data, value, nonce, gasPrice, gasLimit);
    }

    /**
     * Produces the complete transaction.
     *
     * @param fallbackGasPrice price used when none is set, or {@code null} to
     *                         require one
     * @throws IncompleteTransactionException if nonce or gas limit is missing,
     *         or gas price is missing and no fallback is given
     */
    public LegacyTransaction toLegacy(final @Nullable Wei fallbackGasPrice) {
        if (nonce == null) {
            throw new IncompleteTransactionException("nonce");
        }
        if (gasLimit == null) {
            throw new IncompleteTransactionException("gasLimit");
        }
        final Wei price = gasPrice != null ? gasPrice : fallbackGasPrice;
        if (price == null) {
            throw new IncompleteTransactionException("gasPrice");
        }
        return new LegacyTransaction(nonce, price, gasLimit, to, value, data);
    }

    public Builder toBuilder() {
        final Builder builder = new Builder().data(data).value(value);
        builder.to = to;
        builder.nonce = nonce;
        builder.gasPrice = gasPrice;
        builder.gasLimit = gasLimit;
        return builder;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Transaction)) {
            return false;
        }
        final Transaction other = (Transaction) o;
        return Objects.equals(to, other.to)
                && data.equals(other.data)
                && value.equals(other.value)
                && Objects.equals(nonce, other.nonce)
                && Objects.equals(gasPrice, other.gasPrice)
                && Objects.equals(gasLimit, other.gasLimit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(to, data, value, nonce, gasPrice, gasLimit);
    }

    @Override
    public String toString() {
        return "Transaction[to=" + to + ", value=" + value.value() + ", data=" + data.byteLength()
                + " bytes, nonce=" + nonce + ", gasPrice=" + (gasPrice == null ? null : gasPrice.value())
                + ", gasLimit=" + gasLimit + "]";
    }

    public static final class Builder {
        private @Nullable Address to;
        private HexData data = HexData.EMPTY;
        private Wei value = Wei.ZERO;
        private @Nullable Long nonce;
        private @Nullable Wei gasPrice;
        private @Nullable Long gasLimit;

        private Builder() {
        }

        /** Recipient; leave unset for contract creation. */
        public Builder to(final Address to) {
            this.to = Objects.requireNonNull(to, "to");
            return this;
        }

        public Builder data(final HexData data) {
            this.data = Objects.requireNonNull(data, "data");
            return this;
        }

        public Builder value(final Wei value) {
            this.value = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder nonce(final long nonce) {
            if (nonce < 0) {
                throw new IllegalArgumentException("nonce cannot be negative");
            }
            this.nonce = nonce;
            return this;
        }

        public Builder gasPrice(final Wei gasPrice) {
            this.gasPrice = Objects.requireNonNull(gasPrice, "gasPrice");
            return this;
        }

        public Builder gasLimit(final long gasLimit) {
            if (gasLimit <= 0) {
                throw new IllegalArgumentException("gasLimit must be positive");
            }
            this.gasLimit = gasLimit;
            return this;
        }

        public Transaction build() {
            return new Transaction(to, data, value, nonce, gasPrice, gasLimit);
        }
    }
}
