// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.rpc.clef;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.radius.core.crypto.Keccak256;
import io.radius.core.crypto.Signature;
import io.radius.core.crypto.Signer;
import io.radius.core.error.ConfigurationException;
import io.radius.core.error.RpcException;
import io.radius.core.tx.LegacyTransaction;
import io.radius.core.tx.SignedTransaction;
import io.radius.core.types.Address;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;
import io.radius.primitives.Hex;
import io.radius.rpc.JsonRpcResponse;
import io.radius.rpc.RpcTransport;
import io.radius.rpc.internal.RpcUtils;

/**
 * Delegates signing to a Clef daemon over its external JSON-RPC API
 * ({@code account_list}, {@code account_signTransaction},
 * {@code account_signData}).
 *
 * <pre>{@code
 * Signer signer = ClefSigner.builder("http://localhost:8550")
 *         .address(new Address("0x..."))
 *         .chainIdSource(() -> client.chainId().join())
 *         .build();
 * }</pre>
 *
 * <p>Clef fills in nothing on our behalf, so transactions must carry a gas
 * price and gas limit; {@link #fallbackGasPrice()} is empty.
 */
public final class ClefSigner implements Signer {

    private static final Logger LOG = LoggerFactory.getLogger(ClefSigner.class);

    private final RpcTransport transport;
    private final Address address;
    private final long chainId;

    private ClefSigner(final RpcTransport transport, final Address address, final long chainId) {
        this.transport = transport;
        this.address = address;
        this.chainId = chainId;
    }

    public static Builder builder(final String url) {
        return new Builder(RpcTransport.http(Objects.requireNonNull(url, "url")));
    }

    public static Builder builder(final RpcTransport transport) {
        return new Builder(Objects.requireNonNull(transport, "transport"));
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public long chainId() {
        return chainId;
    }

    /**
     * @throws RpcException if Clef rejects the request or returns no raw transaction
     */
    @Override
    public SignedTransaction signTransaction(final LegacyTransaction tx) {
        Objects.requireNonNull(tx, "tx");
        final JsonRpcResponse response =
                transport.send("account_signTransaction", List.of(tx.toRpcObject(address, chainId)));
        final Map<String, Object> result = response.resultAsMap();
        if (result == null) {
            throw RpcException.nullResult("account_signTransaction");
        }
        final String rawHex = RpcUtils.stringValue(result.get("raw"));
        if (rawHex == null) {
            throw RpcException.malformedResult(
                    "account_signTransaction", new IllegalArgumentException("missing 'raw'"));
        }
        try {
            final HexData raw = HexData.of(rawHex);
            return new SignedTransaction(transactionHash(result.get("tx"), raw), raw, tx);
        } catch (IllegalArgumentException e) {
            throw RpcException.malformedResult("account_signTransaction", e);
        }
    }

    /**
     * Signs {@code message} as {@code text/plain} data; Clef applies the
     * EIP-191 personal-message prefix itself.
     *
     * @throws RpcException if Clef fails or returns anything but 65 bytes
     */
    @Override
    public Signature signMessage(final byte[] message) {
        Objects.requireNonNull(message, "message");
        final JsonRpcResponse response = transport.send(
                "account_signData", List.of("text/plain", address.value(), Hex.encode(message)));
        final String result = response.resultAsString();
        if (result == null) {
            throw RpcException.nullResult("account_signData");
        }
        final byte[] bytes;
        try {
            bytes = Hex.decode(result);
        } catch (IllegalArgumentException e) {
            throw RpcException.malformedResult("account_signData", e);
        }
        if (bytes.length != Signature.WIRE_LENGTH) {
            throw RpcException.malformedResult("account_signData", new IllegalArgumentException(
                    "expected " + Signature.WIRE_LENGTH + " signature bytes, got " + bytes.length));
        }
        return Signature.fromBytes(bytes);
    }

    @Override
    public String toString() {
        return "ClefSigner[address=" + address + ", chainId=" + chainId + "]";
    }

    private static Hash transactionHash(final @Nullable Object txObject, final HexData raw) {
        if (txObject instanceof Map<?, ?>) {
            final Object hash = ((Map<?, ?>) txObject).get("hash");
            if (hash != null) {
                return new Hash(hash.toString());
            }
        }
        return Hash.fromBytes(Keccak256.hash(raw.toBytes()));
    }

    public static final class Builder {
        private final RpcTransport transport;
        private @Nullable Address address;
        private @Nullable Long chainId;
        private @Nullable LongSupplier chainIdSource;

        private Builder(final RpcTransport transport) {
            this.transport = transport;
        }

        public Builder address(final Address address) {
            this.address = Objects.requireNonNull(address, "address");
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
         * Evaluated once, in {@link #build()}.
         */
        public Builder chainIdSource(final LongSupplier source) {
            this.chainIdSource = Objects.requireNonNull(source, "source");
            return this;
        }

        /**
         * Probes Clef with {@code account_list} before returning.
         *
         * @throws ConfigurationException if settings are missing or Clef is unreachable
         */
        public ClefSigner build() {
            if (address == null) {
                throw new ConfigurationException("address is required");
            }
            if ((chainId == null) == (chainIdSource == null)) {
                throw new ConfigurationException("Exactly one of chainId or chainIdSource must be set");
            }
            final List<Object> accounts;
            try {
                accounts = transport.send("account_list", List.of()).resultAsList();
            } catch (RpcException | IllegalArgumentException e) {
                throw new ConfigurationException("Clef is not reachable: " + e.getMessage(), e);
            }
            if (accounts == null || accounts.stream().noneMatch(a -> address.value().equalsIgnoreCase(
                    String.valueOf(a)))) {
                LOG.warn("Address {} is not listed by Clef; signing requests may be rejected", address);
            }
            final long resolved = chainId != null ? chainId : chainIdSource.getAsLong();
            if (resolved < 0) {
                throw new ConfigurationException("chainId cannot be negative: " + resolved);
            }
            return new ClefSigner(transport, address, resolved);
        }
    }
}
