// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.abi;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import io.radius.core.crypto.Keccak256;
import io.radius.core.model.Event;
import io.radius.core.types.Hash;
import io.radius.core.types.HexData;

/**
 * A parsed contract ABI.
 *
 * <p>Functions and events are indexed by name; overloaded names are rejected
 * when parsing. Instances are immutable and may be shared between contracts
 * and threads.
 *
 * <pre>{@code
 * Abi abi = Abi.fromJson(json);
 * HexData calldata = abi.encodeFunction("transfer", recipient, BigInteger.TEN);
 * List<Object> out = abi.decodeFunctionResult("balanceOf", returned);
 * }</pre>
 */
public interface Abi {

    /**
     * Parses a JSON ABI array.
     *
     * @throws io.radius.core.error.ConfigurationException if the JSON is malformed,
     *         not an array, declares duplicate function or event names, more than one
     *         constructor, or an unsupported type
     */
    static Abi fromJson(final String json) {
        return new InternalAbi(json);
    }

    /**
     * The first four bytes of keccak256 over a signature such as
     * {@code transfer(address,uint256)}.
     */
    static HexData functionSelector(final String signature) {
        return HexData.fromBytes(Arrays.copyOf(Keccak256.hashUtf8(requireSignature(signature)), 4));
    }

    /**
     * keccak256 over an event signature such as
     * {@code Transfer(address,address,uint256)}.
     */
    static Hash eventTopic(final String signature) {
        return Hash.fromBytes(Keccak256.hashUtf8(requireSignature(signature)));
    }

    /**
     * Encodes a call: selector followed by the encoded arguments.
     *
     * @throws io.radius.core.error.UnknownMethodException if the ABI has no such function
     * @throws io.radius.core.error.AbiEncodingException on an argument mismatch
     */
    HexData encodeFunction(String name, Object... args);

    /**
     * Decodes the return data of {@code name}. Empty data yields an empty list.
     *
     * <p>If strict decoding fails and the function has a single unsigned
     * integer output, the trailing 32 bytes (or the whole payload when shorter)
     * are read as that integer.
     *
     * @throws io.radius.core.error.UnknownMethodException if the ABI has no such function
     * @throws io.radius.core.error.AbiDecodingException if the data cannot be decoded
     */
    List<Object> decodeFunctionResult(String name, byte[] data);

    default List<Object> decodeFunctionResult(final String name, final HexData data) {
        return decodeFunctionResult(name, data.toBytes());
    }

    /**
     * Encodes constructor arguments, without a selector.
     *
     * @return {@link HexData#EMPTY} when neither constructor nor arguments exist
     * @throws io.radius.core.error.MissingConstructorException if arguments are given but no
     *         constructor is declared
     */
    HexData encodeConstructor(Object... args);

    Optional<FunctionMetadata> function(String name);

    /**
     * The topic-0 hash of the named event, if declared.
     */
    Optional<Hash> eventTopicOf(String eventName);

    /**
     * Decodes an emitted log against the named event, returning parameters in
     * declaration order. Indexed reference-type parameters (strings, bytes,
     * arrays, tuples) are stored hashed, so they come back as their topic
     * {@link Hash}.
     *
     * @throws io.radius.core.error.AbiDecodingException if the event is unknown, topic 0
     *         does not match, or topics or data are missing
     */
    List<Object> decodeEvent(String eventName, Event event);

    boolean hasConstructor();

    boolean hasFallback();

    boolean hasReceive();

    private static String requireSignature(final String signature) {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("signature must be provided");
        }
        return signature;
    }
}
