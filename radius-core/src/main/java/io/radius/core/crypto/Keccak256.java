// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Keccak-256 (the pre-standard SHA-3 variant Ethereum uses).
 *
 * <p>Digests are cached per thread. Call {@link #cleanup()} from pooled threads
 * that outlive the application's class loader.
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
    }

    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Hashes the concatenation of {@code parts} without materialising it.
     */
    public static byte[] hash(final byte[]... parts) {
        Objects.requireNonNull(parts, "parts");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] part : parts) {
            digest.update(Objects.requireNonNull(part, "part"));
        }
        return digest.digest();
    }

    public static byte[] hashUtf8(final String text) {
        return hash(text.getBytes(StandardCharsets.UTF_8));
    }

    public static void cleanup() {
        DIGEST.remove();
    }
}
