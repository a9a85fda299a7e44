// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.jspecify.annotations.Nullable;

import io.radius.core.types.Address;

/**
 * secp256k1 arithmetic: RFC 6979 deterministic signing, public key recovery
 * and address derivation.
 *
 * <p>Signatures are low-s normalised (EIP-2). The y-parity of the nonce point
 * is read during signing, so no recovery pass is needed to find {@code v}.
 */
final class Secp256k1 {

    private static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECDomainParameters CURVE =
            new ECDomainParameters(PARAMS.getCurve(), PARAMS.getG(), PARAMS.getN(), PARAMS.getH());
    private static final BigInteger HALF_N = PARAMS.getN().shiftRight(1);
    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private Secp256k1() {
    }

    static ECPoint publicPoint(final BigInteger privateKey) {
        return MULTIPLIER.multiply(CURVE.getG(), privateKey).normalize();
    }

    /**
     * Signs a 32-byte digest.
     *
     * @return signature whose {@code v} is the bare y-parity (0 or 1)
     */
    static Signature sign(final byte[] digest, final BigInteger privateKey) {
        final BigInteger n = CURVE.getN();
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(n, privateKey, digest);
        final BigInteger z = new BigInteger(1, digest);

        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();
            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(n);
            if (r.signum() == 0) {
                continue;
            }
            BigInteger s = k.modInverse(n).multiply(z.add(r.multiply(privateKey))).mod(n);
            if (s.signum() == 0) {
                continue;
            }
            int parity = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;
            if (s.compareTo(HALF_N) > 0) {
                // negating s mirrors R, so the parity flips too
                s = n.subtract(s);
                parity ^= 1;
            }
            return new Signature(toBytes32(r), toBytes32(s), parity);
        }
    }

    static @Nullable ECPoint recover(final byte[] digest, final BigInteger r, final BigInteger s, final int parity) {
        final BigInteger n = CURVE.getN();
        if (r.signum() <= 0 || s.signum() <= 0 || r.compareTo(n) >= 0 || s.compareTo(n) >= 0) {
            return null;
        }
        final byte[] compressed = new byte[33];
        compressed[0] = (byte) (parity == 1 ? 0x03 : 0x02);
        final byte[] x = toBytes32(r);
        System.arraycopy(x, 0, compressed, 1, 32);
        final ECPoint point = CURVE.getCurve().decodePoint(compressed);
        if (!point.isValid() || !point.multiply(n).isInfinity()) {
            return null;
        }
        final BigInteger e = new BigInteger(1, digest);
        final BigInteger rInv = r.modInverse(n);
        final BigInteger u1 = rInv.multiply(e).negate().mod(n);
        final BigInteger u2 = rInv.multiply(s).mod(n);
        return CURVE.getG().multiply(u1).add(point.multiply(u2)).normalize();
    }

    static Address toAddress(final ECPoint publicKey) {
        final byte[] encoded = publicKey.getEncoded(false);
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        if (bytes.length == 32) {
            return bytes;
        }
        final byte[] out = new byte[32];
        if (bytes.length > 32) {
            System.arraycopy(bytes, bytes.length - 32, out, 0, 32);
        } else {
            System.arraycopy(bytes, 0, out, 32 - bytes.length, bytes.length);
        }
        return out;
    }
}
