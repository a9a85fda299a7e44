// SPDX-License-Identifier: MIT OR Apache-2.0
package io.radius.core.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A non-negative amount of the native token in its smallest unit.
 *
 * <p>1 ether = 10^18 wei, 1 gwei = 10^9 wei.
 */
public record Wei(BigInteger value) implements Comparable<Wei> {

    private static final BigDecimal WEI_PER_ETHER = BigDecimal.TEN.pow(18);
    private static final BigInteger WEI_PER_GWEI = BigInteger.TEN.pow(9);

    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei cannot be negative: " + value);
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(WEI_PER_GWEI));
    }

    /**
     * Converts an ether amount. Fractions below one wei are rejected.
     *
     * @throws ArithmeticException if {@code ether} has more than 18 decimals
     */
    public static Wei fromEther(final BigDecimal ether) {
        Objects.requireNonNull(ether, "ether");
        return new Wei(ether.multiply(WEI_PER_ETHER).toBigIntegerExact());
    }

    public BigDecimal toEther() {
        return new BigDecimal(value).divide(WEI_PER_ETHER, 18, RoundingMode.DOWN).stripTrailingZeros();
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    @JsonValue
    public String toHexString() {
        return "0x" + value.toString(16);
    }

    @Override
    public int compareTo(final Wei other) {
        return value.compareTo(other.value);
    }
}
