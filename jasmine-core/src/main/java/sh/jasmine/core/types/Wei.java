// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.jasmine.core.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * A non-negative quantity of the native currency in wei (10^-18 ether).
 * <p>
 * <strong>Conversions:</strong>
 * <ul>
 * <li>1 ether = 10^18 wei</li>
 * <li>1 gwei = 10^9 wei</li>
 * </ul>
 * <p>
 * {@link #fromEther(BigDecimal)} drops any fraction below one wei, rounding
 * toward zero. {@link #toEther()} is exact.
 *
 * @since 0.1.0
 */
public record Wei(BigInteger value) implements Comparable<Wei> {
    private static final int ETHER_DECIMALS = 18;
    private static final BigDecimal WEI_PER_ETHER = BigDecimal.TEN.pow(ETHER_DECIMALS);
    private static final BigInteger GWEI_MULTIPLIER = BigInteger.valueOf(1_000_000_000L);

    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(GWEI_MULTIPLIER));
    }

    /**
     * Converts an ether amount to wei, truncating sub-wei fractions toward zero.
     *
     * @param ether a non-negative ether amount
     * @return the wei amount
     * @throws IllegalArgumentException if {@code ether} is negative
     */
    public static Wei fromEther(final BigDecimal ether) {
        Objects.requireNonNull(ether, "ether");
        return new Wei(ether.multiply(WEI_PER_ETHER).setScale(0, RoundingMode.DOWN).toBigIntegerExact());
    }

    /**
     * Returns this amount in ether with scale 18.
     *
     * @return the exact ether value
     */
    public BigDecimal toEther() {
        return new BigDecimal(value).divide(WEI_PER_ETHER, ETHER_DECIMALS, RoundingMode.UNNECESSARY);
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public String toHexString() {
        return "0x" + value.toString(16);
    }

    @Override
    public int compareTo(final Wei other) {
        return value.compareTo(other.value);
    }
}
