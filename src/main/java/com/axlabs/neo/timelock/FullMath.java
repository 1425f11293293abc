package com.axlabs.neo.timelock;

import java.math.BigInteger;

/**
 * Unsigned 256-bit arithmetic helpers.
 */
public final class FullMath {

    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private FullMath() {
    }

    /**
     * Calculates {@code floor(a * b / denominator)} without losing precision in the intermediate product.
     *
     * @param a           The multiplicand.
     * @param b           The multiplier.
     * @param denominator The divisor.
     * @return the quotient.
     * @throws ArithmeticException if an operand is not a uint256, the denominator is zero or the result does not
     *                             fit into 256 bits.
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        requireUint256(a);
        requireUint256(b);
        requireUint256(denominator);
        if (denominator.signum() == 0) {
            throw new ArithmeticException("mulDiv: division by zero");
        }
        return requireUint256(a.multiply(b).divide(denominator));
    }

    /**
     * Subtracts like a checked uint256 subtraction does.
     *
     * @throws ArithmeticException if {@code b > a}.
     */
    public static BigInteger sub(BigInteger a, BigInteger b) {
        BigInteger result = a.subtract(b);
        if (result.signum() < 0) {
            throw new ArithmeticException("sub: underflow");
        }
        return result;
    }

    public static boolean isUint256(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(MAX_UINT256) <= 0;
    }

    static BigInteger requireUint256(BigInteger value) {
        if (!isUint256(value)) {
            throw new ArithmeticException("Value is not a uint256: " + value);
        }
        return value;
    }
}
