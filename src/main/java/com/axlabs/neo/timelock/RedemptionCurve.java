package com.axlabs.neo.timelock;

import java.math.BigInteger;

import static com.axlabs.neo.timelock.FullMath.mulDiv;
import static com.axlabs.neo.timelock.FullMath.sub;

/**
 * The curve that maps the redemption rate, the membership supply and the redeemable pool to the value paid for a
 * redeemed unit.
 * <pre>
 * base   = pool / supply
 * result = base * (rate + (MAX - rate) / supply) / MAX
 * </pre>
 * A rate of zero pays nothing and a rate of {@link #MAX_REDEMPTION_RATE} pays the full base.
 */
public final class RedemptionCurve {

    public static final BigInteger MAX_REDEMPTION_RATE = BigInteger.valueOf(10000); // basis points

    private RedemptionCurve() {
    }

    /**
     * @param rate   The redemption rate in basis points.
     * @param supply The number of outstanding membership units.
     * @param pool   The redeemable value.
     * @return the value paid for one unit.
     * @throws ArithmeticException if {@code supply} is zero while the rate is not, or if the rate is above
     *                             {@link #MAX_REDEMPTION_RATE}.
     */
    public static BigInteger calculate(BigInteger rate, BigInteger supply, BigInteger pool) {
        if (rate.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger base = mulDiv(pool, BigInteger.ONE, supply);
        if (rate.equals(MAX_REDEMPTION_RATE)) {
            return base;
        }
        BigInteger correction = mulDiv(BigInteger.ONE, sub(MAX_REDEMPTION_RATE, rate), supply);
        return mulDiv(base, rate.add(correction), MAX_REDEMPTION_RATE);
    }
}
