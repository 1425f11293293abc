package com.axlabs.neo.timelock;

import com.axlabs.neo.timelock.runtime.Blockchain;
import com.axlabs.neo.timelock.runtime.Event;
import com.axlabs.neo.timelock.runtime.StorageContext;
import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Calculates the value paid for a redeemed membership unit from the non-allocated treasury, the membership supply
 * and the redemption rate.
 */
public class RedemptionCalculator {

    static final String REDEMPTION_RATE_KEY = "redemptionRate";

    private final Blockchain blockchain;
    private final Hash160 self;
    private final Hash160 membershipRegistry;
    private final ObligationAggregator obligations;
    private final AdminAuthority authority;
    private final StorageContext ctx;

    private final Event rateChanged;

    RedemptionCalculator(Blockchain blockchain, Hash160 self, Hash160 membershipRegistry,
            ObligationAggregator obligations, AdminAuthority authority) {
        this.blockchain = blockchain;
        this.self = self;
        this.membershipRegistry = membershipRegistry;
        this.obligations = obligations;
        this.authority = authority;
        this.ctx = blockchain.getStorageContext(self);
        this.rateChanged = new Event(blockchain, self, "NewRedemptionRate");
    }

    public BigInteger getRedemptionRate() {
        return ctx.getBigInteger(REDEMPTION_RATE_KEY);
    }

    /**
     * @return the native value held by the treasury.
     */
    public BigInteger totalTreasury() {
        return blockchain.getBalance(self);
    }

    /**
     * @return the value paid for one redeemed unit at the current state.
     */
    public BigInteger calculateRedemption() {
        BigInteger nonAllocated = FullMath.sub(totalTreasury(), obligations.allocatedTreasury());
        BigInteger totalSupply = blockchain.getContract(membershipRegistry, MembershipRegistry.class).totalSupply();
        return RedemptionCurve.calculate(getRedemptionRate(), totalSupply, nonAllocated);
    }

    /**
     * Sets the redemption rate. The rate is not checked against {@link RedemptionCurve#MAX_REDEMPTION_RATE}.
     * <p>
     * This method can only be called by the admin.
     *
     * @param caller  The calling identity.
     * @param newRate The new rate in basis points.
     */
    void setRedemptionRate(Hash160 caller, BigInteger newRate) {
        authority.abortIfCallerIsNotAdmin(caller, "setRedemptionRate");
        if (!FullMath.isUint256(newRate)) {
            throw new BoundsException("setRedemptionRate", "Invalid redemption rate");
        }
        ctx.put(REDEMPTION_RATE_KEY, newRate);
        rateChanged.fire(newRate);
    }

    void initialize(BigInteger rate) {
        if (!FullMath.isUint256(rate)) {
            throw new BoundsException("deploy", "Invalid redemption rate");
        }
        ctx.put(REDEMPTION_RATE_KEY, rate);
    }
}
