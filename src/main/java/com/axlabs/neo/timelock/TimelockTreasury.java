package com.axlabs.neo.timelock;

import com.axlabs.neo.timelock.runtime.Blockchain;
import com.axlabs.neo.timelock.runtime.Event;
import com.axlabs.neo.timelock.runtime.InvocationResult;
import com.axlabs.neo.timelock.runtime.InvocationTarget;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * The administrative account of the DAO. It holds the treasury, executes administrative calls through a timelock
 * and lets members redeem their membership units for a share of the treasury.
 * <p>
 * Every state changing method runs atomically. If it fails, nothing it did persists.
 */
public class TimelockTreasury implements InvocationTarget {

    private static final Logger LOG = LoggerFactory.getLogger(TimelockTreasury.class);
    private static final byte[] EMPTY = new byte[0];

    // Signatures of the methods that can be called through the timelock.
    public static final String SET_DELAY = "setDelay(uint256)";
    public static final String SET_PENDING_ADMIN = "setPendingAdmin(address)";
    public static final String ACCEPT_ADMIN = "acceptAdmin()";
    public static final String SET_REDEMPTION_RATE = "setRedemptionRate(uint256)";

    private final Blockchain blockchain;
    private final Hash160 hash;
    private final Hash160 membershipRegistry;

    private final AdminAuthority authority;
    private final TimelockEngine engine;
    private final ObligationAggregator obligations;
    private final RedemptionCalculator redemption;

    private final Event redeemed;

    /**
     * Initialises the treasury. The admin is also the proposal source whose proposals are counted as allocated
     * treasury.
     *
     * @param blockchain         The chain the treasury lives on.
     * @param hash               The hash of the treasury.
     * @param membershipRegistry The registry of the redeemable membership units.
     * @param admin              The initial admin.
     * @param delay              The initial delay in seconds.
     * @param redemptionRate     The initial redemption rate in basis points.
     */
    public TimelockTreasury(Blockchain blockchain, Hash160 hash, Hash160 membershipRegistry, Hash160 admin,
            long delay, BigInteger redemptionRate) {
        if (membershipRegistry == null) {
            throw new BoundsException("deploy", "Invalid membership registry hash");
        }
        this.blockchain = blockchain;
        this.hash = hash;
        this.membershipRegistry = membershipRegistry;
        this.authority = new AdminAuthority(blockchain, hash);
        this.engine = new TimelockEngine(blockchain, hash, authority);
        this.obligations = new ObligationAggregator(blockchain, admin);
        this.redemption = new RedemptionCalculator(blockchain, hash, membershipRegistry, obligations, authority);
        this.redeemed = new Event(blockchain, hash, "Redeemed");
        blockchain.atomically(() -> {
            authority.initialize(admin, delay);
            redemption.initialize(redemptionRate);
        });
    }

    public TimelockTreasury(Blockchain blockchain, Hash160 hash, Hash160 membershipRegistry, Hash160 admin,
            long delay) {
        this(blockchain, hash, membershipRegistry, admin, delay, BigInteger.ZERO);
    }

    //region SAFE METHODS

    public Hash160 getHash() {
        return hash;
    }

    public Hash160 getMembershipRegistry() {
        return membershipRegistry;
    }

    public Hash160 getProposalSource() {
        return obligations.getProposalSource();
    }

    public Hash160 getAdmin() {
        return authority.getAdmin();
    }

    public Hash160 getPendingAdmin() {
        return authority.getPendingAdmin();
    }

    public long getDelay() {
        return authority.getDelay();
    }

    public BigInteger getRedemptionRate() {
        return redemption.getRedemptionRate();
    }

    public boolean isQueued(Hash256 fingerprint) {
        return engine.isQueued(fingerprint);
    }

    public BigInteger totalTreasury() {
        return redemption.totalTreasury();
    }

    public BigInteger allocatedTreasury() {
        return obligations.allocatedTreasury();
    }

    public BigInteger calculateRedemption() {
        return redemption.calculateRedemption();
    }
    //endregion SAFE METHODS

    //region TIMELOCK

    public Hash256 queueTransaction(Hash160 caller, Hash160 target, BigInteger value, String signature,
            byte[] data, long eta) {
        return blockchain.atomically(() ->
                engine.queueTransaction(caller, new Action(target, value, signature, data, eta)));
    }

    public void cancelTransaction(Hash160 caller, Hash160 target, BigInteger value, String signature,
            byte[] data, long eta) {
        blockchain.atomically(() ->
                engine.cancelTransaction(caller, new Action(target, value, signature, data, eta)));
    }

    public byte[] executeTransaction(Hash160 caller, Hash160 target, BigInteger value, String signature,
            byte[] data, long eta) {
        return blockchain.atomically(() ->
                engine.executeTransaction(caller, new Action(target, value, signature, data, eta)));
    }
    //endregion TIMELOCK

    //region ADMIN

    /**
     * Sets the timelock delay. Only callable by the treasury itself, i.e. through an executed action.
     */
    public void setDelay(long delay) {
        setDelay(BigInteger.valueOf(delay));
    }

    private void setDelay(BigInteger delay) {
        blockchain.atomically(() -> authority.setDelay(delay));
    }

    /**
     * Sets the pending admin. Only callable by the treasury itself, i.e. through an executed action.
     */
    public void setPendingAdmin(Hash160 pendingAdmin) {
        blockchain.atomically(() -> authority.setPendingAdmin(pendingAdmin));
    }

    /**
     * Makes the caller the admin. Only callable by the pending admin.
     */
    public void acceptAdmin(Hash160 caller) {
        blockchain.atomically(() -> authority.acceptAdmin(caller));
    }

    /**
     * Sets the redemption rate. Only callable by the admin.
     */
    public void setRedemptionRate(Hash160 caller, BigInteger rate) {
        blockchain.atomically(() -> redemption.setRedemptionRate(caller, rate));
    }
    //endregion ADMIN

    //region REDEMPTION

    /**
     * Burns the caller's membership unit and pays out the current redemption value in GAS.
     * <p>
     * The redemption value is calculated once per call from the aggregate state. It does not depend on which
     * unit is redeemed.
     *
     * @param caller The owner of the unit.
     * @param unitId The unit to redeem.
     * @return the paid value.
     */
    public BigInteger redeemForGas(Hash160 caller, BigInteger unitId) {
        return blockchain.atomically(() -> {
            MembershipRegistry registry = blockchain.getContract(membershipRegistry, MembershipRegistry.class);
            if (!caller.equals(registry.ownerOf(unitId))) {
                throw new AuthorizationException("redeemForGas", "Caller is not the owner of the unit");
            }
            BigInteger value = redemption.calculateRedemption();

            InvocationResult burn = blockchain.invoke(hash, membershipRegistry, BigInteger.ZERO,
                    CallData.encode(MembershipRegistry.BURN, CallData.encodeUint(unitId)));
            if (!burn.isSuccess()) {
                throw new ExternalCallException("redeemForGas", "Burning the unit failed (" + burn.getException()
                        + ")");
            }
            InvocationResult payout = blockchain.invoke(hash, caller, value, EMPTY);
            if (!payout.isSuccess()) {
                throw new ExternalCallException("redeemForGas", "Transfer failed (" + payout.getException() + ")");
            }
            LOG.info("Unit {} redeemed by {} for {}", unitId, caller, value);
            redeemed.fire(caller, unitId, value);
            return value;
        });
    }
    //endregion REDEMPTION

    //region INVOCATION

    /**
     * Accepts GAS sent without any call data.
     */
    public void receive(Hash160 sender, BigInteger value) {
        LOG.debug("Received {} from {}", value, sender);
    }

    /**
     * Accepts GAS sent with call data that does not match any method.
     */
    public void fallback(Hash160 sender, BigInteger value, byte[] payload) {
        LOG.debug("Received {} from {} with unknown payload of {} bytes", value, sender, payload.length);
    }

    @Override
    public byte[] onInvoke(Hash160 caller, BigInteger value, byte[] payload) {
        if (payload.length == 0) {
            receive(caller, value);
            return EMPTY;
        }
        byte[] args = CallData.arguments(payload);
        if (CallData.hasSelector(payload, SET_DELAY)) {
            setDelay(CallData.decodeUint(args, 0));
        } else if (CallData.hasSelector(payload, SET_PENDING_ADMIN)) {
            setPendingAdmin(CallData.decodeHash160(args, 0));
        } else if (CallData.hasSelector(payload, ACCEPT_ADMIN)) {
            acceptAdmin(caller);
        } else if (CallData.hasSelector(payload, SET_REDEMPTION_RATE)) {
            setRedemptionRate(caller, CallData.decodeUint(args, 0));
        } else {
            fallback(caller, value, payload);
        }
        return EMPTY;
    }
    //endregion INVOCATION
}
