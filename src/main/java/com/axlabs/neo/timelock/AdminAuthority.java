package com.axlabs.neo.timelock;

import com.axlabs.neo.timelock.runtime.Blockchain;
import com.axlabs.neo.timelock.runtime.Event;
import com.axlabs.neo.timelock.runtime.StorageContext;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Holds the admin, the pending admin and the timelock delay.
 * <p>
 * The delay and the pending admin can only be changed by the contract itself, i.e. through an action that went
 * through the timelock. The calling identity is read from the chain, not from the arguments. The admin only
 * changes when the pending admin accepts the role.
 */
public class AdminAuthority {

    private static final Logger LOG = LoggerFactory.getLogger(AdminAuthority.class);

    public static final long MINIMUM_DELAY = 2 * 24 * 60 * 60; // 2 days in seconds
    public static final long MAXIMUM_DELAY = 30 * 24 * 60 * 60; // 30 days in seconds

    static final String ADMIN_KEY = "admin";
    static final String PENDING_ADMIN_KEY = "pendingAdmin";
    static final String DELAY_KEY = "delay";

    private final Blockchain blockchain;
    private final Hash160 self;
    private final StorageContext ctx;
    private boolean executingAction;

    private final Event adminChanged;
    private final Event pendingAdminChanged;
    private final Event delayChanged;

    AdminAuthority(Blockchain blockchain, Hash160 self) {
        this.blockchain = blockchain;
        this.self = self;
        this.ctx = blockchain.getStorageContext(self);
        this.adminChanged = new Event(blockchain, self, "NewAdmin");
        this.pendingAdminChanged = new Event(blockchain, self, "NewPendingAdmin");
        this.delayChanged = new Event(blockchain, self, "NewDelay");
    }

    void initialize(Hash160 admin, long delay) {
        if (admin == null || admin.equals(Hash160.ZERO)) {
            throw new BoundsException("deploy", "Invalid admin hash");
        }
        abortIfDelayOutOfBounds(BigInteger.valueOf(delay), "deploy");
        ctx.put(ADMIN_KEY, admin);
        ctx.put(DELAY_KEY, delay);
    }

    public Hash160 getAdmin() {
        return ctx.getHash160(ADMIN_KEY);
    }

    /**
     * @return the pending admin or null if there is none.
     */
    public Hash160 getPendingAdmin() {
        return ctx.getHash160(PENDING_ADMIN_KEY);
    }

    public long getDelay() {
        return ctx.getLong(DELAY_KEY);
    }

    /**
     * Sets the timelock delay.
     * <p>
     * This method can only be called by the contract itself.
     *
     * @param newDelay The new delay in seconds. Must be within [{@link #MINIMUM_DELAY}, {@link #MAXIMUM_DELAY}].
     */
    void setDelay(BigInteger newDelay) {
        abortIfCallerIsNotSelf("setDelay");
        abortIfDelayOutOfBounds(newDelay, "setDelay");
        long delay = newDelay.longValueExact();
        ctx.put(DELAY_KEY, delay);
        LOG.info("Delay of {} set to {} seconds", self, delay);
        delayChanged.fire(delay);
    }

    /**
     * Sets the pending admin. Any identity is accepted, including the zero hash. Passing null clears
     * the pending admin.
     * <p>
     * This method can only be called by the contract itself.
     *
     * @param candidate The new pending admin.
     */
    void setPendingAdmin(Hash160 candidate) {
        abortIfCallerIsNotSelf("setPendingAdmin");
        if (candidate == null) {
            ctx.delete(PENDING_ADMIN_KEY);
        } else {
            ctx.put(PENDING_ADMIN_KEY, candidate);
        }
        LOG.info("Pending admin of {} set to {}", self, candidate);
        pendingAdminChanged.fire(candidate);
    }

    /**
     * Makes the pending admin the admin and clears the pending admin.
     * <p>
     * This method can only be called by the pending admin.
     *
     * @param caller The calling identity.
     */
    void acceptAdmin(Hash160 caller) {
        Hash160 pendingAdmin = getPendingAdmin();
        if (pendingAdmin == null || pendingAdmin.equals(Hash160.ZERO) || !pendingAdmin.equals(caller)) {
            throw new AuthorizationException("acceptAdmin", "Call must come from pendingAdmin");
        }
        ctx.put(ADMIN_KEY, caller);
        ctx.delete(PENDING_ADMIN_KEY);
        LOG.info("Admin of {} changed to {}", self, caller);
        adminChanged.fire(caller);
    }

    void abortIfCallerIsNotAdmin(Hash160 caller, String method) {
        if (!getAdmin().equals(caller)) {
            throw new AuthorizationException(method, "Call must come from admin");
        }
    }

    /**
     * Runs the call of a queued action. Self-only methods are accepted only while an action is running.
     */
    <T> T whileExecutingAction(Supplier<T> call) {
        boolean wasExecuting = executingAction;
        executingAction = true;
        try {
            return call.get();
        } finally {
            executingAction = wasExecuting;
        }
    }

    private void abortIfCallerIsNotSelf(String method) {
        if (!executingAction || !self.equals(blockchain.getExecutingHash())
                || !self.equals(blockchain.getCallingHash())) {
            throw new AuthorizationException(method, "Call must come from the timelock");
        }
    }

    private static void abortIfDelayOutOfBounds(BigInteger delay, String method) {
        if (delay.compareTo(BigInteger.valueOf(MINIMUM_DELAY)) < 0) {
            throw new BoundsException(method, "Delay must exceed minimum delay");
        }
        if (delay.compareTo(BigInteger.valueOf(MAXIMUM_DELAY)) > 0) {
            throw new BoundsException(method, "Delay must not exceed maximum delay");
        }
    }
}
