package com.axlabs.neo.timelock;

import com.axlabs.neo.timelock.runtime.Blockchain;
import com.axlabs.neo.timelock.runtime.Event;
import com.axlabs.neo.timelock.runtime.InvocationResult;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queues, cancels and executes actions. An action moves from unqueued to queued and from there to executed or
 * cancelled. It is identified only by its fingerprint.
 */
public class TimelockEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TimelockEngine.class);

    public static final long GRACE_PERIOD = 14 * 24 * 60 * 60; // 14 days in seconds

    private final Blockchain blockchain;
    private final Hash160 self;
    private final AdminAuthority authority;
    private final QueuedTransactions queuedTransactions;

    private final Event queued;
    private final Event cancelled;
    private final Event executed;

    TimelockEngine(Blockchain blockchain, Hash160 self, AdminAuthority authority) {
        this.blockchain = blockchain;
        this.self = self;
        this.authority = authority;
        this.queuedTransactions = new QueuedTransactions(blockchain.getStorageContext(self));
        this.queued = new Event(blockchain, self, "QueueTransaction");
        this.cancelled = new Event(blockchain, self, "CancelTransaction");
        this.executed = new Event(blockchain, self, "ExecuteTransaction");
    }

    public boolean isQueued(Hash256 fingerprint) {
        return queuedTransactions.isQueued(fingerprint);
    }

    /**
     * Queues the action. The eta must respect the delay that is in effect at the time of queueing.
     * <p>
     * This method can only be called by the admin.
     *
     * @param caller The calling identity.
     * @param action The action to queue.
     * @return the fingerprint of the action.
     */
    Hash256 queueTransaction(Hash160 caller, Action action) {
        authority.abortIfCallerIsNotAdmin(caller, "queueTransaction");
        long now = blockchain.getTime();
        if (action.getEta() < Math.addExact(now, authority.getDelay())) {
            throw new PreconditionException("queueTransaction", "Estimated execution block must satisfy delay");
        }
        Hash256 fingerprint = action.fingerprint();
        queuedTransactions.set(fingerprint, true);
        LOG.debug("Queued {} on {} with eta {}", fingerprint, action.getTarget(), action.getEta());
        fire(queued, fingerprint, action);
        return fingerprint;
    }

    /**
     * Removes the action from the queue. Cancelling an action that is not queued has no effect other than the
     * notification.
     * <p>
     * This method can only be called by the admin.
     *
     * @param caller The calling identity.
     * @param action The action to cancel.
     */
    void cancelTransaction(Hash160 caller, Action action) {
        authority.abortIfCallerIsNotAdmin(caller, "cancelTransaction");
        Hash256 fingerprint = action.fingerprint();
        queuedTransactions.set(fingerprint, false);
        LOG.debug("Cancelled {}", fingerprint);
        fire(cancelled, fingerprint, action);
    }

    /**
     * Executes a queued action whose eta has passed and whose grace period has not ended. The action is removed
     * from the queue before the call is made, so it cannot be executed again from within the call.
     * <p>
     * This method can only be called by the admin.
     *
     * @param caller The calling identity.
     * @param action The action to execute.
     * @return the data returned by the call.
     */
    byte[] executeTransaction(Hash160 caller, Action action) {
        authority.abortIfCallerIsNotAdmin(caller, "executeTransaction");
        Hash256 fingerprint = action.fingerprint();
        if (!queuedTransactions.isQueued(fingerprint)) {
            throw new PreconditionException("executeTransaction", "Transaction hasn't been queued");
        }
        long now = blockchain.getTime();
        if (now < action.getEta()) {
            throw new PreconditionException("executeTransaction", "Transaction hasn't surpassed time lock");
        }
        if (now > Math.addExact(action.getEta(), GRACE_PERIOD)) {
            throw new PreconditionException("executeTransaction", "Transaction is stale");
        }
        queuedTransactions.set(fingerprint, false);

        InvocationResult result = authority.whileExecutingAction(() ->
                blockchain.invoke(self, action.getTarget(), action.getValue(), action.payload()));
        if (!result.isSuccess()) {
            throw new ExternalCallException("executeTransaction",
                    "Transaction execution reverted (" + result.getException() + ")");
        }
        LOG.debug("Executed {} on {}", fingerprint, action.getTarget());
        fire(executed, fingerprint, action);
        return result.getReturnData();
    }

    private static void fire(Event event, Hash256 fingerprint, Action action) {
        event.fire(fingerprint, action.getTarget(), action.getValue(), action.getSignature(), action.getData(),
                action.getEta());
    }
}
