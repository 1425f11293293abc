package com.axlabs.neo.timelock.runtime;

import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * An in-process {@link Blockchain}. Time only moves when it is set or fast-forwarded.
 * <p>
 * Every invocation of a contract opens a frame that records the calling and the executing identity.
 * <p>
 * Atomicity is implemented with checkpoints: before an atomic operation or an invocation frame, the storage of
 * all contracts, all balances and the length of the notification log are captured and restored if the
 * operation aborts.
 */
public class LocalChain implements Blockchain {

    private static final Logger LOG = LoggerFactory.getLogger(LocalChain.class);
    private static final byte[] EMPTY = new byte[0];

    private long time;
    private Map<Hash160, BigInteger> balances = new HashMap<>();
    private final Map<Hash160, Object> contracts = new HashMap<>();
    private final Map<Hash160, StorageContext> storages = new HashMap<>();
    private final List<Notification> notifications = new ArrayList<>();
    private final Deque<Frame> frames = new ArrayDeque<>();

    public LocalChain(long time) {
        this.time = time;
    }

    //region CLOCK

    @Override
    public long getTime() {
        return time;
    }

    public void setTime(long time) {
        if (time < this.time) {
            throw new IllegalArgumentException("Time can only move forward");
        }
        this.time = time;
    }

    public void fastForward(long seconds) {
        setTime(Math.addExact(time, seconds));
    }
    //endregion CLOCK

    //region BALANCES

    @Override
    public BigInteger getBalance(Hash160 account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    /**
     * Credits newly minted value to {@code account}.
     */
    public void mint(Hash160 account, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative");
        }
        balances.put(account, getBalance(account).add(amount));
    }

    private void transfer(Hash160 from, Hash160 to, BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalStateException("transfer: Negative amount");
        }
        if (value.signum() == 0 || from.equals(to)) {
            return;
        }
        BigInteger fromBalance = getBalance(from);
        if (fromBalance.compareTo(value) < 0) {
            throw new IllegalStateException("transfer: Insufficient balance");
        }
        balances.put(from, fromBalance.subtract(value));
        balances.put(to, getBalance(to).add(value));
    }
    //endregion BALANCES

    //region CONTRACTS

    @Override
    public void deploy(Hash160 hash, Object contract) {
        if (contracts.containsKey(hash)) {
            throw new IllegalStateException("Contract already deployed at " + hash);
        }
        contracts.put(hash, contract);
        LOG.debug("Deployed {} at {}", contract.getClass().getSimpleName(), hash);
    }

    @Override
    public <T> T getContract(Hash160 hash, Class<T> type) {
        Object contract = contracts.get(hash);
        if (!type.isInstance(contract)) {
            throw new IllegalStateException("getContract: No " + type.getSimpleName() + " at " + hash);
        }
        return type.cast(contract);
    }

    @Override
    public StorageContext getStorageContext(Hash160 contract) {
        return storages.computeIfAbsent(contract, StorageContext::new);
    }

    @Override
    public InvocationResult invoke(Hash160 from, Hash160 target, BigInteger value, byte[] payload) {
        Checkpoint checkpoint = new Checkpoint();
        try {
            Frame current = frames.peek();
            if (current != null && !current.executing.equals(from)) {
                // Inside a frame only the executing contract can make calls.
                throw new IllegalStateException("invoke: " + from + " is not the executing contract");
            }
            transfer(from, target, value);
            Object contract = contracts.get(target);
            byte[] returnData = EMPTY;
            if (contract instanceof InvocationTarget) {
                frames.push(new Frame(from, target));
                try {
                    returnData = ((InvocationTarget) contract).onInvoke(from, value, payload.clone());
                } finally {
                    frames.pop();
                }
            } else if (contract != null && payload.length > 0) {
                throw new IllegalStateException("invoke: Contract at " + target + " does not accept calls");
            }
            LOG.debug("Invoked {} from {} with value {}", target, from, value);
            return InvocationResult.success(returnData);
        } catch (RuntimeException e) {
            checkpoint.restore();
            LOG.warn("Invocation of {} from {} faulted: {}", target, from, e.getMessage());
            return InvocationResult.failure(e.getMessage());
        }
    }

    @Override
    public Hash160 getCallingHash() {
        Frame frame = frames.peek();
        return frame == null ? null : frame.caller;
    }

    @Override
    public Hash160 getExecutingHash() {
        Frame frame = frames.peek();
        return frame == null ? null : frame.executing;
    }

    @Override
    public <T> T atomically(Supplier<T> operation) {
        Checkpoint checkpoint = new Checkpoint();
        try {
            return operation.get();
        } catch (RuntimeException e) {
            checkpoint.restore();
            LOG.debug("Reverted operation: {}", e.getMessage());
            throw e;
        }
    }
    //endregion CONTRACTS

    //region NOTIFICATIONS

    @Override
    public void notify(Notification notification) {
        notifications.add(notification);
    }

    public List<Notification> getNotifications() {
        return Collections.unmodifiableList(notifications);
    }

    public List<Notification> getNotifications(String eventName) {
        return notifications.stream()
                .filter(n -> n.getEventName().equals(eventName))
                .collect(Collectors.toList());
    }
    //endregion NOTIFICATIONS

    private static class Frame {

        private final Hash160 caller;
        private final Hash160 executing;

        Frame(Hash160 caller, Hash160 executing) {
            this.caller = caller;
            this.executing = executing;
        }
    }

    private class Checkpoint {

        private final Map<Hash160, BigInteger> balancesSnapshot = new HashMap<>(balances);
        private final Map<Hash160, Map<String, byte[]>> storageSnapshot = new HashMap<>();
        private final int notificationCount = notifications.size();

        Checkpoint() {
            storages.forEach((hash, ctx) -> storageSnapshot.put(hash, ctx.copyEntries()));
        }

        void restore() {
            balances = new HashMap<>(balancesSnapshot);
            storages.forEach((hash, ctx) ->
                    ctx.restoreEntries(storageSnapshot.getOrDefault(hash, Collections.emptyMap())));
            notifications.subList(notificationCount, notifications.size()).clear();
        }
    }
}
