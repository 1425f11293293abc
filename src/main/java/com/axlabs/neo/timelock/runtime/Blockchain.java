package com.axlabs.neo.timelock.runtime;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * The execution environment contracts run on. It provides a clock, native value balances, an invoke primitive
 * that forwards value with a call, contract storage, notifications and all-or-nothing execution.
 */
public interface Blockchain {

    /**
     * @return the current time in seconds. Monotonic.
     */
    long getTime();

    /**
     * @param account The account or contract.
     * @return the native value (GAS) held by {@code account}.
     */
    BigInteger getBalance(Hash160 account);

    /**
     * Transfers {@code value} from {@code from} to {@code target} and calls {@code target} with
     * {@code payload}. The call runs in its own frame: if it aborts, all its effects, including the value
     * transfer, are reverted and a failed result is returned.
     *
     * @param from    The calling identity.
     * @param target  The called account or contract.
     * @param value   The native value to forward.
     * @param payload The call payload.
     * @return the invocation result.
     */
    InvocationResult invoke(Hash160 from, Hash160 target, BigInteger value, byte[] payload);

    /**
     * @return the identity that invoked the currently executing contract, or null if no invocation frame is
     * active, i.e. the operation was entered directly by an account.
     */
    Hash160 getCallingHash();

    /**
     * @return the contract whose invocation frame is currently active, or null if there is none.
     */
    Hash160 getExecutingHash();

    void notify(Notification notification);

    StorageContext getStorageContext(Hash160 contract);

    /**
     * Registers {@code contract} under {@code hash}.
     */
    void deploy(Hash160 hash, Object contract);

    /**
     * Resolves the contract deployed under {@code hash}.
     *
     * @throws IllegalStateException if no contract of the given type is deployed there.
     */
    <T> T getContract(Hash160 hash, Class<T> type);

    /**
     * Runs {@code operation} atomically. If it throws, every state change it made is reverted before the
     * exception propagates.
     */
    <T> T atomically(Supplier<T> operation);

    default void atomically(Runnable operation) {
        atomically(() -> {
            operation.run();
            return null;
        });
    }
}
