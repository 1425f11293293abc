package com.axlabs.neo.timelock.runtime;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * A contract that can be the target of {@link Blockchain#invoke(Hash160, Hash160, BigInteger, byte[])}.
 */
public interface InvocationTarget {

    /**
     * Handles an incoming call. The attached value has already been credited when this method runs.
     * <p>
     * Throwing aborts the call. All effects of the call are then reverted and the caller receives a failed
     * {@link InvocationResult}.
     *
     * @param caller  The identity that invoked this contract.
     * @param value   The native value attached to the call.
     * @param payload The call payload. Empty for plain value transfers.
     * @return the raw return data.
     */
    byte[] onInvoke(Hash160 caller, BigInteger value, byte[] payload);
}
