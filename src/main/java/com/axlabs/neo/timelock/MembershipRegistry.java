package com.axlabs.neo.timelock;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * The registry of redeemable membership units.
 * <p>
 * Besides these read methods, the registry must accept an invocation with the payload
 * {@code burn(uint256)} from the timelock, which burns the given unit.
 */
public interface MembershipRegistry {

    String BURN = "burn(uint256)";

    BigInteger totalSupply();

    Hash160 ownerOf(BigInteger unitId);
}
