package com.axlabs.neo.timelock;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * The actions of a proposal as parallel lists. The entries at the same index make up one action.
 */
public class ProposalActions {

    private final List<Hash160> targets;
    private final List<BigInteger> values;
    private final List<String> signatures;
    private final List<byte[]> calldatas;

    public ProposalActions(List<Hash160> targets, List<BigInteger> values, List<String> signatures,
            List<byte[]> calldatas) {
        int n = targets.size();
        if (values.size() != n || signatures.size() != n || calldatas.size() != n) {
            throw new BoundsException("ProposalActions", "Proposal function information arity mismatch");
        }
        this.targets = Collections.unmodifiableList(targets);
        this.values = Collections.unmodifiableList(values);
        this.signatures = Collections.unmodifiableList(signatures);
        this.calldatas = Collections.unmodifiableList(calldatas);
    }

    public List<Hash160> getTargets() {
        return targets;
    }

    public List<BigInteger> getValues() {
        return values;
    }

    public List<String> getSignatures() {
        return signatures;
    }

    public List<byte[]> getCalldatas() {
        return calldatas;
    }

    public int size() {
        return targets.size();
    }
}
