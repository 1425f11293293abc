package com.axlabs.neo.timelock;

import com.axlabs.neo.timelock.runtime.Blockchain;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.List;

/**
 * Sums up the treasury value that live proposals intend to spend.
 */
public class ObligationAggregator {

    private final Blockchain blockchain;
    private final Hash160 proposalSource;

    ObligationAggregator(Blockchain blockchain, Hash160 proposalSource) {
        this.blockchain = blockchain;
        this.proposalSource = proposalSource;
    }

    public Hash160 getProposalSource() {
        return proposalSource;
    }

    /**
     * Walks all proposals and adds up the values of the actions of every pending, active or queued proposal.
     * The last action of each proposal is not counted.
     *
     * @return the allocated treasury value.
     */
    public BigInteger allocatedTreasury() {
        ProposalSource source = blockchain.getContract(proposalSource, ProposalSource.class);
        int count = source.proposalCount();
        BigInteger total = BigInteger.ZERO;
        for (int i = 0; i < count; i++) {
            if (!source.state(i).isLive()) {
                continue;
            }
            List<BigInteger> values = source.getActions(i).getValues();
            for (int j = 0; j < values.size() - 1; j++) {
                total = total.add(values.get(j));
            }
        }
        return total;
    }
}
