package com.axlabs.neo.timelock;

/**
 * The governance contract that creates proposals whose actions are executed through the timelock.
 */
public interface ProposalSource {

    int proposalCount();

    ProposalState state(int proposalId);

    ProposalActions getActions(int proposalId);
}
