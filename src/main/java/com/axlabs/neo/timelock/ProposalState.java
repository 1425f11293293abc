package com.axlabs.neo.timelock;

/**
 * The lifecycle states of a governance proposal.
 */
public enum ProposalState {

    Pending,
    Active,
    Canceled,
    Defeated,
    Succeeded,
    Queued,
    Expired,
    Executed,
    Vetoed;

    /**
     * @return true if a proposal in this state can still spend treasury funds.
     */
    public boolean isLive() {
        return this == Pending || this == Active || this == Queued;
    }
}
