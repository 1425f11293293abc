package com.axlabs.neo.timelock.runtime;

import io.neow3j.types.Hash160;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * A named event of a contract.
 */
public class Event {

    private final Blockchain blockchain;
    private final Hash160 contract;
    private final String name;

    public Event(Blockchain blockchain, Hash160 contract, String name) {
        this.blockchain = blockchain;
        this.contract = contract;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void fire(Object... state) {
        blockchain.notify(new Notification(contract, name, new ArrayList<>(Arrays.asList(state))));
    }
}
