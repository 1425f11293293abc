package com.axlabs.neo.timelock.runtime;

import io.neow3j.types.Hash160;

import java.util.Collections;
import java.util.List;

/**
 * An event fired by a contract. Notifications are an append-only audit log; contracts never read them back.
 */
public class Notification {

    private final Hash160 contract;
    private final String eventName;
    private final List<Object> state;

    public Notification(Hash160 contract, String eventName, List<Object> state) {
        this.contract = contract;
        this.eventName = eventName;
        this.state = Collections.unmodifiableList(state);
    }

    public Hash160 getContract() {
        return contract;
    }

    public String getEventName() {
        return eventName;
    }

    public List<Object> getState() {
        return state;
    }

    @Override
    public String toString() {
        return eventName + state;
    }
}
