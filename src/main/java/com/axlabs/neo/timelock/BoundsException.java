package com.axlabs.neo.timelock;

/**
 * A parameter is outside of its permitted range.
 */
public class BoundsException extends ContractException {

    public BoundsException(String method, String message) {
        super(method, message);
    }
}
