package com.axlabs.neo.timelock;

/**
 * The state or the time does not allow the operation, e.g. an action that is not queued or not yet matured.
 */
public class PreconditionException extends ContractException {

    public PreconditionException(String method, String message) {
        super(method, message);
    }
}
