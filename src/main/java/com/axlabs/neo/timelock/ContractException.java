package com.axlabs.neo.timelock;

/**
 * Aborts a contract operation. The whole operation is reverted when this is thrown.
 * <p>
 * The message has the form {@code "<method>: <reason>"}.
 */
public class ContractException extends RuntimeException {

    public ContractException(String method, String message) {
        super(method + ": " + message);
    }
}
