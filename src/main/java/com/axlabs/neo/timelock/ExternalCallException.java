package com.axlabs.neo.timelock;

/**
 * A call to another contract or account failed.
 */
public class ExternalCallException extends ContractException {

    public ExternalCallException(String method, String message) {
        super(method, message);
    }
}
