package com.axlabs.neo.timelock;

/**
 * The caller is not the admin, the pending admin or the contract itself, as the operation requires.
 */
public class AuthorizationException extends ContractException {

    public AuthorizationException(String method, String message) {
        super(method, message);
    }
}
