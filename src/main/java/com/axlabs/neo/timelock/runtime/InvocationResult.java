package com.axlabs.neo.timelock.runtime;

/**
 * The outcome of an invocation. A failed invocation carries the message of the exception that aborted it.
 */
public class InvocationResult {

    private static final byte[] EMPTY = new byte[0];

    private final boolean success;
    private final byte[] returnData;
    private final String exception;

    private InvocationResult(boolean success, byte[] returnData, String exception) {
        this.success = success;
        this.returnData = returnData;
        this.exception = exception;
    }

    public static InvocationResult success(byte[] returnData) {
        return new InvocationResult(true, returnData == null ? EMPTY : returnData.clone(), null);
    }

    public static InvocationResult failure(String exception) {
        return new InvocationResult(false, EMPTY, exception);
    }

    public boolean isSuccess() {
        return success;
    }

    public byte[] getReturnData() {
        return returnData.clone();
    }

    public String getException() {
        return exception;
    }
}
