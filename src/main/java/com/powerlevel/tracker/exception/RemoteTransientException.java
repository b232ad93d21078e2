package com.powerlevel.tracker.exception;

/**
 * Rate limit or network failure that outlived the retry budget.
 */
public class RemoteTransientException extends RemoteClientException {

    public RemoteTransientException(String operation, String errorOutput) {
        super(operation, errorOutput);
    }

    public RemoteTransientException(String operation, String errorOutput, Throwable cause) {
        super(operation, errorOutput, cause);
    }
}
