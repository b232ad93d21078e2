package com.powerlevel.tracker.exception;

import lombok.Getter;

@Getter
public class RemoteClientException extends RuntimeException {

    private final String operation;
    private final String errorOutput;

    public RemoteClientException(String operation, String errorOutput) {
        super(operation + " failed: " + errorOutput);
        this.operation = operation;
        this.errorOutput = errorOutput;
    }

    public RemoteClientException(String operation, String errorOutput, Throwable cause) {
        super(operation + " failed: " + errorOutput, cause);
        this.operation = operation;
        this.errorOutput = errorOutput;
    }
}
