package com.powerlevel.tracker.exception;

public class RemotePermanentException extends RemoteClientException {

    public RemotePermanentException(String operation, String errorOutput) {
        super(operation, errorOutput);
    }
}
