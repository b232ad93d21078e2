package com.powerlevel.tracker.exception;

public class InvalidTrackerConfigException extends RuntimeException {

    public InvalidTrackerConfigException(String message) {
        super(message);
    }

    public InvalidTrackerConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
