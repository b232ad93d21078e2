package com.powerlevel.tracker.exception;

/**
 * The cache snapshot could not be persisted. Never swallowed.
 */
public class CacheWriteException extends RuntimeException {

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
