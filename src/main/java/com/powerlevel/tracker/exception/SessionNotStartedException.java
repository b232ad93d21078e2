package com.powerlevel.tracker.exception;

public class SessionNotStartedException extends RuntimeException {

    public SessionNotStartedException() {
        super("No tracker session started. POST /tracker/session/start first.");
    }
}
