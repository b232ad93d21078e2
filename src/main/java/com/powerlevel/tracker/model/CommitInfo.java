package com.powerlevel.tracker.model;

import lombok.Value;

@Value
public class CommitInfo {
    String hash;
    String message;
    String timestamp;

    public String shortHash() {
        return hash.length() > 7 ? hash.substring(0, 7) : hash;
    }
}
