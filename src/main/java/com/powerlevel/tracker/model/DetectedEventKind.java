package com.powerlevel.tracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectedEventKind {
    EXECUTION("execution"),
    FINISHING("finishing"),
    SUBAGENT("subagent"),
    TASK_COMPLETION("task-completion");

    private final String value;

    DetectedEventKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DetectedEventKind fromValue(String value) {
        for (DetectedEventKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event kind: " + value);
    }
}
