package com.powerlevel.tracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JourneyEventKind {
    CREATION("creation"),
    SKILL_INVOCATION("skill_invocation"),
    TASK_COMPLETION("task_complete"),
    STATUS_CHANGE("status_change");

    private final String value;

    JourneyEventKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static JourneyEventKind fromValue(String value) {
        for (JourneyEventKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown journey event: " + value);
    }
}
