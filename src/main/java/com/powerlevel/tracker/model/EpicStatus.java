package com.powerlevel.tracker.model;

import java.util.Arrays;
import java.util.Optional;

public enum EpicStatus {
    PLANNING("planning"),
    IN_PROGRESS("in-progress"),
    REVIEW("review"),
    DONE("done");

    public static final String LABEL_PREFIX = "status/";

    private final String value;

    EpicStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public String label() {
        return LABEL_PREFIX + value;
    }

    public static Optional<EpicStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}
