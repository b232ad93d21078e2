package com.powerlevel.tracker.model;

import lombok.Value;

import java.util.List;

@Value
public class FlushResult {
    List<Integer> succeeded;
    List<Integer> failed;

    public static FlushResult empty() {
        return new FlushResult(List.of(), List.of());
    }
}
