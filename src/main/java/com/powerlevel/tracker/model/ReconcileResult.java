package com.powerlevel.tracker.model;

import lombok.Value;

import java.util.List;

@Value
public class ReconcileResult {
    List<Integer> updated;
    List<Integer> unchanged;
    List<Integer> failed;
}
