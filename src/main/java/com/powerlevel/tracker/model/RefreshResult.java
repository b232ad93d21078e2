package com.powerlevel.tracker.model;

import lombok.Value;

import java.util.List;

@Value
public class RefreshResult {
    List<Integer> refreshed;
    List<Integer> failed;
}
