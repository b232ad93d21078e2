package com.powerlevel.tracker.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ParsedPlan {
    String title;
    String goal;
    String priority;
    List<String> tasks;
}
