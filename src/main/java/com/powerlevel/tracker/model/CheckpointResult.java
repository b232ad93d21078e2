package com.powerlevel.tracker.model;

import lombok.Value;

/**
 * Outcome of the idle checkpoint: task completions found in commits, then the flush.
 */
@Value
public class CheckpointResult {
    int taskCompletions;
    FlushResult flush;
}
