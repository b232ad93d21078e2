package com.powerlevel.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typed output of the event classifier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectedEvent {
    private DetectedEventKind kind;
    private String planFilePath;
    private Integer issueNumber;
    private String actor;
}
