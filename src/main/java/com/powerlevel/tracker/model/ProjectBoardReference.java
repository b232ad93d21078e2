package com.powerlevel.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectBoardReference {
    private String id;
    private int number;
    private String title;
    private String owner;
    private String url;
    private Instant detectedAt;
}
