package com.powerlevel.tracker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A foreign issue mirrored into an external epic's checklist.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExternalItem {
    private String title;
    private String url;
    private boolean closed;
}
