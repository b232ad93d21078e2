package com.powerlevel.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable record of one workflow event on an epic.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class JourneyEntry {
    Instant timestamp;
    JourneyEventKind event;
    String message;
    String actor;
    Map<String, Object> metadata;
}
