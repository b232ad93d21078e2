package com.powerlevel.tracker.service;

import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.JourneyEntry;
import com.powerlevel.tracker.model.JourneyEventKind;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The single mutation path for epics: appends a journey entry and marks the epic dirty.
 */
@Service
public class JourneyService {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F]");

    private final Clock clock;

    public JourneyService(Clock clock) {
        this.clock = clock;
    }

    public JourneyEntry record(Epic epic, JourneyEventKind kind, String message, String actor,
                               Map<String, Object> metadata) {
        Instant now = clock.instant();
        Instant timestamp = epic.lastJourneyEntry()
            .map(JourneyEntry::getTimestamp)
            .filter(last -> last.isAfter(now))
            .orElse(now);

        JourneyEntry entry = JourneyEntry.builder()
            .timestamp(timestamp)
            .event(kind)
            .message(sanitize(message))
            .actor(actor == null ? null : sanitize(actor))
            .metadata(metadata == null || metadata.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
            .build();

        epic.appendJourney(entry);
        epic.setUpdatedAt(timestamp);
        epic.setDirty(true);
        return entry;
    }

    public Instant now() {
        return clock.instant();
    }

    static String sanitize(String input) {
        return input == null ? "" : CONTROL_CHARS.matcher(input).replaceAll("");
    }
}
