package com.powerlevel.tracker.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-repository settings read from {@code .github-tracker.yaml}.
 */
@Data
public class TrackerConfig {
    private Tracking tracking = new Tracking();
    private ProjectBoard projectBoard = new ProjectBoard();
    private Integration integration = new Integration();
    private External external = new External();

    @Data
    public static class Tracking {
        private boolean autoUpdateEpics = true;
        private boolean updateOnTaskComplete = true;
        private boolean commentOnProgress = false;
    }

    @Data
    public static class ProjectBoard {
        private boolean enabled = true;
        private Integer number;   // null = first board of the owner
    }

    @Data
    public static class Integration {
        private boolean trackSkillUsage = true;
    }

    @Data
    public static class External {
        private List<String> labelFilters = new ArrayList<>(List.of("type/epic", "epic"));
        private List<ExternalTracker> trackers = new ArrayList<>();
    }

    @Data
    public static class ExternalTracker {
        private int epicNumber;
        private String repo;
        private String description;
    }
}
