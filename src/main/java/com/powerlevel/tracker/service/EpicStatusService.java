package com.powerlevel.tracker.service;

import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.DetectedEvent;
import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.EpicStatus;
import com.powerlevel.tracker.model.JourneyEventKind;
import com.powerlevel.tracker.model.SubItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps detected workflow events onto epic status transitions and journey entries.
 *
 * <p>Automatic transitions only move forward one step ({@code planning -> in-progress -> review});
 * remote edits and manual changes are taken as given. Events that match no epic are dropped.
 */
@Slf4j
@Service
public class EpicStatusService {

    private static final Comparator<Epic> MOST_RECENT_ACTIVITY = Comparator
        .comparing(Epic::lastActivity)
        .thenComparingInt(Epic::getNumber);

    private final JourneyService journeyService;

    public EpicStatusService(JourneyService journeyService) {
        this.journeyService = journeyService;
    }

    public CacheSnapshot applyEvent(CacheSnapshot snapshot, DetectedEvent event) {
        if (event == null || event.getKind() == null) {
            return snapshot;
        }
        switch (event.getKind()) {
            case EXECUTION -> onExecution(snapshot, event);
            case FINISHING -> onFinishing(snapshot, event);
            case SUBAGENT -> onSubagent(snapshot, event);
            case TASK_COMPLETION -> onTaskCompletion(snapshot, event);
        }
        return snapshot;
    }

    /**
     * Manual status change. Any value is accepted; {@code done} closes the epic and any other
     * status reopens a closed one.
     */
    public Optional<Epic> setStatus(CacheSnapshot snapshot, int epicNumber, EpicStatus status, String actor) {
        Optional<Epic> found = snapshot.findEpic(epicNumber);
        found.ifPresent(epic -> {
            String from = epic.getStatus();
            epic.setStatus(status.value());
            if (status == EpicStatus.DONE) {
                epic.setState(Epic.CLOSED);
            } else if (epic.isClosed()) {
                epic.setState(Epic.OPEN);
            }
            journeyService.record(epic, JourneyEventKind.STATUS_CHANGE,
                "Status changed from " + from + " to " + status.value(), actor, transition(from, status));
        });
        return found;
    }

    private void onExecution(CacheSnapshot snapshot, DetectedEvent event) {
        Optional<Epic> match = findByPlanFile(snapshot, event.getPlanFilePath());
        if (match.isEmpty()) {
            log.debug("Dropped execution event, no epic for plan {}", event.getPlanFilePath());
            return;
        }
        Epic epic = match.get();
        Map<String, Object> metadata = skillMetadata("executing-plans");
        if (advance(epic, EpicStatus.PLANNING, EpicStatus.IN_PROGRESS)) {
            metadata.putAll(transition(EpicStatus.PLANNING.value(), EpicStatus.IN_PROGRESS));
        }
        journeyService.record(epic, JourneyEventKind.SKILL_INVOCATION,
            "Started executing implementation plan", event.getActor(), metadata);
        log.info("Linked executing-plans to epic #{}", epic.getNumber());
    }

    private void onFinishing(CacheSnapshot snapshot, DetectedEvent event) {
        Optional<Epic> match = findByPlanFile(snapshot, event.getPlanFilePath())
            .or(() -> mostRecentInProgress(snapshot));
        if (match.isEmpty()) {
            log.debug("Dropped finishing event, no in-progress epic");
            return;
        }
        Epic epic = match.get();
        Map<String, Object> metadata = skillMetadata("finishing-a-development-branch");
        if (advance(epic, EpicStatus.IN_PROGRESS, EpicStatus.REVIEW)) {
            metadata.putAll(transition(EpicStatus.IN_PROGRESS.value(), EpicStatus.REVIEW));
        }
        journeyService.record(epic, JourneyEventKind.SKILL_INVOCATION,
            "Started finishing development branch", event.getActor(), metadata);
        log.info("Linked finishing-branch to epic #{}", epic.getNumber());
    }

    private void onSubagent(CacheSnapshot snapshot, DetectedEvent event) {
        Optional<Epic> match = findByPlanFile(snapshot, event.getPlanFilePath());
        if (match.isEmpty()) {
            log.debug("Dropped subagent event, no epic for plan {}", event.getPlanFilePath());
            return;
        }
        journeyService.record(match.get(), JourneyEventKind.SKILL_INVOCATION,
            "Started subagent-driven development", event.getActor(), skillMetadata("subagent-driven-development"));
    }

    // Closure of the sub-item itself is only ever read back from GitHub.
    private void onTaskCompletion(CacheSnapshot snapshot, DetectedEvent event) {
        if (event.getIssueNumber() == null) {
            return;
        }
        int issueNumber = event.getIssueNumber();
        Optional<Epic> owner = snapshot.findEpicForSubItem(issueNumber);
        if (owner.isEmpty()) {
            log.debug("Dropped task completion, #{} is not a cached sub-item", issueNumber);
            return;
        }
        Epic epic = owner.get();
        SubItem subItem = epic.findSubItem(issueNumber).orElseThrow();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("issueNumber", issueNumber);
        metadata.put("taskTitle", subItem.getTitle());
        journeyService.record(epic, JourneyEventKind.TASK_COMPLETION,
            "Task #" + issueNumber + " completed: " + subItem.getTitle(), event.getActor(), metadata);
        log.info("Recorded completion of #{} on epic #{}", issueNumber, epic.getNumber());
    }

    private boolean advance(Epic epic, EpicStatus from, EpicStatus to) {
        if (EpicStatus.fromValue(epic.getStatus()).orElse(null) != from) {
            return false;
        }
        epic.setStatus(to.value());
        return true;
    }

    Optional<Epic> findByPlanFile(CacheSnapshot snapshot, String planFilePath) {
        if (planFilePath == null || planFilePath.isBlank()) {
            return Optional.empty();
        }
        Optional<Path> wanted = toPath(planFilePath);
        return snapshot.getEpics().values().stream()
            .filter(epic -> !epic.isExternal() && epic.getPlanFile() != null)
            .filter(epic -> epic.getPlanFile().equals(planFilePath) || wanted
                .flatMap(path -> toPath(epic.getPlanFile()).map(stored -> stored.endsWith(path)))
                .orElse(false))
            .max(Comparator.comparingInt(Epic::getNumber));
    }

    private Optional<Epic> mostRecentInProgress(CacheSnapshot snapshot) {
        return snapshot.getEpics().values().stream()
            .filter(epic -> !epic.isExternal() && !epic.isClosed())
            .filter(epic -> EpicStatus.fromValue(epic.getStatus()).orElse(null) == EpicStatus.IN_PROGRESS)
            .max(MOST_RECENT_ACTIVITY);
    }

    private static Optional<Path> toPath(String value) {
        try {
            return Optional.of(Paths.get(value).normalize());
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static Map<String, Object> skillMetadata(String skill) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("skill", skill);
        return metadata;
    }

    private static Map<String, Object> transition(String from, EpicStatus to) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("from", from);
        metadata.put("to", to.value());
        return metadata;
    }
}
