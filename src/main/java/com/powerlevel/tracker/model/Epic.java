package com.powerlevel.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A tracked unit of large-grained work, mirrored 1:1 to a remote issue.
 *
 * <p>An epic either owns sub-items or tracks an external repository, never both.
 * External epics keep their foreign issues only as checklist entries.
 */
@Data
public class Epic {
    public static final String OPEN = "open";
    public static final String CLOSED = "closed";

    private int number;
    private String title;
    private String goal;
    private String priority = "p2";
    private String status = EpicStatus.PLANNING.value();
    private String syncedStatus;
    private String state = OPEN;   // open | closed
    // state GitHub was last known to have; null before the first push or pull
    private String syncedState;
    private String planFile;
    private Instant createdAt;
    private Instant updatedAt;
    private boolean dirty;
    private String externalTarget;

    private List<SubItem> subItems = new ArrayList<>();
    private List<JourneyEntry> journey = new ArrayList<>();
    private List<ExternalItem> externalChecklist = new ArrayList<>();
    private List<String> pendingComments = new ArrayList<>();

    @JsonIgnore
    public boolean isExternal() {
        return externalTarget != null && !externalTarget.isBlank();
    }

    @JsonIgnore
    public boolean isClosed() {
        return CLOSED.equalsIgnoreCase(state);
    }

    public void setExternalTarget(String externalTarget) {
        if (externalTarget != null && !externalTarget.isBlank() && !subItems.isEmpty()) {
            throw new IllegalStateException("Epic #" + number + " owns sub-items and cannot track " + externalTarget);
        }
        this.externalTarget = externalTarget;
    }

    public List<SubItem> getSubItems() {
        return Collections.unmodifiableList(subItems);
    }

    public void setSubItems(List<SubItem> subItems) {
        List<SubItem> copy = subItems == null ? new ArrayList<>() : new ArrayList<>(subItems);
        if (!copy.isEmpty() && isExternal()) {
            throw new IllegalStateException("External epic #" + number + " cannot own sub-items");
        }
        this.subItems = copy;
    }

    /**
     * Adds or replaces (by number) a sub-item.
     */
    public void putSubItem(SubItem subItem) {
        if (isExternal()) {
            throw new IllegalStateException("External epic #" + number + " cannot own sub-items");
        }
        subItem.setEpicNumber(number);
        for (int i = 0; i < subItems.size(); i++) {
            if (subItems.get(i).getNumber() == subItem.getNumber()) {
                subItems.set(i, subItem);
                return;
            }
        }
        subItems.add(subItem);
    }

    public Optional<SubItem> findSubItem(int subItemNumber) {
        return subItems.stream()
            .filter(subItem -> subItem.getNumber() == subItemNumber)
            .findFirst();
    }

    public List<JourneyEntry> getJourney() {
        return Collections.unmodifiableList(journey);
    }

    public void setJourney(List<JourneyEntry> journey) {
        this.journey = journey == null ? new ArrayList<>() : new ArrayList<>(journey);
    }

    public void appendJourney(JourneyEntry entry) {
        journey.add(entry);
    }

    public Optional<JourneyEntry> lastJourneyEntry() {
        return journey.isEmpty() ? Optional.empty() : Optional.of(journey.get(journey.size() - 1));
    }

    /**
     * Time of the latest journey entry, falling back to the update and creation times.
     */
    public Instant lastActivity() {
        return lastJourneyEntry()
            .map(JourneyEntry::getTimestamp)
            .orElse(updatedAt != null ? updatedAt : createdAt != null ? createdAt : Instant.EPOCH);
    }

    public void setExternalChecklist(List<ExternalItem> externalChecklist) {
        this.externalChecklist = externalChecklist == null ? new ArrayList<>() : new ArrayList<>(externalChecklist);
    }

    public void setPendingComments(List<String> pendingComments) {
        this.pendingComments = pendingComments == null ? new ArrayList<>() : new ArrayList<>(pendingComments);
    }
}
