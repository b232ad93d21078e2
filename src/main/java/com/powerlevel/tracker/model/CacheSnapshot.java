package com.powerlevel.tracker.model;

import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Full cached state of one repository. Loaded once per session and owned by a single caller.
 */
@Data
public class CacheSnapshot {
    private SortedMap<Integer, Epic> epics = new TreeMap<>();
    // sub-item number -> owning epic number
    private SortedMap<Integer, Integer> subItemIndex = new TreeMap<>();
    private ProjectBoardReference projectBoard;
    private Instant lastTaskCheck;

    public static CacheSnapshot empty() {
        return new CacheSnapshot();
    }

    public void setEpics(SortedMap<Integer, Epic> epics) {
        this.epics = epics == null ? new TreeMap<>() : new TreeMap<>(epics);
    }

    public void setSubItemIndex(SortedMap<Integer, Integer> subItemIndex) {
        this.subItemIndex = subItemIndex == null ? new TreeMap<>() : new TreeMap<>(subItemIndex);
    }

    public Optional<Epic> findEpic(int number) {
        return Optional.ofNullable(epics.get(number));
    }

    public void putEpic(Epic epic) {
        epics.put(epic.getNumber(), epic);
    }

    /**
     * Attaches a sub-item to its epic and indexes it.
     *
     * @throws IllegalArgumentException if the epic is not cached
     * @throws IllegalStateException if the epic tracks an external repository
     */
    public void putSubItem(int epicNumber, SubItem subItem) {
        Epic epic = findEpic(epicNumber)
            .orElseThrow(() -> new IllegalArgumentException("Epic #" + epicNumber + " not found in cache"));
        epic.putSubItem(subItem);
        subItemIndex.put(subItem.getNumber(), epicNumber);
    }

    public Optional<Epic> findEpicForSubItem(int subItemNumber) {
        Integer epicNumber = subItemIndex.get(subItemNumber);
        if (epicNumber == null) {
            return Optional.empty();
        }
        return findEpic(epicNumber).filter(epic -> epic.findSubItem(subItemNumber).isPresent());
    }

    public List<Epic> dirtyEpics() {
        return epics.values().stream()
            .filter(Epic::isDirty)
            .collect(Collectors.toList());
    }

    public List<Epic> externalEpics() {
        return epics.values().stream()
            .filter(Epic::isExternal)
            .collect(Collectors.toList());
    }
}
