package com.powerlevel.tracker.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CacheSnapshotTest {

    private CacheSnapshot snapshot;

    @BeforeEach
    void setUp() {
        snapshot = CacheSnapshot.empty();
        Epic epic = new Epic();
        epic.setNumber(10);
        snapshot.putEpic(epic);
    }

    @Test
    void shouldIndexSubItemsByNumber() {
        snapshot.putSubItem(10, new SubItem(11, "Write parser", SubItem.OPEN, 0));

        assertEquals(10, snapshot.getSubItemIndex().get(11));
        assertEquals(10, snapshot.findEpicForSubItem(11).orElseThrow().getNumber());
        assertTrue(snapshot.findEpicForSubItem(99).isEmpty());
    }

    @Test
    void shouldRefuseSubItemForUnknownEpic() {
        assertThrows(IllegalArgumentException.class,
            () -> snapshot.putSubItem(77, new SubItem(78, "Orphan", SubItem.OPEN, 0)));
        assertTrue(snapshot.getSubItemIndex().isEmpty());
    }

    @Test
    void shouldListOnlyDirtyEpics() {
        Epic dirty = new Epic();
        dirty.setNumber(20);
        dirty.setDirty(true);
        snapshot.putEpic(dirty);

        List<Integer> numbers = snapshot.dirtyEpics().stream().map(Epic::getNumber).collect(Collectors.toList());

        assertEquals(List.of(20), numbers);
    }

    @Test
    void shouldListExternalEpics() {
        Epic external = new Epic();
        external.setNumber(50);
        external.setExternalTarget("acme/widgets");
        snapshot.putEpic(external);

        assertEquals(1, snapshot.externalEpics().size());
        assertEquals("acme/widgets", snapshot.externalEpics().get(0).getExternalTarget());
    }
}
