package com.powerlevel.tracker.service;

import com.powerlevel.tracker.exception.RemoteTransientException;
import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.RefreshResult;
import com.powerlevel.tracker.model.RemoteIssue;
import com.powerlevel.tracker.model.RepositoryContext;
import com.powerlevel.tracker.model.SubItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CacheRefreshServiceTest {

    private static final RepositoryContext REPO = RepositoryContext.of("acme", "app");

    @Mock
    private RemoteClientService remoteClient;

    private ExecutorService executor;
    private CacheRefreshService refreshService;
    private CacheSnapshot snapshot;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        refreshService = new CacheRefreshService(remoteClient, executor);
        snapshot = CacheSnapshot.empty();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldAcceptStatusEditedOnGithub() {
        Epic epic = epic(10, "in-progress", "in-progress");
        when(remoteClient.viewIssue("acme/app", 10)).thenReturn(remote(10, "OPEN", "status/done"));

        RefreshResult result = refreshService.pull(snapshot, REPO);

        assertEquals(List.of(10), result.getRefreshed());
        assertEquals("done", epic.getStatus());
        assertEquals("done", epic.getSyncedStatus());
    }

    @Test
    void shouldKeepUnflushedLocalProposal() {
        Epic epic = epic(10, "review", "in-progress");
        epic.setDirty(true);
        when(remoteClient.viewIssue("acme/app", 10)).thenReturn(remote(10, "OPEN", "status/in-progress"));

        refreshService.pull(snapshot, REPO);

        assertEquals("review", epic.getStatus());
        assertTrue(epic.isDirty());
    }

    @Test
    void shouldReadSubItemClosureFromGithub() {
        Epic epic = epic(10, "in-progress", "in-progress");
        snapshot.putSubItem(10, new SubItem(11, "Write tokenizer", SubItem.OPEN, 10));
        snapshot.putSubItem(10, new SubItem(12, "Build index", SubItem.CLOSED, 10));
        when(remoteClient.viewIssue("acme/app", 10)).thenReturn(remote(10, "OPEN", "status/in-progress"));
        when(remoteClient.viewIssue("acme/app", 11)).thenReturn(remote(11, "CLOSED"));

        refreshService.pull(snapshot, REPO);

        assertTrue(epic.findSubItem(11).orElseThrow().isClosed());
        assertTrue(epic.isDirty());
        verify(remoteClient, never()).viewIssue("acme/app", 12);
    }

    @Test
    void shouldSkipEpicThatCannotBeRead() {
        Epic unreadable = epic(10, "in-progress", "in-progress");
        Epic readable = epic(11, "planning", "planning");
        when(remoteClient.viewIssue("acme/app", 10)).thenThrow(new RemoteTransientException("view issue #10", "timeout"));
        when(remoteClient.viewIssue("acme/app", 11)).thenReturn(remote(11, "CLOSED", "status/planning"));

        RefreshResult result = refreshService.pull(snapshot, REPO);

        assertEquals(List.of(10), result.getFailed());
        assertEquals(List.of(11), result.getRefreshed());
        assertEquals("in-progress", unreadable.getStatus());
        assertTrue(readable.isClosed());
    }

    @Test
    void shouldKeepLocalReopenUntilFlushed() {
        Epic epic = epic(10, "in-progress", "done");
        epic.setSyncedState(Epic.CLOSED);
        epic.setDirty(true);
        when(remoteClient.viewIssue("acme/app", 10)).thenReturn(remote(10, "CLOSED", "status/done"));

        refreshService.pull(snapshot, REPO);

        assertFalse(epic.isClosed());
        assertEquals("in-progress", epic.getStatus());
        assertTrue(epic.isDirty());
    }

    @Test
    void shouldAcceptClosureMadeOnGithub() {
        Epic epic = epic(10, "in-progress", "in-progress");
        epic.setSyncedState(Epic.OPEN);
        when(remoteClient.viewIssue("acme/app", 10)).thenReturn(remote(10, "CLOSED", "status/in-progress"));

        refreshService.pull(snapshot, REPO);

        assertTrue(epic.isClosed());
        assertEquals(Epic.CLOSED, epic.getSyncedState());
    }

    @Test
    void shouldSkipExternalAndClosedEpics() {
        Epic external = new Epic();
        external.setNumber(50);
        external.setExternalTarget("org/repo");
        snapshot.putEpic(external);
        Epic closed = epic(10, "done", "done");
        closed.setState(Epic.CLOSED);

        RefreshResult result = refreshService.pull(snapshot, REPO);

        assertTrue(result.getRefreshed().isEmpty());
        verifyNoInteractions(remoteClient);
    }

    private Epic epic(int number, String status, String syncedStatus) {
        Epic epic = new Epic();
        epic.setNumber(number);
        epic.setTitle("Epic " + number);
        epic.setStatus(status);
        epic.setSyncedStatus(syncedStatus);
        snapshot.putEpic(epic);
        return epic;
    }

    private static RemoteIssue remote(int number, String state, String... labels) {
        return RemoteIssue.builder()
            .number(number)
            .title("Epic " + number)
            .state(state)
            .labels(Arrays.stream(labels).map(RemoteIssue.Label::new).collect(Collectors.toList()))
            .build();
    }
}
