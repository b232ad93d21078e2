package com.powerlevel.tracker.service;

import com.powerlevel.tracker.exception.RemotePermanentException;
import com.powerlevel.tracker.exception.RemoteTransientException;
import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.EpicStatus;
import com.powerlevel.tracker.model.FlushResult;
import com.powerlevel.tracker.model.RepositoryContext;
import com.powerlevel.tracker.model.SubItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EpicSyncServiceTest {

    private static final RepositoryContext REPO = RepositoryContext.of("acme", "app");

    @Mock
    private RemoteClientService remoteClient;

    private final EpicBodyRenderer renderer = new EpicBodyRenderer();
    private ExecutorService executor;
    private EpicSyncService syncService;
    private CacheSnapshot snapshot;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        syncService = new EpicSyncService(remoteClient, renderer, executor);
        snapshot = CacheSnapshot.empty();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldIsolateFailedEpicDuringFlush() {
        Epic ok = epic(10, true);
        Epic broken = epic(11, true);
        lenient().doThrow(new RemoteTransientException("edit issue #11", "API rate limit exceeded"))
            .when(remoteClient).editIssue(eq("acme/app"), eq(11), anyString(), any());

        FlushResult result = syncService.flush(snapshot, REPO);

        assertEquals(List.of(10), result.getSucceeded());
        assertEquals(List.of(11), result.getFailed());
        assertFalse(ok.isDirty());
        assertTrue(broken.isDirty());
    }

    @Test
    void shouldPushOnlyDirtyEpics() {
        epic(10, true);
        epic(12, false);
        epic(13, true);

        FlushResult result = syncService.flush(snapshot, REPO);

        assertEquals(List.of(10, 13), result.getSucceeded());
        verify(remoteClient).editIssue(eq("acme/app"), eq(10), anyString(), any());
        verify(remoteClient).editIssue(eq("acme/app"), eq(13), anyString(), any());
        verify(remoteClient, never()).editIssue(anyString(), eq(12), anyString(), any());
    }

    @Test
    void shouldPushRenderedBodyAndStatusLabel() {
        Epic epic = epic(10, true);
        epic.setStatus("review");
        snapshot.putSubItem(10, new SubItem(11, "Write tokenizer", SubItem.CLOSED, 10));

        syncService.flush(snapshot, REPO);

        verify(remoteClient).editIssue("acme/app", 10, renderer.render(epic), EpicStatus.REVIEW);
        assertEquals("review", epic.getSyncedStatus());
    }

    @Test
    void shouldPostQueuedCommentsThenCloseDoneEpic() {
        Epic epic = epic(10, true);
        epic.setStatus("done");
        epic.setState(Epic.CLOSED);
        epic.setPendingComments(List.of("Task #11 completed: Write tokenizer"));

        FlushResult result = syncService.flush(snapshot, REPO);

        InOrder order = inOrder(remoteClient);
        order.verify(remoteClient).editIssue(eq("acme/app"), eq(10), anyString(), eq(EpicStatus.DONE));
        order.verify(remoteClient).addComment("acme/app", 10, "Task #11 completed: Write tokenizer");
        order.verify(remoteClient).closeIssue("acme/app", 10);
        assertEquals(List.of(10), result.getSucceeded());
        assertTrue(epic.getPendingComments().isEmpty());
    }

    @Test
    void shouldNotCloseEpicAlreadyClosedOnGithub() {
        Epic epic = epic(10, true);
        epic.setStatus("done");
        epic.setState(Epic.CLOSED);
        epic.setSyncedState(Epic.CLOSED);

        syncService.flush(snapshot, REPO);

        verify(remoteClient).editIssue(eq("acme/app"), eq(10), anyString(), eq(EpicStatus.DONE));
        verify(remoteClient, never()).closeIssue(anyString(), anyInt());
        verify(remoteClient, never()).reopenIssue(anyString(), anyInt());
    }

    @Test
    void shouldReopenEpicMovedBackFromDone() {
        Epic epic = epic(10, true);
        epic.setSyncedStatus("done");
        epic.setSyncedState(Epic.CLOSED);

        FlushResult result = syncService.flush(snapshot, REPO);

        InOrder order = inOrder(remoteClient);
        order.verify(remoteClient).editIssue(eq("acme/app"), eq(10), anyString(), eq(EpicStatus.IN_PROGRESS));
        order.verify(remoteClient).reopenIssue("acme/app", 10);
        verify(remoteClient, never()).closeIssue(anyString(), anyInt());
        assertEquals(List.of(10), result.getSucceeded());
        assertEquals(Epic.OPEN, epic.getSyncedState());
        assertEquals("in-progress", epic.getSyncedStatus());
    }

    @Test
    void shouldKeepEpicDirtyWhenReopenFails() {
        Epic epic = epic(10, true);
        epic.setSyncedState(Epic.CLOSED);
        lenient().doThrow(new RemotePermanentException("reopen issue #10", "HTTP 403"))
            .when(remoteClient).reopenIssue("acme/app", 10);

        FlushResult result = syncService.flush(snapshot, REPO);

        assertEquals(List.of(10), result.getFailed());
        assertTrue(epic.isDirty());
        assertEquals(Epic.CLOSED, epic.getSyncedState());
    }

    @Test
    void shouldNotPushStatusLabelForExternalEpic() {
        Epic epic = new Epic();
        epic.setNumber(50);
        epic.setExternalTarget("org/widgets");
        epic.setDirty(true);
        snapshot.putEpic(epic);

        syncService.flush(snapshot, REPO);

        verify(remoteClient).editIssue(eq("acme/app"), eq(50), contains("org/widgets"), isNull());
        assertNull(epic.getSyncedStatus());
    }

    @Test
    void shouldKeepUnpostedCommentsWhenCommentFails() {
        Epic epic = epic(10, true);
        epic.setPendingComments(List.of("first", "second"));
        lenient().doThrow(new RemotePermanentException("comment on #10", "HTTP 403"))
            .when(remoteClient).addComment("acme/app", 10, "second");

        FlushResult result = syncService.flush(snapshot, REPO);

        assertEquals(List.of(10), result.getFailed());
        assertTrue(epic.isDirty());
        assertEquals(List.of("second"), epic.getPendingComments());
    }

    @Test
    void shouldLeaveUnknownStatusLabelsAlone() {
        Epic epic = epic(10, true);
        epic.setStatus("blocked");

        syncService.flush(snapshot, REPO);

        verify(remoteClient).editIssue(eq("acme/app"), eq(10), anyString(), isNull());
        assertFalse(epic.isDirty());
    }

    @Test
    void shouldDoNothingWhenNothingIsDirty() {
        epic(10, false);

        FlushResult result = syncService.flush(snapshot, REPO);

        assertTrue(result.getSucceeded().isEmpty());
        assertTrue(result.getFailed().isEmpty());
        verifyNoInteractions(remoteClient);
    }

    private Epic epic(int number, boolean dirty) {
        Epic epic = new Epic();
        epic.setNumber(number);
        epic.setTitle("Epic " + number);
        epic.setStatus("in-progress");
        epic.setDirty(dirty);
        snapshot.putEpic(epic);
        return epic;
    }
}
