package com.powerlevel.tracker.service;

import com.powerlevel.tracker.exception.SessionNotStartedException;
import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.CheckpointResult;
import com.powerlevel.tracker.model.CommitInfo;
import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.EpicStatus;
import com.powerlevel.tracker.model.RemoteIssue;
import com.powerlevel.tracker.model.RepositoryContext;
import com.powerlevel.tracker.model.SessionStartResult;
import com.powerlevel.tracker.model.SubItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TrackerSessionServiceTest {

    private static final RepositoryContext REPO = RepositoryContext.of("acme", "app");
    private static final Instant NOW = Instant.parse("2026-02-10T14:30:00Z");

    @Mock
    private GitService gitService;

    @Mock
    private RemoteClientService remoteClient;

    @TempDir
    Path tempDir;

    private Path repoDir;
    private ExecutorService executor;
    private CacheStoreService cacheStore;
    private TrackerSessionService sessionService;

    @BeforeEach
    void setUp() throws Exception {
        repoDir = Files.createDirectories(tempDir.resolve("repo"));
        executor = Executors.newFixedThreadPool(2);

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        JourneyService journeyService = new JourneyService(clock);
        EpicBodyRenderer renderer = new EpicBodyRenderer();
        ProjectBoardService boardService = new ProjectBoardService(remoteClient, clock);
        cacheStore = new CacheStoreService();
        cacheStore.setCacheDir(tempDir.resolve("cache").toString());

        sessionService = new TrackerSessionService(gitService, new ConfigLoaderService(), cacheStore,
            new CacheRefreshService(remoteClient, executor),
            new ExternalReconcilerService(remoteClient, renderer, executor),
            boardService,
            new EpicStatusService(journeyService),
            new EpicSyncService(remoteClient, renderer, executor),
            new EpicCreationService(new PlanParser(), remoteClient, renderer, journeyService, boardService),
            new SessionEventClassifier(),
            journeyService);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRefuseOperationsBeforeSessionStart() {
        assertThrows(SessionNotStartedException.class, () -> sessionService.idle());
        assertThrows(SessionNotStartedException.class, () -> sessionService.listEpics());
        assertTrue(sessionService.currentRepository().isEmpty());
    }

    @Test
    void shouldRejectDirectoryWithoutGithubRemote() {
        when(gitService.detectRepository(repoDir)).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> sessionService.startSession(repoDir));
    }

    @Test
    void shouldRegisterAndReconcileConfiguredExternalTracker() throws Exception {
        writeConfig("project_board:\n  enabled: false\n"
            + "external:\n  trackers:\n    - epic_number: 50\n      repo: org/widgets\n"
            + "      description: Upstream widget work\n");
        when(gitService.detectRepository(repoDir)).thenReturn(Optional.of(REPO));
        when(remoteClient.listOpenIssues("org/widgets", "type/epic")).thenReturn(List.of(RemoteIssue.builder()
            .number(7).title("Crash on start").state("OPEN").url("https://github.com/org/widgets/issues/7").build()));

        SessionStartResult result = sessionService.startSession(repoDir);

        assertEquals(List.of(50), result.getReconcile().getUpdated());
        verify(remoteClient).editIssueBody(eq("acme/app"), eq(50), contains("Upstream widget work"));
        Epic tracked = cacheStore.load(REPO).findEpic(50).orElseThrow();
        assertEquals("org/widgets", tracked.getExternalTarget());
        assertEquals(1, tracked.getExternalChecklist().size());
        assertFalse(tracked.isDirty());
    }

    @Test
    void shouldRecordCommitCompletionsAndFlushAtIdle() throws Exception {
        writeConfig("project_board:\n  enabled: false\n");
        seedEpicWithTask();
        startSession();
        when(gitService.recentCommits(repoDir, NOW.minusSeconds(3600))).thenReturn(List.of(
            new CommitInfo("abc1234def", "Add tokenizer, closes #124", "2026-02-10T14:00:00Z"),
            new CommitInfo("fff0000aaa", "Tidy imports", "2026-02-10T13:00:00Z")));

        CheckpointResult result = sessionService.idle();

        assertEquals(1, result.getTaskCompletions());
        assertEquals(List.of(10), result.getFlush().getSucceeded());
        verify(remoteClient).editIssue(eq("acme/app"), eq(10), contains("Agent: git-commit-abc1234"), any());

        CacheSnapshot saved = cacheStore.load(REPO);
        Epic epic = saved.findEpic(10).orElseThrow();
        assertFalse(epic.isDirty());
        assertEquals(1, epic.getJourney().size());
        assertEquals(SubItem.OPEN, epic.findSubItem(124).orElseThrow().getState());
        assertEquals(NOW, saved.getLastTaskCheck());
    }

    @Test
    void shouldQueueProgressCommentWhenEnabled() throws Exception {
        writeConfig("project_board:\n  enabled: false\ntracking:\n  comment_on_progress: true\n");
        seedEpicWithTask();
        startSession();
        when(gitService.recentCommits(eq(repoDir), any())).thenReturn(List.of(
            new CommitInfo("abc1234def", "fixes #124", "2026-02-10T14:00:00Z")));

        sessionService.idle();

        verify(remoteClient).addComment("acme/app", 10, "Task #124 completed: Write tokenizer");
        assertTrue(cacheStore.load(REPO).findEpic(10).orElseThrow().getPendingComments().isEmpty());
    }

    @Test
    void shouldKeepChangesLocalWhenAutoUpdateIsOff() throws Exception {
        writeConfig("project_board:\n  enabled: false\ntracking:\n  auto_update_epics: false\n");
        seedEpicWithTask();
        startSession();
        when(gitService.recentCommits(eq(repoDir), any())).thenReturn(List.of(
            new CommitInfo("abc1234def", "closes #124", "2026-02-10T14:00:00Z")));

        CheckpointResult result = sessionService.idle();

        assertTrue(result.getFlush().getSucceeded().isEmpty());
        verify(remoteClient, never()).editIssue(anyString(), anyInt(), anyString(), any());
        assertTrue(cacheStore.load(REPO).findEpic(10).orElseThrow().isDirty());
    }

    @Test
    void shouldSkipCommitScanWhenDisabled() throws Exception {
        writeConfig("project_board:\n  enabled: false\ntracking:\n  update_on_task_complete: false\n");
        seedEpicWithTask();
        startSession();

        CheckpointResult result = sessionService.idle();

        assertEquals(0, result.getTaskCompletions());
        verify(gitService, never()).recentCommits(any(), any());
    }

    @Test
    void shouldApplySkillMessagesToMatchingEpic() throws Exception {
        writeConfig("project_board:\n  enabled: false\n");
        seedEpicWithTask();
        startSession();

        assertTrue(sessionService.handleMessage(
            "I'm using the executing-plans skill on docs/plans/search.md", "agent").isPresent());

        assertEquals("in-progress", cacheStore.load(REPO).findEpic(10).orElseThrow().getStatus());
    }

    @Test
    void shouldIgnoreSkillMessagesWhenTrackingIsOff() throws Exception {
        writeConfig("project_board:\n  enabled: false\nintegration:\n  track_skill_usage: false\n");
        seedEpicWithTask();
        startSession();

        sessionService.handleMessage("using the executing-plans skill on docs/plans/search.md", "agent");

        Epic epic = sessionService.listEpics().get(0);
        assertEquals("planning", epic.getStatus());
        assertTrue(epic.getJourney().isEmpty());
    }

    @Test
    void shouldCloseEpicManuallySetToDoneOnNextSync() throws Exception {
        writeConfig("project_board:\n  enabled: false\n");
        seedEpicWithTask();
        startSession();

        assertTrue(sessionService.setStatus(10, EpicStatus.DONE, "alice").isPresent());
        sessionService.sync();

        verify(remoteClient).closeIssue("acme/app", 10);
        assertTrue(cacheStore.load(REPO).findEpic(10).orElseThrow().isClosed());
    }

    private void writeConfig(String yaml) throws Exception {
        Files.writeString(repoDir.resolve(".github-tracker.yaml"), yaml);
    }

    private void seedEpicWithTask() {
        CacheSnapshot snapshot = CacheSnapshot.empty();
        Epic epic = new Epic();
        epic.setNumber(10);
        epic.setTitle("Search");
        epic.setStatus("planning");
        epic.setSyncedStatus("planning");
        epic.setPlanFile("docs/plans/search.md");
        snapshot.putEpic(epic);
        snapshot.putSubItem(10, new SubItem(124, "Write tokenizer", SubItem.OPEN, 10));
        cacheStore.save(REPO, snapshot);
    }

    private void startSession() {
        when(gitService.detectRepository(repoDir)).thenReturn(Optional.of(REPO));
        when(remoteClient.viewIssue("acme/app", 10)).thenReturn(RemoteIssue.builder()
            .number(10).title("Search").state("OPEN")
            .labels(List.of(new RemoteIssue.Label("status/planning"))).build());
        when(remoteClient.viewIssue("acme/app", 124)).thenReturn(RemoteIssue.builder()
            .number(124).title("Write tokenizer").state("OPEN").build());
        sessionService.startSession(repoDir);
    }
}
