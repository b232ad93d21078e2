package com.powerlevel.tracker.service;

import com.powerlevel.tracker.exception.SessionNotStartedException;
import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.CheckpointResult;
import com.powerlevel.tracker.model.CommitInfo;
import com.powerlevel.tracker.model.DetectedEvent;
import com.powerlevel.tracker.model.DetectedEventKind;
import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.EpicStatus;
import com.powerlevel.tracker.model.FlushResult;
import com.powerlevel.tracker.model.ProjectBoardReference;
import com.powerlevel.tracker.model.ReconcileResult;
import com.powerlevel.tracker.model.RefreshResult;
import com.powerlevel.tracker.model.RepositoryContext;
import com.powerlevel.tracker.model.SessionStartResult;
import com.powerlevel.tracker.model.SubItem;
import com.powerlevel.tracker.model.TrackerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Owns the cache snapshot of the active session and drives the checkpoints around it:
 * load at start, mutate on events, flush and save at idle or on request.
 *
 * <p>All operations are serialized on this service; the snapshot is never shared.
 */
@Slf4j
@Service
public class TrackerSessionService {

    static final Duration FIRST_SCAN_WINDOW = Duration.ofHours(1);

    private final GitService gitService;
    private final ConfigLoaderService configLoader;
    private final CacheStoreService cacheStore;
    private final CacheRefreshService cacheRefresh;
    private final ExternalReconcilerService reconciler;
    private final ProjectBoardService projectBoardService;
    private final EpicStatusService statusService;
    private final EpicSyncService syncService;
    private final EpicCreationService creationService;
    private final SessionEventClassifier classifier;
    private final JourneyService journeyService;

    private ActiveSession session;

    public TrackerSessionService(GitService gitService, ConfigLoaderService configLoader, CacheStoreService cacheStore,
                                 CacheRefreshService cacheRefresh, ExternalReconcilerService reconciler,
                                 ProjectBoardService projectBoardService, EpicStatusService statusService,
                                 EpicSyncService syncService, EpicCreationService creationService,
                                 SessionEventClassifier classifier, JourneyService journeyService) {
        this.gitService = gitService;
        this.configLoader = configLoader;
        this.cacheStore = cacheStore;
        this.cacheRefresh = cacheRefresh;
        this.reconciler = reconciler;
        this.projectBoardService = projectBoardService;
        this.statusService = statusService;
        this.syncService = syncService;
        this.creationService = creationService;
        this.classifier = classifier;
        this.journeyService = journeyService;
    }

    /**
     * Opens a session for a repository checkout, replacing any previous one.
     *
     * @throws IllegalArgumentException if the directory has no GitHub origin remote
     */
    public synchronized SessionStartResult startSession(Path repoDir) {
        TrackerConfig config = configLoader.loadConfig(repoDir);
        RepositoryContext context = gitService.detectRepository(repoDir)
            .orElseThrow(() -> new IllegalArgumentException("Not a GitHub repository: " + repoDir));

        CacheSnapshot snapshot = cacheStore.load(context);
        registerExternalTrackers(snapshot, config);

        RefreshResult refresh = cacheRefresh.pull(snapshot, context);
        ReconcileResult reconcile = reconciler.reconcileExternal(
            snapshot, context, config.getExternal().getLabelFilters());
        ProjectBoardReference board = projectBoardService
            .ensureBoard(snapshot, context, config.getProjectBoard())
            .orElse(null);

        cacheStore.save(context, snapshot);
        session = new ActiveSession(repoDir, context, config, snapshot);
        log.info("Session started for {} with {} cached epic(s)", context.getSlug(), snapshot.getEpics().size());

        return SessionStartResult.builder()
            .repository(context)
            .cachedEpics(snapshot.getEpics().size())
            .refresh(refresh)
            .reconcile(reconcile)
            .projectBoard(board)
            .build();
    }

    public synchronized void handleEvent(DetectedEvent event) {
        ActiveSession active = requireSession();
        apply(active, event);
        cacheStore.save(active.context, active.snapshot);
    }

    /**
     * Classifies a session message and applies the resulting event, if any.
     */
    public synchronized Optional<DetectedEvent> handleMessage(String text, String actor) {
        ActiveSession active = requireSession();
        Optional<DetectedEvent> event = classifier.classifyMessage(text, actor);
        event.ifPresent(detected -> {
            apply(active, detected);
            cacheStore.save(active.context, active.snapshot);
        });
        return event;
    }

    /**
     * Session-end checkpoint: scans new commits for task completions, then flushes and saves.
     */
    public synchronized CheckpointResult idle() {
        ActiveSession active = requireSession();
        int completions = 0;
        if (active.config.getTracking().isUpdateOnTaskComplete()) {
            completions = scanCommits(active);
        }
        FlushResult flush = flushIfEnabled(active);
        cacheStore.save(active.context, active.snapshot);
        log.info("Idle checkpoint: {} task completion(s), {} synced, {} failed",
            completions, flush.getSucceeded().size(), flush.getFailed().size());
        return new CheckpointResult(completions, flush);
    }

    public synchronized FlushResult sync() {
        ActiveSession active = requireSession();
        FlushResult flush = flushIfEnabled(active);
        cacheStore.save(active.context, active.snapshot);
        return flush;
    }

    public synchronized Epic createEpic(String planFile) throws IOException {
        ActiveSession active = requireSession();
        Epic epic = creationService.createFromPlan(
            active.snapshot, active.context, active.repoDir, planFile, active.config);
        cacheStore.save(active.context, active.snapshot);
        return epic;
    }

    public synchronized Optional<Epic> setStatus(int epicNumber, EpicStatus status, String actor) {
        ActiveSession active = requireSession();
        Optional<Epic> epic = statusService.setStatus(active.snapshot, epicNumber, status, actor);
        if (epic.isPresent()) {
            cacheStore.save(active.context, active.snapshot);
        }
        return epic;
    }

    public synchronized List<Epic> listEpics() {
        return new ArrayList<>(requireSession().snapshot.getEpics().values());
    }

    public synchronized Optional<RepositoryContext> currentRepository() {
        return Optional.ofNullable(session).map(active -> active.context);
    }

    private void apply(ActiveSession active, DetectedEvent event) {
        if (event.getKind() != DetectedEventKind.TASK_COMPLETION
                && !active.config.getIntegration().isTrackSkillUsage()) {
            log.debug("Skill tracking disabled, ignoring {} event", event.getKind());
            return;
        }
        statusService.applyEvent(active.snapshot, event);

        if (event.getKind() == DetectedEventKind.TASK_COMPLETION
                && event.getIssueNumber() != null
                && active.config.getTracking().isCommentOnProgress()) {
            int issueNumber = event.getIssueNumber();
            active.snapshot.findEpicForSubItem(issueNumber).ifPresent(epic -> epic.getPendingComments().add(
                "Task #" + issueNumber + " completed: "
                    + epic.findSubItem(issueNumber).map(SubItem::getTitle).orElse("")));
        }
    }

    private int scanCommits(ActiveSession active) {
        Instant now = journeyService.now();
        Instant since = active.snapshot.getLastTaskCheck() != null
            ? active.snapshot.getLastTaskCheck()
            : now.minus(FIRST_SCAN_WINDOW);

        List<CommitInfo> commits = new ArrayList<>(gitService.recentCommits(active.repoDir, since));
        // git log lists newest first; the journey wants them in commit order
        Collections.reverse(commits);
        int completions = 0;
        for (CommitInfo commit : commits) {
            Optional<DetectedEvent> event = classifier.classifyCommit(commit);
            if (event.isPresent()) {
                apply(active, event.get());
                completions++;
            }
        }
        active.snapshot.setLastTaskCheck(now);
        return completions;
    }

    private FlushResult flushIfEnabled(ActiveSession active) {
        if (!active.config.getTracking().isAutoUpdateEpics()) {
            log.info("Epic updates disabled for {}, skipping sync", active.context.getSlug());
            return FlushResult.empty();
        }
        return syncService.flush(active.snapshot, active.context);
    }

    private void registerExternalTrackers(CacheSnapshot snapshot, TrackerConfig config) {
        for (TrackerConfig.ExternalTracker tracker : config.getExternal().getTrackers()) {
            Optional<Epic> existing = snapshot.findEpic(tracker.getEpicNumber());
            if (existing.isPresent() && !existing.get().getSubItems().isEmpty()) {
                log.warn("Epic #{} owns sub-items, not tracking {}", tracker.getEpicNumber(), tracker.getRepo());
                continue;
            }
            Epic epic = existing.orElseGet(() -> {
                Epic created = new Epic();
                created.setNumber(tracker.getEpicNumber());
                created.setTitle("External: " + tracker.getRepo());
                created.setCreatedAt(journeyService.now());
                return created;
            });
            epic.setExternalTarget(tracker.getRepo());
            if (tracker.getDescription() != null && !tracker.getDescription().isBlank()) {
                epic.setGoal(tracker.getDescription());
            }
            snapshot.putEpic(epic);
        }
    }

    private ActiveSession requireSession() {
        if (session == null) {
            throw new SessionNotStartedException();
        }
        return session;
    }

    private static final class ActiveSession {
        final Path repoDir;
        final RepositoryContext context;
        final TrackerConfig config;
        final CacheSnapshot snapshot;

        ActiveSession(Path repoDir, RepositoryContext context, TrackerConfig config, CacheSnapshot snapshot) {
            this.repoDir = repoDir;
            this.context = context;
            this.config = config;
            this.snapshot = snapshot;
        }
    }
}
