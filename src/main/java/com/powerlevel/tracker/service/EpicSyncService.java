package com.powerlevel.tracker.service;

import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.EpicStatus;
import com.powerlevel.tracker.model.FlushResult;
import com.powerlevel.tracker.model.RepositoryContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Pushes dirty epics to GitHub at checkpoints (explicit sync, session idle).
 *
 * <p>Each dirty epic gets its own remote calls; a failure leaves that epic dirty for the
 * next flush and never stops the others. Remote calls fan out on the sync pool, while
 * dirty flags are only touched on the calling thread.
 */
@Slf4j
@Service
public class EpicSyncService {

    private final RemoteClientService remoteClient;
    private final EpicBodyRenderer renderer;
    private final ExecutorService syncExecutor;

    public EpicSyncService(RemoteClientService remoteClient, EpicBodyRenderer renderer, ExecutorService syncExecutor) {
        this.remoteClient = remoteClient;
        this.renderer = renderer;
        this.syncExecutor = syncExecutor;
    }

    public FlushResult flush(CacheSnapshot snapshot, RepositoryContext context) {
        List<Epic> dirtyEpics = snapshot.dirtyEpics();
        if (dirtyEpics.isEmpty()) {
            log.info("No epics need syncing");
            return FlushResult.empty();
        }

        log.info("Syncing {} epic(s) to {}", dirtyEpics.size(), context.getSlug());
        List<CompletableFuture<Push>> pushes = new ArrayList<>();
        for (Epic epic : dirtyEpics) {
            Push push = new Push(epic.getNumber(), renderer.render(epic), statusOf(epic),
                new ArrayList<>(epic.getPendingComments()), epic.getState(), stateChange(epic));
            pushes.add(CompletableFuture.supplyAsync(() -> execute(context, push), syncExecutor));
        }

        List<Integer> succeeded = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        for (CompletableFuture<Push> future : pushes) {
            Push push = future.join();
            Epic epic = snapshot.findEpic(push.number).orElseThrow();
            push.postedComments.forEach(epic.getPendingComments()::remove);
            if (push.error == null) {
                epic.setDirty(false);
                if (push.status != null) {
                    epic.setSyncedStatus(push.status.value());
                }
                epic.setSyncedState(push.state);
                succeeded.add(epic.getNumber());
                log.info("Synced epic #{}", epic.getNumber());
            } else {
                failed.add(epic.getNumber());
                log.warn("Failed to sync epic #{}, it stays dirty: {}", epic.getNumber(), push.error.getMessage());
            }
        }
        return new FlushResult(succeeded, failed);
    }

    private Push execute(RepositoryContext context, Push push) {
        try {
            remoteClient.editIssue(context.getSlug(), push.number, push.body, push.status);
            for (String comment : push.comments) {
                remoteClient.addComment(context.getSlug(), push.number, comment);
                push.postedComments.add(comment);
            }
            if (push.stateChange == StateChange.CLOSE) {
                remoteClient.closeIssue(context.getSlug(), push.number);
            } else if (push.stateChange == StateChange.REOPEN) {
                remoteClient.reopenIssue(context.getSlug(), push.number);
            }
        } catch (RuntimeException e) {
            push.error = e;
        }
        return push;
    }

    private EpicStatus statusOf(Epic epic) {
        // external epics carry no workflow status; unknown remote-set values are left alone
        if (epic.isExternal()) {
            return null;
        }
        return EpicStatus.fromValue(epic.getStatus()).orElse(null);
    }

    private StateChange stateChange(Epic epic) {
        if (epic.isClosed()) {
            return Epic.CLOSED.equals(epic.getSyncedState()) ? StateChange.NONE : StateChange.CLOSE;
        }
        return Epic.CLOSED.equals(epic.getSyncedState()) ? StateChange.REOPEN : StateChange.NONE;
    }

    private enum StateChange { NONE, CLOSE, REOPEN }

    private static final class Push {
        final int number;
        final String body;
        final EpicStatus status;
        final List<String> comments;
        final String state;
        final StateChange stateChange;
        final List<String> postedComments = new ArrayList<>();
        RuntimeException error;

        Push(int number, String body, EpicStatus status, List<String> comments, String state,
             StateChange stateChange) {
            this.number = number;
            this.body = body;
            this.status = status;
            this.comments = comments;
            this.state = state;
            this.stateChange = stateChange;
        }
    }
}
