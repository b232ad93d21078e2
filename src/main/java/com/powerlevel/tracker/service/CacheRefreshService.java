package com.powerlevel.tracker.service;

import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.RefreshResult;
import com.powerlevel.tracker.model.RemoteIssue;
import com.powerlevel.tracker.model.RepositoryContext;
import com.powerlevel.tracker.model.SubItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Pulls remote state of open epics into the cache at session start.
 *
 * <p>A status label or open/closed state that differs from the last synced one is an edit made
 * on GitHub and replaces the cached value. Otherwise the cached value stays, since it may be a
 * local change that has not been flushed yet.
 */
@Slf4j
@Service
public class CacheRefreshService {

    private final RemoteClientService remoteClient;
    private final ExecutorService syncExecutor;

    public CacheRefreshService(RemoteClientService remoteClient, ExecutorService syncExecutor) {
        this.remoteClient = remoteClient;
        this.syncExecutor = syncExecutor;
    }

    public RefreshResult pull(CacheSnapshot snapshot, RepositoryContext context) {
        List<CompletableFuture<Pulled>> pulls = new ArrayList<>();
        for (Epic epic : snapshot.getEpics().values()) {
            if (epic.isExternal() || epic.isClosed()) {
                continue;
            }
            List<Integer> openSubItems = epic.getSubItems().stream()
                .filter(subItem -> !subItem.isClosed())
                .map(SubItem::getNumber)
                .toList();
            int epicNumber = epic.getNumber();
            pulls.add(CompletableFuture.supplyAsync(
                () -> fetch(context.getSlug(), epicNumber, openSubItems), syncExecutor));
        }

        List<Integer> refreshed = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        for (CompletableFuture<Pulled> future : pulls) {
            Pulled pulled = future.join();
            if (pulled.error != null) {
                failed.add(pulled.epicNumber);
                log.warn("Could not refresh epic #{}: {}", pulled.epicNumber, pulled.error.getMessage());
                continue;
            }
            snapshot.findEpic(pulled.epicNumber).ifPresent(epic -> apply(epic, pulled));
            refreshed.add(pulled.epicNumber);
        }
        if (!pulls.isEmpty()) {
            log.info("Refreshed {} epic(s) from {}, {} failed", refreshed.size(), context.getSlug(), failed.size());
        }
        return new RefreshResult(refreshed, failed);
    }

    void apply(Epic epic, Pulled pulled) {
        RemoteIssue remote = pulled.epicIssue;
        if (remote.getTitle() != null && !remote.getTitle().isBlank()) {
            epic.setTitle(remote.getTitle());
        }

        String remoteState = remote.isClosed() ? Epic.CLOSED : Epic.OPEN;
        if (!remoteState.equals(epic.getSyncedState())) {
            epic.setState(remoteState);
            epic.setSyncedState(remoteState);
        }

        Optional<String> remoteStatus = remote.statusLabelValue();
        if (remoteStatus.isPresent() && !remoteStatus.get().equals(epic.getSyncedStatus())) {
            log.info("Epic #{} status changed on GitHub: {} -> {}",
                epic.getNumber(), epic.getStatus(), remoteStatus.get());
            epic.setStatus(remoteStatus.get());
            epic.setSyncedStatus(remoteStatus.get());
        }

        for (Integer closedNumber : pulled.closedSubItems) {
            epic.findSubItem(closedNumber).ifPresent(subItem -> {
                subItem.setState(SubItem.CLOSED);
                epic.setDirty(true);
            });
        }
    }

    // Runs on the sync pool: talks to GitHub only.
    private Pulled fetch(String repo, int epicNumber, List<Integer> openSubItems) {
        Pulled pulled = new Pulled(epicNumber);
        try {
            pulled.epicIssue = remoteClient.viewIssue(repo, epicNumber);
            for (Integer subItemNumber : openSubItems) {
                RemoteIssue subIssue = remoteClient.viewIssue(repo, subItemNumber);
                if (subIssue.isClosed()) {
                    pulled.closedSubItems.add(subItemNumber);
                }
            }
        } catch (RuntimeException e) {
            pulled.error = e;
        }
        return pulled;
    }

    static final class Pulled {
        final int epicNumber;
        RemoteIssue epicIssue;
        final List<Integer> closedSubItems = new ArrayList<>();
        RuntimeException error;

        Pulled(int epicNumber) {
            this.epicNumber = epicNumber;
        }
    }
}
