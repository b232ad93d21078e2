package com.powerlevel.tracker.service;

import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.ExternalItem;
import com.powerlevel.tracker.model.ReconcileResult;
import com.powerlevel.tracker.model.RemoteIssue;
import com.powerlevel.tracker.model.RepositoryContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Mirrors the open issues of foreign repositories into the checklists of external tracking epics.
 *
 * <p>Only reads from the external repository; the only write is the tracking epic's body, and
 * only when the rendered checklist changed. Runs once per session start.
 */
@Slf4j
@Service
public class ExternalReconcilerService {

    static final String UNFILTERED = "";

    private final RemoteClientService remoteClient;
    private final EpicBodyRenderer renderer;
    private final ExecutorService syncExecutor;

    public ExternalReconcilerService(RemoteClientService remoteClient, EpicBodyRenderer renderer,
                                     ExecutorService syncExecutor) {
        this.remoteClient = remoteClient;
        this.renderer = renderer;
        this.syncExecutor = syncExecutor;
    }

    public ReconcileResult reconcileExternal(CacheSnapshot snapshot, RepositoryContext context,
                                             List<String> labelFilters) {
        List<String> ladder = filterLadder(labelFilters);
        List<CompletableFuture<Outcome>> outcomes = new ArrayList<>();
        for (Epic epic : snapshot.externalEpics()) {
            outcomes.add(CompletableFuture.supplyAsync(
                () -> reconcile(context, epic, ladder), syncExecutor));
        }

        List<Integer> updated = new ArrayList<>();
        List<Integer> unchanged = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        for (CompletableFuture<Outcome> future : outcomes) {
            Outcome outcome = future.join();
            Epic epic = snapshot.findEpic(outcome.epicNumber).orElseThrow();
            if (outcome.error != null) {
                failed.add(outcome.epicNumber);
                log.warn("Skipped reconciliation of epic #{} ({}): {}",
                    outcome.epicNumber, epic.getExternalTarget(), outcome.error.getMessage());
            } else if (outcome.checklist == null) {
                unchanged.add(outcome.epicNumber);
            } else {
                epic.setExternalChecklist(outcome.checklist);
                updated.add(outcome.epicNumber);
                log.info("Reconciled epic #{}: {} item(s) from {}",
                    outcome.epicNumber, outcome.checklist.size(), epic.getExternalTarget());
            }
        }
        return new ReconcileResult(updated, unchanged, failed);
    }

    /**
     * Configured label filters followed by the unfiltered query.
     */
    List<String> filterLadder(List<String> labelFilters) {
        List<String> ladder = new ArrayList<>();
        if (labelFilters != null) {
            labelFilters.stream()
                .filter(filter -> filter != null && !filter.isBlank())
                .forEach(ladder::add);
        }
        ladder.add(UNFILTERED);
        return ladder;
    }

    /**
     * New checklist: previous items in their order (closed when no longer open), then newly opened items.
     */
    List<ExternalItem> mergeChecklist(List<ExternalItem> previous, List<RemoteIssue> openIssues) {
        Map<String, RemoteIssue> open = new LinkedHashMap<>();
        for (RemoteIssue issue : openIssues) {
            open.putIfAbsent(issue.getUrl(), issue);
        }

        List<ExternalItem> merged = new ArrayList<>();
        for (ExternalItem item : previous) {
            RemoteIssue stillOpen = open.remove(item.getUrl());
            if (stillOpen != null) {
                merged.add(new ExternalItem(stillOpen.getTitle(), stillOpen.getUrl(), false));
            } else {
                merged.add(new ExternalItem(item.getTitle(), item.getUrl(), true));
            }
        }
        for (RemoteIssue issue : open.values()) {
            merged.add(new ExternalItem(issue.getTitle(), issue.getUrl(), false));
        }
        return merged;
    }

    // Runs on the sync pool: reads the epic but never mutates it.
    private Outcome reconcile(RepositoryContext context, Epic epic, List<String> ladder) {
        int epicNumber = epic.getNumber();
        Outcome outcome = new Outcome(epicNumber);
        try {
            List<RemoteIssue> openIssues = fetchOpenIssues(epic.getExternalTarget(), ladder);
            List<ExternalItem> previous = epic.getExternalChecklist();
            List<ExternalItem> checklist = mergeChecklist(previous, openIssues);

            if (renderer.renderChecklist(checklist).equals(renderer.renderChecklist(previous))) {
                return outcome;
            }
            remoteClient.editIssueBody(context.getSlug(), epicNumber, renderer.renderExternal(epic, checklist));
            outcome.checklist = checklist;
        } catch (RuntimeException e) {
            outcome.error = e;
        }
        return outcome;
    }

    private List<RemoteIssue> fetchOpenIssues(String externalRepo, List<String> ladder) {
        List<RemoteIssue> issues = List.of();
        for (String filter : ladder) {
            issues = remoteClient.listOpenIssues(externalRepo, filter);
            if (!issues.isEmpty()) {
                log.debug("{}: {} open issue(s) with filter '{}'", externalRepo, issues.size(), filter);
                break;
            }
        }
        return issues;
    }

    private static final class Outcome {
        final int epicNumber;
        List<ExternalItem> checklist;
        RuntimeException error;

        Outcome(int epicNumber) {
            this.epicNumber = epicNumber;
        }
    }
}
