package com.powerlevel.tracker.service;

import com.powerlevel.tracker.exception.RemoteClientException;
import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.EpicStatus;
import com.powerlevel.tracker.model.JourneyEventKind;
import com.powerlevel.tracker.model.ParsedPlan;
import com.powerlevel.tracker.model.RepositoryContext;
import com.powerlevel.tracker.model.SubItem;
import com.powerlevel.tracker.model.TrackerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Turns an implementation plan into an epic with one sub-item per task.
 */
@Slf4j
@Service
public class EpicCreationService {

    private final PlanParser planParser;
    private final RemoteClientService remoteClient;
    private final EpicBodyRenderer renderer;
    private final JourneyService journeyService;
    private final ProjectBoardService projectBoardService;

    public EpicCreationService(PlanParser planParser, RemoteClientService remoteClient, EpicBodyRenderer renderer,
                               JourneyService journeyService, ProjectBoardService projectBoardService) {
        this.planParser = planParser;
        this.remoteClient = remoteClient;
        this.renderer = renderer;
        this.journeyService = journeyService;
        this.projectBoardService = projectBoardService;
    }

    /**
     * Creates the epic and its sub-items on GitHub and caches them. A failed sub-item is
     * logged and left out; a failed epic aborts the whole creation.
     *
     * @param planFile path of the plan, relative to {@code repoDir} or absolute
     */
    public Epic createFromPlan(CacheSnapshot snapshot, RepositoryContext context, Path repoDir, String planFile,
                               TrackerConfig config) throws IOException {
        ParsedPlan plan = planParser.parse(repoDir.resolve(planFile));
        String repo = context.getSlug();

        Epic epic = new Epic();
        epic.setTitle(plan.getTitle());
        epic.setGoal(plan.getGoal());
        epic.setPriority(plan.getPriority());
        epic.setPlanFile(planFile);
        epic.setStatus(EpicStatus.PLANNING.value());

        int epicNumber = remoteClient.createIssue(repo, plan.getTitle(), renderer.render(epic), List.of(
            "type/epic", "priority/" + plan.getPriority(), EpicStatus.PLANNING.label()));
        Instant createdAt = journeyService.now();
        epic.setNumber(epicNumber);
        epic.setSyncedStatus(EpicStatus.PLANNING.value());
        epic.setSyncedState(Epic.OPEN);
        epic.setCreatedAt(createdAt);
        epic.setUpdatedAt(createdAt);
        snapshot.putEpic(epic);
        log.info("Created epic #{}: {}", epicNumber, plan.getTitle());

        List<String> taskLabels = List.of("type/task", "priority/" + plan.getPriority(), "epic/" + epicNumber);
        List<String> tasks = plan.getTasks();
        for (int i = 0; i < tasks.size(); i++) {
            String task = tasks.get(i);
            try {
                int subItemNumber = remoteClient.createSubIssue(repo, epicNumber, task,
                    "Task " + (i + 1) + " of " + tasks.size(), taskLabels);
                snapshot.putSubItem(epicNumber, new SubItem(subItemNumber, task, SubItem.OPEN, epicNumber));
            } catch (RemoteClientException e) {
                log.warn("Could not create sub-item '{}' for epic #{}: {}", task, epicNumber, e.getMessage());
            }
        }

        journeyService.record(epic, JourneyEventKind.CREATION,
            "Epic created from " + planFile, null,
            Map.of("planFile", planFile, "subItems", epic.getSubItems().size()));

        projectBoardService.ensureBoard(snapshot, context, config.getProjectBoard())
            .ifPresent(board -> projectBoardService.addIssue(board, context, epicNumber));
        return epic;
    }
}
