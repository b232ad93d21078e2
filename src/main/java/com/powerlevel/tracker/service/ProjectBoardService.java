package com.powerlevel.tracker.service;

import com.powerlevel.tracker.exception.RemoteClientException;
import com.powerlevel.tracker.model.CacheSnapshot;
import com.powerlevel.tracker.model.ProjectBoardReference;
import com.powerlevel.tracker.model.RepositoryContext;
import com.powerlevel.tracker.model.TrackerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Detects the owner's project board once and keeps it in the cache. Board problems never
 * fail a session: they are logged and the board is skipped.
 */
@Slf4j
@Service
public class ProjectBoardService {

    private final RemoteClientService remoteClient;
    private final Clock clock;

    public ProjectBoardService(RemoteClientService remoteClient, Clock clock) {
        this.remoteClient = remoteClient;
        this.clock = clock;
    }

    public Optional<ProjectBoardReference> ensureBoard(CacheSnapshot snapshot, RepositoryContext context,
                                                       TrackerConfig.ProjectBoard settings) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        ProjectBoardReference cached = snapshot.getProjectBoard();
        if (cached != null && (settings.getNumber() == null || settings.getNumber() == cached.getNumber())) {
            return Optional.of(cached);
        }

        try {
            List<ProjectBoardReference> boards = remoteClient.listProjectBoards(context.getOwner());
            Optional<ProjectBoardReference> board = boards.stream()
                .filter(candidate -> settings.getNumber() == null || settings.getNumber() == candidate.getNumber())
                .findFirst();
            if (board.isEmpty()) {
                log.info("No project board found for {}", context.getOwner());
                return Optional.empty();
            }
            ProjectBoardReference detected = board.get();
            detected.setDetectedAt(clock.instant());
            snapshot.setProjectBoard(detected);
            log.info("Using project board #{} ({})", detected.getNumber(), detected.getTitle());
            return Optional.of(detected);
        } catch (RemoteClientException e) {
            log.warn("Could not detect project board for {}: {}", context.getOwner(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Adds an issue to the board. Returns false when it could not be added.
     */
    public boolean addIssue(ProjectBoardReference board, RepositoryContext context, int issueNumber) {
        try {
            String contentId = remoteClient.getIssueNodeId(context.getSlug(), issueNumber);
            remoteClient.addItemToBoard(board.getId(), contentId);
            log.debug("Added #{} to project board #{}", issueNumber, board.getNumber());
            return true;
        } catch (RemoteClientException e) {
            log.warn("Could not add #{} to project board #{}: {}", issueNumber, board.getNumber(), e.getMessage());
            return false;
        }
    }
}
