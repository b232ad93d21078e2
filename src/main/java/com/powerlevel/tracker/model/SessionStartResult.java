package com.powerlevel.tracker.model;

import lombok.Builder;
import lombok.Value;

/**
 * What happened while a session was being opened.
 */
@Value
@Builder
public class SessionStartResult {
    RepositoryContext repository;
    int cachedEpics;
    RefreshResult refresh;
    ReconcileResult reconcile;
    ProjectBoardReference projectBoard;
}
