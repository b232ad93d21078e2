package com.powerlevel.tracker.service;

import com.powerlevel.tracker.model.CommitInfo;
import com.powerlevel.tracker.model.RepositoryContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
public class GitService {

    private static final Pattern HTTPS_URL_PATTERN =
        Pattern.compile("^https://github\\.com/([\\w.-]+)/([\\w.-]+?)(?:\\.git)?/?$");
    private static final Pattern SSH_URL_PATTERN =
        Pattern.compile("^(?:ssh://)?git@github\\.com[:/]([\\w.-]+)/([\\w.-]+?)(?:\\.git)?$");
    private static final Duration GIT_TIMEOUT = Duration.ofSeconds(30);

    @Value("${tracker.git.path:git}")
    private String gitPath = "git";

    private final CommandRunner commandRunner;

    public GitService(CommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    public Optional<RepositoryContext> detectRepository(Path repoDir) {
        try {
            CommandRunner.CommandResult result = commandRunner.run(repoDir, null, GIT_TIMEOUT,
                List.of(gitPath, "config", "--get", "remote.origin.url"));
            if (!result.isSuccess()) {
                log.warn("No origin remote in {}: {}", repoDir, result.getStderr().trim());
                return Optional.empty();
            }
            Optional<RepositoryContext> context = parseRemoteUrl(result.getStdout().trim());
            if (context.isEmpty()) {
                log.warn("Unable to parse GitHub URL: {}", result.getStdout().trim());
            }
            return context;
        } catch (IOException e) {
            log.warn("Error detecting repository in {}: {}", repoDir, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<RepositoryContext> parseRemoteUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : List.of(HTTPS_URL_PATTERN, SSH_URL_PATTERN)) {
            Matcher matcher = pattern.matcher(url.trim());
            if (matcher.matches()) {
                return Optional.of(RepositoryContext.of(matcher.group(1), matcher.group(2)));
            }
        }
        return Optional.empty();
    }

    /**
     * Commits made after {@code since}, newest first. Non-git directories yield an empty list.
     */
    public List<CommitInfo> recentCommits(Path repoDir, Instant since) {
        try {
            CommandRunner.CommandResult result = commandRunner.run(repoDir, null, GIT_TIMEOUT,
                List.of(gitPath, "log", "--since=" + since.toString(), "--format=%H|%s|%cI"));
            if (!result.isSuccess()) {
                log.debug("git log failed in {}: {}", repoDir, result.getStderr().trim());
                return List.of();
            }
            return parseCommitLog(result.getStdout());
        } catch (IOException e) {
            log.debug("git log failed in {}: {}", repoDir, e.getMessage());
            return List.of();
        }
    }

    public List<CommitInfo> parseCommitLog(String output) {
        List<CommitInfo> commits = new ArrayList<>();
        if (output == null) {
            return commits;
        }
        for (String line : output.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            int first = line.indexOf('|');
            int last = line.lastIndexOf('|');
            if (first < 0 || last == first) {
                continue;
            }
            // the subject may itself contain '|'
            commits.add(new CommitInfo(
                line.substring(0, first).trim(),
                line.substring(first + 1, last).trim(),
                line.substring(last + 1).trim()));
        }
        return commits;
    }

    public void setGitPath(String gitPath) {
        this.gitPath = gitPath;
    }
}
