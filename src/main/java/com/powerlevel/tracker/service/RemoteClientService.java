package com.powerlevel.tracker.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powerlevel.tracker.config.RetryProperties;
import com.powerlevel.tracker.exception.RemoteClientException;
import com.powerlevel.tracker.exception.RemotePermanentException;
import com.powerlevel.tracker.exception.RemoteTransientException;
import com.powerlevel.tracker.model.EpicStatus;
import com.powerlevel.tracker.model.ProjectBoardReference;
import com.powerlevel.tracker.model.RemoteIssue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub access through the {@code gh} CLI.
 *
 * <p>Rate-limit and network failures are retried with exponential backoff; anything else
 * surfaces immediately as {@link RemotePermanentException}. Holds no mutable state, so it
 * is safe to call from several threads at once.
 */
@Slf4j
@Service
public class RemoteClientService {

    private static final Pattern ISSUE_URL_PATTERN = Pattern.compile("/issues/(\\d+)");
    private static final List<String> RATE_LIMIT_MARKERS = List.of(
        "rate limit", "secondary rate", "abuse detection", "http 429", "too many requests");
    private static final List<String> NETWORK_MARKERS = List.of(
        "timed out", "timeout", "connection reset", "connection refused", "could not resolve host",
        "network is unreachable", "unexpected eof", "http 502", "http 503", "http 504");
    private static final List<String> ALREADY_DONE_MARKERS = List.of(
        "already exists", "already closed", "already open", "duplicate");
    private static final String ISSUE_FIELDS = "number,title,state,url";

    enum FailureClass { RATE_LIMIT, NETWORK, ALREADY_DONE, PERMANENT }

    @Value("${tracker.gh.path:gh}")
    private String ghPath = "gh";

    @Value("${tracker.gh.timeout-seconds:60}")
    private long timeoutSeconds = 60;

    private final CommandRunner commandRunner;
    private final RetryProperties retry;
    private final ObjectMapper mapper;

    public RemoteClientService(CommandRunner commandRunner, RetryProperties retry) {
        this.commandRunner = commandRunner;
        this.retry = retry;
        this.mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public int createIssue(String repo, String title, String body, List<String> labels) {
        List<String> args = new ArrayList<>(List.of("issue", "create", "--repo", repo, "--title", title));
        if (labels != null && !labels.isEmpty()) {
            args.add("--label");
            args.add(String.join(",", labels));
        }
        args.add("--body-file");
        args.add("-");

        String output = execute("create issue", body, args, false, false);
        return parseIssueNumber(output)
            .orElseThrow(() -> new RemotePermanentException("create issue",
                "could not parse issue number from: " + output.trim()));
    }

    public int createSubIssue(String repo, int parentNumber, String title, String body, List<String> labels) {
        return createIssue(repo, title, "Part of #" + parentNumber + "\n\n" + body, labels);
    }

    /**
     * Replaces the issue body and, when {@code status} is given, swaps its status label.
     */
    public void editIssue(String repo, int number, String body, EpicStatus status) {
        List<String> args = new ArrayList<>(List.of(
            "issue", "edit", String.valueOf(number), "--repo", repo, "--body-file", "-"));
        if (status != null) {
            args.add("--add-label");
            args.add(status.label());
            for (EpicStatus other : EpicStatus.values()) {
                if (other != status) {
                    args.add("--remove-label");
                    args.add(other.label());
                }
            }
        }
        execute("edit issue #" + number, body, args, false);
    }

    public void editIssueBody(String repo, int number, String body) {
        editIssue(repo, number, body, null);
    }

    public void addComment(String repo, int number, String body) {
        execute("comment on #" + number, body,
            List.of("issue", "comment", String.valueOf(number), "--repo", repo, "--body-file", "-"), false, false);
    }

    public void closeIssue(String repo, int number) {
        execute("close issue #" + number, null,
            List.of("issue", "close", String.valueOf(number), "--repo", repo), true);
    }

    public void reopenIssue(String repo, int number) {
        execute("reopen issue #" + number, null,
            List.of("issue", "reopen", String.valueOf(number), "--repo", repo), true);
    }

    public RemoteIssue viewIssue(String repo, int number) {
        String output = execute("view issue #" + number, null,
            List.of("issue", "view", String.valueOf(number), "--repo", repo, "--json", ISSUE_FIELDS + ",labels"), false);
        return readJson("view issue #" + number, output, new TypeReference<RemoteIssue>() { });
    }

    public List<RemoteIssue> listOpenIssues(String repo, String labelFilter) {
        List<String> args = new ArrayList<>(List.of("issue", "list", "--repo", repo, "--state", "open"));
        if (labelFilter != null && !labelFilter.isBlank()) {
            args.add("--label");
            args.add(labelFilter);
        }
        args.addAll(List.of("--json", ISSUE_FIELDS, "--limit", "100"));

        String output = execute("list issues of " + repo, null, args, false);
        return readJson("list issues of " + repo, output, new TypeReference<List<RemoteIssue>>() { });
    }

    public List<ProjectBoardReference> listProjectBoards(String owner) {
        String output = execute("list projects of " + owner, null,
            List.of("project", "list", "--owner", owner, "--format", "json"), false);
        JsonNode projects = readJson("list projects of " + owner, output, new TypeReference<JsonNode>() { })
            .path("projects");

        List<ProjectBoardReference> boards = new ArrayList<>();
        for (JsonNode project : projects) {
            int number = project.path("number").asInt();
            String url = project.path("url").asText(null);
            boards.add(ProjectBoardReference.builder()
                .id(project.path("id").asText())
                .number(number)
                .title(project.path("title").asText())
                .owner(owner)
                .url(url != null ? url : "https://github.com/users/" + owner + "/projects/" + number)
                .build());
        }
        return boards;
    }

    public String getIssueNodeId(String repo, int number) {
        String[] parts = repo.split("/", 2);
        String query = "query($owner: String!, $name: String!, $number: Int!) {"
            + " repository(owner: $owner, name: $name) { issue(number: $number) { id } } }";
        JsonNode result = graphql("issue node id #" + number, query,
            List.of("-f", "owner=" + parts[0], "-f", "name=" + parts[1], "-F", "number=" + number), false);
        return result.path("data").path("repository").path("issue").path("id").asText();
    }

    /**
     * Adds an issue to a project board. Returns the board item id, or empty when the issue was already there.
     */
    public Optional<String> addItemToBoard(String projectId, String contentId) {
        String mutation = "mutation($project: ID!, $content: ID!) {"
            + " addProjectV2ItemById(input: {projectId: $project, contentId: $content}) { item { id } } }";
        JsonNode result = graphql("add board item", mutation,
            List.of("-f", "project=" + projectId, "-f", "content=" + contentId), true);
        String itemId = result.path("data").path("addProjectV2ItemById").path("item").path("id").asText("");
        return itemId.isEmpty() ? Optional.empty() : Optional.of(itemId);
    }

    public Optional<Integer> parseIssueNumber(String output) {
        if (output == null) {
            return Optional.empty();
        }
        Matcher matcher = ISSUE_URL_PATTERN.matcher(output);
        return matcher.find() ? Optional.of(Integer.parseInt(matcher.group(1))) : Optional.empty();
    }

    static FailureClass classify(String errorOutput) {
        String text = errorOutput == null ? "" : errorOutput.toLowerCase(Locale.ROOT);
        if (ALREADY_DONE_MARKERS.stream().anyMatch(text::contains)) {
            return FailureClass.ALREADY_DONE;
        }
        if (RATE_LIMIT_MARKERS.stream().anyMatch(text::contains)) {
            return FailureClass.RATE_LIMIT;
        }
        if (NETWORK_MARKERS.stream().anyMatch(text::contains)) {
            return FailureClass.NETWORK;
        }
        return FailureClass.PERMANENT;
    }

    private JsonNode graphql(String operation, String query, List<String> variables, boolean tolerateAlreadyDone) {
        List<String> args = new ArrayList<>(List.of("api", "graphql", "-f", "query=" + query));
        args.addAll(variables);
        String output = execute(operation, null, args, tolerateAlreadyDone);
        if (output.isBlank()) {
            return mapper.createObjectNode();
        }
        JsonNode result = readJson(operation, output, new TypeReference<JsonNode>() { });
        JsonNode errors = result.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            String message = errors.get(0).path("message").asText();
            if (tolerateAlreadyDone && classify(message) == FailureClass.ALREADY_DONE) {
                return mapper.createObjectNode();
            }
            throw new RemotePermanentException(operation, message);
        }
        return result;
    }

    private String execute(String operation, String stdin, List<String> args, boolean tolerateAlreadyDone) {
        return execute(operation, stdin, args, tolerateAlreadyDone, true);
    }

    /**
     * @param retryNetwork false for calls that add something (issues, comments): after a network
     *                     failure the call may already have been applied, so repeating it could
     *                     duplicate it. Rate-limited calls are rejected before they act and are
     *                     always retried.
     */
    private String execute(String operation, String stdin, List<String> args, boolean tolerateAlreadyDone,
                           boolean retryNetwork) {
        List<String> command = new ArrayList<>();
        command.add(ghPath);
        command.addAll(args);

        int attempts = Math.max(1, retry.getMaxAttempts());
        String lastError = "";
        for (int attempt = 1; attempt <= attempts; attempt++) {
            FailureClass failure;
            try {
                CommandRunner.CommandResult result =
                    commandRunner.run(null, stdin, Duration.ofSeconds(timeoutSeconds), command);
                if (result.isSuccess()) {
                    return result.getStdout();
                }
                lastError = result.getStderr().isBlank() ? result.getStdout().trim() : result.getStderr().trim();
                failure = result.isTimedOut() ? FailureClass.NETWORK : classify(lastError);
            } catch (IOException e) {
                throw new RemotePermanentException(operation, "could not run " + ghPath + ": " + e.getMessage());
            }

            if (failure == FailureClass.ALREADY_DONE && tolerateAlreadyDone) {
                log.debug("{}: already done ({})", operation, lastError);
                return "";
            }
            if (failure == FailureClass.PERMANENT || failure == FailureClass.ALREADY_DONE) {
                throw new RemotePermanentException(operation, lastError);
            }
            if (failure == FailureClass.NETWORK && !retryNetwork) {
                log.warn("{} hit {} and is not repeated, it may have been applied: {}", operation, failure, lastError);
                throw new RemoteTransientException(operation, lastError);
            }
            if (attempt < attempts) {
                long delayMs = retry.delayBeforeRetry(attempt);
                log.warn("{} hit {} (attempt {}/{}), retrying in {}ms", operation, failure, attempt, attempts, delayMs);
                sleep(operation, delayMs);
            }
        }
        throw new RemoteTransientException(operation, lastError);
    }

    private void sleep(String operation, long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteTransientException(operation, "interrupted during backoff", e);
        }
    }

    private <T> T readJson(String operation, String output, TypeReference<T> type) {
        try {
            return mapper.readValue(output, type);
        } catch (IOException e) {
            throw new RemoteClientException(operation, "unreadable response: " + e.getMessage(), e);
        }
    }

    public void setGhPath(String ghPath) {
        this.ghPath = ghPath;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }
}
