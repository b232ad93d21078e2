package com.powerlevel.tracker.service;

import com.powerlevel.tracker.model.CommitInfo;
import com.powerlevel.tracker.model.DetectedEvent;
import com.powerlevel.tracker.model.DetectedEventKind;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes workflow skill announcements in session messages and task-closing keywords in commits.
 */
@Component
public class SessionEventClassifier {

    private static final Map<Pattern, DetectedEventKind> SKILL_PATTERNS = new LinkedHashMap<>();

    static {
        SKILL_PATTERNS.put(skill("executing-plans"), DetectedEventKind.EXECUTION);
        SKILL_PATTERNS.put(skill("finishing-a-development-branch"), DetectedEventKind.FINISHING);
        SKILL_PATTERNS.put(skill("subagent-driven-development"), DetectedEventKind.SUBAGENT);
    }

    private static final Pattern PLAN_PATH = Pattern.compile("docs/plans/[\\w-]+\\.md");
    private static final Pattern TASK_KEYWORD = Pattern.compile("\\b(closes|fixes|resolves|completes)\\s+#(\\d+)",
        Pattern.CASE_INSENSITIVE);

    public Optional<DetectedEvent> classifyMessage(String text, String actor) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Map.Entry<Pattern, DetectedEventKind> entry : SKILL_PATTERNS.entrySet()) {
            if (entry.getKey().matcher(text).find()) {
                return Optional.of(DetectedEvent.builder()
                    .kind(entry.getValue())
                    .planFilePath(extractPlanPath(text).orElse(null))
                    .actor(actor)
                    .build());
            }
        }
        return Optional.empty();
    }

    public Optional<DetectedEvent> classifyCommit(CommitInfo commit) {
        return extractCompletedIssue(commit.getMessage())
            .map(issueNumber -> DetectedEvent.builder()
                .kind(DetectedEventKind.TASK_COMPLETION)
                .issueNumber(issueNumber)
                .actor("git-commit-" + commit.shortHash())
                .build());
    }

    public Optional<String> extractPlanPath(String text) {
        Matcher matcher = PLAN_PATH.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    Optional<Integer> extractCompletedIssue(String message) {
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = TASK_KEYWORD.matcher(message);
        return matcher.find() ? Optional.of(Integer.parseInt(matcher.group(2))) : Optional.empty();
    }

    private static Pattern skill(String name) {
        return Pattern.compile("using the " + Pattern.quote(name) + " skill", Pattern.CASE_INSENSITIVE);
    }
}
