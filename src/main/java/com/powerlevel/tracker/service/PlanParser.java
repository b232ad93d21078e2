package com.powerlevel.tracker.service;

import com.powerlevel.tracker.model.ParsedPlan;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a markdown implementation plan: first {@code # } heading, {@code priority: pN},
 * the {@code ## Goal} section and the list items of {@code ## Tasks|Steps|Checklist}.
 */
@Component
public class PlanParser {

    static final String DEFAULT_PRIORITY = "p2";

    private static final Pattern PRIORITY = Pattern.compile("^priority:\\s*(p[0-3])", Pattern.CASE_INSENSITIVE);
    private static final Pattern GOAL_HEADING = Pattern.compile("^#{2,}\\s+goal", Pattern.CASE_INSENSITIVE);
    private static final Pattern TASKS_HEADING = Pattern.compile("^#{2,}\\s+(tasks|steps|checklist)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern TASK_ITEM = Pattern.compile("^[-*]\\s+(?:\\[[ xX]\\]\\s+)?(.+)");

    private enum Section { NONE, GOAL, TASKS }

    public ParsedPlan parse(Path planFile) throws IOException {
        return parse(Files.readString(planFile, StandardCharsets.UTF_8));
    }

    public ParsedPlan parse(String content) {
        String title = "";
        String priority = DEFAULT_PRIORITY;
        StringBuilder goal = new StringBuilder();
        List<String> tasks = new ArrayList<>();
        Section section = Section.NONE;

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();

            if (title.isEmpty() && line.startsWith("# ")) {
                title = line.substring(2).trim();
                continue;
            }
            Matcher priorityMatch = PRIORITY.matcher(line);
            if (priorityMatch.find()) {
                priority = priorityMatch.group(1).toLowerCase(Locale.ROOT);
                continue;
            }
            if (GOAL_HEADING.matcher(line).find()) {
                section = Section.GOAL;
                continue;
            }
            if (TASKS_HEADING.matcher(line).find()) {
                section = Section.TASKS;
                continue;
            }
            if (line.startsWith("##")) {
                section = Section.NONE;
                continue;
            }

            if (section == Section.GOAL && !line.isEmpty()) {
                if (goal.length() > 0) {
                    goal.append('\n');
                }
                goal.append(line);
            } else if (section == Section.TASKS) {
                Matcher task = TASK_ITEM.matcher(line);
                if (task.find()) {
                    tasks.add(task.group(1).trim());
                }
            }
        }

        return ParsedPlan.builder()
            .title(title.isEmpty() ? "Untitled Plan" : title)
            .goal(goal.length() == 0 ? "No goal specified" : goal.toString())
            .priority(priority)
            .tasks(List.copyOf(tasks))
            .build();
    }
}
