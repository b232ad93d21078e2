package com.powerlevel.tracker.service;

import com.powerlevel.tracker.model.Epic;
import com.powerlevel.tracker.model.ExternalItem;
import com.powerlevel.tracker.model.JourneyEntry;
import com.powerlevel.tracker.model.SubItem;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders the canonical issue body of an epic. Output depends only on the epic's goal,
 * sub-items (or external checklist) and journey, in their stored order.
 */
@Component
public class EpicBodyRenderer {

    private static final DateTimeFormatter JOURNEY_TIME =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    public String render(Epic epic) {
        if (epic.isExternal()) {
            return renderExternal(epic, epic.getExternalChecklist());
        }

        StringBuilder body = new StringBuilder();
        body.append("## Goal\n\n").append(goalOf(epic)).append("\n\n");

        List<SubItem> subItems = epic.getSubItems();
        if (!subItems.isEmpty()) {
            body.append("## Tasks\n\n");
            for (SubItem subItem : subItems) {
                body.append("- [").append(subItem.isClosed() ? "x" : " ").append("] #")
                    .append(subItem.getNumber()).append(' ').append(subItem.getTitle()).append('\n');
            }
            body.append('\n');
        }

        appendJourney(body, epic.getJourney());
        return body.toString().stripTrailing() + "\n";
    }

    /**
     * Body of an external tracking epic with the given checklist in place of the cached one.
     */
    public String renderExternal(Epic epic, List<ExternalItem> checklist) {
        String target = epic.getExternalTarget();
        StringBuilder body = new StringBuilder();
        body.append("**External Project Tracking Epic**\n\n");
        body.append("This epic tracks open issues from the external repository: [")
            .append(target).append("](https://github.com/").append(target).append(")\n\n");
        body.append("**Description:** ").append(goalOf(epic)).append("\n\n");
        body.append("**Tracked Issues:**\n\n").append(renderChecklist(checklist)).append("\n\n");
        body.append("_Synced from ").append(target)
            .append(" on session start. This epic never modifies the external repository._\n\n");

        appendJourney(body, epic.getJourney());
        return body.toString().stripTrailing() + "\n";
    }

    public String renderChecklist(List<ExternalItem> checklist) {
        if (checklist == null || checklist.isEmpty()) {
            return "- [ ] No open issues in external repository";
        }
        StringBuilder lines = new StringBuilder();
        for (ExternalItem item : checklist) {
            if (lines.length() > 0) {
                lines.append('\n');
            }
            lines.append("- [").append(item.isClosed() ? "x" : " ").append("] [")
                .append(item.getTitle()).append("](").append(item.getUrl()).append(')');
        }
        return lines.toString();
    }

    private void appendJourney(StringBuilder body, List<JourneyEntry> journey) {
        if (journey.isEmpty()) {
            return;
        }
        body.append("## Progress Journey\n\n");
        for (JourneyEntry entry : journey) {
            body.append("- **").append(JOURNEY_TIME.format(entry.getTimestamp())).append(" UTC** - ")
                .append(entry.getMessage()).append('\n');
            if (entry.getActor() != null && !entry.getActor().isBlank()) {
                body.append("  - Agent: ").append(entry.getActor()).append('\n');
            }
        }
    }

    private String goalOf(Epic epic) {
        if (epic.getGoal() != null && !epic.getGoal().isBlank()) {
            return epic.getGoal().strip();
        }
        return epic.getTitle() != null ? epic.getTitle() : "";
    }
}
