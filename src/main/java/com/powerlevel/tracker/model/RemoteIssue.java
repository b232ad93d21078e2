package com.powerlevel.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Issue as reported by {@code gh issue view/list --json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemoteIssue {
    private int number;
    private String title;
    private String state;   // OPEN | CLOSED
    private String url;
    @Builder.Default
    private List<Label> labels = new ArrayList<>();

    @JsonIgnore
    public boolean isClosed() {
        return "closed".equalsIgnoreCase(state);
    }

    /**
     * Value of the first {@code status/*} label, verbatim.
     */
    public Optional<String> statusLabelValue() {
        if (labels == null) {
            return Optional.empty();
        }
        return labels.stream()
            .map(Label::getName)
            .filter(name -> name != null && name.startsWith(EpicStatus.LABEL_PREFIX))
            .map(name -> name.substring(EpicStatus.LABEL_PREFIX.length()))
            .findFirst();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Label {
        private String name;
    }
}
