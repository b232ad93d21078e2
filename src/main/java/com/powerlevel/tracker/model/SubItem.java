package com.powerlevel.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubItem {
    public static final String OPEN = "open";
    public static final String CLOSED = "closed";

    private int number;
    private String title;
    private String state = OPEN;   // open | closed
    private int epicNumber;

    @JsonIgnore
    public boolean isClosed() {
        return CLOSED.equalsIgnoreCase(state);
    }
}
