package com.iimsoft.gantt.layout;

import lombok.Value;

/**
 * Resolved geometry of one schedule item. A row without a length is a milestone.
 */
@Value
public class Row {
    String title;
    int resourceIndex;
    double offset;
    Double length;
    boolean open;

    public boolean isMilestone() {
        return length == null;
    }
}
