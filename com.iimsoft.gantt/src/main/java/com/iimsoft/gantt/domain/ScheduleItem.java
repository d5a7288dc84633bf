package com.iimsoft.gantt.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One task or milestone of a {@link Schedule}.
 * Every optional field is {@code null} when absent; absent values are inherited from the
 * running cursor / running resource during layout.
 */
public final class ScheduleItem {

    private final String title;
    private final Integer duration;          // 天；null => 里程碑
    private final LocalDateTime startDate;   // null => 接在上一项之后
    private final Integer resourceIndex;     // null => 沿用上一项的资源
    private final boolean open;

    public ScheduleItem(String title, Integer duration, LocalDateTime startDate, Integer resourceIndex, boolean open) {
        this.title = Objects.requireNonNull(title, "title");
        this.duration = duration;
        this.startDate = startDate;
        this.resourceIndex = resourceIndex;
        this.open = open;
    }

    public static ScheduleItem task(String title, int duration) {
        return new ScheduleItem(title, duration, null, null, false);
    }

    public static ScheduleItem milestone(String title) {
        return new ScheduleItem(title, null, null, null, false);
    }

    public ScheduleItem withStartDate(LocalDateTime startDate) {
        return new ScheduleItem(title, duration, startDate, resourceIndex, open);
    }

    public ScheduleItem withResource(Integer resourceIndex) {
        return new ScheduleItem(title, duration, startDate, resourceIndex, open);
    }

    public ScheduleItem withOpen(boolean open) {
        return new ScheduleItem(title, duration, startDate, resourceIndex, open);
    }

    public String getTitle() { return title; }
    public Integer getDuration() { return duration; }
    public LocalDateTime getStartDate() { return startDate; }
    public Integer getResourceIndex() { return resourceIndex; }
    public boolean isOpen() { return open; }

    public boolean isMilestone() {
        return duration == null;
    }

    public boolean hasStartDate() {
        return startDate != null;
    }

    public boolean hasResource() {
        return resourceIndex != null;
    }

    @Override
    public String toString() {
        return "ScheduleItem{" + title + ", duration=" + duration + ", start=" + startDate
                + ", resource=" + resourceIndex + ", open=" + open + '}';
    }
}
