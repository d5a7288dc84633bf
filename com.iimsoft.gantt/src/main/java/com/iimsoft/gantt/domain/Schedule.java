package com.iimsoft.gantt.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * 一张甘特图的输入：标题、可选标记日期、资源列表、任务/里程碑列表（均不可变）。
 */
public final class Schedule {

    private final String title;
    private final LocalDate markedDate;
    private final List<String> resources;
    private final List<ScheduleItem> items;

    public Schedule(String title, LocalDate markedDate, List<String> resources, List<ScheduleItem> items) {
        this.title = Objects.requireNonNull(title, "title");
        this.markedDate = markedDate;
        this.resources = List.copyOf(Objects.requireNonNull(resources, "resources"));
        this.items = List.copyOf(Objects.requireNonNull(items, "items"));
    }

    public String getTitle() { return title; }
    public LocalDate getMarkedDate() { return markedDate; }
    public List<String> getResources() { return resources; }
    public List<ScheduleItem> getItems() { return items; }

    public boolean hasMarkedDate() {
        return markedDate != null;
    }
}
