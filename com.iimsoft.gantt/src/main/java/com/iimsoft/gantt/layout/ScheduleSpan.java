package com.iimsoft.gantt.layout;

import com.iimsoft.gantt.calendar.ChartCalendar;
import com.iimsoft.gantt.domain.ScheduleItem;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of the first pass over a schedule: the month-aligned date span of the chart and the
 * weekend-adjusted ("shadow") duration of every item.
 */
public final class ScheduleSpan {

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final List<Integer> shadowDurations;

    private ScheduleSpan(LocalDate startDate, LocalDate endDate, List<Integer> shadowDurations) {
        this.startDate = startDate;
        this.endDate = endDate;
        this.shadowDurations = Collections.unmodifiableList(shadowDurations);
    }

    /** first day of the first month */
    public LocalDate getStartDate() { return startDate; }

    /** last day of the last month */
    public LocalDate getEndDate() { return endDate; }

    /** one entry per item, null for milestones */
    public List<Integer> getShadowDurations() { return shadowDurations; }

    public Integer shadowDuration(int itemIndex) {
        return shadowDurations.get(itemIndex);
    }

    /**
     * Duration extended so that {@code cursor + duration} does not end on a weekend.
     *
     * @throws ArithmeticException if the extended duration does not fit an int
     */
    public static int shadowDuration(LocalDateTime cursor, int duration) {
        return Math.addExact(duration, ChartCalendar.weekendShift(cursor.plusDays(duration)));
    }

    /**
     * Folds {@code items} into a span. The first item must carry a start date.
     */
    public static ScheduleSpan of(List<ScheduleItem> items) {
        Fold state = Fold.INITIAL;
        for (ScheduleItem item : items) {
            state = state.step(item);
        }
        if (state.start == null) {
            throw new IllegalStateException("No item carries a start date");
        }
        return new ScheduleSpan(
                ChartCalendar.firstOfMonth(state.start.toLocalDate()),
                ChartCalendar.lastOfMonth(state.end.toLocalDate()),
                state.shadows);
    }

    /** Fold state: running cursor, earliest (weekend-snapped) start, latest cursor. */
    private static final class Fold {
        static final Fold INITIAL = new Fold(null, null, null, List.of());

        final LocalDateTime cursor;
        final LocalDateTime start;
        final LocalDateTime end;
        final List<Integer> shadows;

        Fold(LocalDateTime cursor, LocalDateTime start, LocalDateTime end, List<Integer> shadows) {
            this.cursor = cursor;
            this.start = start;
            this.end = end;
            this.shadows = shadows;
        }

        Fold step(ScheduleItem item) {
            LocalDateTime c = cursor;
            LocalDateTime s = start;
            if (item.hasStartDate()) {
                c = item.getStartDate();
                if (s == null || c.isBefore(s)) {
                    // 项目开始日如果落在周末，顺延到周一
                    s = ChartCalendar.skipWeekend(c);
                }
            }
            if (c == null) {
                throw new IllegalStateException("Item '" + item.getTitle() + "' has no start date to follow");
            }

            List<Integer> next = new ArrayList<>(shadows.size() + 1);
            next.addAll(shadows);
            if (item.isMilestone()) {
                next.add(null);
            } else {
                int shadow = shadowDuration(c, item.getDuration());
                c = c.plusDays(shadow);
                next.add(shadow);
            }

            LocalDateTime e = (end == null || end.isBefore(c)) ? c : end;
            return new Fold(c, s, e, next);
        }
    }
}
