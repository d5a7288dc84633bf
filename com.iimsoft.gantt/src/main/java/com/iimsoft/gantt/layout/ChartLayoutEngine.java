package com.iimsoft.gantt.layout;

import com.iimsoft.gantt.calendar.ChartCalendar;
import com.iimsoft.gantt.config.ChartConfig;
import com.iimsoft.gantt.domain.Schedule;
import com.iimsoft.gantt.domain.ScheduleItem;
import com.iimsoft.gantt.log.ChartLog;
import com.iimsoft.gantt.style.ColorAssigner;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps a {@link Schedule} onto pixel geometry.
 *
 * 流程：
 * 1) 校验（至少两项；第一项必须有开始日期和资源；资源下标不越界）
 * 2) 第一遍：推进游标，计算项目起止日期和每项的 shadow duration（跳过周末）
 * 3) 按月生成列：宽度 = maxMonthWidth * 当月天数 / 31
 * 4) 第二遍：游标从起始日重新推进，计算每行的 x 偏移、长度和资源
 * 5) 标记日期的 x 偏移
 */
public class ChartLayoutEngine {

    public static final Gutter GUTTER = new Gutter(10.0, 80.0, 10.0, 10.0);
    public static final Gutter ROW_GUTTER = Gutter.uniform(5.0);
    public static final Gutter LEGEND_GUTTER = Gutter.uniform(10.0);
    /** height of a bar / legend swatch, without gutters */
    public static final double BAR_HEIGHT = 20.0;
    public static final double CORNER_RADIUS = 3.0;
    public static final int DAYS_IN_LONGEST_MONTH = 31;
    /** 单个任务最长 100 年 */
    public static final int MAX_DURATION_DAYS = 36_525;
    /** 月份列上限，留出单个最长任务加上月初/月末对齐的余量 */
    public static final long MAX_SPAN_MONTHS = 1_224;

    private final ColorAssigner colorAssigner;
    private final ChartLog log;

    public ChartLayoutEngine(ColorAssigner colorAssigner, ChartLog log) {
        this.colorAssigner = Objects.requireNonNull(colorAssigner, "colorAssigner");
        this.log = Objects.requireNonNull(log, "log");
    }

    public ChartGeometry layout(Schedule schedule, ChartConfig config) {
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(config, "config");
        config.validate();
        validate(schedule);

        List<ScheduleItem> items = schedule.getItems();
        ScheduleSpan span = ScheduleSpan.of(items);
        long months = ChronoUnit.MONTHS.between(span.getStartDate(), span.getEndDate()) + 1;
        if (months > MAX_SPAN_MONTHS) {
            throw new ScheduleValidationException(ScheduleValidationException.Reason.OUT_OF_RANGE, -1,
                    "Chart spans " + months + " months (" + span.getStartDate() + " .. " + span.getEndDate()
                            + "), at most " + MAX_SPAN_MONTHS + " are supported");
        }

        List<Column> columns = buildColumns(span.getStartDate(), span.getEndDate(), config.getMaxMonthWidth());
        int totalDays = 0;
        double totalWidth = 0.0;
        for (Column c : columns) {
            totalDays += c.getDays();
            totalWidth += c.getWidth();
        }

        OffsetScale scale = new OffsetScale(span.getStartDate(), config.getTitleWidth() + GUTTER.getLeft(),
                totalDays, totalWidth);
        List<Row> rows = buildRows(items, span, scale);

        Double markedDateOffset = null;
        if (schedule.hasMarkedDate()) {
            LocalDate marked = schedule.getMarkedDate();
            markedDateOffset = scale.offsetOf(marked.atStartOfDay());
            if (marked.isBefore(span.getStartDate()) || marked.isAfter(span.getEndDate())) {
                log.warning("Marked date {} lies outside the chart ({} .. {})",
                        marked, span.getStartDate(), span.getEndDate());
            }
        }

        return ChartGeometry.builder()
                .title(schedule.getTitle())
                .gutter(GUTTER)
                .rowGutter(ROW_GUTTER)
                .rowHeight(ROW_GUTTER.height() + BAR_HEIGHT)
                .legendGutter(LEGEND_GUTTER)
                .legendRowHeight(LEGEND_GUTTER.height() + BAR_HEIGHT)
                .markedDateOffset(markedDateOffset)
                .titleWidth(config.getTitleWidth())
                .maxMonthWidth(config.getMaxMonthWidth())
                .cornerRadius(CORNER_RADIUS)
                .palette(colorAssigner.assign(schedule.getResources().size()))
                .columns(columns)
                .rows(rows)
                .resources(schedule.getResources())
                .startDate(span.getStartDate())
                .endDate(span.getEndDate())
                .totalDays(totalDays)
                .totalWidth(totalWidth)
                .build();
    }

    /**
     * @throws ScheduleValidationException if the schedule cannot be laid out
     */
    public static void validate(Schedule schedule) {
        List<ScheduleItem> items = schedule.getItems();
        int resourceCount = schedule.getResources().size();

        if (items.size() < 2) {
            throw new ScheduleValidationException(ScheduleValidationException.Reason.INSUFFICIENT_INPUT, -1,
                    "You must provide more than one task");
        }
        ScheduleItem first = items.get(0);
        if (!first.hasStartDate()) {
            throw new ScheduleValidationException(ScheduleValidationException.Reason.MISSING_ANCHOR, 0,
                    "First item must contain a start date");
        }
        if (!first.hasResource()) {
            throw new ScheduleValidationException(ScheduleValidationException.Reason.MISSING_ANCHOR, 0,
                    "First item must contain a resource index");
        }
        for (int i = 0; i < items.size(); i++) {
            Integer d = items.get(i).getDuration();
            if (d != null && (d < 0 || d > MAX_DURATION_DAYS)) {
                throw new ScheduleValidationException(ScheduleValidationException.Reason.OUT_OF_RANGE, i,
                        "Duration " + d + " of item " + i + " ('" + items.get(i).getTitle()
                                + "') must be between 0 and " + MAX_DURATION_DAYS + " days");
            }
            Integer r = items.get(i).getResourceIndex();
            if (r != null && (r < 0 || r >= resourceCount)) {
                throw new ScheduleValidationException(ScheduleValidationException.Reason.INVALID_REFERENCE, i,
                        "Resource index " + r + " of item " + i + " ('" + items.get(i).getTitle()
                                + "') is out of range, " + resourceCount + " resources defined");
            }
        }
    }

    static List<Column> buildColumns(LocalDate startDate, LocalDate endDate, double maxMonthWidth) {
        List<Column> columns = new ArrayList<>();
        for (LocalDate month = ChartCalendar.firstOfMonth(startDate); !month.isAfter(endDate);
             month = ChartCalendar.nextMonth(month)) {
            int days = ChartCalendar.daysInMonth(month.getYear(), month.getMonthValue());
            double width = maxMonthWidth * days / DAYS_IN_LONGEST_MONTH;
            columns.add(new Column(month, days, width, ChartCalendar.monthLabel(month.getMonthValue())));
        }
        return columns;
    }

    /**
     * Second pass. The cursor restarts at the chart start and is re-derived item by item; only the
     * shadow durations of the first pass are reused.
     */
    static List<Row> buildRows(List<ScheduleItem> items, ScheduleSpan span, OffsetScale scale) {
        RowFold state = new RowFold(span.getStartDate().atStartOfDay(), items.get(0).getResourceIndex());
        List<Row> rows = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            ScheduleItem item = items.get(i);
            Integer shadow = span.shadowDuration(i);

            LocalDateTime cursor = item.hasStartDate() ? item.getStartDate() : state.cursor;
            double offset = scale.offsetOf(cursor);
            Double length = null;
            if (shadow != null) {
                // shadow duration 已包含周末顺延
                length = scale.lengthOf(shadow);
                cursor = cursor.plusDays(shadow);
            }
            int resource = item.hasResource() ? item.getResourceIndex() : state.resourceIndex;

            rows.add(new Row(item.getTitle(), resource, offset, length, item.isOpen()));
            state = new RowFold(cursor, resource);
        }
        return rows;
    }

    private static final class RowFold {
        final LocalDateTime cursor;
        final int resourceIndex;

        RowFold(LocalDateTime cursor, int resourceIndex) {
            this.cursor = cursor;
            this.resourceIndex = resourceIndex;
        }
    }

    /**
     * Days since the chart start -> x coordinate.
     */
    static final class OffsetScale {
        private final LocalDateTime origin;
        private final double x0;
        private final int totalDays;
        private final double totalWidth;

        OffsetScale(LocalDate startDate, double x0, int totalDays, double totalWidth) {
            this.origin = startDate.atStartOfDay();
            this.x0 = x0;
            this.totalDays = totalDays;
            this.totalWidth = totalWidth;
        }

        double offsetOf(LocalDateTime instant) {
            // 整天数（向零截断）
            long days = ChronoUnit.DAYS.between(origin, instant);
            return x0 + lengthOf(days);
        }

        double lengthOf(long days) {
            return (double) days / totalDays * totalWidth;
        }
    }
}
