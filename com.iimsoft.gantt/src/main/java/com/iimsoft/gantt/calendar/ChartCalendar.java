package com.iimsoft.gantt.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 甘特图日历工具（纯函数，无状态）。
 *
 * - 月份天数：下个月 1 号的前一天
 * - 周末顺延：周六 +2 天，周日 +1 天，工作日不动
 * - 月份步进 / 月份简称
 */
public final class ChartCalendar {

    private static final String[] MONTH_LABELS = {
            "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"
    };

    private ChartCalendar() {
    }

    public static int daysInMonth(int year, int month) {
        // the first day of the next month...
        LocalDate firstOfNext = month == 12
                ? LocalDate.of(year + 1, 1, 1)
                : LocalDate.of(year, month + 1, 1);
        // ...is preceded by the last day of the original month
        return firstOfNext.minusDays(1).getDayOfMonth();
    }

    public static boolean isWeekend(LocalDateTime instant) {
        DayOfWeek dow = instant.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    /**
     * Number of days needed to move {@code instant} onto the following Monday when it falls on a
     * weekend, otherwise 0.
     */
    public static int weekendShift(LocalDateTime instant) {
        switch (instant.getDayOfWeek()) {
            case SATURDAY:
                return 2;
            case SUNDAY:
                return 1;
            default:
                return 0;
        }
    }

    public static LocalDateTime skipWeekend(LocalDateTime instant) {
        return instant.plusDays(weekendShift(instant));
    }

    public static LocalDate firstOfMonth(LocalDate date) {
        return LocalDate.of(date.getYear(), date.getMonthValue(), 1);
    }

    public static LocalDate lastOfMonth(LocalDate date) {
        return LocalDate.of(date.getYear(), date.getMonthValue(),
                daysInMonth(date.getYear(), date.getMonthValue()));
    }

    /** First day of the month after {@code date}'s month. */
    public static LocalDate nextMonth(LocalDate date) {
        int month = date.getMonthValue();
        return LocalDate.of(date.getYear() + (month == 12 ? 1 : 0), month % 12 + 1, 1);
    }

    /** @param month 1..12 */
    public static String monthLabel(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Invalid month: " + month);
        }
        return MONTH_LABELS[month - 1];
    }
}
