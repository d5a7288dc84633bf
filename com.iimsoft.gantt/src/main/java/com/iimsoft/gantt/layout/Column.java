package com.iimsoft.gantt.layout;

import lombok.Value;

import java.time.LocalDate;

/**
 * One calendar month of the chart.
 */
@Value
public class Column {
    /** first day of the month */
    LocalDate month;
    int days;
    double width;
    String label;
}
