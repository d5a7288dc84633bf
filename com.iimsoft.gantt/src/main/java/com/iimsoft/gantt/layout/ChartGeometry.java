package com.iimsoft.gantt.layout;

import com.iimsoft.gantt.style.ResourcePalette;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Fully resolved pixel geometry of a chart. Built by {@link ChartLayoutEngine}, read by the
 * scene builder.
 */
@Value
@Builder
public class ChartGeometry {
    @NonNull String title;
    @NonNull Gutter gutter;
    @NonNull Gutter rowGutter;
    double rowHeight;
    @NonNull Gutter legendGutter;
    double legendRowHeight;
    /** null when the chart has no marked date */
    Double markedDateOffset;
    double titleWidth;
    double maxMonthWidth;
    double cornerRadius;
    @NonNull ResourcePalette palette;
    @Singular List<Column> columns;
    @Singular List<Row> rows;
    @Singular List<String> resources;
    /** first day of the first column */
    @NonNull LocalDate startDate;
    /** last day of the last column */
    @NonNull LocalDate endDate;
    int totalDays;
    double totalWidth;

    public boolean hasMarkedDate() {
        return markedDateOffset != null;
    }

    public double columnsWidth() {
        double sum = 0;
        for (Column c : columns) {
            sum += c.getWidth();
        }
        return sum;
    }

    /** Height of the row area (no title, no legend). */
    public double bodyHeight() {
        return rows.size() * rowHeight;
    }

    public double legendBlockHeight() {
        return legendGutter.height() + legendRowHeight;
    }

    public double canvasWidth() {
        return gutter.getLeft() + titleWidth + columnsWidth() + gutter.getRight();
    }

    public double canvasHeight(boolean withLegend) {
        return gutter.getTop() + bodyHeight() + (withLegend ? legendBlockHeight() : 0.0) + gutter.getBottom();
    }
}
