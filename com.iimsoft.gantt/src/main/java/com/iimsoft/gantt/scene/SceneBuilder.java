package com.iimsoft.gantt.scene;

import com.iimsoft.gantt.layout.ChartGeometry;
import com.iimsoft.gantt.layout.Column;
import com.iimsoft.gantt.layout.Gutter;
import com.iimsoft.gantt.layout.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link ChartGeometry} into a {@link Scene}.
 *
 * Document order: stylesheet, title, columns (grid + month names), "Tasks" heading, rows
 * (grid + labels + bars/milestones), marker (only with a marked date), legend (only when
 * requested).
 */
public class SceneBuilder {

    public static final String GROUP_COLUMNS = "columns";
    public static final String GROUP_ROWS = "rows";
    public static final String GROUP_MARKER = "marker";
    public static final String GROUP_LEGEND = "legend";

    public static final double TITLE_Y = 25.0;
    /** horizontal pitch of the legend entries */
    public static final double LEGEND_COLUMN_WIDTH = 100.0;
    public static final double LEGEND_LABEL_GAP = 5.0;
    /** how far the marker line sticks out above and below the rows */
    public static final double MARKER_OVERHANG = 5.0;
    public static final String TASKS_HEADING = "Tasks";

    public Scene build(ChartGeometry geometry, boolean withLegend) {
        double width = geometry.canvasWidth();
        double height = geometry.canvasHeight(withLegend);

        List<SceneNode> nodes = new ArrayList<>();
        nodes.add(StyleSheet.withResourceStyles(geometry.getPalette().allStyles()));
        nodes.add(new TextNode("title", geometry.getTitle(), geometry.getGutter().getLeft(), TITLE_Y));
        nodes.add(columns(geometry));
        nodes.add(new TextNode("heading task-heading", TASKS_HEADING,
                geometry.getGutter().getLeft() + geometry.getRowGutter().getLeft(), headingY(geometry)));
        nodes.add(rows(geometry, width));
        if (geometry.hasMarkedDate()) {
            nodes.add(marker(geometry));
        }
        if (withLegend) {
            nodes.add(legend(geometry));
        }
        return new Scene(width, height, nodes);
    }

    private static double headingY(ChartGeometry g) {
        return g.getGutter().getTop() - g.getRowGutter().getBottom() - g.getRowHeight() / 2.0;
    }

    private GroupNode columns(ChartGeometry g) {
        List<SceneNode> out = new ArrayList<>();
        List<Column> columns = g.getColumns();
        double top = g.getGutter().getTop();
        double bottom = top + g.bodyHeight();

        double x = g.getGutter().getLeft() + g.getTitleWidth();
        for (int i = 0; i <= columns.size(); i++) {
            out.add(new LineNode("inner-lines", x, top, x, bottom));
            if (i < columns.size()) {
                Column column = columns.get(i);
                out.add(new TextNode("heading", column.getLabel(), x + g.getMaxMonthWidth() / 2.0, headingY(g)));
                x += column.getWidth();
            }
        }
        return new GroupNode(GROUP_COLUMNS, out);
    }

    private GroupNode rows(ChartGeometry g, double canvasWidth) {
        List<SceneNode> out = new ArrayList<>();
        List<Row> rows = g.getRows();
        Gutter gutter = g.getGutter();
        Gutter rowGutter = g.getRowGutter();
        double barHeight = g.getRowHeight() - rowGutter.height();

        for (int i = 0; i <= rows.size(); i++) {
            double y = gutter.getTop() + i * g.getRowHeight();
            String lineClass = (i == 0 || i == rows.size()) ? "outer-lines" : "inner-lines";
            out.add(new LineNode(lineClass, gutter.getLeft(), y, canvasWidth - gutter.getRight(), y));

            if (i == rows.size()) {
                break;
            }
            Row row = rows.get(i);
            out.add(new TextNode("item", row.getTitle(),
                    gutter.getLeft() + rowGutter.getLeft(), y + rowGutter.getTop() + g.getRowHeight() / 2.0));

            if (row.isMilestone()) {
                double n = barHeight / 2.0;
                out.add(new DiamondNode("milestone", row.getOffset(), y + rowGutter.getTop() + n, n));
            } else {
                out.add(new RectNode(g.getPalette().style(row.getResourceIndex(), row.isOpen()),
                        row.getOffset(), y + rowGutter.getTop(), row.getLength(), barHeight, g.getCornerRadius()));
            }
        }
        return new GroupNode(GROUP_ROWS, out);
    }

    private GroupNode marker(ChartGeometry g) {
        double x = g.getMarkedDateOffset();
        double top = g.getGutter().getTop();
        LineNode line = new LineNode("marker", x, top - MARKER_OVERHANG, x, top + g.bodyHeight() + MARKER_OVERHANG);
        return new GroupNode(GROUP_MARKER, List.of(line));
    }

    private GroupNode legend(ChartGeometry g) {
        List<SceneNode> out = new ArrayList<>();
        Gutter legendGutter = g.getLegendGutter();
        double y = g.getGutter().getTop() + g.bodyHeight();
        double swatch = g.getLegendRowHeight() - legendGutter.height();

        List<String> resources = g.getResources();
        for (int i = 0; i < resources.size(); i++) {
            double x = legendGutter.getLeft() + (i + 1) * LEGEND_COLUMN_WIDTH;
            out.add(new TextNode("resource", resources.get(i), x - LEGEND_LABEL_GAP, y + g.getLegendRowHeight() / 2.0));
            out.add(new RectNode(g.getPalette().get(i).getClosed(),
                    x + LEGEND_LABEL_GAP, y + legendGutter.getTop(), swatch, swatch, g.getCornerRadius()));
        }
        return new GroupNode(GROUP_LEGEND, out);
    }
}
