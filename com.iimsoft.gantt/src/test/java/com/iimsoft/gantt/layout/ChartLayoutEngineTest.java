package com.iimsoft.gantt.layout;

import com.iimsoft.gantt.config.ChartConfig;
import com.iimsoft.gantt.domain.Schedule;
import com.iimsoft.gantt.domain.ScheduleItem;
import com.iimsoft.gantt.log.ChartLog;
import com.iimsoft.gantt.style.ColorAssigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static com.iimsoft.gantt.layout.ScheduleFixtures.at;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Layout of schedules into rows, columns and offsets.
 */
@ExtendWith(MockitoExtension.class)
public class ChartLayoutEngineTest {

    private static final double EPS = 1e-9;

    @Mock
    ChartLog log;

    private ChartLayoutEngine engine;

    @BeforeEach
    public void setUp() {
        engine = new ChartLayoutEngine(ColorAssigner.fixedHue(0.1), log);
    }

    @Test
    @DisplayName("Two task example: weekend end extends the first bar")
    public void testTwoTaskExample() {
        ChartGeometry g = engine.layout(ScheduleFixtures.twoTasks(), ChartConfig.defaults());

        assertEquals(LocalDate.of(2024, 1, 1), g.getStartDate());
        assertEquals(LocalDate.of(2024, 1, 31), g.getEndDate());
        assertEquals(1, g.getColumns().size());
        assertEquals("Jan", g.getColumns().get(0).getLabel());
        assertEquals(80.0, g.getColumns().get(0).getWidth(), EPS);
        assertEquals(31, g.getTotalDays());
        assertEquals(80.0, g.getTotalWidth(), EPS);

        Row a = g.getRows().get(0);
        assertEquals("A", a.getTitle());
        assertEquals(220.0, a.getOffset(), EPS);
        assertEquals(7.0 / 31.0 * 80.0, a.getLength(), EPS);
        assertEquals(0, a.getResourceIndex());
        assertFalse(a.isOpen());

        // B starts where A's shadow ends: Mon 2024-01-08
        Row b = g.getRows().get(1);
        assertEquals(220.0 + 7.0 / 31.0 * 80.0, b.getOffset(), EPS);
        assertEquals(3.0 / 31.0 * 80.0, b.getLength(), EPS);
        assertEquals(1, b.getResourceIndex());
        assertTrue(b.isOpen());

        assertFalse(g.hasMarkedDate());
        verifyNoInteractions(log);
    }

    @Test
    public void testFixedLayoutConstants() {
        ChartGeometry g = engine.layout(ScheduleFixtures.twoTasks(), ChartConfig.defaults());

        assertEquals(30.0, g.getRowHeight(), EPS);
        assertEquals(40.0, g.getLegendRowHeight(), EPS);
        assertEquals(60.0, g.legendBlockHeight(), EPS);
        assertEquals(3.0, g.getCornerRadius(), EPS);
        assertEquals(10.0, g.getGutter().getLeft(), EPS);
        assertEquals(80.0, g.getGutter().getTop(), EPS);
        assertEquals(20.0, g.getGutter().width(), EPS);
        assertEquals(90.0, g.getGutter().height(), EPS);
    }

    @Test
    public void testMonthColumnsAndMilestone() {
        ChartGeometry g = engine.layout(ScheduleFixtures.quarter(), ChartConfig.defaults());

        List<Column> cols = g.getColumns();
        assertEquals(3, cols.size());
        assertEquals("Jan", cols.get(0).getLabel());
        assertEquals("Feb", cols.get(1).getLabel());
        assertEquals("Mar", cols.get(2).getLabel());
        assertEquals(80.0 * 29 / 31, cols.get(1).getWidth(), EPS);

        double w = 80.0 + 80.0 * 29 / 31 + 80.0;
        assertEquals(91, g.getTotalDays());
        assertEquals(w, g.getTotalWidth(), EPS);

        List<Row> rows = g.getRows();
        assertEquals(220.0 + 28.0 / 91 * w, rows.get(0).getOffset(), EPS);
        assertEquals(10.0 / 91 * w, rows.get(0).getLength(), EPS);

        Row built = rows.get(1);
        assertTrue(built.isMilestone());
        assertNull(built.getLength());
        assertEquals(220.0 + 38.0 / 91 * w, built.getOffset(), EPS);
        assertEquals(0, built.getResourceIndex());

        assertEquals(220.0 + 63.0 / 91 * w, rows.get(2).getOffset(), EPS);
        assertEquals(1, rows.get(2).getResourceIndex());

        // inherits Ops, starts after Deploy (Fri 03-08), ends on a Sunday -> 3 days
        assertEquals(220.0 + 67.0 / 91 * w, rows.get(3).getOffset(), EPS);
        assertEquals(3.0 / 91 * w, rows.get(3).getLength(), EPS);
        assertEquals(1, rows.get(3).getResourceIndex());
    }

    @Test
    public void testConfigWidthsAreApplied() {
        ChartGeometry g = engine.layout(ScheduleFixtures.twoTasks(), new ChartConfig(100.0, 62.0, false));

        assertEquals(62.0, g.getTotalWidth(), EPS);
        assertEquals(110.0, g.getRows().get(0).getOffset(), EPS);
        assertEquals(10.0 + 100.0 + 62.0 + 10.0, g.canvasWidth(), EPS);
    }

    @Test
    public void testCanvasSize() {
        ChartGeometry g = engine.layout(ScheduleFixtures.quarter(), ChartConfig.defaults());

        double sum = 0;
        for (Column c : g.getColumns()) {
            sum += c.getWidth();
        }
        assertEquals(g.getGutter().getLeft() + g.getTitleWidth() + sum + g.getGutter().getRight(), g.canvasWidth(), EPS);
        assertEquals(80.0 + 4 * 30.0 + 10.0, g.canvasHeight(false), EPS);
        assertEquals(80.0 + 4 * 30.0 + 60.0 + 10.0, g.canvasHeight(true), EPS);
    }

    @Test
    public void testOffsetsAreMonotonicForSequentialTasks() {
        Schedule schedule = new Schedule("seq", null, List.of("R"), List.of(
                ScheduleItem.task("1", 3).withStartDate(at(2024, 6, 3)).withResource(0),
                ScheduleItem.task("2", 4),
                ScheduleItem.milestone("m"),
                ScheduleItem.task("3", 6),
                ScheduleItem.task("4", 1),
                ScheduleItem.task("5", 12)));

        ChartGeometry g = engine.layout(schedule, ChartConfig.defaults());

        double previous = Double.NEGATIVE_INFINITY;
        for (Row row : g.getRows()) {
            assertTrue(row.getOffset() >= previous, row.getTitle());
            previous = row.getOffset();
            assertEquals(0, row.getResourceIndex());
            if (!row.isMilestone()) {
                assertTrue(row.getLength() > 0);
            }
        }
    }

    @Test
    public void testMarkedDateOffset() {
        ChartGeometry g = engine.layout(ScheduleFixtures.twoTasks(LocalDate.of(2024, 1, 15)), ChartConfig.defaults());

        assertTrue(g.hasMarkedDate());
        assertEquals(220.0 + 14.0 / 31.0 * 80.0, g.getMarkedDateOffset(), EPS);
        verify(log, never()).warning(anyString(), any(Object[].class));
    }

    @Test
    public void testMarkedDateOutsideChartIsReported() {
        ChartGeometry g = engine.layout(ScheduleFixtures.twoTasks(LocalDate.of(2024, 3, 1)), ChartConfig.defaults());

        assertEquals(220.0 + 60.0 / 31.0 * 80.0, g.getMarkedDateOffset(), EPS);
        verify(log).warning(startsWith("Marked date"), any(), any(), any());
    }

    @Test
    public void testRejectsSingleItem() {
        Schedule schedule = new Schedule("one", null, List.of("R"), List.of(
                ScheduleItem.task("only", 2).withStartDate(at(2024, 1, 1)).withResource(0)));

        ScheduleValidationException e = assertThrows(ScheduleValidationException.class,
                () -> engine.layout(schedule, ChartConfig.defaults()));
        assertEquals(ScheduleValidationException.Reason.INSUFFICIENT_INPUT, e.getReason());
        assertEquals(-1, e.getItemIndex());
    }

    @Test
    public void testRejectsEmptySchedule() {
        Schedule schedule = new Schedule("none", null, List.of(), List.of());

        ScheduleValidationException e = assertThrows(ScheduleValidationException.class,
                () -> ChartLayoutEngine.validate(schedule));
        assertEquals(ScheduleValidationException.Reason.INSUFFICIENT_INPUT, e.getReason());
    }

    @Test
    public void testRejectsFirstItemWithoutStartDate() {
        Schedule schedule = new Schedule("no start", null, List.of("R"), List.of(
                ScheduleItem.task("a", 2).withResource(0),
                ScheduleItem.task("b", 2).withStartDate(at(2024, 1, 1))));

        ScheduleValidationException e = assertThrows(ScheduleValidationException.class,
                () -> engine.layout(schedule, ChartConfig.defaults()));
        assertEquals(ScheduleValidationException.Reason.MISSING_ANCHOR, e.getReason());
        assertEquals("First item must contain a start date", e.getMessage());
    }

    @Test
    public void testRejectsFirstItemWithoutResource() {
        Schedule schedule = new Schedule("no resource", null, List.of("R"), List.of(
                ScheduleItem.task("a", 2).withStartDate(at(2024, 1, 1)),
                ScheduleItem.task("b", 2).withResource(0)));

        ScheduleValidationException e = assertThrows(ScheduleValidationException.class,
                () -> engine.layout(schedule, ChartConfig.defaults()));
        assertEquals(ScheduleValidationException.Reason.MISSING_ANCHOR, e.getReason());
        assertEquals(0, e.getItemIndex());
    }

    @Test
    public void testRejectsResourceOutOfRange() {
        Schedule schedule = new Schedule("bad ref", null, List.of("R1", "R2"), List.of(
                ScheduleItem.task("a", 2).withStartDate(at(2024, 1, 1)).withResource(0),
                ScheduleItem.task("b", 2),
                ScheduleItem.task("c", 2).withResource(2)));

        ScheduleValidationException e = assertThrows(ScheduleValidationException.class,
                () -> engine.layout(schedule, ChartConfig.defaults()));
        assertEquals(ScheduleValidationException.Reason.INVALID_REFERENCE, e.getReason());
        assertEquals(2, e.getItemIndex());
    }

    @Test
    public void testRejectsNegativeResource() {
        Schedule schedule = new Schedule("negative", null, List.of("R1"), List.of(
                ScheduleItem.task("a", 2).withStartDate(at(2024, 1, 1)).withResource(0),
                ScheduleItem.task("b", 2).withResource(-1)));

        ScheduleValidationException e = assertThrows(ScheduleValidationException.class,
                () -> engine.layout(schedule, ChartConfig.defaults()));
        assertEquals(ScheduleValidationException.Reason.INVALID_REFERENCE, e.getReason());
    }

    @Test
    public void testRejectsNegativeConfig() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.layout(ScheduleFixtures.twoTasks(), new ChartConfig(-1.0, 80.0, false)));
    }

    @Test
    public void testGeometryIsImmutable() {
        ChartGeometry g = engine.layout(ScheduleFixtures.twoTasks(), ChartConfig.defaults());

        assertThrows(UnsupportedOperationException.class, () -> g.getRows().add(g.getRows().get(0)));
        assertThrows(UnsupportedOperationException.class, () -> g.getColumns().clear());
    }

    @Test
    public void testSameInputSameGeometryRegardlessOfColors() {
        ChartLayoutEngine other = new ChartLayoutEngine(ColorAssigner.fixedHue(0.7), log);

        ChartGeometry g1 = engine.layout(ScheduleFixtures.quarter(), ChartConfig.defaults());
        ChartGeometry g2 = other.layout(ScheduleFixtures.quarter(), ChartConfig.defaults());

        assertEquals(g1.getRows(), g2.getRows());
        assertEquals(g1.getColumns(), g2.getColumns());
        assertNotEquals(g1.getPalette().get(0).getRgb(), g2.getPalette().get(0).getRgb());
    }

    @Test
    @DisplayName("A duration too long to draw is rejected instead of producing NaN geometry")
    public void testRejectsOverlongDuration() {
        // Fri 2024-01-05 + Integer.MAX_VALUE days ends on a Saturday
        Schedule schedule = new Schedule("huge", null, List.of("R"), List.of(
                ScheduleItem.task("huge", Integer.MAX_VALUE).withStartDate(at(2024, 1, 5)).withResource(0),
                ScheduleItem.milestone("m")));

        ScheduleValidationException e = assertThrows(ScheduleValidationException.class,
                () -> engine.layout(schedule, ChartConfig.defaults()));
        assertEquals(ScheduleValidationException.Reason.OUT_OF_RANGE, e.getReason());
        assertEquals(0, e.getItemIndex());
        verifyNoInteractions(log);
    }

    @Test
    public void testRejectsNegativeDuration() {
        Schedule schedule = new Schedule("negative", null, List.of("R"), List.of(
                ScheduleItem.task("a", 2).withStartDate(at(2024, 1, 1)).withResource(0),
                ScheduleItem.task("b", -4)));

        ScheduleValidationException e = assertThrows(ScheduleValidationException.class,
                () -> ChartLayoutEngine.validate(schedule));
        assertEquals(ScheduleValidationException.Reason.OUT_OF_RANGE, e.getReason());
        assertEquals(1, e.getItemIndex());
    }

    @Test
    public void testRejectsChartSpanningTooManyMonths() {
        // each item is within bounds, together they cover about 200 years
        Schedule schedule = new Schedule("long", null, List.of("R"), List.of(
                ScheduleItem.task("a", ChartLayoutEngine.MAX_DURATION_DAYS).withStartDate(at(2024, 1, 1)).withResource(0),
                ScheduleItem.task("b", ChartLayoutEngine.MAX_DURATION_DAYS)));

        ScheduleValidationException e = assertThrows(ScheduleValidationException.class,
                () -> engine.layout(schedule, ChartConfig.defaults()));
        assertEquals(ScheduleValidationException.Reason.OUT_OF_RANGE, e.getReason());
        assertEquals(-1, e.getItemIndex());
    }

    @Test
    public void testLongestDurationStillLaysOut() {
        Schedule schedule = new Schedule("century", null, List.of("R"), List.of(
                ScheduleItem.task("a", ChartLayoutEngine.MAX_DURATION_DAYS).withStartDate(at(2024, 1, 1)).withResource(0),
                ScheduleItem.milestone("done")));

        ChartGeometry g = engine.layout(schedule, ChartConfig.defaults());

        assertTrue(g.getColumns().size() <= ChartLayoutEngine.MAX_SPAN_MONTHS);
        Row a = g.getRows().get(0);
        assertTrue(a.getLength() > 0.0);
        assertFalse(Double.isNaN(g.getRows().get(1).getOffset()));
    }
}
