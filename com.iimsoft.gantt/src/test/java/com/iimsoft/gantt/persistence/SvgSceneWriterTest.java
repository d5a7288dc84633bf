package com.iimsoft.gantt.persistence;

import com.iimsoft.gantt.config.ChartConfig;
import com.iimsoft.gantt.layout.ChartGeometry;
import com.iimsoft.gantt.layout.ChartLayoutEngine;
import com.iimsoft.gantt.layout.ScheduleFixtures;
import com.iimsoft.gantt.log.ChartLog;
import com.iimsoft.gantt.scene.DiamondNode;
import com.iimsoft.gantt.scene.GroupNode;
import com.iimsoft.gantt.scene.Scene;
import com.iimsoft.gantt.scene.SceneBuilder;
import com.iimsoft.gantt.scene.StyleSheet;
import com.iimsoft.gantt.scene.TextNode;
import com.iimsoft.gantt.style.ColorAssigner;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class SvgSceneWriterTest {

    private final SvgSceneWriter writer = new SvgSceneWriter();

    @Test
    public void testNumberFormat() {
        assertEquals("80", SvgSceneWriter.num(80.0));
        assertEquals("0", SvgSceneWriter.num(0.0));
        assertEquals("0", SvgSceneWriter.num(-0.0));
        assertEquals("-2.5", SvgSceneWriter.num(-2.5));
        assertEquals("18.065", SvgSceneWriter.num(7.0 / 31 * 80));
        assertEquals("1200", SvgSceneWriter.num(1200.0));
    }

    @Test
    public void testEscape() {
        assertEquals("R&amp;D &lt;core&gt; &quot;x&quot; &apos;y&apos;", SvgSceneWriter.escape("R&D <core> \"x\" 'y'"));
    }

    @Test
    public void testDocumentHeaderAndOrder() {
        ChartLayoutEngine engine = new ChartLayoutEngine(ColorAssigner.fixedHue(0.0), mock(ChartLog.class));
        ChartGeometry g = engine.layout(ScheduleFixtures.twoTasks(), ChartConfig.defaults());
        Scene scene = new SceneBuilder().build(g, true);

        String svg = writer.toSvg(scene);

        assertTrue(svg.startsWith("<svg viewBox=\"0 0 310 210\""), svg);
        assertTrue(svg.contains("xmlns=\"http://www.w3.org/2000/svg\""));
        assertTrue(svg.contains("width=\"310\" height=\"210\""));
        assertTrue(svg.contains(".resource-0-closed{fill:#804040;stroke-width:1;stroke:#804040;}"));
        assertTrue(svg.contains("<rect class=\"resource-0-closed\" x=\"220\" y=\"85\" rx=\"3\" ry=\"3\" width=\"18.065\" height=\"20\"/>"));
        assertTrue(svg.trim().endsWith("</svg>"));

        int style = svg.indexOf("<style>");
        int title = svg.indexOf(">Two tasks</text>");
        int columns = svg.indexOf("<g id=\"columns\">");
        int rows = svg.indexOf("<g id=\"rows\">");
        int legend = svg.indexOf("<g id=\"legend\">");
        assertTrue(style >= 0 && style < title && title < columns && columns < rows && rows < legend, svg);
        assertFalse(svg.contains("id=\"marker\""));
    }

    @Test
    public void testDiamondPathAndEscapedText() {
        Scene scene = new Scene(100, 50, List.of(
                StyleSheet.withResourceStyles(List.of()),
                new TextNode("title", "R&D <core>", 10, 25),
                new GroupNode("rows", List.of(new DiamondNode("milestone", 60, 40, 10)))));

        String svg = writer.toSvg(scene);

        assertTrue(svg.contains(">R&amp;D &lt;core&gt;</text>"), svg);
        assertTrue(svg.contains("<path class=\"milestone\" d=\"M50,40 l10,-10 l10,10 l-10,10 l-10,-10 z\"/>"), svg);
    }

    @Test
    public void testEmptyGroupIsSelfClosing() throws IOException {
        Scene scene = new Scene(10, 10, List.of(new GroupNode("legend", List.of())));

        StringWriter out = new StringWriter();
        writer.write(scene, out);

        assertTrue(out.toString().contains("<g id=\"legend\"/>"));
    }
}
