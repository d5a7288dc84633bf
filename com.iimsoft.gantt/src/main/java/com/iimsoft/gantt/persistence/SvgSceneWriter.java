package com.iimsoft.gantt.persistence;

import com.iimsoft.gantt.scene.DiamondNode;
import com.iimsoft.gantt.scene.GroupNode;
import com.iimsoft.gantt.scene.LineNode;
import com.iimsoft.gantt.scene.RectNode;
import com.iimsoft.gantt.scene.Scene;
import com.iimsoft.gantt.scene.SceneNode;
import com.iimsoft.gantt.scene.SceneVisitor;
import com.iimsoft.gantt.scene.StyleSheet;
import com.iimsoft.gantt.scene.TextNode;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Serializes a {@link Scene} as an SVG document.
 */
public class SvgSceneWriter {

    public static final String SVG_NAMESPACE = "http://www.w3.org/2000/svg";

    public void write(Scene scene, Writer writer) throws IOException {
        writer.write(toSvg(scene));
        writer.flush();
    }

    public String toSvg(Scene scene) {
        StringBuilder sb = new StringBuilder();
        String w = num(scene.getWidth());
        String h = num(scene.getHeight());
        sb.append("<svg viewBox=\"0 0 ").append(w).append(' ').append(h).append('"')
                .append(" xmlns=\"").append(SVG_NAMESPACE).append('"')
                .append(" width=\"").append(w).append('"')
                .append(" height=\"").append(h).append('"')
                .append(" style=\"background-color: white;\">\n");
        ElementWriter elements = new ElementWriter(sb);
        for (SceneNode node : scene.getChildren()) {
            node.accept(elements);
        }
        sb.append("</svg>\n");
        return sb.toString();
    }

    /** At most three decimals, no trailing zeros. */
    static String num(double value) {
        BigDecimal bd = BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).stripTrailingZeros();
        if (bd.signum() == 0) {
            return "0";
        }
        return bd.toPlainString();
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '&': sb.append("&amp;"); break;
                case '"': sb.append("&quot;"); break;
                case '\'': sb.append("&apos;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    private static final class ElementWriter implements SceneVisitor<Void> {
        private final StringBuilder sb;
        private int depth = 1;

        ElementWriter(StringBuilder sb) {
            this.sb = sb;
        }

        private StringBuilder indent() {
            for (int i = 0; i < depth; i++) {
                sb.append("  ");
            }
            return sb;
        }

        private StringBuilder attr(String name, String value) {
            return sb.append(' ').append(name).append("=\"").append(escape(value)).append('"');
        }

        private StringBuilder attr(String name, double value) {
            return sb.append(' ').append(name).append("=\"").append(num(value)).append('"');
        }

        @Override
        public Void visitStyleSheet(StyleSheet styleSheet) {
            indent().append("<style>\n");
            // CSS 中不会出现 ]]>，直接放进 CDATA
            sb.append("<![CDATA[\n").append(styleSheet.toCss()).append("\n]]>\n");
            indent().append("</style>\n");
            return null;
        }

        @Override
        public Void visitGroup(GroupNode group) {
            indent().append("<g");
            attr("id", group.getName());
            if (group.getChildren().isEmpty()) {
                sb.append("/>\n");
                return null;
            }
            sb.append(">\n");
            depth++;
            for (SceneNode child : group.getChildren()) {
                child.accept(this);
            }
            depth--;
            indent().append("</g>\n");
            return null;
        }

        @Override
        public Void visitLine(LineNode line) {
            indent().append("<line");
            attr("class", line.getStyleClass());
            attr("x1", line.getX1());
            attr("y1", line.getY1());
            attr("x2", line.getX2());
            attr("y2", line.getY2());
            sb.append("/>\n");
            return null;
        }

        @Override
        public Void visitRect(RectNode rect) {
            indent().append("<rect");
            attr("class", rect.getStyleClass());
            attr("x", rect.getX());
            attr("y", rect.getY());
            attr("rx", rect.getCornerRadius());
            attr("ry", rect.getCornerRadius());
            attr("width", rect.getWidth());
            attr("height", rect.getHeight());
            sb.append("/>\n");
            return null;
        }

        @Override
        public Void visitDiamond(DiamondNode d) {
            String n = num(d.getHalfWidth());
            String path = "M" + num(d.getLeft()) + "," + num(d.getCenterY())
                    + " l" + n + ",-" + n
                    + " l" + n + "," + n
                    + " l-" + n + "," + n
                    + " l-" + n + ",-" + n
                    + " z";
            indent().append("<path");
            attr("class", d.getStyleClass());
            attr("d", path);
            sb.append("/>\n");
            return null;
        }

        @Override
        public Void visitText(TextNode text) {
            indent().append("<text");
            attr("class", text.getStyleClass());
            attr("x", text.getX());
            attr("y", text.getY());
            sb.append('>').append(escape(text.getText())).append("</text>\n");
            return null;
        }
    }
}
