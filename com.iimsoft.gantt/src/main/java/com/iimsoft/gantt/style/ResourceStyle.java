package com.iimsoft.gantt.style;

import lombok.Value;

/**
 * Style descriptor for the bars of one resource in one variant. Scene nodes reference the
 * descriptor itself; the CSS class name is only produced when the stylesheet is written.
 */
@Value
public class ResourceStyle {
    int resourceIndex;
    StyleVariant variant;
    int rgb;

    public String getClassName() {
        return "resource-" + resourceIndex + "-" + variant.getSuffix();
    }

    public String getFill() {
        return variant.isFilled() ? hex(rgb) : "none";
    }

    public String getStroke() {
        return hex(rgb);
    }

    public int getStrokeWidth() {
        return variant.getStrokeWidth();
    }

    public String toCss() {
        return "." + getClassName() + "{fill:" + getFill() + ";stroke-width:" + getStrokeWidth()
                + ";stroke:" + getStroke() + ";}";
    }

    static String hex(int rgb) {
        return String.format("#%06x", rgb & 0xFFFFFF);
    }
}
