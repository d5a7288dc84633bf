package com.iimsoft.gantt.layout;

import lombok.Value;

/**
 * Margins around a layout region.
 */
@Value
public class Gutter {
    double left;
    double top;
    double right;
    double bottom;

    public static Gutter uniform(double size) {
        return new Gutter(size, size, size, size);
    }

    public double width() {
        return left + right;
    }

    public double height() {
        return top + bottom;
    }
}
