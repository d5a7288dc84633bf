package com.iimsoft.gantt.style;

/**
 * CLOSED：实心填充（已完成/已关闭的任务）；OPEN：仅描边（进行中的任务）。
 */
public enum StyleVariant {
    CLOSED("closed", true, 1),
    OPEN("open", false, 2);

    private final String suffix;
    private final boolean filled;
    private final int strokeWidth;

    StyleVariant(String suffix, boolean filled, int strokeWidth) {
        this.suffix = suffix;
        this.filled = filled;
        this.strokeWidth = strokeWidth;
    }

    public String getSuffix() {
        return suffix;
    }

    public boolean isFilled() {
        return filled;
    }

    public int getStrokeWidth() {
        return strokeWidth;
    }

    public static StyleVariant of(boolean open) {
        return open ? OPEN : CLOSED;
    }
}
