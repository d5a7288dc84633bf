package com.iimsoft.gantt.style;

import lombok.Value;

@Value
public class ResourceColor {
    int resourceIndex;
    double hue;
    int rgb;
    ResourceStyle closed;
    ResourceStyle open;

    public ResourceColor(int resourceIndex, double hue, int rgb) {
        this.resourceIndex = resourceIndex;
        this.hue = hue;
        this.rgb = rgb;
        this.closed = new ResourceStyle(resourceIndex, StyleVariant.CLOSED, rgb);
        this.open = new ResourceStyle(resourceIndex, StyleVariant.OPEN, rgb);
    }

    public ResourceStyle style(StyleVariant variant) {
        return variant == StyleVariant.OPEN ? open : closed;
    }
}
