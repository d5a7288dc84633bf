package com.iimsoft.gantt.style;

import java.util.ArrayList;
import java.util.List;

/**
 * Resource index -> {@link ResourceColor}, resolved once per chart.
 */
public final class ResourcePalette {

    private final List<ResourceColor> colors;

    public ResourcePalette(List<ResourceColor> colors) {
        this.colors = List.copyOf(colors);
    }

    public int size() {
        return colors.size();
    }

    public ResourceColor get(int resourceIndex) {
        if (resourceIndex < 0 || resourceIndex >= colors.size()) {
            throw new IndexOutOfBoundsException("No color for resource " + resourceIndex
                    + " (palette size " + colors.size() + ")");
        }
        return colors.get(resourceIndex);
    }

    public ResourceStyle style(int resourceIndex, boolean open) {
        return get(resourceIndex).style(StyleVariant.of(open));
    }

    public List<ResourceColor> getColors() {
        return colors;
    }

    /** 所有资源样式，按 resource 下标，closed 在前 open 在后。 */
    public List<ResourceStyle> allStyles() {
        List<ResourceStyle> out = new ArrayList<>(colors.size() * 2);
        for (ResourceColor c : colors) {
            out.add(c.getClosed());
            out.add(c.getOpen());
        }
        return out;
    }
}
