package com.iimsoft.gantt.scene;

import com.iimsoft.gantt.style.ResourceStyle;
import lombok.Value;

/**
 * Rounded rectangle drawn in a resource style (task bars and legend swatches).
 */
@Value
public class RectNode implements SceneNode {
    ResourceStyle style;
    double x;
    double y;
    double width;
    double height;
    double cornerRadius;

    @Override
    public String getStyleClass() {
        return style.getClassName();
    }

    @Override
    public <R> R accept(SceneVisitor<R> visitor) {
        return visitor.visitRect(this);
    }
}
