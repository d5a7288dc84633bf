package com.iimsoft.gantt.scene;

import lombok.Value;

@Value
public class LineNode implements SceneNode {
    String styleClass;
    double x1;
    double y1;
    double x2;
    double y2;

    @Override
    public <R> R accept(SceneVisitor<R> visitor) {
        return visitor.visitLine(this);
    }
}
