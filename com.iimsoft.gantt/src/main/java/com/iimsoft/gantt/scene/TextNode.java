package com.iimsoft.gantt.scene;

import lombok.Value;

@Value
public class TextNode implements SceneNode {
    String styleClass;
    String text;
    double x;
    double y;

    @Override
    public <R> R accept(SceneVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
