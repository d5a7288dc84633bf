package com.iimsoft.gantt.scene;

import lombok.Value;

import java.util.List;

/**
 * Named container of primitives, kept in drawing order.
 */
@Value
public class GroupNode implements SceneNode {
    String name;
    List<SceneNode> children;

    public GroupNode(String name, List<SceneNode> children) {
        this.name = name;
        this.children = List.copyOf(children);
    }

    @Override
    public String getStyleClass() {
        return "";
    }

    @Override
    public <R> R accept(SceneVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
