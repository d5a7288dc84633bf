package com.iimsoft.gantt.scene;

/**
 * A drawing primitive of the chart scene.
 */
public interface SceneNode {

    /** space separated style classes, may be empty */
    String getStyleClass();

    <R> R accept(SceneVisitor<R> visitor);
}
