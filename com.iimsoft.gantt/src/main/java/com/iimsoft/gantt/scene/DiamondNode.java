package com.iimsoft.gantt.scene;

import lombok.Value;

/**
 * Milestone marker: a square rotated by 45 degrees, centred on ({@code centerX}, {@code centerY}).
 * {@code halfWidth} is the distance from the centre to each corner.
 */
@Value
public class DiamondNode implements SceneNode {
    String styleClass;
    double centerX;
    double centerY;
    double halfWidth;

    public double getLeft() {
        return centerX - halfWidth;
    }

    @Override
    public <R> R accept(SceneVisitor<R> visitor) {
        return visitor.visitDiamond(this);
    }
}
