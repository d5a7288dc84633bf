package com.iimsoft.gantt.scene;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the drawing tree: canvas size plus top level nodes in document order.
 */
@Value
public class Scene {
    double width;
    double height;
    List<SceneNode> children;

    public Scene(double width, double height, List<SceneNode> children) {
        this.width = width;
        this.height = height;
        this.children = List.copyOf(children);
    }

    public GroupNode group(String name) {
        for (SceneNode n : children) {
            if (n instanceof GroupNode && ((GroupNode) n).getName().equals(name)) {
                return (GroupNode) n;
            }
        }
        return null;
    }

    public boolean hasGroup(String name) {
        return group(name) != null;
    }

    /** All leaf nodes of the given type, depth first. */
    public <T extends SceneNode> List<T> collect(Class<T> type) {
        List<T> out = new ArrayList<>();
        collect(children, type, out);
        return out;
    }

    private static <T extends SceneNode> void collect(List<SceneNode> nodes, Class<T> type, List<T> out) {
        for (SceneNode n : nodes) {
            if (type.isInstance(n)) {
                out.add(type.cast(n));
            }
            if (n instanceof GroupNode) {
                collect(((GroupNode) n).getChildren(), type, out);
            }
        }
    }
}
