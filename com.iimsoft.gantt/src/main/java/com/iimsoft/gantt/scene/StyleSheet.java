package com.iimsoft.gantt.scene;

import com.iimsoft.gantt.style.ResourceStyle;
import java.util.ArrayList;
import java.util.List;

/**
 * All style classes used by a scene: fixed base rules followed by the resource styles.
 */
public final class StyleSheet implements SceneNode {

    public static final List<String> BASE_RULES = List.of(
            ".outer-lines{stroke-width:3;stroke:#aaaaaa;}",
            ".inner-lines{stroke-width:2;stroke:#dddddd;}",
            ".item{font-family:Arial;font-size:12pt;dominant-baseline:middle;}",
            ".resource{font-family:Arial;font-size:12pt;text-anchor:end;dominant-baseline:middle;}",
            ".title{font-family:Arial;font-size:18pt;}",
            ".heading{font-family:Arial;font-size:16pt;dominant-baseline:middle;text-anchor:middle;}",
            ".task-heading{dominant-baseline:middle;text-anchor:start;}",
            ".milestone{fill:black;stroke-width:1;stroke:black;}",
            ".marker{stroke-width:2;stroke:#888888;stroke-dasharray:7;}");

    private final List<String> baseRules;
    private final List<ResourceStyle> resourceStyles;

    public StyleSheet(List<String> baseRules, List<ResourceStyle> resourceStyles) {
        this.baseRules = List.copyOf(baseRules);
        this.resourceStyles = List.copyOf(resourceStyles);
    }

    public static StyleSheet withResourceStyles(List<ResourceStyle> resourceStyles) {
        return new StyleSheet(BASE_RULES, resourceStyles);
    }

    public List<String> rules() {
        List<String> rules = new ArrayList<>(baseRules);
        for (ResourceStyle s : resourceStyles) {
            rules.add(s.toCss());
        }
        return rules;
    }

    public String toCss() {
        return String.join("\n", rules());
    }

    @Override
    public String getStyleClass() {
        return "";
    }

    @Override
    public <R> R accept(SceneVisitor<R> visitor) {
        return visitor.visitStyleSheet(this);
    }
}
