package com.iimsoft.gantt.scene;

public interface SceneVisitor<R> {

    R visitStyleSheet(StyleSheet styleSheet);

    R visitGroup(GroupNode group);

    R visitLine(LineNode line);

    R visitRect(RectNode rect);

    R visitDiamond(DiamondNode diamond);

    R visitText(TextNode text);
}
