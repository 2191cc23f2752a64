package org.snippet.cfg;

import java.util.List;

/**
 * CFG 中的一个节点（入口、出口、语句块或判断）
 */
public class CfgNode {
    public final int id;              // 本次生成内按创建顺序分配的编号
    public final List<String> lines;  // 语句文本；判断节点为 [条件]
    public final NodeType type;
    public final String label;        // 入口 "START"、出口 "EXIT"、判断节点为条件，语句块为 null

    public CfgNode(int id, List<String> lines, NodeType type, String label) {
        this.id = id;
        this.lines = List.copyOf(lines);
        this.type = type;
        this.label = label;
    }

    @Override
    public String toString() {
        return "CfgNode{" + id + ", " + type + ", " + lines + "}";
    }
}
