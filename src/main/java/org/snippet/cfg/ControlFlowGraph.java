package org.snippet.cfg;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次生成的结果：节点（入口在前、出口在后）+ 边
 */
public class ControlFlowGraph {
    public List<CfgNode> nodes = new ArrayList<>();
    public List<CfgEdge> edges = new ArrayList<>();

    public CfgNode entry() {
        return nodes.get(0);
    }

    public CfgNode exit() {
        return nodes.get(nodes.size() - 1);
    }
}
