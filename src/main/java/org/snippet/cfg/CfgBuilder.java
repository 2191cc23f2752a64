package org.snippet.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * 由扁平块列表构建 CFG
 * <p>
 * 边完全由位置相邻关系推出：判断节点连向下一个节点（True）和再下一个节点（False），
 * 其余节点只连向下一个节点。
 * <p>
 * 编号按创建顺序分配：先是所有块节点 0..N-1，然后入口 N、出口 N+1。
 * 入口、出口在节点列表中分别排在最前和最后，所以编号与位置并不一致。
 */
public class CfgBuilder {

    private static final Logger LOGGER = LogManager.getLogger(CfgBuilder.class);

    private int idCounter = 0;

    public ControlFlowGraph build(List<Block> blocks) {
        idCounter = 0;
        ControlFlowGraph graph = new ControlFlowGraph();

        // 1. 块 -> 节点
        for (Block block : blocks) {
            if (block.isDecision()) {
                graph.nodes.add(new CfgNode(nextId(), List.of(block.condition()),
                        NodeType.DECISION, block.condition()));
            } else {
                graph.nodes.add(new CfgNode(nextId(), block.lines(), NodeType.STATEMENT, null));
            }
        }

        // 2. 入口/出口在块节点之后才分配编号，再挪到首尾
        CfgNode entry = new CfgNode(nextId(), List.of(), NodeType.ENTRY, "START");
        CfgNode exit = new CfgNode(nextId(), List.of(), NodeType.EXIT, "EXIT");
        graph.nodes.add(0, entry);
        graph.nodes.add(exit);

        // 3. 相邻连边
        List<CfgNode> nodes = graph.nodes;
        for (int i = 0; i < nodes.size() - 1; i++) {
            CfgNode current = nodes.get(i);
            CfgNode next = nodes.get(i + 1);
            if (current.type == NodeType.DECISION) {
                graph.edges.add(new CfgEdge(current.id, next.id, CfgEdge.TRUE_LABEL, CfgEdge.GREEN));
                if (i + 2 < nodes.size()) {
                    graph.edges.add(new CfgEdge(current.id, nodes.get(i + 2).id,
                            CfgEdge.FALSE_LABEL, CfgEdge.RED));
                }
            } else {
                graph.edges.add(new CfgEdge(current.id, next.id, CfgEdge.PLAIN_LABEL, CfgEdge.GRAY));
            }
        }

        LOGGER.debug("Built CFG with {} node(s) and {} edge(s)", nodes.size(), graph.edges.size());
        return graph;
    }

    private int nextId() {
        return idCounter++;
    }
}
