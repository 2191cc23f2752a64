package org.snippet.cfg;

import java.util.stream.Collectors;

/**
 * 输出 Mermaid flowchart 文本，可直接贴到支持 Mermaid 的页面里查看
 * <p>
 * 入口/出口用圆角框，判断用菱形，语句块用矩形；边颜色通过 linkStyle 设置，
 * linkStyle 的序号就是边在 edges 中的下标。
 */
public class MermaidGraphRenderer implements DiagramRenderer {

    @Override
    public String id() {
        return "mermaid";
    }

    @Override
    public String render(ControlFlowGraph graph) {
        StringBuilder builder = new StringBuilder();
        builder.append("flowchart TD").append("\n");

        for (CfgNode node : graph.nodes) {
            builder.append("  ").append(nodeId(node)).append(nodeShape(node)).append("\n");
        }

        builder.append("\n");
        for (CfgEdge edge : graph.edges) {
            builder.append("  ").append("n").append(edge.fromNode);
            if (edge.label.isEmpty()) {
                builder.append(" --> ");
            } else {
                builder.append(" -->|").append(edge.label).append("| ");
            }
            builder.append("n").append(edge.toNode).append("\n");
        }

        for (int i = 0; i < graph.edges.size(); i++) {
            builder.append("  linkStyle ").append(i)
                    .append(" stroke:").append(graph.edges.get(i).color).append(";\n");
        }

        if (!graph.nodes.isEmpty()) {
            builder.append("\n");
            builder.append("  classDef startEnd fill:#f9f;\n");
            builder.append("  class ").append(nodeId(graph.entry())).append(",")
                    .append(nodeId(graph.exit())).append(" startEnd;\n");
        }
        return builder.toString();
    }

    private String nodeId(CfgNode node) {
        return "n" + node.id;
    }

    private String nodeShape(CfgNode node) {
        return switch (node.type) {
            case ENTRY, EXIT -> "([\"" + escape(node.label) + "\"])";
            case DECISION -> "{\"" + escape(node.label) + "\"}";
            case STATEMENT -> "[\"" + node.lines.stream()
                    .map(this::escape)
                    .collect(Collectors.joining("<br/>")) + "\"]";
        };
    }

    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "#quot;")
                .replace("<", "#lt;")
                .replace(">", "#gt;");
    }
}
