package org.snippet.cfg;

public interface DiagramRenderer {
    String id();

    String render(ControlFlowGraph graph);
}
