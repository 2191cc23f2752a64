package org.snippet.cfg;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MermaidGraphRendererTest {

    private final MermaidGraphRenderer renderer = new MermaidGraphRenderer();

    @Test
    void testIfElseFlowchart() {
        ControlFlowGraph cfg = new CfgGenerator().generateCfg("if (x > 0) { y = 1; } else { y = \"neg\"; }");
        String text = renderer.render(cfg);

        assertTrue(text.startsWith("flowchart TD\n"));
        assertTrue(text.contains("  n3([\"START\"])\n"));
        assertTrue(text.contains("  n4([\"EXIT\"])\n"));
        assertTrue(text.contains("  n0{\"x #gt; 0\"}\n"));
        assertTrue(text.contains("  n2[\"y = #quot;neg#quot; ;\"]\n"));

        assertTrue(text.contains("  n3 --> n0\n"));
        assertTrue(text.contains("  n0 -->|True| n1\n"));
        assertTrue(text.contains("  n0 -->|False| n2\n"));
        assertTrue(text.contains("  linkStyle 1 stroke:#22c55e;\n"));
        assertTrue(text.contains("  linkStyle 2 stroke:#ef4444;\n"));
        assertTrue(text.contains("  class n3,n4 startEnd;\n"));
    }

    @Test
    void testId() {
        assertEquals("mermaid", renderer.id());
    }
}
