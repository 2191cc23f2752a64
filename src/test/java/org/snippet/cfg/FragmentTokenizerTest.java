package org.snippet.cfg;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FragmentTokenizerTest {

    @Test
    void testStatementsSplitOnSemicolon() {
        List<Block> blocks = FragmentTokenizer.tokenize("int a = 1; int b = 2;");

        assertEquals(List.of(Block.statement("int a = 1 ;"), Block.statement("int b = 2 ;")), blocks);
    }

    @Test
    void testTrailingTextWithoutSemicolonIsFlushed() {
        List<Block> blocks = FragmentTokenizer.tokenize("a = 1; return a");

        assertEquals(2, blocks.size());
        assertEquals(List.of("return a"), blocks.get(1).lines());
    }

    @Test
    void testTopLevelBracesOnlyFlush() {
        List<Block> blocks = FragmentTokenizer.tokenize("int main() { int a = 1; }");

        assertEquals(List.of(Block.statement("int main()"), Block.statement("int a = 1 ;")), blocks);
    }

    @Test
    void testIfElseChainKeptTogether() {
        List<Block> blocks = FragmentTokenizer.tokenize("if (x > 0) { y = 1; } else { y = -1; } z = 0;");

        assertEquals(List.of(
                Block.decision("x > 0"),
                Block.statement("y = 1 ;"),
                Block.statement("y = -1 ;"),
                Block.statement("z = 0 ;")), blocks);
    }

    @Test
    void testUnbracedChainKeptTogether() {
        List<Block> blocks = FragmentTokenizer.tokenize("if (a) x = 1; else x = 2; done();");

        assertEquals(List.of(
                Block.decision("a"),
                Block.statement("x = 1 ;"),
                Block.statement("x = 2 ;"),
                Block.statement("done() ;")), blocks);
    }

    @Test
    void testIfWithoutElseEndsAtBody() {
        List<Block> blocks = FragmentTokenizer.tokenize("if (a) { x = 1; } y = 2;");

        assertEquals(List.of(
                Block.decision("a"),
                Block.statement("x = 1 ;"),
                Block.statement("y = 2 ;")), blocks);
    }

    @Test
    void testUnbalancedIfBodyFails() {
        assertThrows(MalformedSourceException.class, () -> FragmentTokenizer.tokenize("if (x) { y = 1;"));
    }

    @Test
    void testEmptyInput() {
        assertTrue(FragmentTokenizer.tokenize("").isEmpty());
        assertEquals(List.of(Block.statement(";")), FragmentTokenizer.tokenize(" ; "));
    }

    @Test
    void testNestingUpToLimit() {
        List<Block> blocks = FragmentTokenizer.tokenize(nestedIfs(FragmentTokenizer.MAX_NESTING));

        assertEquals(FragmentTokenizer.MAX_NESTING + 1, blocks.size());
        assertEquals(Block.statement("x = 1 ;"), blocks.get(blocks.size() - 1));
    }

    @Test
    void testNestingBeyondLimitFails() {
        MalformedSourceException e = assertThrows(MalformedSourceException.class,
                () -> FragmentTokenizer.tokenize(nestedIfs(FragmentTokenizer.MAX_NESTING + 1)));
        assertTrue(e.getMessage().contains("Nesting too deep"));
    }

    @Test
    void testLongFlatInput() {
        StringBuilder code = new StringBuilder();
        for (int i = 0; i < 5000; i++) {
            code.append("a").append(i).append(" = ").append(i).append("; ");
            if (i % 10 == 0) {
                code.append("if (a").append(i).append(") { b = 1; } else { b = 2; } ");
            }
        }
        List<Block> blocks = FragmentTokenizer.tokenize(code.toString().trim());

        assertEquals(5000 + 500 * 3, blocks.size());
        // a0..a9 十条语句 + a0 后面的 if 链三个块，之后是 a10 语句和 a10 判断
        assertEquals(Block.decision("a0"), blocks.get(1));
        assertEquals(Block.statement("a10 = 10 ;"), blocks.get(13));
        assertEquals(Block.decision("a10"), blocks.get(14));
    }

    static String nestedIfs(int levels) {
        StringBuilder code = new StringBuilder();
        for (int i = 0; i < levels; i++) {
            code.append("if (a) { ");
        }
        code.append("x = 1; ");
        for (int i = 0; i < levels; i++) {
            code.append("} ");
        }
        return code.toString().trim();
    }
}
