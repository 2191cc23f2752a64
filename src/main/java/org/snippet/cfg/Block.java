package org.snippet.cfg;

import java.util.List;
import java.util.Objects;

/**
 * 扁平化后的基本块（中间表示）
 * <p>
 * STATEMENT 块只有 lines；DECISION 块只有 condition，lines 为空。
 * 块列表中的先后顺序决定了后面 CFG 边的连接方式。
 */
public record Block(BlockKind kind, List<String> lines, String condition) {

    public Block {
        Objects.requireNonNull(kind, "kind");
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static Block statement(String... lines) {
        return new Block(BlockKind.STATEMENT, List.of(lines), null);
    }

    public static Block decision(String condition) {
        Objects.requireNonNull(condition, "condition");
        return new Block(BlockKind.DECISION, List.of(), condition);
    }

    public boolean isDecision() {
        return kind == BlockKind.DECISION;
    }
}
