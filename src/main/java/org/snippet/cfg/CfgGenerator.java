package org.snippet.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * C 风格代码片段 -> CFG
 * <p>
 * 流程：规范化 -> 切分片段 -> 递归展开 if 链得到块列表 -> 构建节点和边。
 * 每次调用的状态都是局部的，可以并发调用。
 */
public class CfgGenerator {

    private static final Logger LOGGER = LogManager.getLogger(CfgGenerator.class);

    /**
     * 生成控制流图
     *
     * @param source 原始源码文本
     * @return 节点和边
     * @throws MalformedSourceException 花括号不配平，此时不返回任何部分结果
     */
    public ControlFlowGraph generateCfg(String source) {
        List<Block> blocks = parse(source);
        ControlFlowGraph graph = new CfgBuilder().build(blocks);
        LOGGER.debug("Generated CFG: {} block(s), {} edge(s)", blocks.size(), graph.edges.size());
        return graph;
    }

    /**
     * 只做解析，返回中间表示（块列表）
     */
    public List<Block> parse(String source) {
        String normalized = SourceNormalizer.normalize(source);
        return FragmentTokenizer.tokenize(normalized);
    }
}
