package org.snippet.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 片段处理器：把一个片段开头的 if / else if / else 链展开成扁平的块序列
 * <p>
 * 没有语法树，只依靠关键字位置和括号配对：
 * <ul>
 *     <li>每个 if / else if 条件生成一个 DECISION 块；</li>
 *     <li>各分支体（带花括号或不带）交回 {@link FragmentTokenizer} 递归处理，结果按源码顺序插在后面；</li>
 *     <li>链尾无法识别的文本直接忽略，不报错。</li>
 * </ul>
 * 花括号不配平时由 {@link BraceMatcher} 抛出 {@link MalformedSourceException}。
 * <p>
 * 条件按括号深度取到配对的 ')'，{@code if (f(x) > 0)} 得到 {@code f(x) > 0}。
 * 早期按行解析的版本只取到第一个 ')'（得到 {@code f(x}），两者只在条件内含括号时不同。
 */
public class FragmentProcessor {

    private static final Logger LOGGER = LogManager.getLogger(FragmentProcessor.class);

    private static final Pattern IF_HEADER = Pattern.compile("^if\\s*\\(");
    private static final Pattern ELSE_IF_HEADER = Pattern.compile("^else\\s+if\\s*\\(");
    private static final Pattern ELSE_KEYWORD = Pattern.compile("^else\\b");
    private static final Pattern ELSE_ANYWHERE = Pattern.compile("\\belse\\b");

    /**
     * 分解一个片段
     *
     * @param fragment 已去掉首尾空白的片段
     * @return 按源码顺序排列的 DECISION / STATEMENT 块
     */
    public static List<Block> process(String fragment) {
        return process(fragment, 0);
    }

    static List<Block> process(String fragment, int depth) {
        List<Block> blocks = new ArrayList<>();
        String text = fragment == null ? "" : fragment.trim();
        if (text.isEmpty()) {
            return blocks;
        }

        // 1. 开头不是 if (...)：整个片段就是一条语句
        Header header = matchHeader(text, IF_HEADER);
        if (header == null) {
            blocks.add(Block.statement(text));
            return blocks;
        }

        // 2. if 条件 + 真分支
        blocks.add(Block.decision(header.condition()));
        String rest = takeBody(header.rest(), blocks, true, depth);

        // 3. else if / else 链
        while (!rest.isEmpty()) {
            Header elseIf = matchHeader(rest, ELSE_IF_HEADER);
            if (elseIf != null) {
                blocks.add(Block.decision(elseIf.condition()));
                rest = takeBody(elseIf.rest(), blocks, true, depth);
                continue;
            }

            Matcher elseMatcher = ELSE_KEYWORD.matcher(rest);
            if (elseMatcher.find()) {
                // else 结束整条链，块体之后的内容不再处理
                takeBody(rest.substring(elseMatcher.end()).trim(), blocks, false, depth);
                break;
            }

            LOGGER.debug("Dropping unrecognized text after branch chain: [{}]", rest);
            break;
        }

        return blocks;
    }

    static boolean startsWithIf(String text) {
        return matchHeader(text, IF_HEADER) != null;
    }

    /**
     * 处理一个分支体，把产生的块追加到 blocks
     *
     * @param stopAtElse 不带花括号时，是否在第一个 else 关键字处截断
     * @param depth      当前片段所在的嵌套层数，分支体在 depth + 1 层处理
     * @return 分支体之后剩余的文本
     */
    private static String takeBody(String rest, List<Block> blocks, boolean stopAtElse, int depth) {
        if (rest.startsWith("{")) {
            int close = BraceMatcher.findClosing(rest);
            blocks.addAll(FragmentTokenizer.tokenize(rest.substring(1, close), depth + 1));
            return rest.substring(close + 1).trim();
        }

        if (stopAtElse) {
            Matcher m = ELSE_ANYWHERE.matcher(rest);
            if (m.find()) {
                blocks.addAll(FragmentTokenizer.tokenize(rest.substring(0, m.start()), depth + 1));
                return rest.substring(m.start()).trim();
            }
        }

        blocks.addAll(FragmentTokenizer.tokenize(rest, depth + 1));
        return "";
    }

    /**
     * 匹配 "关键字 (条件)"，条件用括号深度找到配对的 ')'
     *
     * @return 括号不配平或关键字不匹配时返回 null
     */
    private static Header matchHeader(String text, Pattern keyword) {
        Matcher m = keyword.matcher(text);
        if (!m.find()) {
            return null;
        }

        int open = m.end() - 1;
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    String condition = text.substring(open + 1, i).trim();
                    return new Header(condition, text.substring(i + 1).trim());
                }
            }
        }
        return null;
    }

    private record Header(String condition, String rest) {
    }
}
