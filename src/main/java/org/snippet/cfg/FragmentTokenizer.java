package org.snippet.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 按 '{' '}' ';' 切分规范化后的源码，把累积的片段交给 {@link FragmentProcessor}
 * <p>
 * 顶层的花括号只起"刷新缓冲区"的作用。唯一的例外是 if 链：缓冲区里已经有
 * {@code if (...)} 头部时，遇到的 '{' 连同整个配平的块体一起并入缓冲区，
 * 紧跟其后的 else / else if 也继续累积，整条链作为一个片段交给处理器递归分解。
 * <p>
 * 分支体每嵌套一层，递归深度加一；超过 {@link #MAX_NESTING} 层直接拒绝。
 */
public class FragmentTokenizer {

    private static final Logger LOGGER = LogManager.getLogger(FragmentTokenizer.class);

    static final int MAX_NESTING = 256;

    private static final Pattern ELSE_AHEAD = Pattern.compile("\\s*else\\b");

    public static List<Block> tokenize(String source) {
        return tokenize(source, 0);
    }

    static List<Block> tokenize(String source, int depth) {
        if (depth > MAX_NESTING) {
            throw new MalformedSourceException(
                    "Nesting too deep: more than " + MAX_NESTING + " nested branch bodies");
        }

        List<Block> blocks = new ArrayList<>();
        if (source == null || source.isEmpty()) {
            return blocks;
        }

        StringBuilder buffer = new StringBuilder();
        // 缓冲区是否以 if (...) 头部开始，在写入第一个 token 时确定
        boolean inChain = false;
        int i = 0;
        int n = source.length();

        while (i < n) {
            char c = source.charAt(i);

            if (c == '{') {
                if (inChain) {
                    // if 链的块体：整体并入，由处理器再配对拆分
                    int close = BraceMatcher.findClosing(source, i);
                    buffer.append(source, i, close + 1).append(' ');
                    i = close + 1;
                    if (!elseFollows(source, i)) {
                        flush(buffer, blocks, depth);
                        inChain = false;
                    }
                } else {
                    flush(buffer, blocks, depth);
                    i++;
                }
            } else if (c == '}') {
                flush(buffer, blocks, depth);
                inChain = false;
                i++;
            } else if (c == ';') {
                buffer.append(';');
                i++;
                if (!(inChain && elseFollows(source, i))) {
                    flush(buffer, blocks, depth);
                    inChain = false;
                }
            } else {
                int end = nextDelimiter(source, i);
                String token = source.substring(i, end).trim();
                if (!token.isEmpty()) {
                    if (buffer.length() == 0) {
                        inChain = FragmentProcessor.startsWithIf(token);
                    }
                    buffer.append(token).append(' ');
                }
                i = end;
            }
        }

        flush(buffer, blocks, depth);
        return blocks;
    }

    private static void flush(StringBuilder buffer, List<Block> blocks, int depth) {
        String fragment = buffer.toString().trim();
        buffer.setLength(0);
        if (fragment.isEmpty()) {
            return;
        }
        List<Block> produced = FragmentProcessor.process(fragment, depth);
        LOGGER.debug("Fragment [{}] -> {} block(s)", fragment, produced.size());
        blocks.addAll(produced);
    }

    private static boolean elseFollows(String source, int from) {
        return ELSE_AHEAD.matcher(source).region(from, source.length()).lookingAt();
    }

    private static int nextDelimiter(String source, int from) {
        for (int j = from; j < source.length(); j++) {
            char c = source.charAt(j);
            if (c == '{' || c == '}' || c == ';') {
                return j;
            }
        }
        return source.length();
    }
}
