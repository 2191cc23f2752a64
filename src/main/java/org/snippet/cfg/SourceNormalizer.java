package org.snippet.cfg;

import java.util.regex.Pattern;

/**
 * 源码预处理：去掉单行注释，把所有空白（包括换行）压缩成一个空格
 */
public class SourceNormalizer {

    private static final Pattern LINE_COMMENT = Pattern.compile("//[^\\n]*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static String normalize(String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        String noComments = LINE_COMMENT.matcher(source).replaceAll("");
        return WHITESPACE.matcher(noComments).replaceAll(" ").trim();
    }
}
