package org.snippet.cfg;

/**
 * 花括号配对
 */
public class BraceMatcher {

    /**
     * 查找与开头 '{' 配对的 '}'
     *
     * @param text 必须以 '{' 开头的文本
     * @return 配对 '}' 在 text 中的下标
     * @throws MalformedSourceException 不以 '{' 开头，或扫描到末尾深度仍未归零
     */
    public static int findClosing(String text) {
        return findClosing(text, 0);
    }

    /**
     * 同 {@link #findClosing(String)}，从 from 处的 '{' 开始扫描，不复制子串
     *
     * @return 配对 '}' 在 text 中的绝对下标
     */
    public static int findClosing(String text, int from) {
        if (text == null || from < 0 || from >= text.length() || text.charAt(from) != '{') {
            throw new MalformedSourceException("Expected '{' at start of: " + preview(text, from));
        }

        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }

        // 扫描结束仍未回到 0 层
        throw new MalformedSourceException(
                "Unbalanced braces: " + depth + " unclosed '{' in: " + preview(text, from));
    }

    private static String preview(String text, int from) {
        if (text == null) {
            return "<null>";
        }
        String tail = from >= 0 && from < text.length() ? text.substring(from) : "";
        return tail.length() <= 40 ? tail : tail.substring(0, 40) + "...";
    }
}
