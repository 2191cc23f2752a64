package org.snippet.cfg;

/**
 * 源码片段中的花括号无法配平时抛出。
 * 整个 CFG 生成请求随之终止，不返回部分结果。
 */
public class MalformedSourceException extends RuntimeException {

    public MalformedSourceException(String message) {
        super(message);
    }
}
