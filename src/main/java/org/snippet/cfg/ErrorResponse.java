package org.snippet.cfg;

/**
 * 请求失败时的响应体，status 固定为客户端错误 400
 */
public class ErrorResponse {
    public static final int BAD_REQUEST = 400;

    public final int status;
    public final String detail;

    public ErrorResponse(int status, String detail) {
        this.status = status;
        this.detail = detail;
    }
}
