package org.snippet.cfg;

import com.google.gson.annotations.SerializedName;

/**
 * 请求体：{"c_code": "..."}
 */
public class CodeInput {
    @SerializedName("c_code")
    public String cCode;
}
