package org.snippet.cfg;

import com.google.gson.annotations.SerializedName;

public enum NodeType {
    @SerializedName("entry")
    ENTRY,
    @SerializedName("exit")
    EXIT,
    @SerializedName("statement")
    STATEMENT,
    @SerializedName("decision")
    DECISION
}
