package org.snippet.cfg;

import com.google.gson.annotations.SerializedName;

/**
 * 有向边，label 为 ""、"True" 或 "False"
 */
public class CfgEdge {
    public static final String TRUE_LABEL = "True";
    public static final String FALSE_LABEL = "False";
    public static final String PLAIN_LABEL = "";

    public static final String GREEN = "#22c55e";
    public static final String RED = "#ef4444";
    public static final String GRAY = "#6b7280";

    @SerializedName("from_node")
    public final int fromNode;
    @SerializedName("to_node")
    public final int toNode;
    public final String label;
    public final String color;

    public CfgEdge(int fromNode, int toNode, String label, String color) {
        this.fromNode = fromNode;
        this.toNode = toNode;
        this.label = label;
        this.color = color;
    }

    @Override
    public String toString() {
        return fromNode + " -> " + toNode + (label.isEmpty() ? "" : " [" + label + "]");
    }
}
