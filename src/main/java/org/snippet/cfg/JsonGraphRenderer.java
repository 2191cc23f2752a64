package org.snippet.cfg;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * 输出 {nodes, edges} JSON，语句节点的 label 保留为 null
 */
public class JsonGraphRenderer implements DiagramRenderer {

    private final Gson gson;

    public JsonGraphRenderer(boolean prettyPrinting) {
        this.gson = newGson(prettyPrinting);
    }

    static Gson newGson(boolean prettyPrinting) {
        GsonBuilder builder = new GsonBuilder()
                .serializeNulls()
                .disableHtmlEscaping();
        if (prettyPrinting) {
            builder.setPrettyPrinting();
        }
        return builder.create();
    }

    @Override
    public String id() {
        return "json";
    }

    @Override
    public String render(ControlFlowGraph graph) {
        return gson.toJson(graph);
    }
}
