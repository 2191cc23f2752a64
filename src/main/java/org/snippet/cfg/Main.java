package org.snippet.cfg;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 读取一段 C 风格代码，生成 CFG 并输出：
 * - 默认输出 JSON（nodes + edges）
 * - --format mermaid 输出 Mermaid flowchart
 * - --request 时输入是 {"c_code": "..."} 请求体
 */
public class Main {

    private static final Logger LOGGER = LogManager.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_BAD_INPUT = 2;

    private static final String USAGE =
            "Usage: snippet-cfg [--format json|mermaid] [--compact] [--request] [FILE|-]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        String format = "json";
        boolean pretty = true;
        boolean requestMode = false;
        String file = null;

        // 1. 解析命令行参数
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--format" -> {
                    if (i + 1 >= args.length) {
                        err.println("Missing value for --format");
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    format = args[++i];
                }
                case "--compact" -> pretty = false;
                case "--request" -> requestMode = true;
                case "-h", "--help" -> {
                    out.println(USAGE);
                    return EXIT_OK;
                }
                default -> {
                    if (arg.startsWith("--") || file != null) {
                        err.println("Unexpected argument: " + arg);
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    file = arg;
                }
            }
        }

        DiagramRenderer renderer = rendererFor(format, pretty);
        if (renderer == null) {
            err.println("Unknown format: " + format);
            err.println(USAGE);
            return EXIT_USAGE;
        }

        // 2. 读取输入
        String input;
        try {
            input = readInput(file, in);
        } catch (IOException e) {
            err.println("Cannot read input: " + e.getMessage());
            return EXIT_USAGE;
        }

        Gson gson = JsonGraphRenderer.newGson(pretty);
        String source = input;
        if (requestMode) {
            CodeInput request;
            try {
                request = gson.fromJson(input, CodeInput.class);
            } catch (JsonParseException e) {
                return reject(gson, out, "Invalid request body: " + e.getMessage());
            }
            if (request == null || request.cCode == null) {
                return reject(gson, out, "Request body must contain \"c_code\"");
            }
            source = request.cCode;
        }

        // 3. 生成并输出
        try {
            ControlFlowGraph graph = new CfgGenerator().generateCfg(source);
            out.println(renderer.render(graph));
            LOGGER.info("Rendered CFG as {}: {} node(s), {} edge(s)",
                    renderer.id(), graph.nodes.size(), graph.edges.size());
            return EXIT_OK;
        } catch (MalformedSourceException e) {
            LOGGER.warn("Rejected source: {}", e.getMessage());
            if (requestMode) {
                return reject(gson, out, e.getMessage());
            }
            err.println("Malformed source: " + e.getMessage());
            return EXIT_BAD_INPUT;
        }
    }

    static DiagramRenderer rendererFor(String format, boolean pretty) {
        List<DiagramRenderer> renderers = List.of(new JsonGraphRenderer(pretty), new MermaidGraphRenderer());
        for (DiagramRenderer r : renderers) {
            if (r.id().equalsIgnoreCase(format)) {
                return r;
            }
        }
        return null;
    }

    private static String readInput(String file, InputStream in) throws IOException {
        if (file == null || file.equals("-")) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(file), StandardCharsets.UTF_8);
    }

    private static int reject(Gson gson, PrintStream out, String detail) {
        out.println(gson.toJson(new ErrorResponse(ErrorResponse.BAD_REQUEST, detail)));
        return EXIT_BAD_INPUT;
    }
}
