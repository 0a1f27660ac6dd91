package com.myla.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myla.agents.AgentChannel;
import com.myla.agents.ChannelLauncher;
import com.myla.agents.OperationDef;
import com.myla.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manages a single MCP agent subprocess, communicates via JSON-RPC 2.0 over stdio.
 * Messages are newline-delimited JSON objects, per the MCP stdio transport.
 */
public class McpClient implements AgentChannel {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final String PROTOCOL_VERSION = "2024-11-05";

    private final String name;
    private final List<String> command;
    private final Map<String, String> env;
    private final long requestTimeoutMillis;
    private final AtomicInteger idSeq = new AtomicInteger(1);
    private final ConcurrentMap<Integer, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();

    private Process process;
    private BufferedWriter out;
    private BufferedReader in;

    public McpClient(String name, String command, List<String> args, Map<String, String> env,
                     long requestTimeoutMillis) {
        this.name = name;
        var cmd = new ArrayList<String>();
        cmd.add(command);
        if (args != null) cmd.addAll(args);
        this.command = List.copyOf(cmd);
        this.env = env != null ? env : Map.of();
        this.requestTimeoutMillis = requestTimeoutMillis;
    }

    /**
     * Launcher that spawns and initializes one client per agent spec.
     */
    public static ChannelLauncher launcher(long requestTimeoutMillis) {
        return spec -> {
            var client = new McpClient(spec.id(), spec.command(), spec.args(), spec.env(), requestTimeoutMillis);
            client.start();
            return client;
        };
    }

    public String name() { return name; }

    /**
     * Spawns the process and runs the initialize handshake. On any failure the process is destroyed.
     */
    public void start() throws IOException {
        var pb = new ProcessBuilder(command);
        pb.redirectErrorStream(false);
        env.forEach((k, v) -> pb.environment().put(k, v));

        process = pb.start();
        try {
            out = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
            in = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));

            daemon("mcp-" + name + "-stderr", this::drainStderr);
            daemon("mcp-" + name + "-reader", this::readLoop);

            initialize();
        } catch (IOException | RuntimeException e) {
            close();
            throw e;
        }
    }

    private void drainStderr() {
        try (var err = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = err.readLine()) != null) {
                log.debug("[mcp:{}:stderr] {}", name, line);
            }
        } catch (IOException e) {
            log.debug("[mcp:{}] stderr closed: {}", name, e.getMessage());
        }
    }

    private void readLoop() {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                JsonNode msg;
                try {
                    msg = MAPPER.readTree(line);
                } catch (IOException e) {
                    log.debug("[mcp:{}] skipping non-JSON output: {}", name, line);
                    continue;
                }
                if (msg.has("id") && !msg.get("id").isNull() && (msg.has("result") || msg.has("error"))) {
                    var future = pending.remove(msg.get("id").asInt());
                    if (future != null) future.complete(msg);
                }
            }
        } catch (IOException e) {
            if (process.isAlive()) log.debug("[mcp:{}] read loop error: {}", name, e.getMessage());
        } finally {
            pending.values().forEach(f -> f.complete(null));
            pending.clear();
        }
    }

    private synchronized void writeMessage(JsonNode msg) throws IOException {
        out.write(MAPPER.writeValueAsString(msg));
        out.write('\n');
        out.flush();
    }

    private void initialize() throws IOException {
        var params = MAPPER.createObjectNode();
        params.putObject("clientInfo").put("name", "myla").put("version", "1.0");
        params.putObject("capabilities");
        params.put("protocolVersion", PROTOCOL_VERSION);

        sendRequest("initialize", params);
        sendNotification("notifications/initialized", MAPPER.createObjectNode());
        log.info("MCP agent '{}' initialized", name);
    }

    @Override
    public List<OperationDef> listOperations() throws IOException {
        var result = sendRequest("tools/list", MAPPER.createObjectNode());
        var tools = new ArrayList<OperationDef>();
        if (result.has("tools")) {
            for (var t : result.get("tools")) {
                tools.add(new OperationDef(
                    t.path("name").asText(""),
                    t.path("description").asText(""),
                    t.has("inputSchema") ? t.get("inputSchema") : MAPPER.createObjectNode().put("type", "object")
                ));
            }
        }
        return tools;
    }

    @Override
    public ToolResult invoke(String toolName, JsonNode arguments) throws IOException {
        var params = MAPPER.createObjectNode();
        params.put("name", toolName);
        params.set("arguments", arguments != null ? arguments : MAPPER.createObjectNode());
        return parseResult(sendRequest("tools/call", params));
    }

    static ToolResult parseResult(JsonNode result) {
        // tools/call returns { content: [{type, text}...], isError? }
        boolean isError = result.path("isError").asBoolean(false);
        var content = result.get("content");
        if (content == null || !content.isArray() || content.isEmpty()) {
            return new ToolResult("No result", isError);
        }
        var sb = new StringBuilder();
        for (var item : content) {
            if ("text".equals(item.path("type").asText())) {
                if (sb.length() > 0) sb.append("\n");
                sb.append(item.path("text").asText());
            }
        }
        return new ToolResult(sb.length() > 0 ? sb.toString() : "No result", isError);
    }

    private JsonNode sendRequest(String method, JsonNode params) throws IOException {
        int id = idSeq.getAndIncrement();
        var req = MAPPER.createObjectNode();
        req.put("jsonrpc", "2.0");
        req.put("id", id);
        req.put("method", method);
        req.set("params", params);

        var future = new CompletableFuture<JsonNode>();
        pending.put(id, future);
        writeMessage(req);

        try {
            var response = future.get(requestTimeoutMillis, TimeUnit.MILLISECONDS);
            if (response == null) {
                throw new IOException("MCP agent " + name + " closed the connection during '" + method + "'");
            }
            if (response.has("error")) {
                var error = response.get("error");
                throw new IOException("MCP agent " + name + " rejected '" + method + "': "
                    + error.path("message").asText(error.toString()));
            }
            return response.path("result");
        } catch (TimeoutException e) {
            pending.remove(id);
            throw new IOException("MCP request '" + method + "' timed out after " + requestTimeoutMillis + "ms");
        } catch (InterruptedException e) {
            pending.remove(id);
            Thread.currentThread().interrupt();
            throw new IOException("MCP request '" + method + "' interrupted", e);
        } catch (ExecutionException e) {
            pending.remove(id);
            throw new IOException("MCP request '" + method + "' failed: " + e.getMessage(), e);
        }
    }

    private void sendNotification(String method, JsonNode params) throws IOException {
        var req = MAPPER.createObjectNode();
        req.put("jsonrpc", "2.0");
        req.put("method", method);
        req.set("params", params);
        writeMessage(req);
    }

    @Override
    public void close() {
        if (process == null) return;
        try {
            if (out != null) out.close();
        } catch (IOException e) {
            log.debug("[mcp:{}] error closing stdin: {}", name, e.getMessage());
        }
        if (process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(2, TimeUnit.SECONDS)) process.destroyForcibly();
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
            }
            log.info("MCP agent '{}' stopped", name);
        }
    }

    private static void daemon(String threadName, Runnable task) {
        var thread = new Thread(task, threadName);
        thread.setDaemon(true);
        thread.start();
    }
}
