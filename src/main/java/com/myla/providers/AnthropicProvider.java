package com.myla.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API. Translates the chat-completions message shape used across the
 * engine into content blocks: assistant tool calls become {@code tool_use} blocks and
 * consecutive tool messages are folded into one user turn of {@code tool_result} blocks.
 */
public class AnthropicProvider implements ModelProvider {

    static final String API_VERSION = "2023-06-01";

    private final String apiKey;
    private final String baseUrl;
    private final String defaultModel;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public AnthropicProvider(String apiKey, String defaultModel) {
        this(apiKey, "https://api.anthropic.com/v1", defaultModel);
    }

    public AnthropicProvider(String apiKey, String baseUrl, String defaultModel) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.defaultModel = defaultModel;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String id() {
        return "anthropic";
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        try {
            var body = toRequestBody(request);
            var httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/messages"))
                    .header("Content-Type", "application/json")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .timeout(Duration.ofSeconds(120))
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            var resp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw new ModelException("Anthropic API error " + resp.statusCode() + ": " + resp.body());
            }
            return parseResponse(mapper.readTree(resp.body()));
        } catch (ModelException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelException("Anthropic request interrupted", e);
        } catch (IOException | RuntimeException e) {
            throw new ModelException("Anthropic request failed: " + e.getMessage(), e);
        }
    }

    ObjectNode toRequestBody(ChatRequest request) {
        var body = mapper.createObjectNode();
        body.put("model", request.model() != null ? request.model() : defaultModel);
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());

        var system = new StringBuilder();
        var messages = body.putArray("messages");
        ArrayNode pendingResults = null;
        for (Map<String, Object> msg : request.messages()) {
            var role = String.valueOf(msg.get("role"));
            if ("tool".equals(role)) {
                if (pendingResults == null) {
                    var user = messages.addObject();
                    user.put("role", "user");
                    pendingResults = user.putArray("content");
                }
                var block = pendingResults.addObject();
                block.put("type", "tool_result");
                block.put("tool_use_id", String.valueOf(msg.get("tool_call_id")));
                block.put("content", String.valueOf(msg.getOrDefault("content", "")));
                continue;
            }
            pendingResults = null;
            if ("system".equals(role)) {
                if (system.length() > 0) system.append("\n\n");
                system.append(msg.get("content"));
            } else if ("assistant".equals(role) && msg.get("tool_calls") instanceof List<?> calls) {
                var assistant = messages.addObject();
                assistant.put("role", "assistant");
                var content = assistant.putArray("content");
                var text = msg.get("content");
                if (text != null && !String.valueOf(text).isBlank()) {
                    content.addObject().put("type", "text").put("text", String.valueOf(text));
                }
                for (var call : calls) {
                    JsonNode node = mapper.valueToTree(call);
                    var block = content.addObject();
                    block.put("type", "tool_use");
                    block.put("id", node.path("id").asText());
                    block.put("name", node.path("function").path("name").asText());
                    block.set("input", parseArguments(node.path("function").path("arguments").asText("")));
                }
            } else {
                var plain = messages.addObject();
                plain.put("role", role);
                plain.put("content", String.valueOf(msg.getOrDefault("content", "")));
            }
        }
        if (system.length() > 0) body.put("system", system.toString());

        if (request.tools() != null && !request.tools().isEmpty()) {
            var tools = body.putArray("tools");
            for (var tool : request.tools()) {
                JsonNode fn = mapper.valueToTree(tool).path("function");
                var t = tools.addObject();
                t.put("name", fn.path("name").asText());
                t.put("description", fn.path("description").asText(""));
                t.set("input_schema", fn.has("parameters") ? fn.get("parameters") : mapper.createObjectNode().put("type", "object"));
            }
        }
        return body;
    }

    private JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) return mapper.createObjectNode();
        try {
            return mapper.readTree(arguments);
        } catch (IOException e) {
            throw new ModelException("Tool call arguments are not valid JSON: " + arguments, e);
        }
    }

    static ChatResponse parseResponse(JsonNode root) {
        var text = new StringBuilder();
        var toolCalls = new ArrayList<ToolCallInfo>();
        for (var block : root.path("content")) {
            switch (block.path("type").asText()) {
                case "text" -> {
                    if (text.length() > 0) text.append("\n");
                    text.append(block.path("text").asText());
                }
                case "tool_use" -> toolCalls.add(new ToolCallInfo(
                        block.path("id").asText(),
                        block.path("name").asText(),
                        block.path("input").toString()));
                default -> { }
            }
        }
        var u = root.path("usage");
        var usage = Map.of(
                "promptTokens", u.path("input_tokens").asInt(0),
                "completionTokens", u.path("output_tokens").asInt(0));
        return new ChatResponse(root.path("model").asText(null), text.toString(), usage, toolCalls,
                root.path("stop_reason").asText("end_turn"));
    }
}
