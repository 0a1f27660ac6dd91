package com.myla.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for OpenAI and servers speaking the same protocol (Ollama, vLLM).
 */
public class OpenAiCompatibleProvider implements ModelProvider {

    private final String id;
    private final String apiKey;
    private final String baseUrl;
    private final String defaultModel;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public OpenAiCompatibleProvider(String id, String apiKey, String baseUrl, String defaultModel,
                                    Duration requestTimeout) {
        this.id = id;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.defaultModel = defaultModel;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public static OpenAiCompatibleProvider openAi(String apiKey, String model) {
        return new OpenAiCompatibleProvider("openai", apiKey, "https://api.openai.com/v1", model, Duration.ofSeconds(60));
    }

    public static OpenAiCompatibleProvider ollama(String model) {
        return new OpenAiCompatibleProvider("ollama", "ollama", "http://localhost:11434/v1", model, Duration.ofSeconds(120));
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        try {
            return doChat(request);
        } catch (ModelException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelException(id + " request interrupted", e);
        } catch (Exception e) {
            throw new ModelException(id + " request failed: " + e.getMessage(), e);
        }
    }

    private ChatResponse doChat(ChatRequest request) throws Exception {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", request.model() != null ? request.model() : defaultModel);
        body.put("messages", request.messages());
        body.put("temperature", request.temperature());
        body.put("max_tokens", request.maxTokens());
        if (request.tools() != null && !request.tools().isEmpty()) {
            body.put("tools", request.tools());
        }

        var httpReq = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();

        var resp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new ModelException("LLM API error " + resp.statusCode() + ": " + resp.body());
        }
        return parseResponse(mapper.readTree(resp.body()));
    }

    static ChatResponse parseResponse(JsonNode root) {
        var choice = root.path("choices").path(0);
        var message = choice.path("message");
        return new ChatResponse(
            root.path("model").asText(null),
            message.path("content").asText(""),
            usageOf(root.path("usage")),
            toolCallsOf(message.path("tool_calls")),
            stopReasonOf(choice.path("finish_reason").asText("stop")));
    }

    private static Map<String, Integer> usageOf(JsonNode usage) {
        return Map.of(
            "promptTokens", usage.path("prompt_tokens").asInt(0),
            "completionTokens", usage.path("completion_tokens").asInt(0));
    }

    private static List<ToolCallInfo> toolCallsOf(JsonNode calls) {
        var result = new ArrayList<ToolCallInfo>();
        for (var call : calls) {
            var function = call.path("function");
            result.add(new ToolCallInfo(call.path("id").asText(), function.path("name").asText(),
                function.path("arguments").asText("")));
        }
        return result;
    }

    // Same vocabulary as AnthropicProvider.
    private static String stopReasonOf(String finishReason) {
        return switch (finishReason) {
            case "tool_calls" -> "tool_use";
            case "stop" -> "end_turn";
            default -> finishReason;
        };
    }
}
