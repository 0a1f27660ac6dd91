package com.myla.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AnthropicProvider provider = new AnthropicProvider("key", "claude-test");

    @Test
    void translatesToolTurnsIntoContentBlocks() {
        var assistant = new LinkedHashMap<String, Object>();
        assistant.put("role", "assistant");
        assistant.put("content", "");
        assistant.put("tool_calls", List.of(
            Map.of("id", "tu_1", "type", "function",
                "function", Map.of("name", "jira-agent_get_sprint_status", "arguments", "{\"sprint\":3}")),
            Map.of("id", "tu_2", "type", "function",
                "function", Map.of("name", "github-agent_get_test_status", "arguments", ""))));
        var messages = List.<Map<String, Object>>of(
            Map.of("role", "system", "content", "You are Myla"),
            Map.of("role", "user", "content", "How is the sprint?"),
            assistant,
            Map.of("role", "tool", "tool_call_id", "tu_1", "content", "Behind schedule"),
            Map.of("role", "tool", "tool_call_id", "tu_2", "content", "72% coverage"));
        var tools = List.<Map<String, Object>>of(Map.of("type", "function", "function", Map.of(
            "name", "jira-agent_get_sprint_status",
            "description", "[jira-agent] sprint",
            "parameters", Map.of("type", "object"))));

        var body = provider.toRequestBody(new ChatRequest(null, messages, 0.7, tools, 1024));

        assertEquals("claude-test", body.path("model").asText());
        assertEquals(1024, body.path("max_tokens").asInt());
        assertEquals("You are Myla", body.path("system").asText());
        var msgs = body.path("messages");
        assertEquals(3, msgs.size());
        assertEquals("user", msgs.get(0).path("role").asText());

        var toolUse = msgs.get(1).path("content");
        assertEquals(2, toolUse.size());
        assertEquals("tool_use", toolUse.get(0).path("type").asText());
        assertEquals(3, toolUse.get(0).path("input").path("sprint").asInt());
        assertTrue(toolUse.get(1).path("input").isObject());

        var results = msgs.get(2);
        assertEquals("user", results.path("role").asText());
        assertEquals(2, results.path("content").size());
        assertEquals("tu_2", results.path("content").get(1).path("tool_use_id").asText());

        assertEquals("object", body.path("tools").get(0).path("input_schema").path("type").asText());
    }

    @Test
    void parsesTextAndToolUse() throws Exception {
        var resp = AnthropicProvider.parseResponse(MAPPER.readTree("""
                {"model":"claude-test","stop_reason":"tool_use",
                 "content":[{"type":"text","text":"Checking"},
                            {"type":"tool_use","id":"tu_1","name":"jira-agent_list","input":{"q":"bug"}}],
                 "usage":{"input_tokens":12,"output_tokens":5}}
                """));

        assertEquals("Checking", resp.content());
        assertEquals("tool_use", resp.stopReason());
        assertEquals(1, resp.toolCalls().size());
        assertEquals("jira-agent_list", resp.toolCalls().get(0).name());
        assertEquals("{\"q\":\"bug\"}", resp.toolCalls().get(0).arguments());
        assertEquals(12, resp.usage().get("promptTokens"));
    }
}
