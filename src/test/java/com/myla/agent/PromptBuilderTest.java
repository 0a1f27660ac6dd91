package com.myla.agent;

import com.myla.routing.Complexity;
import com.myla.routing.IntentAnalysis;
import com.myla.shared.model.ThreadMessage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void systemPromptCarriesAnalysisAndFallbackContext() {
        var analysis = new IntentAnalysis("any bugs?", List.of("jira-agent"), Map.of("jira-agent", 1), Complexity.LOW);

        var messages = builder.build("any bugs?", analysis, List.of());

        assertEquals(2, messages.size());
        var system = (String) messages.get(0).get("content");
        assertTrue(system.contains("**User Query:** any bugs?"));
        assertTrue(system.contains("- Complexity: low"));
        assertTrue(system.contains("- Relevant Agents: jira-agent"));
        assertTrue(system.contains("jira-agent=1"));
        assertTrue(system.contains("No previous thread context."));
        assertFalse(system.contains("orchestrate_workflow"));
        assertEquals("any bugs?", messages.get(1).get("content"));
    }

    @Test
    void keepsOnlyLastFiveThreadMessages() {
        var thread = IntStream.rangeClosed(1, 7)
            .mapToObj(i -> new ThreadMessage("user" + i, "message " + i))
            .toList();

        var context = PromptBuilder.threadContext(thread);

        assertFalse(context.contains("message 2"));
        assertTrue(context.startsWith("**user3**: message 3"));
        assertTrue(context.endsWith("**user7**: message 7"));
    }

    @Test
    void highComplexityAddsWorkflowHint() {
        var analysis = new IntentAnalysis("q", List.of("a-agent", "b-agent", "inter-agent-coordinator"),
            Map.of(), Complexity.HIGH);

        var system = (String) builder.build("q", analysis, null).get(0).get("content");

        assertTrue(system.contains("orchestrate_workflow"));
    }

    @Test
    void rejectsEmptyQuery() {
        var analysis = new IntentAnalysis("", List.of(), Map.of(), Complexity.LOW);

        assertThrows(IllegalArgumentException.class, () -> builder.build(" ", analysis, List.of()));
    }
}
