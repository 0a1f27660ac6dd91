package com.myla.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolNamesTest {

    @Test
    void splitsOnFirstSeparatorOnly() {
        var key = ToolNames.split("jira-agent_create_task");

        assertEquals("jira-agent", key.agentId());
        assertEquals("create_task", key.toolName());
    }

    @Test
    void qualifiedNameRoundTrips() {
        for (var tool : new String[]{"search", "get_sprint_status", "a_b_c", "x-y"}) {
            var qualified = ToolNames.qualify("github-agent", tool);
            assertEquals(new ToolKey("github-agent", tool), ToolNames.split(qualified));
        }
    }

    @Test
    void rejectsAgentIdsWithSeparator() {
        assertThrows(IllegalArgumentException.class, () -> ToolNames.qualify("github_agent", "search"));
    }

    @Test
    void rejectsNamesThatAreNotNamespaced() {
        assertThrows(IllegalArgumentException.class, () -> ToolNames.split("search"));
        assertThrows(IllegalArgumentException.class, () -> ToolNames.split("_search"));
        assertThrows(IllegalArgumentException.class, () -> ToolNames.split("agent_"));
    }

    @Test
    void toolNameValidation() {
        assertTrue(ToolNames.isValidToolName("get_status"));
        assertFalse(ToolNames.isValidToolName(""));
        assertFalse(ToolNames.isValidToolName("  "));
        assertFalse(ToolNames.isValidToolName("_hidden"));
    }

    @Test
    void modelAcceptsOnlyShortPlainNames() {
        assertTrue(ToolNames.isAcceptedByModel("jira-agent", "create_task"));
        assertFalse(ToolNames.isAcceptedByModel("jira-agent", "create task"));
        assertFalse(ToolNames.isAcceptedByModel("jira-agent", "x".repeat(60)));
    }
}
