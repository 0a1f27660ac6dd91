package com.myla.routing;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntentRouterTest {

    private static final String COORDINATOR = "inter-agent-coordinator";

    private final IntentRouter router = new IntentRouter(routing(), List.of("github-agent", "jira-agent"), COORDINATOR);

    private static Map<String, List<String>> routing() {
        var routing = new LinkedHashMap<String, List<String>>();
        routing.put("github-agent", List.of("code", "github", "test", "technical debt"));
        routing.put("jira-agent", List.of("jira", "ticket", "sprint", "bug", "sync"));
        routing.put("product-manager-agent", List.of("priority", "risk", "roadmap"));
        routing.put("google-docs-agent", List.of("document", "prd"));
        return routing;
    }

    @Test
    void ticketTrackingSelectedForBugSyncQuery() {
        var analysis = router.analyze("the rendering bug is high priority, can we sync the ticket?");

        assertEquals("jira-agent", analysis.relevantAgents().get(0));
        assertTrue(analysis.scores().get("jira-agent") >= 1);
    }

    @Test
    void matchingIsCaseInsensitiveAndCountsKeywords() {
        var analysis = router.analyze("Check the GitHub CODE");

        assertEquals(List.of("github-agent"), analysis.relevantAgents());
        assertEquals(2, analysis.scores().get("github-agent"));
        assertEquals(Complexity.LOW, analysis.complexity());
    }

    @Test
    void multipleAgentsBringInTheCoordinator() {
        var analysis = router.analyze("Is the sprint at risk because of the bug in the code?");

        assertEquals(List.of("jira-agent", "github-agent", "product-manager-agent", COORDINATOR),
            analysis.relevantAgents());
        assertEquals(Complexity.HIGH, analysis.complexity());
        assertFalse(analysis.scores().containsKey(COORDINATOR));
    }

    @Test
    void tiesKeepRoutingOrder() {
        var analysis = router.analyze("document the code");

        assertEquals(List.of("github-agent", "google-docs-agent", COORDINATOR), analysis.relevantAgents());
    }

    @Test
    void noMatchFallsBackToDefaults() {
        var analysis = router.analyze("hello there");

        assertEquals(List.of("github-agent", "jira-agent"), analysis.relevantAgents());
        assertTrue(analysis.scores().isEmpty());
        assertEquals(Complexity.MEDIUM, analysis.complexity());
    }

    @Test
    void scoresFollowRelevanceOrder() {
        var analysis = router.analyze("prd for the jira sprint ticket");

        assertEquals(List.of("jira-agent", "google-docs-agent"), List.copyOf(analysis.scores().keySet()));
    }
}
