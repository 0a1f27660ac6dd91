package com.myla.agent;

import com.myla.routing.Complexity;
import com.myla.routing.IntentAnalysis;
import com.myla.shared.model.ThreadMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class PromptBuilder {

    static final int THREAD_CONTEXT_LIMIT = 5;

    private static final String ROSTER = """
            You are Myla, an assistant that orchestrates multiple specialized agents to provide \
            comprehensive project insights.

            **Available Agents:**
            - **GitHub Agent**: Code analysis, testing status, performance metrics, technical debt from code perspective
            - **JIRA Agent**: Task management, sprint tracking, bug reports, creating/updating tasks
            - **Product Manager Agent**: Technical debt prioritization, risk assessment, sprint recommendations, capacity analysis
            - **Google Docs Agent**: Document search, creation, meeting notes, templates
            - **Inter-Agent Coordinator**: Multi-agent workflows, task coordination, agent communication
            """;

    private static final String INSTRUCTIONS = """
            **Instructions:**
            1. Use the appropriate agent tools to gather comprehensive information
            2. For complex queries, coordinate multiple agents through the Inter-Agent Coordinator
            3. Provide insights and analysis, not just raw data
            4. Be conversational and helpful
            5. If agents need to communicate with each other (e.g., PM agent requesting JIRA data), use the coordination tools
            """;

    private static final String WORKFLOW_HINT = """
            This query spans several agents. Prefer the coordinator's orchestrate_workflow tool \
            (technical_debt_analysis, sprint_planning, bug_investigation, feature_planning) to lay out the work.
            """;

    public List<Map<String, Object>> build(String query, IntentAnalysis analysis, List<ThreadMessage> priorContext) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be empty");
        }
        var messages = new ArrayList<Map<String, Object>>();
        messages.add(Map.of("role", "system", "content", systemPrompt(query, analysis, priorContext)));
        messages.add(Map.of("role", "user", "content", query));
        return messages;
    }

    String systemPrompt(String query, IntentAnalysis analysis, List<ThreadMessage> priorContext) {
        var sb = new StringBuilder(ROSTER);
        sb.append("\n**User Query:** ").append(query).append("\n\n");
        sb.append("**Analysis:**\n");
        sb.append("- Complexity: ").append(analysis.complexity().label()).append("\n");
        sb.append("- Relevant Agents: ").append(String.join(", ", analysis.relevantAgents())).append("\n");
        sb.append("- Confidence Scores: ").append(scores(analysis.scores())).append("\n\n");
        sb.append(INSTRUCTIONS);
        if (analysis.complexity() == Complexity.HIGH) {
            sb.append("\n").append(WORKFLOW_HINT);
        }
        sb.append("\n**Thread Context:**\n").append(threadContext(priorContext));
        return sb.toString();
    }

    static String threadContext(List<ThreadMessage> priorContext) {
        if (priorContext == null || priorContext.isEmpty()) return "No previous thread context.";
        var recent = priorContext.subList(Math.max(0, priorContext.size() - THREAD_CONTEXT_LIMIT), priorContext.size());
        return recent.stream()
            .map(m -> "**" + m.user() + "**: " + m.text())
            .collect(Collectors.joining("\n"));
    }

    private static String scores(Map<String, Integer> scores) {
        if (scores.isEmpty()) return "none";
        return scores.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
    }
}
