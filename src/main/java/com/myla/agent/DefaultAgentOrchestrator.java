package com.myla.agent;

import com.myla.coordination.AgentRole;
import com.myla.coordination.Coordinator;
import com.myla.coordination.MessageType;
import com.myla.routing.Complexity;
import com.myla.routing.IntentAnalysis;
import com.myla.routing.IntentRouter;
import com.myla.shared.model.ThreadMessage;
import com.myla.tools.CatalogBuilder;
import com.myla.tools.CatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

public class DefaultAgentOrchestrator implements AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultAgentOrchestrator.class);

    public static final String NO_AGENTS_MESSAGE =
        "I'm sorry, but I couldn't connect to any agents to help with your request.";

    private final IntentRouter router;
    private final CatalogBuilder catalogBuilder;
    private final OrchestrationLoop loop;
    private final PromptBuilder promptBuilder;
    private final Coordinator coordinator;
    private final int maxIterations;

    public DefaultAgentOrchestrator(IntentRouter router, CatalogBuilder catalogBuilder, OrchestrationLoop loop,
                                    Coordinator coordinator, int maxIterations) {
        this.router = router;
        this.catalogBuilder = catalogBuilder;
        this.loop = loop;
        this.promptBuilder = new PromptBuilder();
        this.coordinator = coordinator;
        this.maxIterations = maxIterations;
    }

    @Override
    public String submit(String query, List<ThreadMessage> priorContext) {
        if (query == null || query.isBlank()) {
            return "Please tell me what you need help with.";
        }
        log.info("Orchestrating response for: {}", abbreviate(query));
        try {
            var analysis = router.analyze(query);
            log.info("Relevant agents identified: {} ({})", analysis.relevantAgents(), analysis.complexity().label());

            var catalog = catalogBuilder.build(analysis.relevantAgents());
            if (analysis.complexity() == Complexity.HIGH) {
                announce(analysis);
            }

            var session = new ConversationSession(maxIterations);
            promptBuilder.build(query, analysis, priorContext).forEach(session::add);
            var result = loop.run(session, catalog);
            log.info("Loop finished in state {} after {} iterations, {} tool calls",
                result.state(), result.iterations(), result.toolCalls());
            return result.text();
        } catch (CatalogException e) {
            log.warn("No agent tools available: {}", e.getMessage());
            return NO_AGENTS_MESSAGE;
        } catch (RuntimeException e) {
            log.error("Error orchestrating response: {}", e.getMessage(), e);
            return OrchestrationLoop.APOLOGY_MESSAGE;
        }
    }

    /** Lets every relevant worker know a multi-agent request is coming its way. */
    private void announce(IntentAnalysis analysis) {
        for (var agentId : analysis.relevantAgents()) {
            AgentRole.fromAgentId(agentId)
                .filter(role -> role != AgentRole.ORCHESTRATOR)
                .ifPresent(role -> coordinator.send(AgentRole.ORCHESTRATOR, role, MessageType.NOTIFICATION,
                    "Multi-agent request in progress: " + abbreviate(analysis.message()),
                    Map.of("relevant_agents", analysis.relevantAgents()), false, null));
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 100 ? text : text.substring(0, 100) + "...";
    }
}
