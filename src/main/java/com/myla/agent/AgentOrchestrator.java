package com.myla.agent;

import com.myla.shared.model.AgentRequest;
import com.myla.shared.model.ThreadMessage;

import java.util.List;

public interface AgentOrchestrator {

    /**
     * Answers a query. Never throws: every failure is turned into reply text.
     */
    String submit(String query, List<ThreadMessage> priorContext);

    default String run(AgentRequest request) {
        return submit(request.message(), request.context() != null ? request.context() : List.of());
    }
}
