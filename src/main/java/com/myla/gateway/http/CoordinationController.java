package com.myla.gateway.http;

import com.myla.agent.OrchestratorContext;
import com.myla.coordination.AgentMessage;
import com.myla.coordination.AgentRole;
import com.myla.coordination.CoordinationTask;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshots of coordinator and connection state.
 */
@RestController
@RequestMapping("/v1/coordination")
public class CoordinationController {

    private final OrchestratorContext context;

    public CoordinationController(OrchestratorContext context) {
        this.context = context;
    }

    @GetMapping("/messages")
    public List<AgentMessage> messages() {
        return context.coordinator().messages();
    }

    @GetMapping("/tasks")
    public List<CoordinationTask> tasks() {
        return context.coordinator().tasks();
    }

    @GetMapping("/workflows")
    public List<CoordinationTask> workflows() {
        return context.coordinator().activeWorkflows();
    }

    @GetMapping("/agent-status")
    public Map<String, Object> agentStatus() {
        var connections = new ArrayList<Map<String, Object>>();
        for (var c : context.connector().connections()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("agentId", c.agentId());
            entry.put("state", c.state().name());
            entry.put("capabilities", c.capabilities());
            if (c.failureReason() != null) entry.put("failureReason", c.failureReason());
            AgentRole.fromAgentId(c.agentId()).ifPresent(role -> entry.put("role", role.key()));
            connections.add(entry);
        }
        var status = new LinkedHashMap<String, Object>();
        status.put("connections", connections);
        status.put("workloads", context.coordinator().workloads());
        return status;
    }
}
