package com.myla.agents;

import java.util.List;

/**
 * Plain-text table of agent connections, for operators.
 */
public final class ConnectionReport {

    private ConnectionReport() {}

    public static String render(List<AgentConnection> connections) {
        if (connections.isEmpty()) return "No agents configured.";
        int width = Math.max("AGENT".length(),
            connections.stream().mapToInt(c -> c.agentId().length()).max().orElse(0));
        var sb = new StringBuilder();
        sb.append(String.format("%-" + width + "s  %-12s  %s%n", "AGENT", "STATE", "DETAILS"));
        for (var c : connections) {
            var details = c.failureReason() != null ? c.failureReason() : String.join(", ", c.capabilities());
            sb.append(String.format("%-" + width + "s  %-12s  %s%n", c.agentId(), c.state(), details));
        }
        return sb.toString().stripTrailing();
    }
}
