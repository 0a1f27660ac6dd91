package com.myla.coordination;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Markdown renderings of coordinator state, used as tool output.
 */
public final class CoordinationFormatter {

    private CoordinationFormatter() {}

    public static String message(AgentMessage m) {
        return "**" + m.id() + "** [" + titleCase(m.type().key()) + "] "
            + m.from().displayName() + " -> " + m.to().displayName() + "\n"
            + "Time: " + m.timestamp() + "\n"
            + (m.requiresResponse() ? "Response required\n" : "")
            + (m.parentMessageId() != null ? "In reply to: " + m.parentMessageId() + "\n" : "")
            + m.content();
    }

    public static String messages(AgentRole agent, List<AgentMessage> messages, boolean unreadOnly) {
        if (messages.isEmpty()) {
            return "No " + (unreadOnly ? "unread " : "") + "messages for " + agent.displayName() + ".";
        }
        var sb = new StringBuilder("## Messages for ").append(agent.displayName())
            .append(" (").append(messages.size()).append(")\n");
        for (var m : messages) sb.append("\n").append(message(m)).append("\n");
        return sb.toString().trim();
    }

    public static String task(CoordinationTask t) {
        var sb = new StringBuilder();
        sb.append("**").append(t.id()).append("**: ").append(t.title()).append("\n");
        sb.append("Status: ").append(titleCase(t.status().key())).append("\n");
        sb.append("Assigned to: ").append(displayNames(t.assignedAgents())).append("\n");
        if (!t.dependencies().isEmpty()) {
            sb.append("Depends on: ").append(String.join(", ", t.dependencies())).append("\n");
        }
        if (!t.description().isBlank()) sb.append(t.description()).append("\n");
        return sb.toString().trim();
    }

    public static String workflow(WorkflowResult result) {
        var sb = new StringBuilder("## ").append(result.type().displayName()).append(" Workflow\n")
            .append("Created ").append(result.tasks().size()).append(" tasks:\n");
        for (var t : result.tasks()) sb.append("\n").append(task(t)).append("\n");
        return sb.toString().trim();
    }

    public static String workload(WorkloadSnapshot w) {
        return "## Workload: " + w.agent().displayName() + "\n"
            + "- Total tasks: " + w.totalTasks() + "\n"
            + "- Pending: " + w.pendingTasks() + "\n"
            + "- In progress: " + w.inProgressTasks() + "\n"
            + "- Completed: " + w.completedTasks() + "\n"
            + "- Recent messages: " + w.recentMessages() + "\n"
            + "- Workload score: " + w.workloadScore();
    }

    public static String metrics(CoordinationMetrics m) {
        var sb = new StringBuilder("## Coordination Metrics\n")
            .append("- Total messages: ").append(m.totalMessages()).append("\n")
            .append("- Total tasks: ").append(m.totalTasks()).append("\n");
        if (!m.messageTypes().isEmpty()) {
            sb.append("\n### Message Types\n");
            for (Map.Entry<MessageType, Integer> e : m.messageTypes().entrySet()) {
                sb.append("- ").append(titleCase(e.getKey().key())).append(": ").append(e.getValue()).append("\n");
            }
        }
        if (!m.taskStatuses().isEmpty()) {
            sb.append("\n### Task Status\n");
            for (Map.Entry<TaskStatus, Integer> e : m.taskStatuses().entrySet()) {
                sb.append("- ").append(titleCase(e.getKey().key())).append(": ").append(e.getValue()).append("\n");
            }
        }
        sb.append("\n### Agent Activity\n");
        for (var e : m.agentActivity().entrySet()) {
            var a = e.getValue();
            sb.append("- ").append(e.getKey().displayName()).append(": ")
                .append(a.sent()).append(" sent, ").append(a.received()).append(" received\n");
        }
        return sb.toString().trim();
    }

    static String titleCase(String key) {
        var sb = new StringBuilder();
        for (var word : key.split("_")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return sb.toString();
    }

    private static String displayNames(List<AgentRole> roles) {
        return String.join(", ", roles.stream().map(AgentRole::displayName).toList());
    }
}
