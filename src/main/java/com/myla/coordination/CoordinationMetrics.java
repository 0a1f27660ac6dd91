package com.myla.coordination;

import java.util.Map;

public record CoordinationMetrics(
    int totalMessages,
    int totalTasks,
    Map<MessageType, Integer> messageTypes,
    Map<TaskStatus, Integer> taskStatuses,
    Map<AgentRole, Activity> agentActivity
) {
    public record Activity(int sent, int received) {
        public int total() {
            return sent + received;
        }
    }
}
