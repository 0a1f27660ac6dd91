package com.myla.coordination;

public record WorkloadSnapshot(
    AgentRole agent,
    int totalTasks,
    int pendingTasks,
    int inProgressTasks,
    int completedTasks,
    int recentMessages,
    int workloadScore
) {
    static int score(int pending, int inProgress) {
        return pending * 2 + inProgress * 3;
    }
}
