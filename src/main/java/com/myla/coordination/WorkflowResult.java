package com.myla.coordination;

import java.util.List;

public record WorkflowResult(WorkflowType type, List<CoordinationTask> tasks) {

    public WorkflowResult {
        tasks = List.copyOf(tasks);
    }

    public List<String> taskIds() {
        return tasks.stream().map(CoordinationTask::id).toList();
    }
}
