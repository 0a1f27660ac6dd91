package com.myla.coordination.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.coordination.CoordinationFormatter;
import com.myla.coordination.Coordinator;
import com.myla.coordination.TaskStatus;

import java.util.Arrays;

public class UpdateTaskStatusTool extends CoordinatorTool {

    public UpdateTaskStatusTool(Coordinator coordinator) {
        super(coordinator);
    }

    @Override public String name() { return "update_task_status"; }

    @Override public String description() {
        return "Update the status of a coordination task and notify the other assigned agents";
    }

    @Override public JsonNode inputSchema() {
        var props = properties();
        props.set("task_id", string("Task id, e.g. TASK-0001"));
        props.set("new_status", oneOf("New status",
            Arrays.stream(TaskStatus.values()).map(TaskStatus::key).toArray(String[]::new)));
        props.set("agent", agentEnum("Agent making the change"));
        props.set("results", object("Results to merge into the task"));
        return schema(props, "task_id", "new_status", "agent");
    }

    @Override
    protected String run(JsonNode args) {
        var taskId = requireText(args, "task_id");
        var status = TaskStatus.fromKey(requireText(args, "new_status"));
        var agent = requireAgent(args, "agent");

        var task = coordinator.updateStatus(taskId, status, agent, objectMap(args, "results"));
        return "Task status updated.\n\n" + CoordinationFormatter.task(task);
    }
}
