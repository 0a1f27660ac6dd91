package com.myla.coordination.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.coordination.AgentRole;
import com.myla.coordination.CoordinationFormatter;
import com.myla.coordination.Coordinator;

import java.util.ArrayList;

public class CreateTaskTool extends CoordinatorTool {

    public CreateTaskTool(Coordinator coordinator) {
        super(coordinator);
    }

    @Override public String name() { return "create_task"; }

    @Override public String description() {
        return "Create a coordination task assigned to one or more agents, optionally depending on existing tasks";
    }

    @Override public JsonNode inputSchema() {
        var props = properties();
        props.set("title", string("Task title"));
        props.set("description", string("What needs to be done"));
        props.set("assigned_agents", array("Agents responsible for the task", agentEnum("Agent")));
        props.set("dependencies", array("Ids of tasks this one depends on", string("Task id")));
        props.set("created_by", agentEnum("Agent creating the task, defaults to orchestrator"));
        return schema(props, "title", "description", "assigned_agents");
    }

    @Override
    protected String run(JsonNode args) {
        var title = requireText(args, "title");
        var description = args.path("description").asText("");
        var agents = new ArrayList<AgentRole>();
        for (var key : textList(args, "assigned_agents")) agents.add(AgentRole.fromKey(key));
        var createdBy = args.hasNonNull("created_by") ? requireAgent(args, "created_by") : AgentRole.ORCHESTRATOR;

        var task = coordinator.createTask(title, description, agents, createdBy, textList(args, "dependencies"));
        return "Task created and assigned.\n\n" + CoordinationFormatter.task(task);
    }
}
