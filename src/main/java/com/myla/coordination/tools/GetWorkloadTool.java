package com.myla.coordination.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.coordination.CoordinationFormatter;
import com.myla.coordination.Coordinator;

import java.util.stream.Collectors;

public class GetWorkloadTool extends CoordinatorTool {

    public GetWorkloadTool(Coordinator coordinator) {
        super(coordinator);
    }

    @Override public String name() { return "get_workload"; }

    @Override public String description() {
        return "Show task counts and workload score for one agent, or for every agent when none is given";
    }

    @Override public JsonNode inputSchema() {
        var props = properties();
        props.set("agent", agentEnum("Agent to inspect"));
        return schema(props);
    }

    @Override
    protected String run(JsonNode args) {
        if (args.hasNonNull("agent")) {
            return CoordinationFormatter.workload(coordinator.getWorkload(requireAgent(args, "agent")));
        }
        return coordinator.workloads().stream()
            .map(CoordinationFormatter::workload)
            .collect(Collectors.joining("\n\n"));
    }
}
