package com.myla.coordination.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.coordination.Coordinator;

public class SimulateCommunicationTool extends CoordinatorTool {

    public SimulateCommunicationTool(Coordinator coordinator) {
        super(coordinator);
    }

    @Override public String name() { return "simulate_communication"; }

    @Override public String description() {
        return "Rehearse a request/response exchange between two agents and record both messages";
    }

    @Override public JsonNode inputSchema() {
        var props = properties();
        props.set("from_agent", agentEnum("Requesting agent"));
        props.set("to_agent", agentEnum("Responding agent"));
        props.set("request", string("Request text"));
        return schema(props, "from_agent", "to_agent", "request");
    }

    @Override
    protected String run(JsonNode args) {
        var from = requireAgent(args, "from_agent");
        var to = requireAgent(args, "to_agent");
        var request = requireText(args, "request");

        var reply = coordinator.simulateCommunication(from, to, request);
        return "## Agent Communication\n"
            + "**" + from.displayName() + " -> " + to.displayName() + "**: " + request + "\n"
            + "**" + to.displayName() + " -> " + from.displayName() + "**: " + reply;
    }
}
