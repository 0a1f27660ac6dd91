package com.myla.coordination.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.coordination.CoordinationFormatter;
import com.myla.coordination.Coordinator;

public class GetMessagesTool extends CoordinatorTool {

    public GetMessagesTool(Coordinator coordinator) {
        super(coordinator);
    }

    @Override public String name() { return "get_messages"; }

    @Override public String description() {
        return "Read the messages addressed to an agent. Unread-only reads mark the returned messages as read";
    }

    @Override public JsonNode inputSchema() {
        var props = properties();
        props.set("agent", agentEnum("Recipient agent"));
        props.set("unread_only", bool("Only messages not yet read by this agent", true));
        return schema(props, "agent");
    }

    @Override
    protected String run(JsonNode args) {
        var agent = requireAgent(args, "agent");
        var unreadOnly = args.path("unread_only").asBoolean(true);
        return CoordinationFormatter.messages(agent, coordinator.getMessages(agent, unreadOnly), unreadOnly);
    }
}
