package com.myla.coordination.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.coordination.CoordinationFormatter;
import com.myla.coordination.Coordinator;
import com.myla.coordination.MessageType;

import java.util.Arrays;

public class SendMessageTool extends CoordinatorTool {

    public SendMessageTool(Coordinator coordinator) {
        super(coordinator);
    }

    @Override public String name() { return "send_message"; }

    @Override public String description() {
        return "Send a message from one agent to another";
    }

    @Override public JsonNode inputSchema() {
        var props = properties();
        props.set("from_agent", agentEnum("Sending agent"));
        props.set("to_agent", agentEnum("Receiving agent"));
        props.set("message_type", oneOf("Kind of message",
            Arrays.stream(MessageType.values()).map(MessageType::key).toArray(String[]::new)));
        props.set("content", string("Message body"));
        props.set("requires_response", bool("Whether the recipient should answer", false));
        props.set("parent_message_id", string("Id of the message this one answers"));
        props.set("metadata", object("Extra key/value data attached to the message"));
        return schema(props, "from_agent", "to_agent", "message_type", "content");
    }

    @Override
    protected String run(JsonNode args) {
        var from = requireAgent(args, "from_agent");
        var to = requireAgent(args, "to_agent");
        var type = MessageType.fromKey(requireText(args, "message_type"));
        var content = requireText(args, "content");
        var requiresResponse = args.path("requires_response").asBoolean(false);
        var parent = args.hasNonNull("parent_message_id") ? args.get("parent_message_id").asText() : null;

        var message = coordinator.send(from, to, type, content, objectMap(args, "metadata"), requiresResponse, parent);
        return "Message sent.\n\n" + CoordinationFormatter.message(message);
    }
}
