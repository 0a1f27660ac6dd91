package com.myla.coordination.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myla.agents.LocalAgentChannel;
import com.myla.coordination.AgentRole;
import com.myla.coordination.Coordinator;
import com.myla.coordination.TaskStatus;
import com.myla.tools.ToolNames;
import com.myla.tools.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorToolsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Coordinator coordinator = new Coordinator();
    private final LocalAgentChannel channel = CoordinatorTools.channel(coordinator);

    @Test
    void exposesEveryCoordinationOperation() {
        var names = channel.listOperations().stream().map(op -> op.name()).toList();

        assertEquals(List.of("send_message", "create_task", "update_task_status", "get_messages",
            "simulate_communication", "get_workload", "orchestrate_workflow", "get_metrics"), names);
        for (var op : channel.listOperations()) {
            assertTrue(ToolNames.isAcceptedByModel("inter-agent-coordinator", op.name()));
            assertEquals("object", op.inputSchema().path("type").asText());
        }
    }

    @Test
    void sendThenReadMessages() throws Exception {
        var sent = call("send_message", """
                {"from_agent":"product_manager","to_agent":"jira","message_type":"request",
                 "content":"Need sprint velocity","requires_response":true}
                """);
        assertFalse(sent.isError());
        assertTrue(sent.output().contains("MSG-0001"));

        var inbox = call("get_messages", "{\"agent\":\"jira\"}");
        assertTrue(inbox.output().contains("Need sprint velocity"));
        assertTrue(inbox.output().contains("Response required"));
        assertTrue(call("get_messages", "{\"agent\":\"jira\"}").output().startsWith("No unread messages"));
    }

    @Test
    void createAndUpdateTask() throws Exception {
        var created = call("create_task", """
                {"title":"Fix memory leak","description":"Board view leaks listeners",
                 "assigned_agents":["github","jira"]}
                """);
        assertTrue(created.output().contains("TASK-0001"));

        var updated = call("update_task_status", """
                {"task_id":"TASK-0001","new_status":"in_progress","agent":"github","results":{"pr":"#42"}}
                """);
        assertFalse(updated.isError());
        assertTrue(updated.output().contains("In Progress"));
        assertEquals(TaskStatus.IN_PROGRESS, coordinator.task("TASK-0001").status());
        assertEquals("#42", coordinator.task("TASK-0001").results().get("pr"));
    }

    @Test
    void invalidInputIsErrorText() throws Exception {
        assertTrue(call("send_message", "{\"from_agent\":\"slack\",\"to_agent\":\"jira\","
            + "\"message_type\":\"request\",\"content\":\"hi\"}").isError());
        assertTrue(call("create_task", "{\"title\":\"x\",\"assigned_agents\":[]}").isError());
        assertTrue(call("create_task", "{\"title\":\"x\",\"assigned_agents\":[\"jira\"],"
            + "\"dependencies\":[\"TASK-0077\"]}").isError());

        var missing = call("update_task_status", "{\"task_id\":\"TASK-0404\",\"new_status\":\"completed\","
            + "\"agent\":\"jira\"}");
        assertTrue(missing.isError());
        assertEquals("Error: Task TASK-0404 not found", missing.output());

        var workflow = call("orchestrate_workflow", "{\"workflow_type\":\"nope\"}");
        assertTrue(workflow.isError());
        assertTrue(workflow.output().contains("sprint_planning"));

        assertTrue(channel.invoke("get_workload", null).output().contains("Workload: GitHub"));
    }

    @Test
    void workflowWorkloadAndMetrics() throws Exception {
        var workflow = call("orchestrate_workflow", "{\"workflow_type\":\"bug_investigation\"}");
        assertTrue(workflow.output().startsWith("## Bug Investigation Workflow"));
        assertTrue(workflow.output().contains("Depends on: TASK-0001, TASK-0002"));

        var workload = call("get_workload", "{\"agent\":\"github\"}");
        assertTrue(workload.output().contains("- Pending: 1"));
        assertTrue(workload.output().contains("- Workload score: 2"));

        var metrics = call("get_metrics", "{}");
        assertTrue(metrics.output().contains("- Total tasks: 4"));
        assertTrue(metrics.output().contains("Task Assignment: 4"));
    }

    @Test
    void simulateCommunication() throws Exception {
        var result = call("simulate_communication",
            "{\"from_agent\":\"product_manager\",\"to_agent\":\"github\",\"request\":\"How is test coverage?\"}");

        assertTrue(result.output().contains("Test coverage: 72%"));
        assertEquals(2, coordinator.messages().size());
        assertEquals(AgentRole.GITHUB, coordinator.messages().get(0).to());
    }

    @Test
    void nullWorkflowParameterStillCreatesEveryTask() throws Exception {
        var result = call("orchestrate_workflow",
            "{\"workflow_type\":\"technical_debt_analysis\",\"parameters\":{\"repo\":null,\"team\":\"web\"}}");

        assertFalse(result.isError());
        assertEquals(4, coordinator.tasks().size());
        assertEquals(4, coordinator.messages().size());
        @SuppressWarnings("unchecked")
        var params = (Map<String, Object>) coordinator.task("TASK-0004").results().get("parameters");
        assertTrue(params.containsKey("repo"));
        assertNull(params.get("repo"));
        assertEquals("web", params.get("team"));
    }

    @Test
    void nullMetadataValueIsKept() throws Exception {
        var result = call("send_message", """
                {"from_agent":"github","to_agent":"jira","message_type":"notification",
                 "content":"PR merged","metadata":{"pr":"#7","reviewer":null}}
                """);

        assertFalse(result.isError());
        var metadata = coordinator.messages().get(0).metadata();
        assertEquals("#7", metadata.get("pr"));
        assertTrue(metadata.containsKey("reviewer"));
    }

    @Test
    void unexpectedFailureBecomesErrorText() {
        var failing = new CoordinatorTool(coordinator) {
            @Override
            public String name() { return "broken"; }

            @Override
            public String description() { return "always fails"; }

            @Override
            public JsonNode inputSchema() { return schema(properties()); }

            @Override
            protected String run(JsonNode args) {
                throw new IllegalStateException("registry corrupted");
            }
        };

        var result = failing.execute(null, MAPPER.createObjectNode());

        assertTrue(result.isError());
        assertTrue(result.output().contains("registry corrupted"));
    }

    private ToolResult call(String tool, String json) throws Exception {
        return channel.invoke(tool, MAPPER.readTree(json));
    }
}
