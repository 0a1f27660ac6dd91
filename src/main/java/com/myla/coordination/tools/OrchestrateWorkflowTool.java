package com.myla.coordination.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.coordination.CoordinationFormatter;
import com.myla.coordination.Coordinator;
import com.myla.coordination.WorkflowType;

import java.util.Arrays;

public class OrchestrateWorkflowTool extends CoordinatorTool {

    public OrchestrateWorkflowTool(Coordinator coordinator) {
        super(coordinator);
    }

    @Override public String name() { return "orchestrate_workflow"; }

    @Override public String description() {
        return "Lay out a multi-agent workflow as dependent tasks. Available: " + WorkflowType.availableKeys();
    }

    @Override public JsonNode inputSchema() {
        var props = properties();
        props.set("workflow_type", oneOf("Workflow to run",
            Arrays.stream(WorkflowType.values()).map(WorkflowType::key).toArray(String[]::new)));
        props.set("parameters", object("Parameters recorded on every task of the workflow"));
        return schema(props, "workflow_type");
    }

    @Override
    protected String run(JsonNode args) {
        var result = coordinator.orchestrateWorkflow(requireText(args, "workflow_type"), objectMap(args, "parameters"));
        return CoordinationFormatter.workflow(result);
    }
}
