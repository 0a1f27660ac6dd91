package com.myla.coordination.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.coordination.CoordinationFormatter;
import com.myla.coordination.Coordinator;

public class GetMetricsTool extends CoordinatorTool {

    public GetMetricsTool(Coordinator coordinator) {
        super(coordinator);
    }

    @Override public String name() { return "get_metrics"; }

    @Override public String description() {
        return "Message and task totals with per-agent activity";
    }

    @Override public JsonNode inputSchema() {
        return schema(properties());
    }

    @Override
    protected String run(JsonNode args) {
        return CoordinationFormatter.metrics(coordinator.metrics());
    }
}
