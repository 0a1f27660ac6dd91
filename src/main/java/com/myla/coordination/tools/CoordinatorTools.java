package com.myla.coordination.tools;

import com.myla.agents.LocalAgentChannel;
import com.myla.coordination.Coordinator;
import com.myla.tools.Tool;

import java.util.List;

public final class CoordinatorTools {

    private CoordinatorTools() {}

    public static List<Tool> all(Coordinator coordinator) {
        return List.of(
            new SendMessageTool(coordinator),
            new CreateTaskTool(coordinator),
            new UpdateTaskStatusTool(coordinator),
            new GetMessagesTool(coordinator),
            new SimulateCommunicationTool(coordinator),
            new GetWorkloadTool(coordinator),
            new OrchestrateWorkflowTool(coordinator),
            new GetMetricsTool(coordinator));
    }

    /** The coordinator as an in-process agent. */
    public static LocalAgentChannel channel(Coordinator coordinator) {
        return new LocalAgentChannel(all(coordinator));
    }
}
