package com.myla.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.myla.tools.ToolResult;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Live channel to one agent. Any implementation of this contract is interchangeable
 * with the engine: an MCP subprocess, or an in-process agent.
 */
public interface AgentChannel extends Closeable {

    List<OperationDef> listOperations() throws IOException;

    ToolResult invoke(String operation, JsonNode arguments) throws IOException;

    @Override
    void close();
}
