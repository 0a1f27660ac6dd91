package com.myla.agents;

import com.fasterxml.jackson.databind.JsonNode;

public record OperationDef(String name, String description, JsonNode inputSchema) {}
