package com.myla.coordination;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a task. Status changes produce a new instance in the registry.
 */
public record CoordinationTask(
    String id,
    String title,
    String description,
    List<AgentRole> assignedAgents,
    TaskStatus status,
    AgentRole createdBy,
    Instant createdAt,
    Instant updatedAt,
    List<String> dependencies,
    Map<String, Object> results
) {
    public CoordinationTask {
        assignedAgents = List.copyOf(assignedAgents);
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        results = results != null ? Collections.unmodifiableMap(new LinkedHashMap<>(results)) : Map.of();
    }

    CoordinationTask withStatus(TaskStatus newStatus, Instant at, Map<String, Object> newResults) {
        var merged = new LinkedHashMap<>(results);
        if (newResults != null) merged.putAll(newResults);
        return new CoordinationTask(id, title, description, assignedAgents, newStatus, createdBy,
            createdAt, at, dependencies, merged);
    }

    public boolean isAssignedTo(AgentRole role) {
        return assignedAgents.contains(role);
    }
}
