package com.myla.shared.config;

import java.util.List;
import java.util.Map;

/**
 * Launch descriptor of one agent process: command line, extra environment and capability tags.
 */
public record AgentSpec(
    String id,
    String command,
    List<String> args,
    Map<String, String> env,
    List<String> capabilities
) {
    public AgentSpec {
        args = args != null ? List.copyOf(args) : List.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
    }

    public AgentSpec(String id, String command, List<String> args) {
        this(id, command, args, Map.of(), List.of());
    }
}
