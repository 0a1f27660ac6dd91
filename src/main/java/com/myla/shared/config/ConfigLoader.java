package com.myla.shared.config;

import com.myla.tools.ToolNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Loads the YAML (or JSON) descriptor. A missing or unreadable file yields defaults with no agents.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".myla", "config.yaml"
    );

    public static MylaConfig load() {
        var override = System.getenv("MYLA_CONFIG");
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static MylaConfig load(Path path) {
        Map<String, Object> raw = Map.of();
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                Object loaded = new Yaml().load(in);
                if (loaded instanceof Map<?, ?> map) {
                    raw = (Map<String, Object>) map;
                } else if (loaded != null) {
                    log.error("Config {} is not a mapping, using defaults", path);
                }
            } catch (IOException | RuntimeException e) {
                log.error("Failed to load config {}: {}", path, e.getMessage());
            }
        } else {
            log.warn("Config file not found: {}", path);
        }

        var server = section(raw, "server");
        var providers = section(raw, "providers");
        var keys = section(raw, "api-keys");

        var apiKeys = new HashMap<String, String>();
        keys.forEach((k, v) -> apiKeys.put(k, String.valueOf(v)));
        putEnv(apiKeys, "anthropic", "ANTHROPIC_API_KEY");
        putEnv(apiKeys, "openai", "OPENAI_API_KEY");

        return new MylaConfig(
            number("server.port", envOrDefault("MYLA_PORT", server.get("port")), 18790, Integer::parseInt),
            String.valueOf(providers.getOrDefault("primary", "anthropic")),
            String.valueOf(providers.getOrDefault("model", "claude-3-5-sonnet-20241022")),
            stringList(providers.get("fallback")),
            apiKeys,
            parseAgents(section(raw, "agents")),
            parseRouting(section(raw, "routing")),
            parseOrchestrator(section(raw, "orchestrator"))
        );
    }

    static Map<String, AgentSpec> parseAgents(Map<String, Object> agents) {
        var result = new LinkedHashMap<String, AgentSpec>();
        for (var entry : agents.entrySet()) {
            try {
                result.put(entry.getKey(), parseAgent(entry.getKey(), entry.getValue()));
            } catch (ConfigurationException e) {
                log.error("Skipping agent '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static AgentSpec parseAgent(String id, Object value) {
        if (id.isBlank() || id.contains(ToolNames.SEPARATOR)) {
            throw new ConfigurationException("agent id must be non-blank and must not contain '"
                + ToolNames.SEPARATOR + "'");
        }
        if (!(value instanceof Map<?, ?> cfg) || !cfg.containsKey("command")) {
            throw new ConfigurationException("missing required 'command' field");
        }
        var rawEnv = cfg.get("env");
        var env = new LinkedHashMap<String, String>();
        if (rawEnv instanceof Map<?, ?> map) {
            map.forEach((k, v) -> env.put(String.valueOf(k), String.valueOf(v)));
        }
        return new AgentSpec(
            id,
            String.valueOf(cfg.get("command")),
            stringList(cfg.get("args")),
            env,
            stringList(((Map<String, Object>) cfg).get("capabilities"))
        );
    }

    static Map<String, List<String>> parseRouting(Map<String, Object> routing) {
        var result = new LinkedHashMap<String, List<String>>();
        for (var entry : routing.entrySet()) {
            var keywords = stringList(entry.getValue());
            if (keywords.isEmpty()) {
                log.warn("Routing entry '{}' has no keywords, ignoring", entry.getKey());
                continue;
            }
            result.put(entry.getKey(), keywords);
        }
        return result;
    }

    private static OrchestratorSettings parseOrchestrator(Map<String, Object> orch) {
        var defaults = OrchestratorSettings.defaults();
        var defaultAgents = orch.containsKey("default-agents")
            ? stringList(orch.get("default-agents"))
            : defaults.defaultAgents();
        int maxIterations = number("orchestrator.max-iterations", orch.get("max-iterations"),
            defaults.maxIterations(), Integer::parseInt);
        if (maxIterations < 1) {
            log.error("orchestrator.max-iterations must be positive, got {}; using {}",
                maxIterations, defaults.maxIterations());
            maxIterations = defaults.maxIterations();
        }
        return new OrchestratorSettings(
            maxIterations,
            number("orchestrator.connect-timeout", orch.get("connect-timeout"),
                defaults.connectTimeoutSeconds(), Long::parseLong),
            number("orchestrator.request-timeout", orch.get("request-timeout"),
                defaults.requestTimeoutSeconds(), Long::parseLong),
            defaultAgents,
            String.valueOf(orch.getOrDefault("coordinator-id", defaults.coordinatorId())),
            number("orchestrator.unread-window-hours", orch.get("unread-window-hours"),
                defaults.unreadWindowHours(), Long::parseLong),
            number("orchestrator.temperature", orch.get("temperature"), defaults.temperature(), Double::parseDouble),
            number("orchestrator.max-tokens", orch.get("max-tokens"), defaults.maxTokens(), Integer::parseInt)
        );
    }

    /** Parses one numeric setting; a value that does not parse is logged and replaced by the default. */
    private static <T> T number(String name, Object value, T fallback, Function<String, T> parser) {
        if (value == null) return fallback;
        try {
            return parser.apply(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            var error = new ConfigurationException(name + " must be a number, got '" + value + "'", e);
            log.error("Using default {} for {}: {}", fallback, name, error.getMessage());
            return fallback;
        }
    }

    private static Map<String, Object> section(Map<String, Object> raw, String key) {
        var result = new LinkedHashMap<String, Object>();
        if (raw.get(key) instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
        }
        return result;
    }

    private static List<String> stringList(Object value) {
        var result = new ArrayList<String>();
        if (value instanceof List<?> list) {
            list.forEach(v -> result.add(String.valueOf(v)));
        }
        return result;
    }

    private static void putEnv(Map<String, String> keys, String name, String env) {
        var val = System.getenv(env);
        if (val != null && !val.isBlank()) keys.put(name, val);
    }

    private static Object envOrDefault(String env, Object fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
