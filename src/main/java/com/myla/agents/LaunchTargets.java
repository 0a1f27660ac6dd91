package com.myla.agents;

import com.myla.shared.config.AgentSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Checks that an agent's launch target exists before a process is spawned for it.
 */
final class LaunchTargets {

    private static final Logger log = LoggerFactory.getLogger(LaunchTargets.class);

    private static final Set<String> SCRIPT_EXTENSIONS = Set.of(
        ".py", ".js", ".mjs", ".cjs", ".ts", ".jar", ".sh", ".rb");

    private LaunchTargets() {}

    static void validate(AgentSpec spec) {
        var command = spec.command();
        if (command == null || command.isBlank()) {
            throw new AgentConnectionException("no launch command configured");
        }
        if (looksLikePath(command)) {
            if (!exists(command)) {
                throw new AgentConnectionException("launch command not found: " + command);
            }
        } else if (!onPath(command)) {
            throw new AgentConnectionException("launch command not found on PATH: " + command);
        }
        var script = scriptArgument(spec);
        if (script != null && !exists(script)) {
            throw new AgentConnectionException("agent server file not found: " + script);
        }
    }

    /** First non-flag argument, if it names a file. */
    static String scriptArgument(AgentSpec spec) {
        for (var arg : spec.args()) {
            if (arg.startsWith("-")) continue;
            return looksLikeFile(arg) ? arg : null;
        }
        return null;
    }

    private static boolean looksLikeFile(String arg) {
        if (looksLikePath(arg)) return true;
        var lower = arg.toLowerCase();
        return SCRIPT_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    private static boolean looksLikePath(String s) {
        return s.contains("/") || s.contains(File.separator);
    }

    private static boolean exists(String file) {
        try {
            return Files.exists(Path.of(file));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private static boolean onPath(String command) {
        var path = System.getenv("PATH");
        if (path == null || path.isBlank()) return true;
        for (var dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            try {
                var candidate = Path.of(dir, command);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) return true;
                var windows = Path.of(dir, command + ".exe");
                if (Files.isRegularFile(windows)) return true;
            } catch (InvalidPathException e) {
                log.debug("Ignoring malformed PATH entry '{}': {}", dir, e.getMessage());
            }
        }
        return false;
    }
}
