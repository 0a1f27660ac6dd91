package com.myla.tools;

import java.util.regex.Pattern;

/**
 * Encodes {@code <agentId>_<toolName>} and decodes it by splitting on the first separator.
 * Agent ids never contain the separator, so the split is unambiguous.
 */
public final class ToolNames {

    public static final String SEPARATOR = "_";

    private static final Pattern QUALIFIED = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private ToolNames() {}

    public static String qualify(String agentId, String toolName) {
        if (agentId == null || agentId.isEmpty() || agentId.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Invalid agent id: " + agentId);
        }
        if (!isValidToolName(toolName)) {
            throw new IllegalArgumentException("Invalid tool name: " + toolName);
        }
        return agentId + SEPARATOR + toolName;
    }

    public static ToolKey split(String qualifiedName) {
        int idx = qualifiedName == null ? -1 : qualifiedName.indexOf(SEPARATOR);
        if (idx <= 0 || idx == qualifiedName.length() - 1) {
            throw new IllegalArgumentException("Not a namespaced tool name: " + qualifiedName);
        }
        return new ToolKey(qualifiedName.substring(0, idx), qualifiedName.substring(idx + 1));
    }

    public static boolean isValidToolName(String toolName) {
        return toolName != null && !toolName.isBlank() && !toolName.startsWith(SEPARATOR);
    }

    /** Whether the namespaced form is accepted by model tool-use APIs. */
    public static boolean isAcceptedByModel(String agentId, String toolName) {
        return QUALIFIED.matcher(agentId + SEPARATOR + toolName).matches();
    }
}
