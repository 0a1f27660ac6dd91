package com.myla.coordination;

import java.util.Locale;

/**
 * Canned replies used to rehearse agent-to-agent exchanges without reaching the real agents.
 */
final class CommunicationSimulator {

    private CommunicationSimulator() {}

    static String reply(AgentRole from, AgentRole to, String request, int nextTaskNumber) {
        var text = request.toLowerCase(Locale.ROOT);
        switch (to) {
            case JIRA:
                if (text.contains("critical") || text.contains("bug")) {
                    return "Found 3 critical bugs: BUG-001 (Board State Corruption), BUG-002 (Memory Leak), "
                        + "BUG-003 (CRM Data Sync)";
                }
                if (text.contains("sprint")) {
                    return "Sprint 3 Status: Behind schedule, 65% velocity, 10 critical bugs pending";
                }
                if (text.contains("create") && text.contains("task")) {
                    return String.format("Task created successfully: TASK-%03d - %s", nextTaskNumber, request);
                }
                return "JIRA query processed successfully";
            case GITHUB:
                if (text.contains("code") || text.contains("technical debt")) {
                    return "Found 3 high-priority technical debt items: UI Library Modernization, "
                        + "Performance Issues, Database Integration";
                }
                if (text.contains("test")) {
                    return "Test coverage: 72% (target: 85%), 23 ESLint issues, 8 TypeScript errors";
                }
                return "GitHub analysis completed successfully";
            case GOOGLE_DOCS:
                if (text.contains("search")) {
                    return "Found 5 relevant documents: PRD, Technical Architecture, Sprint Planning, "
                        + "Meeting Notes, User Research";
                }
                if (text.contains("create")) {
                    return "Document created successfully: " + request;
                }
                return "Google Docs operation completed successfully";
            case PRODUCT_MANAGER:
                if (text.contains("risk")) {
                    return "Risk Assessment: HIGH - 2 critical impact items, immediate sprint planning required";
                }
                if (text.contains("prioritize")) {
                    return "Prioritization complete: 3 high-priority items recommended for next sprint";
                }
                return "Product management analysis completed successfully";
            default:
                return "Processed request from " + from.key() + " successfully";
        }
    }
}
