package com.myla.coordination;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Multi-agent workflows the coordinator can lay out as a chain of dependent tasks.
 * Each step depends on earlier steps only, so every workflow is acyclic.
 */
public enum WorkflowType {
    TECHNICAL_DEBT_ANALYSIS("technical_debt_analysis", "Technical Debt Analysis", List.of(
        new Step("Analyze Technical Debt",
            "Product Manager analyzes technical debt priorities", AgentRole.PRODUCT_MANAGER),
        new Step("Get GitHub Code Analysis",
            "GitHub agent provides code structure and issues analysis", AgentRole.GITHUB, 0),
        new Step("Create JIRA Tasks for Debt Items",
            "JIRA agent creates tasks for prioritized technical debt", AgentRole.JIRA, 0, 1),
        new Step("Document Analysis Results",
            "Google Docs agent creates technical debt analysis document", AgentRole.GOOGLE_DOCS, 0, 1, 2))),

    SPRINT_PLANNING("sprint_planning", "Sprint Planning", List.of(
        new Step("Get Sprint Status from JIRA",
            "JIRA agent provides current sprint status and metrics", AgentRole.JIRA),
        new Step("Analyze Technical Constraints",
            "GitHub agent analyzes technical constraints and testing requirements", AgentRole.GITHUB),
        new Step("Create Sprint Recommendations",
            "Product Manager creates sprint planning recommendations", AgentRole.PRODUCT_MANAGER, 0, 1),
        new Step("Document Sprint Plan",
            "Google Docs agent creates sprint planning document", AgentRole.GOOGLE_DOCS, 2))),

    BUG_INVESTIGATION("bug_investigation", "Bug Investigation", List.of(
        new Step("Collect Bug Reports",
            "JIRA agent gathers the reported bugs and their reproduction details", AgentRole.JIRA),
        new Step("Trace Affected Code",
            "GitHub agent locates the code paths and recent changes involved", AgentRole.GITHUB, 0),
        new Step("Assess Bug Impact",
            "Product Manager rates user impact and fix priority", AgentRole.PRODUCT_MANAGER, 0, 1),
        new Step("Document Root Cause",
            "Google Docs agent writes up the investigation and follow-ups", AgentRole.GOOGLE_DOCS, 1, 2))),

    FEATURE_PLANNING("feature_planning", "Feature Planning", List.of(
        new Step("Gather Feature Requirements",
            "Google Docs agent collects the PRD and related research", AgentRole.GOOGLE_DOCS),
        new Step("Assess Technical Feasibility",
            "GitHub agent reviews the affected components and effort", AgentRole.GITHUB, 0),
        new Step("Prioritize Feature Scope",
            "Product Manager decides scope and sequencing", AgentRole.PRODUCT_MANAGER, 0, 1),
        new Step("Create Feature Tickets",
            "JIRA agent creates the implementation tickets", AgentRole.JIRA, 2)));

    private final String key;
    private final String displayName;
    private final List<Step> steps;

    WorkflowType(String key, String displayName, List<Step> steps) {
        this.key = key;
        this.displayName = displayName;
        this.steps = steps;
    }

    public String key() { return key; }
    public String displayName() { return displayName; }
    public List<Step> steps() { return steps; }

    public static WorkflowType fromKey(String key) {
        for (var type : values()) {
            if (type.key.equals(key)) return type;
        }
        throw new UnknownWorkflowException(key);
    }

    public static String availableKeys() {
        return Arrays.stream(values()).map(WorkflowType::key).collect(Collectors.joining(", "));
    }

    /**
     * One task of a workflow; {@code dependsOn} holds indexes of earlier steps.
     */
    public record Step(String title, String description, AgentRole agent, int... dependsOn) {}
}
