package com.myla.coordination;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T09:00:00Z"));
    private final Coordinator coordinator = new Coordinator(clock, Duration.ofHours(24));

    @Test
    void technicalDebtWorkflowChainsEveryPredecessor() {
        var result = coordinator.orchestrateWorkflow("technical_debt_analysis", Map.of());

        var tasks = result.tasks();
        assertEquals(4, tasks.size());
        assertEquals(List.of(), tasks.get(0).dependencies());
        assertEquals(List.of(tasks.get(0).id()), tasks.get(1).dependencies());
        assertEquals(List.of(tasks.get(0).id(), tasks.get(1).id()), tasks.get(2).dependencies());
        assertEquals(List.of(tasks.get(0).id(), tasks.get(1).id(), tasks.get(2).id()), tasks.get(3).dependencies());
        assertEquals(List.of(AgentRole.PRODUCT_MANAGER), tasks.get(0).assignedAgents());
        assertEquals(List.of(AgentRole.GOOGLE_DOCS), tasks.get(3).assignedAgents());
    }

    @Test
    void sprintPlanningRunsJiraAndGithubInParallel() {
        var tasks = coordinator.orchestrateWorkflow("sprint_planning", Map.of("sprint", 4)).tasks();

        assertTrue(tasks.get(0).dependencies().isEmpty());
        assertTrue(tasks.get(1).dependencies().isEmpty());
        assertEquals(List.of(tasks.get(0).id(), tasks.get(1).id()), tasks.get(2).dependencies());
        assertEquals(List.of(tasks.get(2).id()), tasks.get(3).dependencies());
        assertEquals(Map.of("sprint", 4), coordinator.task(tasks.get(3).id()).results().get("parameters"));
    }

    @Test
    void workflowParametersMayHoldNulls() {
        var params = new HashMap<String, Object>();
        params.put("repo", null);

        var tasks = coordinator.orchestrateWorkflow("technical_debt_analysis", params).tasks();

        assertEquals(4, tasks.size());
        assertEquals(4, coordinator.tasks().size());
        for (var task : tasks) {
            assertEquals(params, task.results().get("parameters"));
        }
        params.put("repo", "web");
        assertNull(((Map<?, ?>) coordinator.task("TASK-0001").results().get("parameters")).get("repo"));
    }

    @Test
    void messageMetadataMayHoldNulls() {
        var metadata = new HashMap<String, Object>();
        metadata.put("reviewer", null);

        var message = coordinator.send(AgentRole.GITHUB, AgentRole.JIRA, MessageType.NOTIFICATION, "PR merged",
            metadata, false, null);

        assertTrue(message.metadata().containsKey("reviewer"));
        assertThrows(UnsupportedOperationException.class, () -> message.metadata().put("x", 1));
    }

    @Test
    void unknownWorkflowListsAvailableTypes() {
        var e = assertThrows(UnknownWorkflowException.class,
            () -> coordinator.orchestrateWorkflow("release_party", Map.of()));

        assertTrue(e.getMessage().contains("technical_debt_analysis"));
        assertTrue(coordinator.tasks().isEmpty());
    }

    @Test
    void idsAreSequentialAndTimestampsNeverGoBack() {
        var first = coordinator.send(AgentRole.GITHUB, AgentRole.JIRA, MessageType.REQUEST, "one");
        clock.set(Instant.parse("2024-05-01T08:00:00Z"));
        var second = coordinator.send(AgentRole.JIRA, AgentRole.GITHUB, MessageType.RESPONSE, "two");

        assertEquals("MSG-0001", first.id());
        assertEquals("MSG-0002", second.id());
        assertFalse(second.timestamp().isBefore(first.timestamp()));
    }

    @Test
    void createTaskAssignsEveryAgentBeforeAnyStatusUpdate() {
        var task = coordinator.createTask("Fix login", "Users cannot log in",
            List.of(AgentRole.JIRA, AgentRole.GITHUB));
        coordinator.updateStatus(task.id(), TaskStatus.IN_PROGRESS, AgentRole.JIRA, Map.of("branch", "fix/login"));

        var githubInbox = coordinator.getMessages(AgentRole.GITHUB, false);
        assertEquals(MessageType.TASK_ASSIGNMENT, githubInbox.get(0).type());
        assertTrue(githubInbox.get(0).requiresResponse());
        assertEquals(task.id(), githubInbox.get(0).metadata().get("task_id"));
        assertEquals(MessageType.STATUS_UPDATE, githubInbox.get(1).type());
        assertEquals("jira", githubInbox.get(1).metadata().get("updated_by"));

        var jiraInbox = coordinator.getMessages(AgentRole.JIRA, false);
        assertEquals(1, jiraInbox.size(), "the acting agent is not notified of its own change");
    }

    @Test
    void dependenciesMustExist() {
        assertThrows(UnknownTaskException.class, () -> coordinator.createTask("Docs", "", List.of(AgentRole.GOOGLE_DOCS),
            AgentRole.ORCHESTRATOR, List.of("TASK-0042")));
        assertTrue(coordinator.tasks().isEmpty());
        assertTrue(coordinator.messages().isEmpty());
    }

    @Test
    void updatingUnknownTaskIsNotFound() {
        var e = assertThrows(UnknownTaskException.class,
            () -> coordinator.updateStatus("TASK-9999", TaskStatus.COMPLETED, AgentRole.JIRA, Map.of()));

        assertEquals("Task TASK-9999 not found", e.getMessage());
    }

    @Test
    void completingDependencyLeavesDependentsUntouched() {
        var tasks = coordinator.orchestrateWorkflow("technical_debt_analysis", Map.of()).tasks();

        coordinator.updateStatus(tasks.get(0).id(), TaskStatus.COMPLETED, AgentRole.PRODUCT_MANAGER,
            Map.of("summary", "3 items"));

        assertEquals(TaskStatus.COMPLETED, coordinator.task(tasks.get(0).id()).status());
        assertEquals("3 items", coordinator.task(tasks.get(0).id()).results().get("summary"));
        for (var dependent : tasks.subList(1, 4)) {
            assertEquals(TaskStatus.PENDING, coordinator.task(dependent.id()).status());
        }
    }

    @Test
    void resultsAreMerged() {
        var task = coordinator.createTask("Audit", "", List.of(AgentRole.GITHUB));
        coordinator.updateStatus(task.id(), TaskStatus.IN_PROGRESS, AgentRole.GITHUB, Map.of("a", 1));
        var updated = coordinator.updateStatus(task.id(), TaskStatus.COMPLETED, AgentRole.GITHUB, Map.of("b", 2));

        assertEquals(Map.of("a", 1, "b", 2), updated.results());
        assertFalse(updated.updatedAt().isBefore(updated.createdAt()));
    }

    @Test
    void workloadIsAPureRead() {
        coordinator.createTask("One", "", List.of(AgentRole.JIRA));
        var two = coordinator.createTask("Two", "", List.of(AgentRole.JIRA));
        coordinator.updateStatus(two.id(), TaskStatus.IN_PROGRESS, AgentRole.GITHUB, Map.of());

        var first = coordinator.getWorkload(AgentRole.JIRA);
        var second = coordinator.getWorkload(AgentRole.JIRA);

        assertEquals(first, second);
        assertEquals(2, first.totalTasks());
        assertEquals(1, first.pendingTasks());
        assertEquals(1, first.inProgressTasks());
        assertEquals(2 + 3, first.workloadScore());
        assertEquals(3, first.recentMessages());
    }

    @Test
    void recentMessagesUseTheTimeWindow() {
        coordinator.send(AgentRole.GITHUB, AgentRole.JIRA, MessageType.NOTIFICATION, "old news");
        clock.set(clock.instant().plus(Duration.ofHours(25)));
        coordinator.send(AgentRole.GITHUB, AgentRole.JIRA, MessageType.NOTIFICATION, "fresh");

        assertEquals(1, coordinator.getWorkload(AgentRole.JIRA).recentMessages());
    }

    @Test
    void unreadReadsAdvanceTheCursor() {
        coordinator.send(AgentRole.GITHUB, AgentRole.JIRA, MessageType.REQUEST, "first");

        assertEquals(1, coordinator.getMessages(AgentRole.JIRA, true).size());
        assertTrue(coordinator.getMessages(AgentRole.JIRA, true).isEmpty());

        coordinator.send(AgentRole.PRODUCT_MANAGER, AgentRole.JIRA, MessageType.REQUEST, "second");
        var unread = coordinator.getMessages(AgentRole.JIRA, true);
        assertEquals(1, unread.size());
        assertEquals("second", unread.get(0).content());
        assertEquals(2, coordinator.getMessages(AgentRole.JIRA, false).size());
        assertTrue(coordinator.getMessages(AgentRole.GITHUB, true).isEmpty());
    }

    @Test
    void simulatedCommunicationRecordsLinkedPair() {
        var reply = coordinator.simulateCommunication(AgentRole.PRODUCT_MANAGER, AgentRole.JIRA,
            "List critical bugs for this sprint");

        assertTrue(reply.startsWith("Found 3 critical bugs"));
        var messages = coordinator.messages();
        assertEquals(2, messages.size());
        assertEquals(MessageType.RESPONSE, messages.get(1).type());
        assertEquals(messages.get(0).id(), messages.get(1).parentMessageId());
    }

    @Test
    void rejectsReplyToUnknownMessage() {
        assertThrows(IllegalArgumentException.class, () -> coordinator.send(AgentRole.JIRA, AgentRole.GITHUB,
            MessageType.RESPONSE, "re", Map.of(), false, "MSG-0404"));
    }

    @Test
    void metricsSummariseTraffic() {
        coordinator.createTask("Shared", "", List.of(AgentRole.JIRA, AgentRole.GITHUB));
        coordinator.simulateCommunication(AgentRole.GITHUB, AgentRole.JIRA, "sprint status?");

        var metrics = coordinator.metrics();

        assertEquals(4, metrics.totalMessages());
        assertEquals(1, metrics.totalTasks());
        assertEquals(2, metrics.messageTypes().get(MessageType.TASK_ASSIGNMENT));
        assertEquals(1, metrics.taskStatuses().get(TaskStatus.PENDING));
        assertEquals(new CoordinationMetrics.Activity(1, 2), metrics.agentActivity().get(AgentRole.GITHUB));
        assertEquals(1, coordinator.activeWorkflows().size());
    }

    static class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant instant) {
            now = instant;
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }
}
