package com.myla.coordination;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Inter-agent message queue and dependency-ordered task registry.
 * <p>
 * Every public operation runs under this object's monitor, so mutations from concurrent
 * requests are serialized. Messages and tasks are kept for the lifetime of the process.
 * <p>
 * Unread messages are tracked with a per-agent read cursor: {@code getMessages(agent, true)}
 * returns what arrived since that agent's previous unread read and advances the cursor.
 */
public class Coordinator {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final Clock clock;
    private final Duration recentWindow;
    private final List<AgentMessage> messages = new ArrayList<>();
    private final Map<String, CoordinationTask> tasks = new LinkedHashMap<>();
    private final Map<AgentRole, Integer> readCursor = new EnumMap<>(AgentRole.class);
    private int messageCounter = 1;
    private int taskCounter = 1;
    private Instant lastTimestamp = Instant.EPOCH;

    public Coordinator() {
        this(Clock.systemUTC(), Duration.ofHours(24));
    }

    public Coordinator(Clock clock, Duration recentWindow) {
        this.clock = clock;
        this.recentWindow = recentWindow;
    }

    public synchronized AgentMessage send(AgentRole from, AgentRole to, MessageType type, String content,
                                          Map<String, Object> metadata, boolean requiresResponse,
                                          String parentMessageId) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Message content must not be empty");
        }
        if (parentMessageId != null && messages.stream().noneMatch(m -> m.id().equals(parentMessageId))) {
            throw new IllegalArgumentException("Unknown parent message " + parentMessageId);
        }
        var message = new AgentMessage(String.format("MSG-%04d", messageCounter++), from, to, type, content,
            metadata, now(), requiresResponse, parentMessageId);
        messages.add(message);
        log.debug("{} {} -> {}: {}", message.id(), from.key(), to.key(), type.key());
        return message;
    }

    public AgentMessage send(AgentRole from, AgentRole to, MessageType type, String content) {
        return send(from, to, type, content, Map.of(), false, null);
    }

    public synchronized List<AgentMessage> getMessages(AgentRole agent, boolean unreadOnly) {
        int from = unreadOnly ? readCursor.getOrDefault(agent, 0) : 0;
        var result = new ArrayList<AgentMessage>();
        for (int i = from; i < messages.size(); i++) {
            var message = messages.get(i);
            if (message.to() == agent) result.add(message);
        }
        if (unreadOnly) readCursor.put(agent, messages.size());
        return result;
    }

    public synchronized CoordinationTask createTask(String title, String description,
                                                    Collection<AgentRole> assignedAgents, AgentRole createdBy,
                                                    List<String> dependencies) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title must not be empty");
        }
        if (assignedAgents == null || assignedAgents.isEmpty()) {
            throw new IllegalArgumentException("A task needs at least one assigned agent");
        }
        var deps = dependencies != null ? List.copyOf(new LinkedHashSet<>(dependencies)) : List.<String>of();
        for (var dep : deps) {
            if (!tasks.containsKey(dep)) throw new UnknownTaskException(dep);
        }

        var at = now();
        var task = new CoordinationTask(String.format("TASK-%04d", taskCounter++), title,
            description != null ? description : "", List.copyOf(new LinkedHashSet<>(assignedAgents)),
            TaskStatus.PENDING, createdBy, at, at, deps, Map.of());
        tasks.put(task.id(), task);

        for (var agent : task.assignedAgents()) {
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("task_id", task.id());
            metadata.put("description", task.description());
            metadata.put("dependencies", deps);
            send(AgentRole.ORCHESTRATOR, agent, MessageType.TASK_ASSIGNMENT,
                "New task assigned: " + title, metadata, true, null);
        }
        log.info("Created {} '{}' for {}", task.id(), title, AgentRole.keys(task.assignedAgents()));
        return task;
    }

    public CoordinationTask createTask(String title, String description, Collection<AgentRole> assignedAgents) {
        return createTask(title, description, assignedAgents, AgentRole.ORCHESTRATOR, List.of());
    }

    /**
     * Changes one task's status and notifies its other assignees. Tasks depending on it are not touched.
     */
    public synchronized CoordinationTask updateStatus(String taskId, TaskStatus newStatus, AgentRole actingAgent,
                                                      Map<String, Object> results) {
        var current = tasks.get(taskId);
        if (current == null) throw new UnknownTaskException(taskId);

        var updated = current.withStatus(newStatus, now(), results);
        tasks.put(taskId, updated);

        for (var agent : updated.assignedAgents()) {
            if (agent == actingAgent) continue;
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("task_id", taskId);
            metadata.put("old_status", current.status().key());
            metadata.put("new_status", newStatus.key());
            metadata.put("updated_by", actingAgent.key());
            send(actingAgent, agent, MessageType.STATUS_UPDATE,
                "Task " + taskId + " status changed: " + current.status().key() + " -> " + newStatus.key(),
                metadata, false, null);
        }
        log.info("{} {} -> {} by {}", taskId, current.status().key(), newStatus.key(), actingAgent.key());
        return updated;
    }

    public synchronized WorkflowResult orchestrateWorkflow(String workflowType, Map<String, Object> parameters) {
        var type = WorkflowType.fromKey(workflowType);
        Map<String, Object> recorded = parameters != null && !parameters.isEmpty()
            ? Collections.singletonMap("parameters", Collections.unmodifiableMap(new LinkedHashMap<>(parameters)))
            : null;
        var created = new ArrayList<CoordinationTask>();
        for (var step : type.steps()) {
            var deps = new ArrayList<String>();
            for (int idx : step.dependsOn()) deps.add(created.get(idx).id());
            var task = createTask(step.title(), step.description(), List.of(step.agent()),
                AgentRole.ORCHESTRATOR, deps);
            if (recorded != null) {
                task = task.withStatus(TaskStatus.PENDING, task.updatedAt(), recorded);
                tasks.put(task.id(), task);
            }
            created.add(task);
        }
        log.info("Orchestrated {} workflow with {} tasks", type.key(), created.size());
        return new WorkflowResult(type, created);
    }

    /**
     * Current load of one agent. Reads only; repeated calls without mutations return equal snapshots.
     */
    public synchronized WorkloadSnapshot getWorkload(AgentRole agent) {
        int total = 0;
        int pending = 0;
        int inProgress = 0;
        int completed = 0;
        for (var task : tasks.values()) {
            if (!task.isAssignedTo(agent)) continue;
            total++;
            switch (task.status()) {
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                default -> { }
            }
        }
        var cutoff = clock.instant().minus(recentWindow);
        int recent = (int) messages.stream()
            .filter(m -> m.to() == agent && m.timestamp().isAfter(cutoff))
            .count();
        return new WorkloadSnapshot(agent, total, pending, inProgress, completed, recent,
            WorkloadSnapshot.score(pending, inProgress));
    }

    public synchronized List<WorkloadSnapshot> workloads() {
        return AgentRole.workers().stream().map(this::getWorkload).toList();
    }

    /**
     * Records a request and a canned reply between two agents; returns the reply.
     */
    public synchronized String simulateCommunication(AgentRole from, AgentRole to, String request) {
        var requestMessage = send(from, to, MessageType.REQUEST, request, Map.of(), true, null);
        var reply = CommunicationSimulator.reply(from, to, request, taskCounter);
        send(to, from, MessageType.RESPONSE, reply, Map.of(), false, requestMessage.id());
        return reply;
    }

    public synchronized CoordinationMetrics metrics() {
        var byType = new EnumMap<MessageType, Integer>(MessageType.class);
        for (var m : messages) byType.merge(m.type(), 1, Integer::sum);

        var byStatus = new EnumMap<TaskStatus, Integer>(TaskStatus.class);
        for (var t : tasks.values()) byStatus.merge(t.status(), 1, Integer::sum);

        var activity = new EnumMap<AgentRole, CoordinationMetrics.Activity>(AgentRole.class);
        for (var role : AgentRole.workers()) {
            int sent = (int) messages.stream().filter(m -> m.from() == role).count();
            int received = (int) messages.stream().filter(m -> m.to() == role).count();
            activity.put(role, new CoordinationMetrics.Activity(sent, received));
        }
        return new CoordinationMetrics(messages.size(), tasks.size(), byType, byStatus, activity);
    }

    public synchronized List<AgentMessage> messages() {
        return List.copyOf(messages);
    }

    public synchronized List<CoordinationTask> tasks() {
        return List.copyOf(tasks.values());
    }

    public synchronized CoordinationTask task(String taskId) {
        var task = tasks.get(taskId);
        if (task == null) throw new UnknownTaskException(taskId);
        return task;
    }

    /** Pending or in-progress tasks shared by more than one agent. */
    public synchronized List<CoordinationTask> activeWorkflows() {
        return tasks.values().stream()
            .filter(t -> t.status().isActive() && t.assignedAgents().size() > 1)
            .toList();
    }

    private Instant now() {
        var instant = clock.instant();
        if (instant.isBefore(lastTimestamp)) instant = lastTimestamp;
        lastTimestamp = instant;
        return instant;
    }
}
