package com.myla.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myla.observability.MetricsConfig;
import com.myla.providers.ChatRequest;
import com.myla.providers.ChatResponse;
import com.myla.providers.ModelProvider;
import com.myla.providers.ToolCallInfo;
import com.myla.tools.ToolCatalog;
import com.myla.tools.ToolContext;
import com.myla.tools.ToolResult;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Alternates model turns and tool batches until the model answers without tool calls or the
 * iteration budget runs out. Tool calls of one turn run in parallel; their results go back to
 * the model in call order.
 */
public class OrchestrationLoop {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationLoop.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String MAX_ITERATIONS_MESSAGE =
        "I've reached the maximum number of iterations while processing your request. Please try a simpler query.";
    public static final String EMPTY_RESPONSE_MESSAGE = "I couldn't generate a proper response.";
    public static final String APOLOGY_MESSAGE =
        "I'm sorry, I ran into a problem while processing your request. Please try again later.";

    private final ModelProvider provider;
    private final ExecutorService executor;
    private final MetricsConfig metrics;
    private final double temperature;
    private final int maxTokens;

    public OrchestrationLoop(ModelProvider provider, ExecutorService executor, MetricsConfig metrics,
                             double temperature, int maxTokens) {
        this.provider = provider;
        this.executor = executor;
        this.metrics = metrics;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    public LoopResult run(ConversationSession session, ToolCatalog catalog) {
        var tools = toolDefinitions(catalog);
        var state = LoopState.AWAITING_MODEL;
        LoopResult result = null;
        List<ToolCallInfo> pendingCalls = List.of();
        int toolCalls = 0;

        while (!state.isTerminal()) {
            switch (state) {
                case AWAITING_MODEL -> {
                    if (!session.hasIterationsLeft()) {
                        log.warn("Iteration budget of {} exhausted", session.maxIterations());
                        result = new LoopResult(LoopState.ITERATION_EXCEEDED, MAX_ITERATIONS_MESSAGE,
                            session.iteration(), toolCalls);
                        state = result.state();
                        continue;
                    }
                    int iteration = session.nextIteration();
                    ChatResponse resp;
                    try {
                        resp = callModel(session, tools);
                    } catch (RuntimeException e) {
                        log.error("Model call failed at iteration {}: {}", iteration, e.getMessage(), e);
                        result = new LoopResult(LoopState.ERRORED, APOLOGY_MESSAGE, iteration, toolCalls);
                        state = result.state();
                        continue;
                    }
                    if (!resp.hasToolCalls()) {
                        var text = resp.content();
                        if (text == null || text.isBlank()) text = EMPTY_RESPONSE_MESSAGE;
                        session.add(Map.of("role", "assistant", "content", text));
                        result = new LoopResult(LoopState.DONE, text, iteration, toolCalls);
                        state = result.state();
                        continue;
                    }
                    session.add(assistantMessage(resp));
                    pendingCalls = resp.toolCalls();
                    state = LoopState.AWAITING_TOOL_RESULTS;
                }
                case AWAITING_TOOL_RESULTS -> {
                    var results = dispatchAll(pendingCalls, catalog);
                    for (int i = 0; i < pendingCalls.size(); i++) {
                        session.add(Map.of(
                            "role", "tool",
                            "tool_call_id", pendingCalls.get(i).id(),
                            "content", results.get(i)));
                    }
                    toolCalls += pendingCalls.size();
                    pendingCalls = List.of();
                    state = LoopState.AWAITING_MODEL;
                }
                default -> throw new IllegalStateException("Unexpected loop state " + state);
            }
        }
        return result;
    }

    private ChatResponse callModel(ConversationSession session, List<Map<String, Object>> tools) {
        var sample = Timer.start(metrics.registry());
        try {
            metrics.llmCalls().increment();
            return provider.chat(new ChatRequest(null, session.messages(), temperature, tools, maxTokens));
        } finally {
            sample.stop(metrics.llmLatency());
        }
    }

    /**
     * Runs every call of one turn concurrently and waits for the whole batch.
     * The returned texts line up with {@code calls} by index.
     */
    private List<String> dispatchAll(List<ToolCallInfo> calls, ToolCatalog catalog) {
        var futures = new ArrayList<CompletableFuture<String>>(calls.size());
        for (var call : calls) {
            futures.add(CompletableFuture
                .supplyAsync(() -> dispatch(call, catalog), executor)
                .exceptionally(e -> failure(call, e)));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private String dispatch(ToolCallInfo call, ToolCatalog catalog) {
        metrics.toolInvocations().increment();
        JsonNode input;
        try {
            input = parseArguments(call.arguments());
        } catch (JsonProcessingException e) {
            metrics.toolFailures().increment();
            return "Error: invalid arguments for " + call.name() + ": " + e.getOriginalMessage();
        }
        ToolResult result = catalog.dispatch(call.name(), new ToolContext("", call.id()), input);
        if (!result.isError()) return result.output();
        metrics.toolFailures().increment();
        var output = result.output() != null ? result.output() : "";
        return output.startsWith("Error") ? output : "Error: " + output;
    }

    private String failure(ToolCallInfo call, Throwable e) {
        var cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        metrics.toolFailures().increment();
        log.error("Tool call {} ({}) failed: {}", call.id(), call.name(), cause.getMessage());
        return "Error: " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
    }

    private static JsonNode parseArguments(String arguments) throws JsonProcessingException {
        if (arguments == null || arguments.isBlank()) return MAPPER.createObjectNode();
        return MAPPER.readTree(arguments);
    }

    static List<Map<String, Object>> toolDefinitions(ToolCatalog catalog) {
        var tools = new ArrayList<Map<String, Object>>();
        for (var d : catalog.descriptors()) {
            var fn = new LinkedHashMap<String, Object>();
            fn.put("name", d.qualifiedName());
            fn.put("description", "[" + d.agentId() + "] " + d.description());
            fn.put("parameters", MAPPER.convertValue(d.inputSchema(), Map.class));
            tools.add(Map.of("type", "function", "function", fn));
        }
        return tools;
    }

    private static Map<String, Object> assistantMessage(ChatResponse resp) {
        var msg = new LinkedHashMap<String, Object>();
        msg.put("role", "assistant");
        msg.put("content", resp.content() != null ? resp.content() : "");
        var calls = new ArrayList<Map<String, Object>>();
        for (var tc : resp.toolCalls()) {
            calls.add(Map.of(
                "id", tc.id(),
                "type", "function",
                "function", Map.of("name", tc.name(),
                    "arguments", tc.arguments() != null ? tc.arguments() : "{}")));
        }
        msg.put("tool_calls", calls);
        return msg;
    }
}
