package com.myla.routing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores each routed agent by counting its trigger keywords in the query.
 */
public class IntentRouter {

    private final Map<String, List<String>> routing;
    private final List<String> defaultAgents;
    private final String coordinatorId;

    public IntentRouter(Map<String, List<String>> routing, List<String> defaultAgents, String coordinatorId) {
        var lowered = new LinkedHashMap<String, List<String>>();
        routing.forEach((agent, keywords) -> lowered.put(agent,
            keywords.stream().filter(k -> k != null && !k.isBlank())
                .map(k -> k.toLowerCase(Locale.ROOT)).toList()));
        this.routing = lowered;
        this.defaultAgents = List.copyOf(defaultAgents);
        this.coordinatorId = coordinatorId;
    }

    public IntentAnalysis analyze(String message) {
        var text = message == null ? "" : message.toLowerCase(Locale.ROOT);

        var scores = new LinkedHashMap<String, Integer>();
        for (var entry : routing.entrySet()) {
            int score = 0;
            for (var keyword : entry.getValue()) {
                if (text.contains(keyword)) score++;
            }
            if (score > 0) scores.put(entry.getKey(), score);
        }

        // stable sort: ties keep routing-table order
        var relevant = new ArrayList<>(scores.keySet());
        relevant.sort(Comparator.comparing(scores::get, Comparator.reverseOrder()));

        if (relevant.size() > 1 && !relevant.contains(coordinatorId)) {
            relevant.add(coordinatorId);
        }
        if (relevant.isEmpty()) {
            relevant.addAll(defaultAgents);
        }

        var orderedScores = new LinkedHashMap<String, Integer>();
        for (var agent : relevant) {
            if (scores.containsKey(agent)) orderedScores.put(agent, scores.get(agent));
        }
        return new IntentAnalysis(message, List.copyOf(relevant), orderedScores,
            Complexity.of(relevant.size()));
    }
}
