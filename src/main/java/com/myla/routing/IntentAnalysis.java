package com.myla.routing;

import java.util.List;
import java.util.Map;

/**
 * Which agents a query needs, how strongly each matched, and how complex the query looks.
 */
public record IntentAnalysis(
    String message,
    List<String> relevantAgents,
    Map<String, Integer> scores,
    Complexity complexity
) {}
