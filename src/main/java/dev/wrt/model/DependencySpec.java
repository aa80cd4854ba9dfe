package dev.wrt.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared run order and dependency graph for a family of workflows.
 * {@code dependencies} maps a step name to the steps that depend on it.
 */
public record DependencySpec(
    List<String> runOrder,
    Map<String, List<String>> dependencies
) {

    public DependencySpec {
        runOrder = List.copyOf(runOrder);
        var copy = new LinkedHashMap<String, List<String>>();
        dependencies.forEach((step, dependents) -> copy.put(step, List.copyOf(dependents)));
        dependencies = Collections.unmodifiableMap(copy);
    }

    /**
     * Position of a step in the declared run order, or -1 when it is not declared.
     */
    public int positionOf(String stepName) {
        return runOrder.indexOf(stepName);
    }

    /**
     * Every (upstream, downstream) pair in declaration order.
     */
    public List<Map.Entry<String, String>> edgePairs() {
        var pairs = new ArrayList<Map.Entry<String, String>>();
        for (var entry : dependencies.entrySet()) {
            for (String dependent : entry.getValue()) {
                pairs.add(Map.entry(entry.getKey(), dependent));
            }
        }
        return pairs;
    }
}
