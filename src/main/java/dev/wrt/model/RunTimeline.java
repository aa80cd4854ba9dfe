package dev.wrt.model;

import java.util.List;

/**
 * Ordered view of a set of runs, ready to hand to a renderer.
 */
public record RunTimeline(
    List<EnrichedRun> byStartTime,
    List<EnrichedRun> byRunOrder, // empty when no dependency spec was supplied
    List<TemporalEdge> edges,
    boolean declaredOrderAvailable
) {

    public RunTimeline {
        byStartTime = List.copyOf(byStartTime);
        byRunOrder = List.copyOf(byRunOrder);
        edges = List.copyOf(edges);
    }
}
